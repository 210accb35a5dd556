package com.example.werewolf.global.concurrency;

import com.example.werewolf.global.config.GameProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 등록된 LockStrategy 빈을 LockType별로 묶고
 * werewolf.lock-type 설정에 맞는 전략을 기동 시점에 한 번 고른다.
 */
@Slf4j
@Component
public class LockStrategyFactory {

    private final Map<LockType, LockStrategy> strategyMap;
    private final LockStrategy configuredStrategy;

    public LockStrategyFactory(List<LockStrategy> strategies, GameProperties gameProperties) {
        Map<LockType, LockStrategy> byType = new EnumMap<>(LockType.class);
        for (LockStrategy strategy : strategies) {
            LockType type = LockType.valueOf(strategy.getStrategyName());
            if (byType.putIfAbsent(type, strategy) != null) {
                throw new IllegalStateException("같은 락 타입의 전략이 둘 이상 등록됨: " + type);
            }
        }
        this.strategyMap = Collections.unmodifiableMap(byType);
        this.configuredStrategy = getStrategy(gameProperties.getLockType());
        log.info("[락] 방 락 전략: {}", configuredStrategy.getStrategyName());
    }

    /**
     * 설정된 방 락 전략
     */
    public LockStrategy configured() {
        return configuredStrategy;
    }

    /**
     * @throws IllegalArgumentException 등록되지 않은 락 타입인 경우
     */
    public LockStrategy getStrategy(LockType type) {
        LockStrategy strategy = strategyMap.get(type);
        if (strategy == null) {
            throw new IllegalArgumentException("등록되지 않은 락 타입: " + type);
        }
        return strategy;
    }
}
