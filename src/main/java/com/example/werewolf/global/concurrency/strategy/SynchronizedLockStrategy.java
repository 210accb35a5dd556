package com.example.werewolf.global.concurrency.strategy;

import com.example.werewolf.global.concurrency.LockStrategy;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Java synchronized 기반 락 전략
 * 방 코드별 모니터 하나로 변경과 조회를 모두 직렬화한다.
 */
@Component
public class SynchronizedLockStrategy implements LockStrategy {

    // lockKey별로 별도의 락 객체를 관리 (같은 방에 대해서만 동기화)
    private final Map<String, Object> lockMap = new ConcurrentHashMap<>();

    @Override
    public <T> T executeWithLock(String lockKey, Supplier<T> action) {
        Object lock = lockMap.computeIfAbsent(lockKey, k -> new Object());

        synchronized (lock) {
            return action.get();
        }
    }

    @Override
    public <T> T executeWithReadLock(String lockKey, Supplier<T> action) {
        return executeWithLock(lockKey, action);
    }

    @Override
    public String getStrategyName() {
        return "SYNCHRONIZED";
    }
}
