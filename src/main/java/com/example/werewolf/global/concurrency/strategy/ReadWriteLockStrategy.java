package com.example.werewolf.global.concurrency.strategy;

import com.example.werewolf.global.concurrency.LockStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * ReentrantReadWriteLock 기반 락 전략
 *
 * 변경(행동 제출, 밤/낮 처리, 페이즈 전환)은 쓰기 락으로 배타 실행하고
 * 상태 조회는 읽기 락으로 서로 동시에 실행한다.
 * 조회는 처리 도중의 중간 상태를 보지 못한다.
 */
@Component
@Slf4j
public class ReadWriteLockStrategy implements LockStrategy {

    private final Map<String, ReadWriteLock> lockMap = new ConcurrentHashMap<>();

    @Override
    public <T> T executeWithLock(String lockKey, Supplier<T> action) {
        ReadWriteLock lock = lockFor(lockKey);
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public <T> T executeWithReadLock(String lockKey, Supplier<T> action) {
        ReadWriteLock lock = lockFor(lockKey);
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String getStrategyName() {
        return "READ_WRITE";
    }

    private ReadWriteLock lockFor(String lockKey) {
        return lockMap.computeIfAbsent(lockKey, k -> {
            log.debug("[락] 방 락 생성: {}", k);
            // 공정 모드: 도착 순서대로 락을 넘겨준다
            return new ReentrantReadWriteLock(true);
        });
    }
}
