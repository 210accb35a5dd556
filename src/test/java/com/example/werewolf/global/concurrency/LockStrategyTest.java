package com.example.werewolf.global.concurrency;

import com.example.werewolf.global.concurrency.strategy.ReadWriteLockStrategy;
import com.example.werewolf.global.concurrency.strategy.SynchronizedLockStrategy;
import com.example.werewolf.global.config.GameProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 락 전략별 정합성 테스트
 */
class LockStrategyTest {

    private static final int THREAD_COUNT = 100;

    private LockStrategyFactory factory() {
        return factory(LockType.READ_WRITE);
    }

    private LockStrategyFactory factory(LockType configured) {
        GameProperties gameProperties = new GameProperties();
        gameProperties.setLockType(configured);
        return new LockStrategyFactory(
                List.of(new SynchronizedLockStrategy(), new ReadWriteLockStrategy()), gameProperties);
    }

    @Test
    @DisplayName("모든 전략에서 배타 락 안의 갱신은 누락되지 않는다")
    void noLostUpdates() throws InterruptedException {
        for (LockType lockType : LockType.values()) {
            LockStrategy strategy = factory().getStrategy(lockType);
            int[] counter = {0};

            ExecutorService executorService = Executors.newFixedThreadPool(32);
            CountDownLatch latch = new CountDownLatch(THREAD_COUNT);

            for (int i = 0; i < THREAD_COUNT; i++) {
                executorService.submit(() -> {
                    try {
                        strategy.executeWithLock("room-1", () -> {
                            int current = counter[0];
                            Thread.yield();
                            counter[0] = current + 1;
                            return null;
                        });
                    } finally {
                        latch.countDown();
                    }
                });
            }

            latch.await();
            executorService.shutdown();

            assertThat(counter[0]).as(lockType.name()).isEqualTo(THREAD_COUNT);
        }
    }

    @Test
    @DisplayName("READ_WRITE 전략은 조회끼리 동시에 실행된다")
    void readersRunTogether() throws InterruptedException {
        LockStrategy strategy = factory().getStrategy(LockType.READ_WRITE);
        CountDownLatch bothInside = new CountDownLatch(2);
        AtomicInteger completed = new AtomicInteger();

        ExecutorService executorService = Executors.newFixedThreadPool(2);
        for (int i = 0; i < 2; i++) {
            executorService.submit(() -> strategy.executeWithReadLock("room-1", () -> {
                bothInside.countDown();
                try {
                    // 다른 조회가 들어올 때까지 읽기 락을 쥐고 기다린다
                    if (bothInside.await(5, TimeUnit.SECONDS)) {
                        completed.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return null;
            }));
        }
        executorService.shutdown();
        assertThat(executorService.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(completed.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("서로 다른 방은 서로를 막지 않는다")
    void differentKeysAreIndependent() throws InterruptedException {
        LockStrategy strategy = factory().getStrategy(LockType.SYNCHRONIZED);
        CountDownLatch otherRoomDone = new CountDownLatch(1);
        AtomicInteger result = new AtomicInteger();

        ExecutorService executorService = Executors.newFixedThreadPool(2);
        executorService.submit(() -> strategy.executeWithLock("room-1", () -> {
            try {
                // room-1 락을 쥔 상태에서 room-2 작업이 끝나야 통과
                if (otherRoomDone.await(5, TimeUnit.SECONDS)) {
                    result.incrementAndGet();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }));
        executorService.submit(() -> strategy.executeWithLock("room-2", () -> {
            otherRoomDone.countDown();
            return null;
        }));
        executorService.shutdown();
        assertThat(executorService.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(result.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("전략 이름으로 LockType을 찾는다")
    void factoryResolvesByName() {
        LockStrategyFactory factory = factory();

        assertThat(factory.getStrategy(LockType.READ_WRITE)).isInstanceOf(ReadWriteLockStrategy.class);
        assertThat(factory.getStrategy(LockType.SYNCHRONIZED)).isInstanceOf(SynchronizedLockStrategy.class);
    }

    @Test
    @DisplayName("설정된 락 타입의 전략을 기동 시점에 고른다")
    void configuredStrategyFollowsProperties() {
        assertThat(factory(LockType.READ_WRITE).configured()).isInstanceOf(ReadWriteLockStrategy.class);
        assertThat(factory(LockType.SYNCHRONIZED).configured()).isInstanceOf(SynchronizedLockStrategy.class);
    }

    @Test
    @DisplayName("설정된 락 타입의 전략이 등록되지 않았으면 기동에 실패한다")
    void missingConfiguredStrategyFails() {
        GameProperties gameProperties = new GameProperties();
        gameProperties.setLockType(LockType.SYNCHRONIZED);

        assertThatThrownBy(() -> new LockStrategyFactory(List.of(new ReadWriteLockStrategy()), gameProperties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("SYNCHRONIZED");
    }

    @Test
    @DisplayName("같은 락 타입이 두 번 등록되면 기동에 실패한다")
    void duplicateStrategyFails() {
        assertThatThrownBy(() -> new LockStrategyFactory(
                List.of(new ReadWriteLockStrategy(), new ReadWriteLockStrategy()), new GameProperties()))
                .isInstanceOf(IllegalStateException.class);
    }
}
