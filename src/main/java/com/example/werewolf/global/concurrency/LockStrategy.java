package com.example.werewolf.global.concurrency;

import java.util.function.Supplier;

/**
 * 방 단위 동시성 제어 전략 인터페이스
 * 설정값(werewolf.lock-type)으로 구현체를 고른다.
 */
public interface LockStrategy {

    /**
     * 배타 락을 획득하고 상태 변경 로직을 실행
     *
     * @param lockKey 락을 식별하는 키 (방 코드)
     * @param action  락 보호 하에 실행할 로직
     * @return 로직 실행 결과
     */
    <T> T executeWithLock(String lockKey, Supplier<T> action);

    /**
     * 조회 전용 로직 실행. 같은 방의 변경 도중에는 대기한다.
     * 구현에 따라 다른 조회와 동시에 실행될 수 있다.
     */
    <T> T executeWithReadLock(String lockKey, Supplier<T> action);

    /**
     * 전략 이름 반환 (로깅용)
     */
    String getStrategyName();
}
