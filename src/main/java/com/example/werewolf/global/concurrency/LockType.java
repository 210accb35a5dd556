package com.example.werewolf.global.concurrency;

public enum LockType {
    SYNCHRONIZED, // 조회까지 모두 직렬화
    READ_WRITE // 변경은 배타, 조회끼리는 동시 실행
}
