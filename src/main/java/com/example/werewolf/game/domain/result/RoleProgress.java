package com.example.werewolf.game.domain.result;

import java.util.List;

/**
 * 호출된 역할의 이번 밤 결정 현황
 *
 * @param pending 아직 결정을 끝내지 않은 생존 보유자 이름
 * @param done    pending이 비었는지 여부
 */
public record RoleProgress(List<String> pending, boolean done) {

    public static RoleProgress of(List<String> pending) {
        return new RoleProgress(List.copyOf(pending), pending.isEmpty());
    }
}
