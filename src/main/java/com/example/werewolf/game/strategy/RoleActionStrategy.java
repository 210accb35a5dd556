package com.example.werewolf.game.strategy;

import com.example.werewolf.game.domain.state.GameState;

/**
 * 역할별 밤 행동 처리 단계 인터페이스 (Strategy Pattern)
 * 구현체는 RoleActionFactory가 정한 순서대로 실행된다.
 */
public interface RoleActionStrategy {

    /**
     * 밤 행동 처리
     *
     * @param gameState 현재 게임 상태 (읽기 전용으로 다룬다)
     * @param context   이번 밤의 행동 목록과 앞 단계 결과
     */
    void execute(GameState gameState, NightContext context);
}
