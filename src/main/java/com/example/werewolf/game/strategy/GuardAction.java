package com.example.werewolf.game.strategy;

import com.example.werewolf.game.domain.action.DecisionSlot;
import com.example.werewolf.game.domain.state.GameState;
import org.springframework.stereotype.Component;

/**
 * 보호자 밤 행동 전략
 * - 마지막으로 지목한 대상을 늑대 공격으로부터 보호
 */
@Component
public class GuardAction implements RoleActionStrategy {

    @Override
    public void execute(GameState gameState, NightContext context) {
        context.lastOf(DecisionSlot.PROTECT)
                .ifPresent(action -> context.setProtectedName(action.targetName()));
    }
}
