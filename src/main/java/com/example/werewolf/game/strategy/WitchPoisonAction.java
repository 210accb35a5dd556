package com.example.werewolf.game.strategy;

import com.example.werewolf.game.domain.action.ActionType;
import com.example.werewolf.game.domain.action.DecisionSlot;
import com.example.werewolf.game.domain.state.GameState;
import org.springframework.stereotype.Component;

/**
 * 마녀 독 전략
 * - 독이 남아 있고 마지막 독 결정이 witch_poison이면 대상은 보호/치료와 무관하게 사망
 */
@Component
public class WitchPoisonAction implements RoleActionStrategy {

    @Override
    public void execute(GameState gameState, NightContext context) {
        if (!gameState.isWitchHasPoison()) {
            return;
        }
        context.lastOf(DecisionSlot.POISON)
                .filter(action -> action.type() == ActionType.WITCH_POISON)
                .ifPresent(action -> context.setPoisonTargetName(action.targetName()));
    }
}
