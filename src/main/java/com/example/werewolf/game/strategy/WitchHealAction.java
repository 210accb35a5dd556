package com.example.werewolf.game.strategy;

import com.example.werewolf.game.domain.action.ActionType;
import com.example.werewolf.game.domain.action.DecisionSlot;
import com.example.werewolf.game.domain.state.GameState;
import org.springframework.stereotype.Component;

/**
 * 마녀 치료 전략
 * - 치료약이 남아 있고 마지막 치료 결정이 witch_heal이면 늑대 희생자를 살린다
 * - 약은 실제로 희생자를 살렸을 때만 소모된다
 * - 도박꾼 대상에는 영향이 없다
 */
@Component
public class WitchHealAction implements RoleActionStrategy {

    @Override
    public void execute(GameState gameState, NightContext context) {
        if (!gameState.isWitchHasHeal() || context.getWolfVictimName() == null) {
            return;
        }
        boolean heal = context.lastOf(DecisionSlot.HEAL)
                .map(action -> action.type() == ActionType.WITCH_HEAL)
                .orElse(false);
        if (heal) {
            context.setWolfVictimName(null);
            context.setHealUsed(true);
        }
    }
}
