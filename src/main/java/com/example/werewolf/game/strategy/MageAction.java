package com.example.werewolf.game.strategy;

import com.example.werewolf.game.domain.action.DecisionSlot;
import com.example.werewolf.game.domain.state.GameState;
import org.springframework.stereotype.Component;

/**
 * 마법사 밤 행동 전략
 * - 마지막으로 지목한 대상을 다음 낮 동안 침묵시킨다
 */
@Component
public class MageAction implements RoleActionStrategy {

    @Override
    public void execute(GameState gameState, NightContext context) {
        context.lastOf(DecisionSlot.MUTE)
                .ifPresent(action -> context.setMutedName(action.targetName()));
    }
}
