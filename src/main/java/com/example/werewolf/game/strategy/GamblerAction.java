package com.example.werewolf.game.strategy;

import com.example.werewolf.game.domain.action.ActionType;
import com.example.werewolf.game.domain.action.GameAction;
import com.example.werewolf.game.domain.state.GameState;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 도박꾼 밤 행동 전략
 * - 둘째 밤부터 마지막 gambler_bet 대상은 보호나 치료와 무관하게 사망
 * - gambler_skip은 진행 여부에만 쓰이고 결과에는 영향이 없다
 */
@Component
public class GamblerAction implements RoleActionStrategy {

    static final int FIRST_BETTING_NIGHT = 2;

    @Override
    public void execute(GameState gameState, NightContext context) {
        if (context.getNightNumber() < FIRST_BETTING_NIGHT) {
            return;
        }
        List<GameAction> bets = context.allOf(ActionType.GAMBLER_BET);
        if (!bets.isEmpty()) {
            context.setGamblerTargetName(bets.get(bets.size() - 1).targetName());
        }
    }
}
