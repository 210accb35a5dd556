package com.example.werewolf.game.strategy;

import com.example.werewolf.game.domain.action.ActionType;
import com.example.werewolf.game.domain.action.GameAction;
import com.example.werewolf.game.domain.state.GameState;
import com.example.werewolf.game.domain.action.VoteTally;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 늑대인간 밤 행동 전략
 * - 이번 밤의 모든 wolf_kill을 집계해 최다 득표 대상을 고른다
 * - 보호자가 같은 대상을 지켰으면 희생자는 없다
 */
@Component
public class WerewolfAction implements RoleActionStrategy {

    @Override
    public void execute(GameState gameState, NightContext context) {
        String choice = chooseTarget(context.allOf(ActionType.WOLF_KILL)).orElse(null);
        context.setWolfChoiceName(choice);

        if (choice != null && !choice.equals(context.getProtectedName())) {
            context.setWolfVictimName(choice);
        }
    }

    /**
     * 늑대 지목 집계. 마녀 정보 조회에서도 같은 규칙을 쓴다.
     */
    public Optional<String> chooseTarget(List<GameAction> wolfKills) {
        return VoteTally.of(wolfKills.stream()
                .filter(action -> action.type() == ActionType.WOLF_KILL)
                .map(GameAction::targetName)
                .toList())
                .leader();
    }
}
