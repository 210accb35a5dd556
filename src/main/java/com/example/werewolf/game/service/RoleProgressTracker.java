package com.example.werewolf.game.service;

import com.example.werewolf.game.domain.action.DecisionSlot;
import com.example.werewolf.game.domain.action.GameAction;
import com.example.werewolf.game.domain.result.RoleProgress;
import com.example.werewolf.game.domain.state.GamePlayerState;
import com.example.werewolf.game.domain.state.GameState;
import com.example.werewolf.game.domain.state.PlayerRole;
import com.example.werewolf.global.error.CommonException;
import com.example.werewolf.global.error.ErrorCode;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 호스트가 호출한 역할이 이번 밤 결정을 마쳤는지 계산한다. 상태는 바꾸지 않는다.
 */
@Component
public class RoleProgressTracker {

    public RoleProgress pending(GameState gameState, PlayerRole role) {
        if (!role.isCallable()) {
            throw new CommonException(ErrorCode.INVALID_ROLE, "Role is not called at night: " + role.getValue());
        }

        List<GameAction> tonight = gameState.getActionLog().forNight(gameState.getNightNumber());
        Set<DecisionSlot> required = role.requiredSlots();

        List<String> pending = gameState.findAlivePlayersWithRole(role).stream()
                .filter(player -> !hasDecided(player, tonight, required))
                .map(GamePlayerState::getPlayerName)
                .collect(Collectors.toList());

        return RoleProgress.of(pending);
    }

    private boolean hasDecided(GamePlayerState player, List<GameAction> tonight, Set<DecisionSlot> required) {
        Set<DecisionSlot> decided = EnumSet.noneOf(DecisionSlot.class);
        tonight.stream()
                .filter(action -> player.getPlayerId().equals(action.playerId()))
                .forEach(action -> decided.add(action.slot()));
        return decided.containsAll(required);
    }
}
