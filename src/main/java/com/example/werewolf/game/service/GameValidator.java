package com.example.werewolf.game.service;

import com.example.werewolf.game.domain.action.ActionType;
import com.example.werewolf.game.domain.state.GamePhase;
import com.example.werewolf.game.domain.state.GamePlayerState;
import com.example.werewolf.game.domain.state.GameState;
import com.example.werewolf.game.domain.state.PlayerRole;
import com.example.werewolf.global.config.GameProperties;
import com.example.werewolf.global.error.CommonException;
import com.example.werewolf.global.error.ErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 변경 전에 호출되는 검증. 여기서 예외가 나면 상태는 건드리지 않은 것이다.
 */
@Component
@RequiredArgsConstructor
public class GameValidator {

    private final GameProperties gameProperties;

    public void validateHost(GameState gameState, String hostSecret) {
        if (hostSecret == null || !gameState.getHostSecret().equals(hostSecret)) {
            throw new CommonException(ErrorCode.FORBIDDEN);
        }
    }

    public void validatePlayerCount(GameState gameState) {
        int minPlayers = gameProperties.getMinPlayers();
        if (gameState.getPlayers().size() < minPlayers) {
            throw new CommonException(ErrorCode.VALIDATION_ERROR,
                    "At least " + minPlayers + " players are required to start");
        }
    }

    public void validateNotEnded(GameState gameState) {
        if (gameState.isEnded()) {
            throw new CommonException(ErrorCode.GAME_ENDED);
        }
    }

    public void validatePhase(GameState gameState, GamePhase expected) {
        if (gameState.getPhase() != expected) {
            throw new CommonException(ErrorCode.INVALID_PHASE,
                    "Expected phase " + expected.getValue() + " but was " + gameState.getPhase().getValue());
        }
    }

    public String validateJoin(GameState gameState, String name) {
        if (gameState.isStarted()) {
            throw new CommonException(ErrorCode.GAME_ALREADY_STARTED);
        }
        if (name == null || name.isBlank()) {
            throw new CommonException(ErrorCode.VALIDATION_ERROR, "name is required");
        }
        String trimmed = name.trim();
        if (gameState.findPlayerByName(trimmed) != null) {
            throw new CommonException(ErrorCode.DUPLICATE_PLAYER_NAME);
        }
        return trimmed;
    }

    public GamePlayerState requirePlayer(GameState gameState, String playerId) {
        GamePlayerState player = gameState.findPlayer(playerId);
        if (player == null) {
            throw new CommonException(ErrorCode.PLAYER_NOT_FOUND);
        }
        return player;
    }

    /**
     * 행동 제출 검증: 플레이어 → 생존 → 게임 종료 여부 → 행동 종류 → 대상 순
     */
    public ActionType validateAction(GameState gameState, String playerId, String actionType, String targetName) {
        GamePlayerState player = requirePlayer(gameState, playerId);
        if (!player.isAlive()) {
            throw new CommonException(ErrorCode.DEAD_PLAYER);
        }
        validateNotEnded(gameState);

        ActionType type = ActionType.fromValue(actionType);
        if (type.isTargetRequired() && (targetName == null || targetName.isBlank())) {
            throw new CommonException(ErrorCode.VALIDATION_ERROR, "target_name is required for " + type.getValue());
        }
        return type;
    }

    public GamePlayerState requireLivingRole(GameState gameState, String playerId, PlayerRole role,
            ErrorCode errorCode) {
        GamePlayerState player = gameState.findPlayer(playerId);
        if (player == null || !player.isAlive() || !player.hasRole(role)) {
            throw new CommonException(errorCode);
        }
        return player;
    }
}
