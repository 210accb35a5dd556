package com.example.werewolf.game.service;

import com.example.werewolf.game.domain.result.RoleProgress;
import com.example.werewolf.game.domain.result.VotePreview;
import com.example.werewolf.game.domain.state.GamePlayerState;
import com.example.werewolf.game.domain.state.PlayerRole;
import com.example.werewolf.game.dto.response.HostStateResponse;
import com.example.werewolf.game.dto.response.PlayerStateResponse;
import com.example.werewolf.game.dto.response.SeerResultResponse;
import com.example.werewolf.game.dto.response.VillageStateResponse;
import com.example.werewolf.game.dto.response.WitchInfoResponse;
import com.example.werewolf.global.error.CommonException;
import com.example.werewolf.global.error.ErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 조회 전용 서비스. 모든 조회는 공유 락 안에서 실행되어 처리 중간 상태를 보지 않는다.
 */
@Service
@RequiredArgsConstructor
public class GameQueryService {

    private final GameStateAccessor gameStateAccessor;
    private final GameValidator gameValidator;
    private final RoleProgressTracker roleProgressTracker;
    private final NightResolver nightResolver;
    private final DayResolver dayResolver;

    public VillageStateResponse getVillageState(String roomCode) {
        return gameStateAccessor.read(roomCode, VillageStateResponse::from);
    }

    public PlayerStateResponse getPlayerState(String roomCode, String playerId) {
        return gameStateAccessor.read(roomCode, gameState ->
                PlayerStateResponse.of(gameState, gameValidator.requirePlayer(gameState, playerId)));
    }

    public HostStateResponse getHostState(String roomCode, String hostSecret) {
        return gameStateAccessor.read(roomCode, gameState -> {
            gameValidator.validateHost(gameState, hostSecret);
            return HostStateResponse.from(gameState);
        });
    }

    public RoleProgress getRoleProgress(String roomCode, String hostSecret, String role) {
        return gameStateAccessor.read(roomCode, gameState -> {
            gameValidator.validateHost(gameState, hostSecret);
            return roleProgressTracker.pending(gameState, PlayerRole.fromValue(role));
        });
    }

    public VotePreview getVotePreview(String roomCode, String hostSecret) {
        return gameStateAccessor.read(roomCode, gameState -> {
            gameValidator.validateHost(gameState, hostSecret);
            return dayResolver.preview(gameState);
        });
    }

    public SeerResultResponse getSeerResult(String roomCode, String playerId, String targetName) {
        return gameStateAccessor.read(roomCode, gameState -> {
            gameValidator.requireLivingRole(gameState, playerId, PlayerRole.SEER, ErrorCode.NOT_A_LIVING_SEER);
            if (targetName == null || targetName.isBlank()) {
                throw new CommonException(ErrorCode.VALIDATION_ERROR, "target_name is required");
            }
            GamePlayerState target = gameState.findPlayerByName(targetName.trim());
            if (target == null) {
                throw new CommonException(ErrorCode.TARGET_NOT_FOUND);
            }
            return new SeerResultResponse(target.getPlayerName(), target.isWerewolf());
        });
    }

    public WitchInfoResponse getWitchInfo(String roomCode, String playerId) {
        return gameStateAccessor.read(roomCode, gameState -> {
            gameValidator.requireLivingRole(gameState, playerId, PlayerRole.WITCH, ErrorCode.NOT_A_LIVING_WITCH);
            String victim = nightResolver.currentWolfChoice(gameState).orElse(null);
            return new WitchInfoResponse(victim, victim != null && gameState.isWitchHasHeal(),
                    gameState.isWitchHasPoison());
        });
    }
}
