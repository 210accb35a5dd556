package com.example.werewolf.game.service;

import com.example.werewolf.game.domain.action.ActionType;
import com.example.werewolf.game.domain.action.GameAction;
import com.example.werewolf.game.domain.result.LynchOutcome;
import com.example.werewolf.game.domain.result.NightOutcome;
import com.example.werewolf.game.domain.state.GamePhase;
import com.example.werewolf.game.domain.state.GamePlayerState;
import com.example.werewolf.game.domain.state.GameState;
import com.example.werewolf.game.domain.state.PlayerRole;
import com.example.werewolf.game.domain.state.VotingStatus;
import com.example.werewolf.game.dto.response.ActionResponse;
import com.example.werewolf.game.dto.response.CallRoleResponse;
import com.example.werewolf.game.dto.response.CreateRoomResponse;
import com.example.werewolf.game.dto.response.JoinRoomResponse;
import com.example.werewolf.game.dto.response.PhaseResponse;
import com.example.werewolf.game.dto.response.VillageStateResponse;
import com.example.werewolf.game.dto.response.VotingResponse;
import com.example.werewolf.game.repository.GameStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 방 상태를 바꾸는 모든 작업.
 * 각 작업은 방 단위 배타 락 안에서 검증을 모두 끝낸 뒤에만 상태를 쓰고, 락을 쥔 채로 공개 스냅샷을 방송한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameService {

    private final GameStateRepository gameStateRepository;
    private final GameStateAccessor gameStateAccessor;
    private final GameValidator gameValidator;
    private final RoleAssigner roleAssigner;
    private final NightResolver nightResolver;
    private final DayResolver dayResolver;
    private final IdentifierGenerator identifierGenerator;
    private final WebSocketMessageBroadcaster broadcaster;

    // ==================== 로비 ====================

    public CreateRoomResponse createRoom() {
        GameState gameState;
        do {
            gameState = GameState.builder()
                    .roomCode(identifierGenerator.roomCode())
                    .hostSecret(identifierGenerator.secret())
                    .build();
        } while (!gameStateRepository.saveIfAbsent(gameState));

        log.info("[방 생성] roomCode={}", gameState.getRoomCode());
        return new CreateRoomResponse(gameState.getRoomCode(), gameState.getHostSecret());
    }

    public JoinRoomResponse joinRoom(String roomCode, String name) {
        return gameStateAccessor.write(roomCode, gameState -> {
            String playerName = gameValidator.validateJoin(gameState, name);

            String playerId;
            do {
                playerId = identifierGenerator.secret();
            } while (gameState.findPlayer(playerId) != null);

            gameState.addPlayer(GamePlayerState.joined(playerId, playerName));
            log.info("[입장] roomCode={}, name={}, players={}", roomCode, playerName, gameState.getPlayers().size());

            broadcaster.sendPlayerJoined(roomCode, playerName, VillageStateResponse.from(gameState));
            return new JoinRoomResponse(roomCode, playerId);
        });
    }

    // ==================== 호스트 ====================

    /**
     * 게임 시작. 진행 중이어도 호스트가 다시 호출하면 새 게임으로 초기화된다.
     */
    public PhaseResponse startGame(String roomCode, String hostSecret) {
        return gameStateAccessor.write(roomCode, gameState -> {
            gameValidator.validateHost(gameState, hostSecret);
            gameValidator.validatePlayerCount(gameState);

            roleAssigner.assignRoles(gameState);
            gameState.beginFirstNight();
            log.info("[게임 시작] roomCode={}, players={}", roomCode, gameState.getPlayers().size());

            broadcaster.sendGameStart(roomCode, VillageStateResponse.from(gameState));
            return PhaseResponse.from(gameState);
        });
    }

    public PhaseResponse setPhase(String roomCode, String hostSecret, String phase) {
        return gameStateAccessor.write(roomCode, gameState -> {
            gameValidator.validateHost(gameState, hostSecret);
            gameValidator.validateNotEnded(gameState);
            GamePhase target = GamePhase.hostSelectable(phase);

            switch (target) {
                case NIGHT -> gameState.enterNight();
                case DAY -> gameState.enterDay();
                case LOBBY -> gameState.enterLobby();
                default -> throw new IllegalStateException("호스트가 선택할 수 없는 페이즈: " + target);
            }
            log.info("[페이즈 변경] roomCode={}, phase={}, night={}, day={}",
                    roomCode, target.getValue(), gameState.getNightNumber(), gameState.getDayNumber());

            broadcaster.sendPhaseChange(roomCode, VillageStateResponse.from(gameState));
            return PhaseResponse.from(gameState);
        });
    }

    /**
     * 역할 호출. role이 비어 있으면 호출을 해제한다.
     */
    public CallRoleResponse callRole(String roomCode, String hostSecret, String role) {
        return gameStateAccessor.write(roomCode, gameState -> {
            gameValidator.validateHost(gameState, hostSecret);
            gameValidator.validateNotEnded(gameState);
            PlayerRole called = (role == null || role.isBlank()) ? null : PlayerRole.callableFromValue(role);

            gameState.setActiveCall(called);
            log.debug("[역할 호출] roomCode={}, role={}", roomCode, called);

            broadcaster.sendRoleCalled(roomCode, called == null ? null : called.getValue(),
                    VillageStateResponse.from(gameState));
            return new CallRoleResponse(called);
        });
    }

    public NightOutcome resolveNight(String roomCode, String hostSecret) {
        return gameStateAccessor.write(roomCode, gameState -> {
            gameValidator.validateHost(gameState, hostSecret);
            NightOutcome outcome = nightResolver.resolve(gameState);

            VillageStateResponse snapshot = VillageStateResponse.from(gameState);
            broadcaster.sendNightResolved(roomCode, outcome, snapshot);
            if (outcome.winner() != null) {
                broadcaster.sendGameEnded(roomCode, snapshot);
            }
            return outcome;
        });
    }

    /**
     * 투표 시작. 시간은 클라이언트 표시용이며 서버는 강제하지 않는다.
     */
    public VotingResponse startVoting(String roomCode, String hostSecret, Integer durationSec) {
        return gameStateAccessor.write(roomCode, gameState -> {
            gameValidator.validateHost(gameState, hostSecret);
            gameValidator.validateNotEnded(gameState);
            gameValidator.validatePhase(gameState, GamePhase.DAY);

            gameState.setVotingStatus(VotingStatus.VOTING);
            gameState.setVoteDurationSec(durationSec);
            log.info("[투표 시작] roomCode={}, day={}, durationSec={}", roomCode, gameState.getDayNumber(), durationSec);

            broadcaster.sendVotingStarted(roomCode, VillageStateResponse.from(gameState));
            return new VotingResponse(gameState.getVotingStatus(), gameState.getVoteDurationSec());
        });
    }

    public LynchOutcome resolveDay(String roomCode, String hostSecret) {
        return gameStateAccessor.write(roomCode, gameState -> {
            gameValidator.validateHost(gameState, hostSecret);
            LynchOutcome outcome = dayResolver.resolve(gameState);

            VillageStateResponse snapshot = VillageStateResponse.from(gameState);
            broadcaster.sendDayResolved(roomCode, outcome, snapshot);
            if (outcome.winner() != null) {
                broadcaster.sendGameEnded(roomCode, snapshot);
            }
            return outcome;
        });
    }

    // ==================== 플레이어 ====================

    /**
     * 행동 제출. 제출 자체는 방송하지 않는다 (밤 행동 시점이 드러나지 않도록).
     */
    public ActionResponse submitAction(String roomCode, String playerId, String actionType, String targetName) {
        return gameStateAccessor.write(roomCode, gameState -> {
            ActionType type = gameValidator.validateAction(gameState, playerId, actionType, targetName);
            String target = (targetName == null || targetName.isBlank()) ? null : targetName.trim();

            GameAction action = gameState.getActionLog().append(playerId, type, target, gameState.getPhase(),
                    gameState.currentNightStamp(), gameState.currentDayStamp());
            log.debug("[행동 제출] roomCode={}, seq={}, type={}, phase={}",
                    roomCode, action.sequence(), type.getValue(), action.phase());
            return ActionResponse.from(action);
        });
    }
}
