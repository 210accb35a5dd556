package com.example.werewolf.game.domain.state;

import com.example.werewolf.game.domain.action.ActionLog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 방 하나의 실시간 게임 상태.
 * 변경은 항상 방 단위 락 안에서만 일어난다.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameState {

    private String roomCode;
    private String hostSecret;

    // 입장 순서 유지, 키는 playerId
    @Builder.Default
    private Map<String, GamePlayerState> players = new LinkedHashMap<>();

    @Builder.Default
    private GamePhase phase = GamePhase.LOBBY;

    @Builder.Default
    private int nightNumber = 0;

    @Builder.Default
    private int dayNumber = 0;

    @Builder.Default
    private boolean started = false;

    // 같은 사이클을 두 번 처리하지 않도록 표시
    @Builder.Default
    private boolean nightResolved = false;

    @Builder.Default
    private boolean dayResolved = false;

    @Builder.Default
    private ActionLog actionLog = new ActionLog();

    @Builder.Default
    private boolean witchHasHeal = true;

    @Builder.Default
    private boolean witchHasPoison = true;

    // 기록만 하고 규칙에는 아직 쓰이지 않는다 (연속 보호 금지 규칙용)
    private String lastGuardTargetName;

    @Builder.Default
    private List<String> deathsLastNight = new ArrayList<>();

    @Builder.Default
    private List<String> mutedForToday = new ArrayList<>();

    private PlayerRole activeCall;

    @Builder.Default
    private VotingStatus votingStatus = VotingStatus.IDLE;

    private Integer voteDurationSec;

    private Faction winner;

    // ==================== 플레이어 조회 ====================

    public void addPlayer(GamePlayerState player) {
        players.put(player.getPlayerId(), player);
    }

    public GamePlayerState findPlayer(String playerId) {
        return playerId == null ? null : players.get(playerId);
    }

    public GamePlayerState findPlayerByName(String playerName) {
        if (playerName == null) {
            return null;
        }
        return players.values().stream()
                .filter(p -> playerName.equals(p.getPlayerName()))
                .findFirst()
                .orElse(null);
    }

    public List<GamePlayerState> getPlayerList() {
        return Collections.unmodifiableList(new ArrayList<>(players.values()));
    }

    public List<GamePlayerState> findAlivePlayersWithRole(PlayerRole role) {
        return players.values().stream()
                .filter(GamePlayerState::isAlive)
                .filter(p -> p.hasRole(role))
                .collect(Collectors.toList());
    }

    // ==================== 사이클 ====================

    /**
     * 지금 제출되는 행동에 찍힐 밤 번호 (밤이 아니면 null)
     */
    public Integer currentNightStamp() {
        return phase == GamePhase.NIGHT ? nightNumber : null;
    }

    /**
     * 지금 제출되는 행동에 찍힐 낮 번호 (낮이 아니면 null)
     */
    public Integer currentDayStamp() {
        return phase == GamePhase.DAY ? dayNumber : null;
    }

    public boolean isEnded() {
        return winner != null;
    }

    // ==================== 상태 전환 ====================

    public void resetVoting() {
        this.votingStatus = VotingStatus.IDLE;
        this.voteDurationSec = null;
    }

    public void clearMutes() {
        mutedForToday.clear();
        players.values().forEach(p -> p.setMutedToday(false));
    }

    public void enterNight() {
        this.phase = GamePhase.NIGHT;
        this.nightNumber++;
        this.nightResolved = false;
        deathsLastNight.clear();
        clearMutes();
        this.activeCall = null;
        resetVoting();
    }

    public void enterDay() {
        this.phase = GamePhase.DAY;
        this.dayNumber++;
        this.dayResolved = false;
        this.activeCall = null;
        resetVoting();
    }

    public void enterLobby() {
        this.phase = GamePhase.LOBBY;
    }

    /**
     * 첫 밤으로 게임을 (재)시작한다. 역할 배정은 호출 전에 끝나 있어야 한다.
     */
    public void beginFirstNight() {
        this.started = true;
        this.winner = null;
        this.phase = GamePhase.NIGHT;
        this.nightNumber = 1;
        this.dayNumber = 0;
        this.nightResolved = false;
        this.dayResolved = false;
        actionLog.reset();
        deathsLastNight.clear();
        mutedForToday.clear();
        this.activeCall = null;
        this.witchHasHeal = true;
        this.witchHasPoison = true;
        this.lastGuardTargetName = null;
        resetVoting();
    }

    /**
     * 승리 진영 확정. 이후 어떤 처리도 상태를 바꾸지 않는다.
     */
    public void endWith(Faction faction) {
        this.winner = faction;
        this.phase = GamePhase.ENDED;
        resetVoting();
    }
}
