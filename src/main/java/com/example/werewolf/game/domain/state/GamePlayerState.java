package com.example.werewolf.game.domain.state;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GamePlayerState {

    private String playerId;
    private String playerName;

    @Builder.Default
    private PlayerRole role = null;

    @Builder.Default
    private boolean isAlive = true;

    @Builder.Default
    private boolean mutedToday = false;

    @Builder.Default
    private boolean princeRevealed = false;

    public static GamePlayerState joined(String playerId, String playerName) {
        return GamePlayerState.builder()
                .playerId(playerId)
                .playerName(playerName)
                .build();
    }

    public boolean hasRole(PlayerRole role) {
        return this.role == role;
    }

    public boolean isWerewolf() {
        return role == PlayerRole.WEREWOLF;
    }

    /**
     * 사망 처리. 한 게임 안에서 되살아나는 경로는 없다.
     */
    public void kill() {
        this.isAlive = false;
    }

    /**
     * 왕자 공개는 한 번만 일어나며 되돌릴 수 없다.
     */
    public void revealPrince() {
        this.princeRevealed = true;
    }

    /**
     * 새 게임 시작 시 역할을 배정하고 상태를 초기화한다.
     */
    public void resetForNewGame(PlayerRole assignedRole) {
        this.role = assignedRole;
        this.isAlive = true;
        this.mutedToday = false;
        this.princeRevealed = false;
    }
}
