package com.example.werewolf.game.dto.response;

import com.example.werewolf.game.domain.state.Faction;
import com.example.werewolf.game.domain.state.GamePhase;
import com.example.werewolf.game.domain.state.GamePlayerState;
import com.example.werewolf.game.domain.state.GameState;
import com.example.werewolf.game.domain.state.PlayerRole;

import java.util.List;

/**
 * 플레이어 본인 화면.
 * 다른 플레이어의 역할은 보이지 않고, 살아 있는 늑대인간에게만 동료 늑대 이름이 채워진다.
 */
public record PlayerStateResponse(
        String roomCode,
        OwnPlayer player,
        List<PublicPlayerView> players,
        GamePhase phase,
        int nightNumber,
        int dayNumber,
        List<String> deathsLastNight,
        PlayerRole activeCall,
        List<String> wolfMates,
        Faction winner) {

    public record OwnPlayer(
            String playerId,
            String name,
            PlayerRole role,
            boolean alive,
            boolean mutedToday,
            boolean princeRevealed) {
    }

    public static PlayerStateResponse of(GameState gameState, GamePlayerState viewer) {
        OwnPlayer own = new OwnPlayer(viewer.getPlayerId(), viewer.getPlayerName(), viewer.getRole(),
                viewer.isAlive(), viewer.isMutedToday(), viewer.isPrinceRevealed());

        List<String> wolfMates = List.of();
        if (viewer.isWerewolf() && viewer.isAlive()) {
            wolfMates = gameState.getPlayerList().stream()
                    .filter(GamePlayerState::isWerewolf)
                    .filter(p -> !p.getPlayerId().equals(viewer.getPlayerId()))
                    .map(GamePlayerState::getPlayerName)
                    .toList();
        }

        return new PlayerStateResponse(
                gameState.getRoomCode(),
                own,
                gameState.getPlayerList().stream().map(PublicPlayerView::from).toList(),
                gameState.getPhase(),
                gameState.getNightNumber(),
                gameState.getDayNumber(),
                List.copyOf(gameState.getDeathsLastNight()),
                gameState.getActiveCall(),
                wolfMates,
                gameState.getWinner());
    }
}
