package com.example.werewolf.game.dto.response;

import com.example.werewolf.game.domain.state.Faction;
import com.example.werewolf.game.domain.state.GamePhase;
import com.example.werewolf.game.domain.state.GameState;
import com.example.werewolf.game.domain.state.VotingStatus;

import java.util.List;

/**
 * 마을 공개 화면. WebSocket 브로드캐스트에도 그대로 쓰이므로 역할을 담지 않는다.
 */
public record VillageStateResponse(
        String roomCode,
        GamePhase phase,
        int nightNumber,
        int dayNumber,
        boolean started,
        List<PublicPlayerView> players,
        List<String> deathsLastNight,
        List<String> mutedForToday,
        VotingStatus votingStatus,
        Integer voteDurationSec,
        Faction winner) {

    public static VillageStateResponse from(GameState gameState) {
        return new VillageStateResponse(
                gameState.getRoomCode(),
                gameState.getPhase(),
                gameState.getNightNumber(),
                gameState.getDayNumber(),
                gameState.isStarted(),
                gameState.getPlayerList().stream().map(PublicPlayerView::from).toList(),
                List.copyOf(gameState.getDeathsLastNight()),
                List.copyOf(gameState.getMutedForToday()),
                gameState.getVotingStatus(),
                gameState.getVoteDurationSec(),
                gameState.getWinner());
    }
}
