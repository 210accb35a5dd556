package com.example.werewolf.game.dto.response;

import com.example.werewolf.game.domain.state.Faction;
import com.example.werewolf.game.domain.state.GamePhase;
import com.example.werewolf.game.domain.state.GameState;
import com.example.werewolf.game.domain.state.PlayerRole;
import com.example.werewolf.game.domain.state.VotingStatus;

import java.util.List;

/**
 * 호스트 전용 전체 화면 (역할, 소모품, 투표 상태 포함)
 */
public record HostStateResponse(
        String roomCode,
        GamePhase phase,
        int nightNumber,
        int dayNumber,
        boolean started,
        List<HostPlayerView> players,
        List<String> deathsLastNight,
        List<String> mutedForToday,
        boolean witchHasHeal,
        boolean witchHasPoison,
        String lastGuardTargetName,
        PlayerRole activeCall,
        VotingStatus votingStatus,
        Integer voteDurationSec,
        int actionCount,
        Faction winner) {

    public static HostStateResponse from(GameState gameState) {
        return new HostStateResponse(
                gameState.getRoomCode(),
                gameState.getPhase(),
                gameState.getNightNumber(),
                gameState.getDayNumber(),
                gameState.isStarted(),
                gameState.getPlayerList().stream().map(HostPlayerView::from).toList(),
                List.copyOf(gameState.getDeathsLastNight()),
                List.copyOf(gameState.getMutedForToday()),
                gameState.isWitchHasHeal(),
                gameState.isWitchHasPoison(),
                gameState.getLastGuardTargetName(),
                gameState.getActiveCall(),
                gameState.getVotingStatus(),
                gameState.getVoteDurationSec(),
                gameState.getActionLog().size(),
                gameState.getWinner());
    }
}
