package com.example.werewolf.game.dto.response;

import com.example.werewolf.game.domain.state.GamePhase;
import com.example.werewolf.game.domain.state.GameState;

public record PhaseResponse(GamePhase phase, int nightNumber, int dayNumber) {

    public static PhaseResponse from(GameState gameState) {
        return new PhaseResponse(gameState.getPhase(), gameState.getNightNumber(), gameState.getDayNumber());
    }
}
