package com.example.werewolf.game.dto.request;

import jakarta.validation.constraints.NotBlank;

public record SeerResultRequest(
        @NotBlank(message = "player_id is required") String playerId,
        String targetName) {
}
