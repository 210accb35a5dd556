package com.example.werewolf.game.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public record StartVotingRequest(
        @NotBlank(message = "host_secret is required") String hostSecret,
        @Positive(message = "duration_sec must be positive") Integer durationSec) {
}
