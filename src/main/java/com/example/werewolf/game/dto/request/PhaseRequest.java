package com.example.werewolf.game.dto.request;

import jakarta.validation.constraints.NotBlank;

public record PhaseRequest(
        @NotBlank(message = "host_secret is required") String hostSecret,
        @NotBlank(message = "phase is required") String phase) {
}
