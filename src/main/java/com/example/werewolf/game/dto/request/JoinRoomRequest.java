package com.example.werewolf.game.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record JoinRoomRequest(
        @NotBlank(message = "name is required")
        @Size(max = 30, message = "name must be at most 30 characters") String name) {
}
