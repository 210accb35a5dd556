package com.example.werewolf.game.dto.request;

import jakarta.validation.constraints.NotBlank;

public record HostRequest(
        @NotBlank(message = "host_secret is required") String hostSecret) {
}
