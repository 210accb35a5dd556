package com.example.werewolf.game.dto.request;

import jakarta.validation.constraints.NotBlank;

/**
 * role이 비어 있으면 현재 호출을 해제한다.
 */
public record CallRoleRequest(
        @NotBlank(message = "host_secret is required") String hostSecret,
        String role) {
}
