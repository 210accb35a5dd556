package com.example.werewolf.game.dto.request;

import jakarta.validation.constraints.NotBlank;

/**
 * 행동 제출. target_name 필요 여부는 행동 종류에 따라 서비스에서 검증한다.
 */
public record ActionRequest(
        @NotBlank(message = "player_id is required") String playerId,
        @NotBlank(message = "action_type is required") String actionType,
        String targetName) {
}
