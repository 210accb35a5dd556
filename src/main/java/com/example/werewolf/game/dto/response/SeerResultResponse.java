package com.example.werewolf.game.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SeerResultResponse(String targetName, @JsonProperty("is_werewolf") boolean isWerewolf) {
}
