package com.example.werewolf.game.domain.state;

import com.fasterxml.jackson.annotation.JsonValue;

public enum VotingStatus {
    IDLE("idle"),
    VOTING("voting");

    private final String value;

    VotingStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
