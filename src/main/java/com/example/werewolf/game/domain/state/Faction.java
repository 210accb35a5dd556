package com.example.werewolf.game.domain.state;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Faction {
    VILLAGE("village"),
    WEREWOLVES("werewolves");

    private final String value;

    Faction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
