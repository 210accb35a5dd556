package com.example.werewolf.game.domain.state;

import com.example.werewolf.game.domain.action.DecisionSlot;
import com.example.werewolf.global.error.CommonException;
import com.example.werewolf.global.error.ErrorCode;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

public enum PlayerRole {
    WEREWOLF("werewolf"),
    SEER("seer"),
    WITCH("witch"),
    GUARD("guard"),
    GAMBLER("gambler"),
    PRINCE("prince"),
    MAGE("mage"),
    VILLAGER("villager");

    private final String value;

    PlayerRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Faction getFaction() {
        return this == WEREWOLF ? Faction.WEREWOLVES : Faction.VILLAGE;
    }

    /**
     * 밤에 호스트가 호출하는 역할인지 여부
     */
    public boolean isCallable() {
        return !requiredSlots().isEmpty();
    }

    /**
     * 한 밤 동안 이 역할이 반드시 내려야 하는 결정 슬롯.
     * 마녀만 두 개(치료, 독)이고 나머지는 하나씩이다.
     */
    public Set<DecisionSlot> requiredSlots() {
        return switch (this) {
            case MAGE -> EnumSet.of(DecisionSlot.MUTE);
            case GUARD -> EnumSet.of(DecisionSlot.PROTECT);
            case WEREWOLF -> EnumSet.of(DecisionSlot.KILL);
            case SEER -> EnumSet.of(DecisionSlot.INSPECT);
            case GAMBLER -> EnumSet.of(DecisionSlot.BET);
            case WITCH -> EnumSet.of(DecisionSlot.HEAL, DecisionSlot.POISON);
            case PRINCE, VILLAGER -> EnumSet.noneOf(DecisionSlot.class);
        };
    }

    public static PlayerRole fromValue(String value) {
        return Arrays.stream(values())
                .filter(role -> role.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new CommonException(ErrorCode.INVALID_ROLE, "Unknown role: " + value));
    }

    /**
     * 호출 가능한 역할만 허용한다. 진행 상황 조회와 호스트 호출에서 사용.
     */
    public static PlayerRole callableFromValue(String value) {
        PlayerRole role = fromValue(value);
        if (!role.isCallable()) {
            throw new CommonException(ErrorCode.INVALID_ROLE, "Role is not called at night: " + value);
        }
        return role;
    }
}
