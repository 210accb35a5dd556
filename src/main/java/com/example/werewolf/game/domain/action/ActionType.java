package com.example.werewolf.game.domain.action;

import com.example.werewolf.game.domain.state.GamePhase;
import com.example.werewolf.global.error.CommonException;
import com.example.werewolf.global.error.ErrorCode;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Arrays;

/**
 * 플레이어가 제출할 수 있는 행동 종류.
 * 제출자의 역할은 검사하지 않는다. 역할과 무관한 행동은 저장되지만 해당 슬롯을 읽는 처리 단계가 없으면 아무 효과가 없다.
 */
@Getter
public enum ActionType {
    MAGE_MUTE("mage_mute", GamePhase.NIGHT, DecisionSlot.MUTE, true),
    GUARD_PROTECT("guard_protect", GamePhase.NIGHT, DecisionSlot.PROTECT, true),
    WOLF_KILL("wolf_kill", GamePhase.NIGHT, DecisionSlot.KILL, true),
    SEER_INSPECT("seer_inspect", GamePhase.NIGHT, DecisionSlot.INSPECT, true),
    GAMBLER_BET("gambler_bet", GamePhase.NIGHT, DecisionSlot.BET, true),
    GAMBLER_SKIP("gambler_skip", GamePhase.NIGHT, DecisionSlot.BET, false),
    WITCH_HEAL("witch_heal", GamePhase.NIGHT, DecisionSlot.HEAL, false),
    WITCH_NO_HEAL("witch_no_heal", GamePhase.NIGHT, DecisionSlot.HEAL, false),
    WITCH_POISON("witch_poison", GamePhase.NIGHT, DecisionSlot.POISON, true),
    WITCH_NO_POISON("witch_no_poison", GamePhase.NIGHT, DecisionSlot.POISON, false),
    VOTE_LYNCH("vote_lynch", GamePhase.DAY, DecisionSlot.LYNCH, true);

    private final String value;
    private final GamePhase phase;
    private final DecisionSlot slot;
    private final boolean targetRequired;

    ActionType(String value, GamePhase phase, DecisionSlot slot, boolean targetRequired) {
        this.value = value;
        this.phase = phase;
        this.slot = slot;
        this.targetRequired = targetRequired;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ActionType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new CommonException(ErrorCode.VALIDATION_ERROR, "Unknown action type: " + value));
    }
}
