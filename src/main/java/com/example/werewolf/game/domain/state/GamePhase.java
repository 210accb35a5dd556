package com.example.werewolf.game.domain.state;

import com.example.werewolf.global.error.CommonException;
import com.example.werewolf.global.error.ErrorCode;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum GamePhase {
    LOBBY("lobby"), // 게임 시작 전 대기
    NIGHT("night"), // 밤 (역할별 행동)
    DAY("day"), // 낮 (토론, 처형 투표)
    ENDED("ended"); // 승리 진영 확정

    private final String value;

    GamePhase(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * 호스트가 직접 전환할 수 있는 페이즈만 허용 (ENDED는 승패 판정으로만 진입)
     */
    public static GamePhase hostSelectable(String value) {
        return Arrays.stream(new GamePhase[] { NIGHT, DAY, LOBBY })
                .filter(phase -> phase.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new CommonException(ErrorCode.VALIDATION_ERROR, "Invalid phase: " + value));
    }
}
