package com.example.werewolf.game.domain.action;

import com.example.werewolf.game.domain.state.GamePhase;

/**
 * 제출된 행동 한 건. 사이클 번호는 제출 시점에 서버가 찍는다.
 *
 * @param sequence    방 안에서의 제출 순서 (0부터)
 * @param nightNumber 밤에 제출된 경우의 밤 번호, 아니면 null
 * @param dayNumber   낮에 제출된 경우의 낮 번호, 아니면 null
 */
public record GameAction(
        long sequence,
        String playerId,
        ActionType type,
        String targetName,
        GamePhase phase,
        Integer nightNumber,
        Integer dayNumber) {

    public boolean isOfNight(int night) {
        return phase == GamePhase.NIGHT && nightNumber != null && nightNumber == night;
    }

    public boolean isOfDay(int day) {
        return phase == GamePhase.DAY && dayNumber != null && dayNumber == day;
    }

    public DecisionSlot slot() {
        return type.getSlot();
    }
}
