package com.example.werewolf.game.domain.action;

import com.example.werewolf.game.domain.state.GamePhase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 방의 행동 기록. 추가만 가능하고 기존 항목은 바뀌지 않는다.
 * 사이클별 조회는 제출 시 찍힌 밤/낮 번호로 걸러낸다.
 */
public class ActionLog {

    private final List<GameAction> actions = new ArrayList<>();

    public GameAction append(String playerId, ActionType type, String targetName, GamePhase phase,
            Integer nightNumber, Integer dayNumber) {
        GameAction action = new GameAction(actions.size(), playerId, type, targetName, phase, nightNumber,
                dayNumber);
        actions.add(action);
        return action;
    }

    /**
     * 해당 밤에 제출된 행동 (제출 순서 유지)
     */
    public List<GameAction> forNight(int nightNumber) {
        return actions.stream()
                .filter(action -> action.isOfNight(nightNumber))
                .collect(Collectors.toList());
    }

    /**
     * 해당 낮에 제출된 행동 (제출 순서 유지)
     */
    public List<GameAction> forDay(int dayNumber) {
        return actions.stream()
                .filter(action -> action.isOfDay(dayNumber))
                .collect(Collectors.toList());
    }

    public List<GameAction> getAll() {
        return Collections.unmodifiableList(actions);
    }

    public int size() {
        return actions.size();
    }

    /**
     * 새 게임 시작 시에만 호출된다.
     */
    public void reset() {
        actions.clear();
    }
}
