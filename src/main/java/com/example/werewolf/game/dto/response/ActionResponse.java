package com.example.werewolf.game.dto.response;

import com.example.werewolf.game.domain.action.ActionType;
import com.example.werewolf.game.domain.action.GameAction;
import com.example.werewolf.game.domain.state.GamePhase;

/**
 * 접수된 행동. 서버가 찍은 사이클 번호를 그대로 돌려준다.
 */
public record ActionResponse(long sequence, ActionType actionType, String targetName, GamePhase phase,
        Integer nightNumber, Integer dayNumber) {

    public static ActionResponse from(GameAction action) {
        return new ActionResponse(action.sequence(), action.type(), action.targetName(), action.phase(),
                action.nightNumber(), action.dayNumber());
    }
}
