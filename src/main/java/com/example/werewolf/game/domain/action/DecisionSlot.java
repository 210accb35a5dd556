package com.example.werewolf.game.domain.action;

/**
 * 행동이 답하는 결정 단위. 같은 사이클, 같은 플레이어, 같은 슬롯에서는 마지막 제출만 유효하다.
 */
public enum DecisionSlot {
    MUTE,
    PROTECT,
    KILL,
    INSPECT,
    BET,
    HEAL,
    POISON,
    LYNCH
}
