package com.example.werewolf.game.dto.response;

/**
 * @param victimName 이번 밤 늑대가 고른 대상 (보호 미적용), 없으면 null
 */
public record WitchInfoResponse(String victimName, boolean canHeal, boolean canPoison) {
}
