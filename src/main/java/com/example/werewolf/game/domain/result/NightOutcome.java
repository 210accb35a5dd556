package com.example.werewolf.game.domain.result;

import com.example.werewolf.game.domain.state.Faction;

import java.util.List;

/**
 * 밤 처리 결과
 *
 * @param deaths        이번 밤 사망자 이름 (중복 없음, 처리 순서)
 * @param mutedForToday 다음 낮 동안 침묵하는 이름
 * @param winner        승리 진영, 없으면 null
 */
public record NightOutcome(List<String> deaths, List<String> mutedForToday, Faction winner) {
}
