package com.example.werewolf.game.domain.result;

import java.util.Map;

/**
 * 처형 투표 중간 집계. 상태를 바꾸지 않는다.
 *
 * @param candidateName 현재 최다 득표자, 표가 없으면 null
 * @param votes         대상 이름별 득표 수 (첫 표가 들어온 순서)
 */
public record VotePreview(String candidateName, Map<String, Integer> votes) {

    public static VotePreview empty() {
        return new VotePreview(null, Map.of());
    }
}
