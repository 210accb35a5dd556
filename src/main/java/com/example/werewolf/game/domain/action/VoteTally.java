package com.example.werewolf.game.domain.action;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 표 집계.
 * 표는 제출 순서대로 센다. 최다 득표 동률이면 첫 표가 가장 먼저 들어온 대상이 이긴다.
 */
public final class VoteTally {

    // 첫 표가 들어온 순서 유지
    private final Map<String, Integer> counts;

    private VoteTally(Map<String, Integer> counts) {
        this.counts = counts;
    }

    public static VoteTally of(List<String> ballots) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String target : ballots) {
            if (target == null) {
                continue;
            }
            counts.merge(target, 1, Integer::sum);
        }
        return new VoteTally(counts);
    }

    public Optional<String> leader() {
        String leader = null;
        int max = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            // 동률은 앞선 대상 유지
            if (entry.getValue() > max) {
                leader = entry.getKey();
                max = entry.getValue();
            }
        }
        return Optional.ofNullable(leader);
    }

    public Map<String, Integer> getCounts() {
        return Collections.unmodifiableMap(counts);
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }
}
