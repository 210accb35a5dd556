package com.example.werewolf.game.domain;

import com.example.werewolf.game.domain.action.VoteTally;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class VoteTallyTest {

    @Test
    @DisplayName("최다 득표 대상이 이긴다")
    void leaderHasMostVotes() {
        VoteTally tally = VoteTally.of(List.of("A", "B", "B", "C", "B"));

        assertThat(tally.leader()).contains("B");
        assertThat(tally.getCounts()).containsEntry("B", 3).containsEntry("A", 1);
    }

    @Test
    @DisplayName("동률이면 첫 표가 먼저 들어온 대상이 이긴다")
    void tieGoesToEarliestFirstBallot() {
        VoteTally tally = VoteTally.of(List.of("B", "A", "A", "B"));

        assertThat(tally.leader()).contains("B");
        assertThat(tally.getCounts().keySet()).containsExactly("B", "A");
    }

    @Test
    @DisplayName("표가 없으면 결과도 없다")
    void emptyTally() {
        VoteTally tally = VoteTally.of(List.of());

        assertThat(tally.isEmpty()).isTrue();
        assertThat(tally.leader()).isEmpty();
    }

    @Test
    @DisplayName("대상이 없는 표는 세지 않는다")
    void ignoresNullBallots() {
        VoteTally tally = VoteTally.of(Arrays.asList(null, "A"));

        assertThat(tally.getCounts()).hasSize(1);
        assertThat(tally.leader()).contains("A");
    }
}
