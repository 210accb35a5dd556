package com.example.werewolf.game.service;

import com.example.werewolf.game.GameFixture;
import com.example.werewolf.game.domain.action.ActionType;
import com.example.werewolf.game.domain.result.RoleProgress;
import com.example.werewolf.game.domain.state.GameState;
import com.example.werewolf.game.domain.state.PlayerRole;
import com.example.werewolf.global.error.CommonException;
import com.example.werewolf.global.error.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoleProgressTrackerTest {

    private final RoleProgressTracker tracker = new RoleProgressTracker();

    private GameState gameState;

    @BeforeEach
    void setUp() {
        gameState = GameFixture.sevenPlayerRoom();
    }

    @Test
    @DisplayName("마녀는 치료와 독 결정을 모두 내려야 완료된다")
    void witchNeedsBothDecisions() {
        // given
        GameFixture.submit(gameState, "P4", ActionType.WITCH_HEAL, null);

        // when
        RoleProgress halfway = tracker.pending(gameState, PlayerRole.WITCH);

        // then
        assertThat(halfway.pending()).containsExactly("P4");
        assertThat(halfway.done()).isFalse();

        GameFixture.submit(gameState, "P4", ActionType.WITCH_NO_POISON, null);
        RoleProgress finished = tracker.pending(gameState, PlayerRole.WITCH);
        assertThat(finished.pending()).isEmpty();
        assertThat(finished.done()).isTrue();
    }

    @Test
    @DisplayName("늑대는 각자 결정해야 하고 죽은 늑대는 기다리지 않는다")
    void eachLivingWolfMustDecide() {
        GameFixture.submit(gameState, "P1", ActionType.WOLF_KILL, "P3");
        assertThat(tracker.pending(gameState, PlayerRole.WEREWOLF).pending()).containsExactly("P2");

        GameFixture.player(gameState, "P2").kill();
        assertThat(tracker.pending(gameState, PlayerRole.WEREWOLF).done()).isTrue();
    }

    @Test
    @DisplayName("도박꾼은 건너뛰기도 결정으로 인정된다")
    void gamblerSkipCounts() {
        GameFixture.submit(gameState, "P6", ActionType.GAMBLER_SKIP, null);

        assertThat(tracker.pending(gameState, PlayerRole.GAMBLER).done()).isTrue();
    }

    @Test
    @DisplayName("이전 밤의 행동은 이번 밤 진행에 포함되지 않는다")
    void previousNightDoesNotCount() {
        GameFixture.submit(gameState, "P5", ActionType.GUARD_PROTECT, "P3");
        gameState.enterDay();
        gameState.enterNight();

        assertThat(tracker.pending(gameState, PlayerRole.GUARD).pending()).containsExactly("P5");
    }

    @Test
    @DisplayName("보유자가 없는 역할은 바로 완료")
    void noHolderIsDone() {
        GameState small = GameFixture.startedRoom(PlayerRole.WEREWOLF, PlayerRole.VILLAGER, PlayerRole.VILLAGER,
                PlayerRole.VILLAGER);

        RoleProgress progress = tracker.pending(small, PlayerRole.SEER);

        assertThat(progress.pending()).isEmpty();
        assertThat(progress.done()).isTrue();
    }

    @Test
    @DisplayName("호출 대상이 아닌 역할은 INVALID_ROLE")
    void rejectsNonCallableRole() {
        assertThatThrownBy(() -> tracker.pending(gameState, PlayerRole.PRINCE))
                .isInstanceOf(CommonException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_ROLE);
    }
}
