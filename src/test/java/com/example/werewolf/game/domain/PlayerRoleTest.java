package com.example.werewolf.game.domain;

import com.example.werewolf.game.domain.action.ActionType;
import com.example.werewolf.game.domain.action.DecisionSlot;
import com.example.werewolf.game.domain.state.Faction;
import com.example.werewolf.game.domain.state.GamePhase;
import com.example.werewolf.game.domain.state.PlayerRole;
import com.example.werewolf.global.error.CommonException;
import com.example.werewolf.global.error.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlayerRoleTest {

    @Test
    @DisplayName("마녀는 치료와 독 두 슬롯, 나머지 호출 역할은 한 슬롯")
    void requiredSlots() {
        assertThat(PlayerRole.WITCH.requiredSlots()).containsExactlyInAnyOrder(DecisionSlot.HEAL, DecisionSlot.POISON);
        assertThat(PlayerRole.GAMBLER.requiredSlots()).containsExactly(DecisionSlot.BET);
        assertThat(PlayerRole.PRINCE.isCallable()).isFalse();
        assertThat(PlayerRole.VILLAGER.isCallable()).isFalse();
        assertThat(PlayerRole.MAGE.isCallable()).isTrue();
    }

    @Test
    @DisplayName("늑대인간만 늑대 진영이다")
    void faction() {
        assertThat(PlayerRole.WEREWOLF.getFaction()).isEqualTo(Faction.WEREWOLVES);
        assertThat(PlayerRole.PRINCE.getFaction()).isEqualTo(Faction.VILLAGE);
    }

    @Test
    @DisplayName("호출할 수 없는 역할이나 모르는 역할은 INVALID_ROLE")
    void callableFromValueRejects() {
        assertThat(PlayerRole.callableFromValue("witch")).isEqualTo(PlayerRole.WITCH);

        assertThatThrownBy(() -> PlayerRole.callableFromValue("villager"))
                .isInstanceOf(CommonException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_ROLE);
        assertThatThrownBy(() -> PlayerRole.fromValue("vampire"))
                .isInstanceOf(CommonException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_ROLE);
    }

    @Test
    @DisplayName("행동 종류는 닫힌 집합이고 gambler_skip은 대상이 필요 없다")
    void actionTypes() {
        assertThat(ActionType.fromValue("gambler_skip").isTargetRequired()).isFalse();
        assertThat(ActionType.fromValue("gambler_skip").getSlot()).isEqualTo(DecisionSlot.BET);
        assertThat(ActionType.fromValue("vote_lynch").getPhase()).isEqualTo(GamePhase.DAY);

        assertThatThrownBy(() -> ActionType.fromValue("eat_cookie"))
                .isInstanceOf(CommonException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.VALIDATION_ERROR);
    }

    @Test
    @DisplayName("호스트는 ended 페이즈를 직접 고를 수 없다")
    void hostSelectablePhase() {
        assertThat(GamePhase.hostSelectable("DAY")).isEqualTo(GamePhase.DAY);
        assertThatThrownBy(() -> GamePhase.hostSelectable("ended"))
                .isInstanceOf(CommonException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.VALIDATION_ERROR);
    }
}
