package com.example.werewolf.game.service;

import com.example.werewolf.game.GameFixture;
import com.example.werewolf.game.domain.state.GamePlayerState;
import com.example.werewolf.game.domain.state.GameState;
import com.example.werewolf.game.domain.state.PlayerRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class RoleAssignerTest {

    private final RoleAssigner roleAssigner = new RoleAssigner(new Random(42));

    @Test
    @DisplayName("5명 미만이면 늑대 1명, 남는 역할은 잘린다")
    void fourPlayers() {
        assertThat(roleAssigner.distributeRoles(4))
                .containsExactly(PlayerRole.WEREWOLF, PlayerRole.SEER, PlayerRole.WITCH, PlayerRole.GUARD);
    }

    @Test
    @DisplayName("5명부터 늑대 2명")
    void fivePlayers() {
        assertThat(roleAssigner.distributeRoles(5))
                .containsExactly(PlayerRole.WEREWOLF, PlayerRole.WEREWOLF, PlayerRole.SEER, PlayerRole.WITCH,
                        PlayerRole.GUARD);
    }

    @Test
    @DisplayName("특수 역할을 다 채우고 남은 자리는 시민")
    void surplusSeatsAreVillagers() {
        assertThat(roleAssigner.distributeRoles(10))
                .containsExactly(PlayerRole.WEREWOLF, PlayerRole.WEREWOLF, PlayerRole.SEER, PlayerRole.WITCH,
                        PlayerRole.GUARD, PlayerRole.GAMBLER, PlayerRole.PRINCE, PlayerRole.MAGE,
                        PlayerRole.VILLAGER, PlayerRole.VILLAGER);
    }

    @Test
    @DisplayName("모든 플레이어가 역할을 받고 상태가 초기화된다")
    void assignsEveryPlayer() {
        // given
        GameState gameState = GameFixture.sevenPlayerRoom();
        GamePlayerState dead = GameFixture.player(gameState, "P3");
        dead.kill();
        dead.revealPrince();

        // when
        Map<String, PlayerRole> assignment = roleAssigner.assignRoles(gameState);

        // then
        assertThat(assignment).hasSize(7);
        assertThat(assignment.values()).containsExactlyInAnyOrderElementsOf(roleAssigner.distributeRoles(7));
        assertThat(gameState.getPlayerList()).allMatch(GamePlayerState::isAlive);
        assertThat(gameState.getPlayerList()).noneMatch(GamePlayerState::isPrinceRevealed);
        gameState.getPlayerList()
                .forEach(p -> assertThat(p.getRole()).isEqualTo(assignment.get(p.getPlayerId())));
    }
}
