package com.example.werewolf.game.service;

import com.example.werewolf.game.GameFixture;
import com.example.werewolf.game.domain.state.Faction;
import com.example.werewolf.game.domain.state.GameState;
import com.example.werewolf.game.domain.state.PlayerRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WinEvaluatorTest {

    private final WinEvaluator winEvaluator = new WinEvaluator();

    private GameState gameState;

    @BeforeEach
    void setUp() {
        // 5인, 늑대 1
        gameState = GameFixture.startedRoom(PlayerRole.WEREWOLF, PlayerRole.SEER, PlayerRole.WITCH,
                PlayerRole.GUARD, PlayerRole.VILLAGER);
    }

    @Test
    @DisplayName("모두 살아 있으면 승자가 없다")
    void noWinnerAtStart() {
        assertThat(winEvaluator.evaluate(gameState.getPlayerList())).isEmpty();
    }

    @Test
    @DisplayName("늑대 수가 나머지 생존자 수 이상이면 늑대 승리")
    void werewolvesWinOnParity() {
        GameFixture.player(gameState, "P2").kill();
        GameFixture.player(gameState, "P3").kill();
        assertThat(winEvaluator.evaluate(gameState.getPlayerList())).isEmpty();

        GameFixture.player(gameState, "P4").kill();
        assertThat(winEvaluator.evaluate(gameState.getPlayerList())).contains(Faction.WEREWOLVES);
    }

    @Test
    @DisplayName("살아 있는 늑대가 없으면 마을 승리")
    void villageWinsWhenWolvesDead() {
        GameFixture.player(gameState, "P1").kill();

        assertThat(winEvaluator.evaluate(gameState.getPlayerList())).contains(Faction.VILLAGE);
    }

    @Test
    @DisplayName("생존자가 아무도 없으면 승자도 없다")
    void nobodyAlive() {
        gameState.getPlayerList().forEach(p -> p.kill());

        assertThat(winEvaluator.evaluate(gameState.getPlayerList())).isEmpty();
    }
}
