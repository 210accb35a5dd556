package com.example.werewolf.game;

import com.example.werewolf.game.domain.action.ActionType;
import com.example.werewolf.game.domain.state.GamePlayerState;
import com.example.werewolf.game.domain.state.GameState;
import com.example.werewolf.game.domain.state.PlayerRole;

/**
 * 테스트용 방 상태. 플레이어 이름은 P1, P2 ... 이고 ID는 "id-" + 이름이다.
 */
public final class GameFixture {

    private GameFixture() {
    }

    /**
     * 주어진 역할 순서대로 플레이어를 만들고 첫 밤 상태로 시작한다.
     */
    public static GameState startedRoom(PlayerRole... roles) {
        GameState gameState = GameState.builder()
                .roomCode("1234")
                .hostSecret("host-secret")
                .build();
        for (int i = 0; i < roles.length; i++) {
            String name = "P" + (i + 1);
            GamePlayerState player = GamePlayerState.joined(idOf(name), name);
            player.resetForNewGame(roles[i]);
            gameState.addPlayer(player);
        }
        gameState.beginFirstNight();
        return gameState;
    }

    /**
     * 늑대 2, 예언자, 마녀, 보호자, 도박꾼, 마법사로 구성된 7인 방
     */
    public static GameState sevenPlayerRoom() {
        return startedRoom(PlayerRole.WEREWOLF, PlayerRole.WEREWOLF, PlayerRole.SEER, PlayerRole.WITCH,
                PlayerRole.GUARD, PlayerRole.GAMBLER, PlayerRole.MAGE);
    }

    public static void submit(GameState gameState, String playerName, ActionType type, String targetName) {
        gameState.getActionLog().append(idOf(playerName), type, targetName, gameState.getPhase(),
                gameState.currentNightStamp(), gameState.currentDayStamp());
    }

    public static String idOf(String playerName) {
        return "id-" + playerName;
    }

    public static GamePlayerState player(GameState gameState, String playerName) {
        return gameState.findPlayerByName(playerName);
    }
}
