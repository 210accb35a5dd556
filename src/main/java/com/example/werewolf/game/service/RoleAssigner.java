package com.example.werewolf.game.service;

import com.example.werewolf.game.domain.state.GamePlayerState;
import com.example.werewolf.game.domain.state.GameState;
import com.example.werewolf.game.domain.state.PlayerRole;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

@Component
@RequiredArgsConstructor
public class RoleAssigner {

    // 늑대 다음으로 채워지는 역할 순서
    private static final List<PlayerRole> SPECIAL_ROLES = List.of(
            PlayerRole.SEER, PlayerRole.WITCH, PlayerRole.GUARD,
            PlayerRole.GAMBLER, PlayerRole.PRINCE, PlayerRole.MAGE);

    private static final int TWO_WEREWOLVES_FROM = 5;

    private final Random gameRandom;

    /**
     * 플레이어 순서를 섞은 뒤 역할 목록과 짝지어 배정하고, 각 플레이어 상태를 새 게임용으로 초기화한다.
     *
     * @return playerId별 배정된 역할
     */
    public Map<String, PlayerRole> assignRoles(GameState gameState) {
        List<String> playerIds = new ArrayList<>(gameState.getPlayers().keySet());
        List<PlayerRole> roles = distributeRoles(playerIds.size());
        Collections.shuffle(playerIds, gameRandom);

        Map<String, PlayerRole> assignment = new LinkedHashMap<>();
        for (int i = 0; i < playerIds.size(); i++) {
            GamePlayerState player = gameState.findPlayer(playerIds.get(i));
            player.resetForNewGame(roles.get(i));
            assignment.put(player.getPlayerId(), roles.get(i));
        }
        return assignment;
    }

    List<PlayerRole> distributeRoles(int playerCount) {
        List<PlayerRole> roles = new ArrayList<>();
        int werewolfCount = playerCount < TWO_WEREWOLVES_FROM ? 1 : 2;

        for (int i = 0; i < werewolfCount; i++) {
            roles.add(PlayerRole.WEREWOLF);
        }
        roles.addAll(SPECIAL_ROLES);

        while (roles.size() < playerCount) {
            roles.add(PlayerRole.VILLAGER);
        }
        // 자리보다 역할이 많으면 뒤쪽 역할은 빠진다
        return new ArrayList<>(roles.subList(0, playerCount));
    }
}
