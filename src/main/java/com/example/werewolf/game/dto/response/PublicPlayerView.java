package com.example.werewolf.game.dto.response;

import com.example.werewolf.game.domain.state.GamePlayerState;

/**
 * 누구에게나 보이는 플레이어 정보 (역할 없음)
 */
public record PublicPlayerView(String name, boolean alive, boolean mutedToday) {

    public static PublicPlayerView from(GamePlayerState player) {
        return new PublicPlayerView(player.getPlayerName(), player.isAlive(), player.isMutedToday());
    }
}
