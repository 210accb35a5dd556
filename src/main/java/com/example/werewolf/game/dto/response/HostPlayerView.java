package com.example.werewolf.game.dto.response;

import com.example.werewolf.game.domain.state.GamePlayerState;
import com.example.werewolf.game.domain.state.PlayerRole;

public record HostPlayerView(
        String playerId,
        String name,
        PlayerRole role,
        boolean alive,
        boolean mutedToday,
        boolean princeRevealed) {

    public static HostPlayerView from(GamePlayerState player) {
        return new HostPlayerView(player.getPlayerId(), player.getPlayerName(), player.getRole(),
                player.isAlive(), player.isMutedToday(), player.isPrinceRevealed());
    }
}
