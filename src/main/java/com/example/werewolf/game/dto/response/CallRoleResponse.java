package com.example.werewolf.game.dto.response;

import com.example.werewolf.game.domain.state.PlayerRole;

public record CallRoleResponse(PlayerRole activeCall) {
}
