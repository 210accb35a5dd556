package com.example.werewolf.game.dto.response;

public record JoinRoomResponse(String roomCode, String playerId) {
}
