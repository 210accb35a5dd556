package com.example.werewolf.game.dto.response;

public record CreateRoomResponse(String roomCode, String hostSecret) {
}
