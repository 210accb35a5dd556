package com.example.werewolf.global.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {
    ROOM_NOT_FOUND(HttpStatus.NOT_FOUND, "ROOM_NOT_FOUND", "Room not found"),
    PLAYER_NOT_FOUND(HttpStatus.NOT_FOUND, "PLAYER_NOT_FOUND", "Player does not belong to this room"),
    TARGET_NOT_FOUND(HttpStatus.NOT_FOUND, "TARGET_NOT_FOUND", "Target player not found"),
    FORBIDDEN(HttpStatus.FORBIDDEN, "FORBIDDEN", "Host secret mismatch"),
    NOT_A_LIVING_SEER(HttpStatus.FORBIDDEN, "NOT_A_LIVING_SEER", "Only the living seer can inspect"),
    NOT_A_LIVING_WITCH(HttpStatus.FORBIDDEN, "NOT_A_LIVING_WITCH", "Only the living witch can see this"),
    INVALID_PHASE(HttpStatus.BAD_REQUEST, "INVALID_PHASE", "Operation not allowed in the current phase"),
    GAME_ENDED(HttpStatus.CONFLICT, "GAME_ENDED", "Game has already ended"),
    DEAD_PLAYER(HttpStatus.BAD_REQUEST, "DEAD_PLAYER", "Dead players cannot act"),
    INVALID_ROLE(HttpStatus.BAD_REQUEST, "INVALID_ROLE", "Invalid role"),
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Invalid request"),
    GAME_ALREADY_STARTED(HttpStatus.CONFLICT, "GAME_ALREADY_STARTED", "Game already started, cannot join"),
    DUPLICATE_PLAYER_NAME(HttpStatus.CONFLICT, "DUPLICATE_PLAYER_NAME", "Name already taken in this room"),
    ;
    private final String code;
    private final String message;
    private final HttpStatus status;

    ErrorCode(HttpStatus status, String code, String message) {
        this.status = status;
        this.message = message;
        this.code = code;
    }
}
