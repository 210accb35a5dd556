package com.example.werewolf.game.controller;

import com.example.werewolf.game.dto.request.JoinRoomRequest;
import com.example.werewolf.game.dto.response.ApiResponse;
import com.example.werewolf.game.dto.response.CreateRoomResponse;
import com.example.werewolf.game.dto.response.JoinRoomResponse;
import com.example.werewolf.game.dto.response.VillageStateResponse;
import com.example.werewolf.game.service.GameQueryService;
import com.example.werewolf.game.service.GameService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/rooms")
@RequiredArgsConstructor
public class RoomController {

    private final GameService gameService;
    private final GameQueryService gameQueryService;

    @PostMapping
    public ResponseEntity<ApiResponse<CreateRoomResponse>> createRoom() {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("방 생성 완료", gameService.createRoom()));
    }

    @PostMapping("/{roomCode}/join")
    public ResponseEntity<ApiResponse<JoinRoomResponse>> joinRoom(@PathVariable String roomCode,
            @Valid @RequestBody JoinRoomRequest request) {
        return ResponseEntity.ok(ApiResponse.success("입장 완료", gameService.joinRoom(roomCode, request.name())));
    }

    @GetMapping("/{roomCode}/village_state")
    public ResponseEntity<ApiResponse<VillageStateResponse>> getVillageState(@PathVariable String roomCode) {
        return ResponseEntity.ok(ApiResponse.success("마을 상태", gameQueryService.getVillageState(roomCode)));
    }
}
