package com.example.werewolf.game.controller;

import com.example.werewolf.game.dto.request.ActionRequest;
import com.example.werewolf.game.dto.request.SeerResultRequest;
import com.example.werewolf.game.dto.response.ActionResponse;
import com.example.werewolf.game.dto.response.ApiResponse;
import com.example.werewolf.game.dto.response.PlayerStateResponse;
import com.example.werewolf.game.dto.response.SeerResultResponse;
import com.example.werewolf.game.dto.response.WitchInfoResponse;
import com.example.werewolf.game.service.GameQueryService;
import com.example.werewolf.game.service.GameService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 플레이어 API. 응답은 요청한 플레이어 기준으로 걸러진 정보만 담는다.
 */
@RestController
@RequestMapping("/api/rooms/{roomCode}")
@RequiredArgsConstructor
public class PlayerController {

    private final GameService gameService;
    private final GameQueryService gameQueryService;

    @GetMapping("/state/{playerId}")
    public ResponseEntity<ApiResponse<PlayerStateResponse>> getPlayerState(@PathVariable String roomCode,
            @PathVariable String playerId) {
        return ResponseEntity.ok(ApiResponse.success("플레이어 상태",
                gameQueryService.getPlayerState(roomCode, playerId)));
    }

    @PostMapping("/actions")
    public ResponseEntity<ApiResponse<ActionResponse>> submitAction(@PathVariable String roomCode,
            @Valid @RequestBody ActionRequest request) {
        ActionResponse response = gameService.submitAction(roomCode, request.playerId(), request.actionType(),
                request.targetName());
        return ResponseEntity.ok(ApiResponse.success("행동 접수", response));
    }

    @PostMapping("/seer_result")
    public ResponseEntity<ApiResponse<SeerResultResponse>> getSeerResult(@PathVariable String roomCode,
            @Valid @RequestBody SeerResultRequest request) {
        return ResponseEntity.ok(ApiResponse.success("조사 결과",
                gameQueryService.getSeerResult(roomCode, request.playerId(), request.targetName())));
    }

    @GetMapping("/witch_info/{playerId}")
    public ResponseEntity<ApiResponse<WitchInfoResponse>> getWitchInfo(@PathVariable String roomCode,
            @PathVariable String playerId) {
        return ResponseEntity.ok(ApiResponse.success("마녀 정보", gameQueryService.getWitchInfo(roomCode, playerId)));
    }
}
