package com.example.werewolf.game.controller;

import com.example.werewolf.game.domain.result.LynchOutcome;
import com.example.werewolf.game.domain.result.NightOutcome;
import com.example.werewolf.game.domain.result.RoleProgress;
import com.example.werewolf.game.domain.result.VotePreview;
import com.example.werewolf.game.dto.request.CallRoleRequest;
import com.example.werewolf.game.dto.request.HostRequest;
import com.example.werewolf.game.dto.request.PhaseRequest;
import com.example.werewolf.game.dto.request.StartVotingRequest;
import com.example.werewolf.game.dto.response.ApiResponse;
import com.example.werewolf.game.dto.response.CallRoleResponse;
import com.example.werewolf.game.dto.response.HostStateResponse;
import com.example.werewolf.game.dto.response.PhaseResponse;
import com.example.werewolf.game.dto.response.VotingResponse;
import com.example.werewolf.game.service.GameQueryService;
import com.example.werewolf.game.service.GameService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 호스트 API. 모든 요청은 host_secret으로 검증된다.
 */
@RestController
@RequestMapping("/api/rooms/{roomCode}")
@RequiredArgsConstructor
public class HostController {

    private final GameService gameService;
    private final GameQueryService gameQueryService;

    @GetMapping("/host_state")
    public ResponseEntity<ApiResponse<HostStateResponse>> getHostState(@PathVariable String roomCode,
            @RequestParam("host_secret") String hostSecret) {
        return ResponseEntity.ok(ApiResponse.success("호스트 상태", gameQueryService.getHostState(roomCode, hostSecret)));
    }

    @PostMapping("/start")
    public ResponseEntity<ApiResponse<PhaseResponse>> startGame(@PathVariable String roomCode,
            @Valid @RequestBody HostRequest request) {
        return ResponseEntity.ok(ApiResponse.success("게임 시작", gameService.startGame(roomCode, request.hostSecret())));
    }

    @PostMapping("/phase")
    public ResponseEntity<ApiResponse<PhaseResponse>> setPhase(@PathVariable String roomCode,
            @Valid @RequestBody PhaseRequest request) {
        return ResponseEntity.ok(ApiResponse.success("페이즈 변경",
                gameService.setPhase(roomCode, request.hostSecret(), request.phase())));
    }

    @PostMapping("/call_role")
    public ResponseEntity<ApiResponse<CallRoleResponse>> callRole(@PathVariable String roomCode,
            @Valid @RequestBody CallRoleRequest request) {
        return ResponseEntity.ok(ApiResponse.success("역할 호출",
                gameService.callRole(roomCode, request.hostSecret(), request.role())));
    }

    @PostMapping("/resolve_night")
    public ResponseEntity<ApiResponse<NightOutcome>> resolveNight(@PathVariable String roomCode,
            @Valid @RequestBody HostRequest request) {
        return ResponseEntity.ok(ApiResponse.success("밤 처리 완료",
                gameService.resolveNight(roomCode, request.hostSecret())));
    }

    @PostMapping("/start_voting")
    public ResponseEntity<ApiResponse<VotingResponse>> startVoting(@PathVariable String roomCode,
            @Valid @RequestBody StartVotingRequest request) {
        return ResponseEntity.ok(ApiResponse.success("투표 시작",
                gameService.startVoting(roomCode, request.hostSecret(), request.durationSec())));
    }

    @PostMapping("/vote_preview")
    public ResponseEntity<ApiResponse<VotePreview>> previewVotes(@PathVariable String roomCode,
            @Valid @RequestBody HostRequest request) {
        return ResponseEntity.ok(ApiResponse.success("투표 현황",
                gameQueryService.getVotePreview(roomCode, request.hostSecret())));
    }

    @PostMapping("/resolve_day")
    public ResponseEntity<ApiResponse<LynchOutcome>> resolveDay(@PathVariable String roomCode,
            @Valid @RequestBody HostRequest request) {
        return ResponseEntity.ok(ApiResponse.success("낮 처리 완료",
                gameService.resolveDay(roomCode, request.hostSecret())));
    }

    @GetMapping("/role_progress")
    public ResponseEntity<ApiResponse<RoleProgress>> getRoleProgress(@PathVariable String roomCode,
            @RequestParam("role") String role,
            @RequestParam("host_secret") String hostSecret) {
        return ResponseEntity.ok(ApiResponse.success("역할 진행 현황",
                gameQueryService.getRoleProgress(roomCode, hostSecret, role)));
    }
}
