package com.example.werewolf.game.service;

import com.example.werewolf.game.domain.result.LynchOutcome;
import com.example.werewolf.game.domain.result.NightOutcome;
import com.example.werewolf.game.dto.response.VillageStateResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 방 구독자에게 공개 스냅샷을 전송한다. 역할 정보는 절대 싣지 않는다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSocketMessageBroadcaster {

    private final SimpMessagingTemplate messagingTemplate;

    /**
     * 특정 방의 모든 구독자에게 메시지 전송
     */
    public void broadcastToRoom(String roomCode, Object message) {
        try {
            messagingTemplate.convertAndSend("/topic/room." + roomCode, message);
        } catch (MessagingException e) {
            // 상태 변경은 이미 끝났으므로 전송 실패는 기록만 한다
            log.error("[브로드캐스트] 전송 실패: roomCode={}, error: {}", roomCode, e.getMessage());
        }
    }

    public void sendPlayerJoined(String roomCode, String playerName, VillageStateResponse state) {
        Map<String, Object> message = event("PLAYER_JOINED", state);
        message.put("playerName", playerName);
        broadcastToRoom(roomCode, message);
    }

    /**
     * 게임 시작 메시지
     */
    public void sendGameStart(String roomCode, VillageStateResponse state) {
        broadcastToRoom(roomCode, event("GAME_START", state));
    }

    /**
     * 페이즈 변경 메시지
     */
    public void sendPhaseChange(String roomCode, VillageStateResponse state) {
        broadcastToRoom(roomCode, event("PHASE_CHANGE", state));
    }

    public void sendRoleCalled(String roomCode, String role, VillageStateResponse state) {
        Map<String, Object> message = event("ROLE_CALLED", state);
        message.put("role", role);
        broadcastToRoom(roomCode, message);
    }

    public void sendVotingStarted(String roomCode, VillageStateResponse state) {
        broadcastToRoom(roomCode, event("VOTING_STARTED", state));
    }

    public void sendNightResolved(String roomCode, NightOutcome outcome, VillageStateResponse state) {
        Map<String, Object> message = event("NIGHT_RESOLVED", state);
        message.put("result", outcome);
        broadcastToRoom(roomCode, message);
    }

    public void sendDayResolved(String roomCode, LynchOutcome outcome, VillageStateResponse state) {
        Map<String, Object> message = event("DAY_RESOLVED", state);
        message.put("result", outcome);
        broadcastToRoom(roomCode, message);
    }

    /**
     * 게임 종료 메시지
     */
    public void sendGameEnded(String roomCode, VillageStateResponse state) {
        Map<String, Object> message = event("GAME_ENDED", state);
        message.put("winner", state.winner());
        broadcastToRoom(roomCode, message);
    }

    // null 값이 들어갈 수 있어 Map.of 대신 LinkedHashMap 사용
    private Map<String, Object> event(String type, VillageStateResponse state) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", type);
        message.put("gameState", state);
        return message;
    }
}
