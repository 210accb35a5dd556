package com.example.werewolf.game.repository;

import com.example.werewolf.game.domain.state.GameState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 방 코드별 게임 상태 저장소 (메모리).
 * 방 안의 상태 변경은 방 단위 락이 보호하고, 여기서는 방 등록/조회만 원자적으로 처리한다.
 */
@Slf4j
@Repository
public class GameStateRepository {

    private final Map<String, GameState> rooms = new ConcurrentHashMap<>();

    /**
     * 같은 코드의 방이 없을 때만 저장
     *
     * @return 저장했으면 true
     */
    public boolean saveIfAbsent(GameState gameState) {
        boolean saved = rooms.putIfAbsent(gameState.getRoomCode(), gameState) == null;
        if (!saved) {
            log.debug("[방 생성] 코드 충돌: {}", gameState.getRoomCode());
        }
        return saved;
    }

    public Optional<GameState> findById(String roomCode) {
        if (roomCode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rooms.get(roomCode));
    }
}
