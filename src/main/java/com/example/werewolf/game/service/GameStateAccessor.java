package com.example.werewolf.game.service;

import com.example.werewolf.game.domain.state.GameState;
import com.example.werewolf.game.repository.GameStateRepository;
import com.example.werewolf.global.concurrency.LockStrategyFactory;
import com.example.werewolf.global.error.CommonException;
import com.example.werewolf.global.error.ErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.function.Function;

/**
 * 방 조회 + 방 단위 락 실행을 묶는다.
 * 변경은 배타 락, 조회는 공유 락 안에서 실행된다.
 */
@Component
@RequiredArgsConstructor
public class GameStateAccessor {

    private final GameStateRepository gameStateRepository;
    private final LockStrategyFactory lockStrategyFactory;

    public <T> T write(String roomCode, Function<GameState, T> action) {
        GameState gameState = getGameState(roomCode);
        return lockStrategyFactory.configured().executeWithLock(roomCode, () -> action.apply(gameState));
    }

    public <T> T read(String roomCode, Function<GameState, T> action) {
        GameState gameState = getGameState(roomCode);
        return lockStrategyFactory.configured().executeWithReadLock(roomCode, () -> action.apply(gameState));
    }

    public GameState getGameState(String roomCode) {
        return gameStateRepository.findById(roomCode)
                .orElseThrow(() -> new CommonException(ErrorCode.ROOM_NOT_FOUND));
    }
}
