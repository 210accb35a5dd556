package com.example.werewolf.game.service;

import com.example.werewolf.game.dto.response.ActionResponse;
import com.example.werewolf.game.dto.response.CreateRoomResponse;
import com.example.werewolf.global.error.CommonException;
import com.example.werewolf.global.error.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class GameConcurrencyTest {

    private static final int PLAYER_COUNT = 8;

    @Autowired
    private GameService gameService;

    @Autowired
    private GameQueryService gameQueryService;

    @MockBean
    private WebSocketMessageBroadcaster broadcaster;

    private String roomCode;
    private String hostSecret;
    private final List<String> playerIds = new ArrayList<>();

    @BeforeEach
    void setUp() {
        CreateRoomResponse room = gameService.createRoom();
        roomCode = room.roomCode();
        hostSecret = room.hostSecret();
        playerIds.clear();
        for (int i = 1; i <= PLAYER_COUNT; i++) {
            playerIds.add(gameService.joinRoom(roomCode, "P" + i).playerId());
        }
        gameService.startGame(roomCode, hostSecret);
    }

    @Test
    @DisplayName("100개의 행동이 동시에 제출돼도 하나도 누락되지 않는다")
    void concurrentSubmissionsAreNotLost() throws InterruptedException {
        int threadCount = 100;
        ExecutorService executorService = Executors.newFixedThreadPool(32);
        CountDownLatch latch = new CountDownLatch(threadCount);
        Set<Long> sequences = ConcurrentHashMap.newKeySet();

        for (int i = 0; i < threadCount; i++) {
            String playerId = playerIds.get(i % PLAYER_COUNT);
            executorService.submit(() -> {
                try {
                    ActionResponse response = gameService.submitAction(roomCode, playerId, "witch_no_heal", null);
                    sequences.add(response.sequence());
                } finally {
                    latch.countDown();
                }
            });
        }

        latch.await();
        executorService.shutdown();

        assertThat(sequences).hasSize(threadCount);
        assertThat(gameQueryService.getHostState(roomCode, hostSecret).actionCount()).isEqualTo(threadCount);
    }

    @Test
    @DisplayName("밤 처리를 동시에 여러 번 눌러도 한 번만 처리된다")
    void duplicateResolveRunsOnce() throws InterruptedException {
        int threadCount = 10;
        ExecutorService executorService = Executors.newFixedThreadPool(threadCount);
        CountDownLatch latch = new CountDownLatch(threadCount);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();

        for (int i = 0; i < threadCount; i++) {
            executorService.submit(() -> {
                try {
                    gameService.resolveNight(roomCode, hostSecret);
                    succeeded.incrementAndGet();
                } catch (CommonException e) {
                    if (e.getErrorCode() == ErrorCode.INVALID_PHASE) {
                        rejected.incrementAndGet();
                    }
                } finally {
                    latch.countDown();
                }
            });
        }

        latch.await();
        executorService.shutdown();

        assertThat(succeeded.get()).isEqualTo(1);
        assertThat(rejected.get()).isEqualTo(threadCount - 1);
    }
}
