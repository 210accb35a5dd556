package com.example.werewolf.game.service;

import com.example.werewolf.game.domain.action.ActionType;
import com.example.werewolf.game.domain.action.GameAction;
import com.example.werewolf.game.domain.action.VoteTally;
import com.example.werewolf.game.domain.result.LynchOutcome;
import com.example.werewolf.game.domain.result.VotePreview;
import com.example.werewolf.game.domain.state.Faction;
import com.example.werewolf.game.domain.state.GamePhase;
import com.example.werewolf.game.domain.state.GamePlayerState;
import com.example.werewolf.game.domain.state.GameState;
import com.example.werewolf.game.domain.state.PlayerRole;
import com.example.werewolf.global.error.CommonException;
import com.example.werewolf.global.error.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class DayResolver {

    static final String NO_LYNCH_MESSAGE = "Nobody was lynched.";

    private final WinEvaluator winEvaluator;

    /**
     * 오늘 낮의 처형 투표 집계. 투표자별 마지막 표만 센다.
     */
    public VoteTally tally(GameState gameState) {
        Map<String, GameAction> lastVotes = new LinkedHashMap<>();
        for (GameAction action : gameState.getActionLog().forDay(gameState.getDayNumber())) {
            if (action.type() != ActionType.VOTE_LYNCH) {
                continue;
            }
            // 다시 넣어서 마지막 표의 제출 순서를 따르게 한다
            lastVotes.remove(action.playerId());
            lastVotes.put(action.playerId(), action);
        }
        return VoteTally.of(lastVotes.values().stream()
                .map(GameAction::targetName)
                .toList());
    }

    public VotePreview preview(GameState gameState) {
        if (gameState.getPhase() != GamePhase.DAY) {
            return VotePreview.empty();
        }
        VoteTally tally = tally(gameState);
        return new VotePreview(tally.leader().orElse(null), new LinkedHashMap<>(tally.getCounts()));
    }

    public LynchOutcome resolve(GameState gameState) {
        if (gameState.isEnded()) {
            throw new CommonException(ErrorCode.GAME_ENDED);
        }
        if (gameState.getPhase() != GamePhase.DAY) {
            throw new CommonException(ErrorCode.INVALID_PHASE, "Day can only be resolved during day");
        }
        if (gameState.isDayResolved()) {
            throw new CommonException(ErrorCode.INVALID_PHASE,
                    "Day " + gameState.getDayNumber() + " has already been resolved");
        }

        String candidate = tally(gameState).leader().orElse(null);
        String lynched = null;
        boolean princeRevealed = false;
        String message;

        if (candidate == null) {
            message = NO_LYNCH_MESSAGE;
        } else {
            GamePlayerState target = gameState.findPlayerByName(candidate);
            if (target == null) {
                message = "Lynch target not found: " + candidate;
            } else if (target.hasRole(PlayerRole.PRINCE) && target.isAlive() && !target.isPrinceRevealed()) {
                target.revealPrince();
                princeRevealed = true;
                // 지목된 이름은 보고하되 생존
                lynched = candidate;
                message = candidate + " is the prince and survives the lynching.";
            } else {
                if (target.isAlive()) {
                    target.kill();
                }
                lynched = candidate;
                message = candidate + " was lynched.";
            }
        }

        gameState.setDayResolved(true);
        gameState.resetVoting();
        gameState.setActiveCall(null);

        Faction winner = winEvaluator.evaluate(gameState.getPlayerList()).orElse(null);
        if (winner != null) {
            gameState.endWith(winner);
        }

        log.info("[낮 처리] roomCode={}, day={}, lynched={}, princeRevealed={}, winner={}",
                gameState.getRoomCode(), gameState.getDayNumber(), lynched, princeRevealed, winner);
        return new LynchOutcome(lynched, princeRevealed, message, winner);
    }
}
