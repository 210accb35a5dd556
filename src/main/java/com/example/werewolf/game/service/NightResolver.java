package com.example.werewolf.game.service;

import com.example.werewolf.game.domain.result.NightOutcome;
import com.example.werewolf.game.domain.state.Faction;
import com.example.werewolf.game.domain.state.GamePhase;
import com.example.werewolf.game.domain.state.GamePlayerState;
import com.example.werewolf.game.domain.state.GameState;
import com.example.werewolf.game.strategy.NightContext;
import com.example.werewolf.game.strategy.RoleActionFactory;
import com.example.werewolf.game.strategy.RoleActionStrategy;
import com.example.werewolf.global.error.CommonException;
import com.example.werewolf.global.error.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 밤 결과 처리.
 * 역할별 단계를 순서대로 실행해 결과를 모은 뒤, 검증이 끝난 상태에 한 번에 반영한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NightResolver {

    private final RoleActionFactory roleActionFactory;
    private final WinEvaluator winEvaluator;

    public NightOutcome resolve(GameState gameState) {
        if (gameState.isEnded()) {
            throw new CommonException(ErrorCode.GAME_ENDED);
        }
        if (gameState.getPhase() != GamePhase.NIGHT) {
            throw new CommonException(ErrorCode.INVALID_PHASE, "Night can only be resolved during night");
        }
        if (gameState.isNightResolved()) {
            throw new CommonException(ErrorCode.INVALID_PHASE,
                    "Night " + gameState.getNightNumber() + " has already been resolved");
        }

        int night = gameState.getNightNumber();
        NightContext context = new NightContext(night, gameState.getActionLog().forNight(night));
        for (RoleActionStrategy step : roleActionFactory.nightSequence()) {
            step.execute(gameState, context);
        }

        List<String> deaths = apply(gameState, context);
        gameState.setNightResolved(true);

        Faction winner = winEvaluator.evaluate(gameState.getPlayerList()).orElse(null);
        if (winner != null) {
            gameState.endWith(winner);
        }

        log.info("[밤 처리] roomCode={}, night={}, deaths={}, muted={}, winner={}",
                gameState.getRoomCode(), night, deaths, gameState.getMutedForToday(), winner);
        return new NightOutcome(deaths, List.copyOf(gameState.getMutedForToday()), winner);
    }

    /**
     * 이번 밤 늑대가 고른 대상 (보호 미적용). 마녀에게 보여줄 때 쓴다.
     */
    public Optional<String> currentWolfChoice(GameState gameState) {
        return roleActionFactory.getWerewolfAction()
                .chooseTarget(gameState.getActionLog().forNight(gameState.getNightNumber()));
    }

    private List<String> apply(GameState gameState, NightContext context) {
        gameState.clearMutes();
        String muted = context.getMutedName();
        if (muted != null) {
            gameState.getMutedForToday().add(muted);
            GamePlayerState mutedPlayer = gameState.findPlayerByName(muted);
            if (mutedPlayer != null) {
                mutedPlayer.setMutedToday(true);
            }
        }

        if (context.getProtectedName() != null) {
            gameState.setLastGuardTargetName(context.getProtectedName());
        }
        if (context.isHealUsed()) {
            gameState.setWitchHasHeal(false);
        }
        if (context.getPoisonTargetName() != null) {
            gameState.setWitchHasPoison(false);
        }

        List<String> deaths = context.deaths();
        for (String name : deaths) {
            GamePlayerState victim = gameState.findPlayerByName(name);
            if (victim != null && victim.isAlive()) {
                victim.kill();
            }
        }
        gameState.setDeathsLastNight(new ArrayList<>(deaths));
        gameState.setActiveCall(null);
        return deaths;
    }
}
