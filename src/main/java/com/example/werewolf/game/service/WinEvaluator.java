package com.example.werewolf.game.service;

import com.example.werewolf.game.domain.state.Faction;
import com.example.werewolf.game.domain.state.GamePlayerState;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Optional;

/**
 * 승리 판정. 사망이 생길 때마다 현재 생존자로 다시 계산하며 결과를 캐시하지 않는다.
 */
@Component
public class WinEvaluator {

    public Optional<Faction> evaluate(Collection<GamePlayerState> players) {
        long werewolves = players.stream()
                .filter(GamePlayerState::isAlive)
                .filter(GamePlayerState::isWerewolf)
                .count();
        long others = players.stream()
                .filter(GamePlayerState::isAlive)
                .filter(p -> !p.isWerewolf())
                .count();

        if (werewolves == 0 && others > 0) {
            return Optional.of(Faction.VILLAGE);
        }
        if (werewolves > 0 && werewolves >= others) {
            return Optional.of(Faction.WEREWOLVES);
        }
        return Optional.empty();
    }
}
