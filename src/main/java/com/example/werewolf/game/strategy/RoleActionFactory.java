package com.example.werewolf.game.strategy;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 밤 처리 단계를 고정된 우선순위로 제공하는 Factory
 */
@Component
@RequiredArgsConstructor
public class RoleActionFactory {

    private final MageAction mageAction;
    private final GuardAction guardAction;
    private final WerewolfAction werewolfAction;
    private final GamblerAction gamblerAction;
    private final WitchHealAction witchHealAction;
    private final WitchPoisonAction witchPoisonAction;

    /**
     * 침묵 → 보호 → 늑대 공격 → 도박 → 치료 → 독
     */
    public List<RoleActionStrategy> nightSequence() {
        return List.of(mageAction, guardAction, werewolfAction, gamblerAction, witchHealAction, witchPoisonAction);
    }

    public WerewolfAction getWerewolfAction() {
        return werewolfAction;
    }

    public static RoleActionFactory createDefault() {
        return new RoleActionFactory(new MageAction(), new GuardAction(), new WerewolfAction(), new GamblerAction(),
                new WitchHealAction(), new WitchPoisonAction());
    }
}
