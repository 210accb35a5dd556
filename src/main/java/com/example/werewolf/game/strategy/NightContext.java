package com.example.werewolf.game.strategy;

import com.example.werewolf.game.domain.action.ActionType;
import com.example.werewolf.game.domain.action.DecisionSlot;
import com.example.werewolf.game.domain.action.GameAction;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 한 밤의 처리 중간 결과.
 * 각 단계는 게임 상태를 읽기만 하고 결과를 여기에 쌓는다. 실제 반영은 NightResolver가 한 번에 한다.
 */
@Getter
@Setter
public class NightContext {

    private final int nightNumber;
    private final List<GameAction> actions;

    private String mutedName;
    private String protectedName;

    // 늑대가 고른 대상과, 보호/치료 후에도 남은 희생자
    private String wolfChoiceName;
    private String wolfVictimName;

    private String gamblerTargetName;
    private boolean healUsed;
    private String poisonTargetName;

    public NightContext(int nightNumber, List<GameAction> actions) {
        this.nightNumber = nightNumber;
        this.actions = List.copyOf(actions);
    }

    /**
     * 슬롯에서 가장 마지막에 제출된 행동
     */
    public Optional<GameAction> lastOf(DecisionSlot slot) {
        GameAction last = null;
        for (GameAction action : actions) {
            if (action.slot() == slot) {
                last = action;
            }
        }
        return Optional.ofNullable(last);
    }

    public List<GameAction> allOf(ActionType type) {
        return actions.stream()
                .filter(action -> action.type() == type)
                .collect(Collectors.toList());
    }

    /**
     * 사망자 목록: 늑대 희생자, 도박꾼 대상, 독 대상 순으로 중복 없이
     */
    public List<String> deaths() {
        Set<String> deaths = new LinkedHashSet<>();
        if (wolfVictimName != null) {
            deaths.add(wolfVictimName);
        }
        if (gamblerTargetName != null) {
            deaths.add(gamblerTargetName);
        }
        if (poisonTargetName != null) {
            deaths.add(poisonTargetName);
        }
        return new ArrayList<>(deaths);
    }
}
