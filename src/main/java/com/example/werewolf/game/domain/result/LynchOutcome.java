package com.example.werewolf.game.domain.result;

import com.example.werewolf.game.domain.state.Faction;

public record LynchOutcome(String lynched, boolean princeRevealed, String message, Faction winner) {
}
