package com.example.werewolf.game.dto.response;

import com.example.werewolf.game.domain.state.VotingStatus;

public record VotingResponse(VotingStatus votingStatus, Integer voteDurationSec) {
}
