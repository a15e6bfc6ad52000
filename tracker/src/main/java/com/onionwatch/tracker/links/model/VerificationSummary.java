package com.onionwatch.tracker.links.model;

import java.time.Instant;
import java.util.Map;

public record VerificationSummary(
    int candidates,
    int alive,
    int dead,
    int storeErrors,
    int batches,
    Map<LinkTransition, Integer> transitions,
    Instant startedAt,
    Instant finishedAt
) {
    public VerificationSummary {
        transitions = transitions == null ? Map.of() : Map.copyOf(transitions);
    }

    public int transitionCount(LinkTransition transition) {
        return transitions.getOrDefault(transition, 0);
    }

    public int processed() {
        return alive + dead + storeErrors;
    }
}
