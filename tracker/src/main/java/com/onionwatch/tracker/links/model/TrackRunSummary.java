package com.onionwatch.tracker.links.model;

import java.util.Map;

public record TrackRunSummary(
    int collected,
    VerificationSummary verification,
    Integer sweptCount,
    Map<LinkStatus, Long> storeTotals
) {
    public TrackRunSummary {
        storeTotals = storeTotals == null ? Map.of() : Map.copyOf(storeTotals);
    }
}
