package com.onionwatch.tracker.links.model;

public record FilterRunSummary(int scanned, int matched, int failed, int pruned) {
}
