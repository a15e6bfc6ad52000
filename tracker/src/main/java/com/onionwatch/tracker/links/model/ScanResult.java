package com.onionwatch.tracker.links.model;

import java.util.List;

/**
 * Outcome of scanning one address. {@code failed} marks a scan that gave up (attempts exhausted or
 * an unreadable page); such results never carry matches.
 */
public record ScanResult(String title, List<String> matches, String snippet, boolean failed) {
    public ScanResult {
        title = title == null ? "" : title;
        matches = matches == null ? List.of() : List.copyOf(matches);
        snippet = snippet == null ? "" : snippet;
    }

    public static ScanResult of(String title, List<String> matches, String snippet) {
        return new ScanResult(title, matches, snippet, false);
    }

    public static ScanResult failure() {
        return new ScanResult("", List.of(), "", true);
    }

    public boolean hasMatches() {
        return !matches.isEmpty();
    }
}
