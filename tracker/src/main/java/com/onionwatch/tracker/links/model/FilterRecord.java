package com.onionwatch.tracker.links.model;

import java.time.Instant;
import java.util.List;

public record FilterRecord(
    String address,
    String title,
    List<String> matchedKeywords,
    String contextSnippet,
    Instant scannedAt
) {
    public FilterRecord {
        title = title == null ? "" : title;
        matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
        contextSnippet = contextSnippet == null ? "" : contextSnippet;
    }
}
