package com.onionwatch.tracker.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Contents of the watchlist document: the pages scraped for addresses, the keywords the content
 * filter looks for, and the scam patterns.
 *
 * <p>{@code scamPatterns} is loaded and carried along but no matching logic consumes it yet.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Watchlist(
    @JsonProperty("sources") List<String> sources,
    @JsonProperty("keywords") List<String> keywords,
    @JsonProperty("scam_patterns") List<String> scamPatterns
) {
    public Watchlist {
        sources = clean(sources);
        keywords = clean(keywords);
        scamPatterns = clean(scamPatterns);
    }

    public static Watchlist empty() {
        return new Watchlist(List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return sources.isEmpty() && keywords.isEmpty() && scamPatterns.isEmpty();
    }

    private static List<String> clean(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
            .filter(value -> value != null && !value.isBlank())
            .map(String::trim)
            .toList();
    }
}
