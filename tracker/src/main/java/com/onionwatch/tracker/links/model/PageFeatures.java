package com.onionwatch.tracker.links.model;

/**
 * Text pulled out of a fetched page.
 *
 * @param title    the document title as written, empty when absent
 * @param combined lower-cased title, meta content, headings, bold and code text
 * @param body     all visible text with whitespace collapsed
 */
public record PageFeatures(String title, String combined, String body) {
    public PageFeatures {
        title = title == null ? "" : title;
        combined = combined == null ? "" : combined;
        body = body == null ? "" : body;
    }
}
