package com.onionwatch.tracker.links.extract;

import com.onionwatch.tracker.links.model.PageFeatures;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Whole-word, case-insensitive keyword matching over the text of a page.
 *
 * <p>Keywords are tested in the order they were configured and every hit is reported, so the first
 * entry of {@link #match(PageFeatures)} is the first configured keyword found on the page. A keyword
 * that appears only inside a longer word ("market" in "supermarket") does not match.
 */
public class KeywordMatcher {
    private final Map<String, Pattern> patterns = new LinkedHashMap<>();
    private final int snippetBefore;
    private final int snippetAfter;

    public KeywordMatcher(List<String> keywords, int snippetBefore, int snippetAfter) {
        for (String keyword : keywords) {
            if (keyword == null || keyword.isBlank()) {
                continue;
            }
            patterns.putIfAbsent(
                keyword,
                Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
            );
        }
        this.snippetBefore = snippetBefore;
        this.snippetAfter = snippetAfter;
    }

    public List<String> match(PageFeatures features) {
        String text = features.combined() + " " + features.body();
        List<String> matches = new ArrayList<>();
        for (Map.Entry<String, Pattern> entry : patterns.entrySet()) {
            if (entry.getValue().matcher(text).find()) {
                matches.add(entry.getKey());
            }
        }
        return matches;
    }

    /**
     * Cuts a window of body text around the first occurrence of {@code keyword}. When the keyword
     * only occurs outside the body the window starts at the beginning of the body.
     */
    public String snippet(String body, String keyword) {
        if (body == null || body.isEmpty() || keyword == null || keyword.isEmpty()) {
            return "";
        }
        Matcher occurrence = Pattern.compile(Pattern.quote(keyword), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
            .matcher(body);
        int position = occurrence.find() ? occurrence.start() : 0;
        int start = Math.min(body.length(), Math.max(0, position - snippetBefore));
        int end = Math.min(body.length(), position + snippetAfter);
        if (end <= start) {
            return "";
        }
        return body.substring(start, end);
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }
}
