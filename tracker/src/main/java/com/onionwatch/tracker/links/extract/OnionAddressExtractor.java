package com.onionwatch.tracker.links.extract;

import org.springframework.stereotype.Component;

import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class OnionAddressExtractor {
    private static final Pattern ONION_URL = Pattern.compile("https?://[a-zA-Z0-9\\-.]{10,60}\\.onion(?:/[^\\s\"'<]*)?");
    private static final Pattern TRAILING_JUNK = Pattern.compile("[/\\s<]+$");

    /**
     * Finds every hidden-service URL in {@code text}. The result is sorted and free of duplicates;
     * trailing slashes, whitespace and stray {@code <} from broken markup are removed first.
     */
    public SortedSet<String> extract(String text) {
        SortedSet<String> addresses = new TreeSet<>();
        if (text == null || text.isBlank()) {
            return addresses;
        }
        Matcher matcher = ONION_URL.matcher(text);
        while (matcher.find()) {
            String address = cleanToken(matcher.group());
            if (address != null) {
                addresses.add(address);
            }
        }
        return addresses;
    }

    static String cleanToken(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = TRAILING_JUNK.matcher(raw.trim()).replaceFirst("");
        return cleaned.isEmpty() ? null : cleaned;
    }
}
