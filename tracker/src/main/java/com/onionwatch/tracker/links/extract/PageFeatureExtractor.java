package com.onionwatch.tracker.links.extract;

import com.onionwatch.tracker.links.model.PageFeatures;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class PageFeatureExtractor {
    private static final String HEADINGS = "h1, h2, h3";
    private static final String BOLD = "b, strong";
    private static final String PREFORMATTED = "pre, code";

    public PageFeatures extract(String html) {
        if (html == null || html.isBlank()) {
            return new PageFeatures("", "", "");
        }
        Document document = Jsoup.parse(html);
        String title = document.title().trim();
        String meta = String.join(" ", metaContent(document));
        String headings = String.join(" ", document.select(HEADINGS).eachText());
        String bold = String.join(" ", document.select(BOLD).eachText());
        String preformatted = String.join(" ", document.select(PREFORMATTED).eachText());
        String combined = String.join(" ", title, meta, headings, bold, preformatted).toLowerCase(Locale.ROOT);
        return new PageFeatures(title, combined, document.text());
    }

    private List<String> metaContent(Document document) {
        List<String> values = new ArrayList<>();
        for (Element meta : document.select("meta[content]")) {
            String content = meta.attr("content");
            if (!content.isBlank()) {
                values.add(content);
            }
        }
        return values;
    }
}
