package com.onionwatch.tracker.links.extract;

import com.onionwatch.tracker.links.model.PageFeatures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PageFeatureExtractorTest {
    private final PageFeatureExtractor extractor = new PageFeatureExtractor();

    @Test
    void collectsSalientTextIntoCombinedField() {
        String html = """
            <html>
              <head>
                <title>  Hidden Bazaar </title>
                <meta name="description" content="Escrow Services">
              </head>
              <body>
                <h1>Welcome</h1>
                <h4>ignored heading</h4>
                <p>Plain text with <strong>Bold Offer</strong> and <code>PGP-KEY</code>.</p>
              </body>
            </html>
            """;

        PageFeatures features = extractor.extract(html);

        assertThat(features.title()).isEqualTo("Hidden Bazaar");
        assertThat(features.combined())
            .contains("hidden bazaar")
            .contains("escrow services")
            .contains("welcome")
            .contains("bold offer")
            .contains("pgp-key")
            .doesNotContain("ignored heading");
        assertThat(features.body()).contains("Plain text with Bold Offer and PGP-KEY.");
    }

    @Test
    void emptyDocumentHasNoFeatures() {
        PageFeatures features = extractor.extract("");

        assertThat(features.title()).isEmpty();
        assertThat(features.combined()).isEmpty();
        assertThat(features.body()).isEmpty();
    }
}
