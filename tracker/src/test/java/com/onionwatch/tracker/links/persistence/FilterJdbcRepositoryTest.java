package com.onionwatch.tracker.links.persistence;

import com.onionwatch.tracker.links.model.FilterRecord;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class FilterJdbcRepositoryTest {

    @Autowired
    private FilterJdbcRepository repository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void upsertReplacesEveryColumn() {
        String address = uniqueAddress();
        repository.upsert(new FilterRecord(address, "First", List.of("market", "escrow"), "first snippet", Instant.parse("2024-05-01T10:00:00Z")));
        repository.upsert(new FilterRecord(address, "Second", List.of("forum"), "second snippet", Instant.parse("2024-05-02T10:00:00Z")));

        FilterRecord stored = repository.find(address);

        assertThat(stored.title()).isEqualTo("Second");
        assertThat(stored.matchedKeywords()).containsExactly("forum");
        assertThat(stored.contextSnippet()).isEqualTo("second snippet");
        assertThat(stored.scannedAt()).isEqualTo(Instant.parse("2024-05-02T10:00:00Z"));
    }

    @Test
    void matchedKeywordsAreStoredAsJsonArray() {
        String address = uniqueAddress();
        repository.upsert(new FilterRecord(address, "", List.of("market", "escrow"), "", Instant.now()));

        String raw = jdbc.queryForObject(
            "SELECT matched_keywords FROM filtered_links WHERE url = :url",
            new MapSqlParameterSource("url", address),
            String.class
        );
        assertThat(raw).isEqualTo("[\"market\",\"escrow\"]");
    }

    @Test
    void readsCommaSeparatedKeywordsFromLegacyRows() {
        String address = uniqueAddress();
        jdbc.update(
            "INSERT INTO filtered_links (url, title, matched_keywords, context_snippet) VALUES (:url, 'T', 'market, escrow', 's')",
            new MapSqlParameterSource("url", address)
        );

        FilterRecord stored = repository.find(address);

        assertThat(stored.matchedKeywords()).containsExactly("market", "escrow");
        assertThat(stored.scannedAt()).isNull();
    }

    @Test
    void deleteAllExceptRemovesOnlyUnlistedRows() {
        String keep = uniqueAddress();
        List<String> stale = new ArrayList<>();
        for (int i = 0; i < 205; i++) {
            stale.add(uniqueAddress());
        }
        repository.upsert(new FilterRecord(keep, "", List.of("market"), "", Instant.now()));
        for (String address : stale) {
            repository.upsert(new FilterRecord(address, "", List.of("market"), "", Instant.now()));
        }

        int removed = repository.deleteAllExcept(List.of(keep));

        assertThat(removed).isGreaterThanOrEqualTo(stale.size());
        assertThat(repository.find(keep)).isNotNull();
        assertThat(repository.find(stale.get(0))).isNull();
        assertThat(repository.find(stale.get(204))).isNull();
    }

    private static String uniqueAddress() {
        return "http://" + UUID.randomUUID().toString().replace("-", "").substring(0, 16) + ".onion";
    }
}
