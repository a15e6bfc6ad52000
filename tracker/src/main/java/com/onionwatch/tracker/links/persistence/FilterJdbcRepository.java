package com.onionwatch.tracker.links.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onionwatch.tracker.links.model.FilterRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

import java.sql.Types;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Repository
public class FilterJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(FilterJdbcRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final int DELETE_BATCH_SIZE = 200;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public FilterJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    /**
     * Inserts the record or replaces every column of the existing row for the same address.
     */
    public void upsert(FilterRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("url", record.address())
            .addValue("title", record.title())
            .addValue("matchedKeywords", writeJson(record.matchedKeywords()))
            .addValue("contextSnippet", record.contextSnippet())
            .addValue("scannedAt", StoreTimestamps.format(record.scannedAt()), Types.VARCHAR);
        jdbc.update(
            """
                INSERT INTO filtered_links (url, title, matched_keywords, context_snippet, scanned_at)
                VALUES (:url, :title, :matchedKeywords, :contextSnippet, :scannedAt)
                ON CONFLICT (url)
                DO UPDATE SET
                    title = EXCLUDED.title,
                    matched_keywords = EXCLUDED.matched_keywords,
                    context_snippet = EXCLUDED.context_snippet,
                    scanned_at = EXCLUDED.scanned_at
                """,
            params
        );
    }

    public FilterRecord find(String address) {
        List<FilterRecord> rows = jdbc.query(
            """
                SELECT url, title, matched_keywords, context_snippet, scanned_at
                FROM filtered_links
                WHERE url = :url
                """,
            new MapSqlParameterSource("url", address),
            (rs, rowNum) -> new FilterRecord(
                rs.getString("url"),
                rs.getString("title"),
                readJson(rs.getString("matched_keywords")),
                rs.getString("context_snippet"),
                StoreTimestamps.parse(rs.getString("scanned_at"))
            )
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<String> findAllAddresses() {
        return jdbc.query(
            "SELECT url FROM filtered_links ORDER BY url",
            new MapSqlParameterSource(),
            (rs, rowNum) -> rs.getString("url")
        );
    }

    /**
     * Deletes rows whose address is not in {@code keep}. Returns the number of rows removed.
     */
    public int deleteAllExcept(Collection<String> keep) {
        Set<String> retained = new HashSet<>(keep);
        List<String> stale = findAllAddresses().stream()
            .filter(address -> !retained.contains(address))
            .toList();
        int removed = 0;
        for (int i = 0; i < stale.size(); i += DELETE_BATCH_SIZE) {
            List<String> chunk = stale.subList(i, Math.min(stale.size(), i + DELETE_BATCH_SIZE));
            SqlParameterSource[] batch = chunk.stream()
                .map(address -> new MapSqlParameterSource("url", address))
                .toArray(SqlParameterSource[]::new);
            int[] counts = jdbc.batchUpdate("DELETE FROM filtered_links WHERE url = :url", batch);
            for (int count : counts) {
                removed += Math.max(0, count);
            }
        }
        return removed;
    }

    private String writeJson(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values == null ? List.of() : values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize matched keywords", e);
        }
    }

    private List<String> readJson(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<String> parsed = objectMapper.readValue(json, STRING_LIST);
            return parsed == null ? List.of() : parsed;
        } catch (JsonProcessingException e) {
            log.warn("Unreadable matched_keywords value, treating as comma separated: {}", json);
            return List.of(json.split("\\s*,\\s*"));
        }
    }
}
