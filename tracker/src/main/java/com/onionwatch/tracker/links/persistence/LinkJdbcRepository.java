package com.onionwatch.tracker.links.persistence;

import com.onionwatch.tracker.links.model.LinkRecord;
import com.onionwatch.tracker.links.model.LinkStatus;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
public class LinkJdbcRepository {
    private static final RowMapper<LinkRecord> LINK_ROW = (rs, rowNum) -> new LinkRecord(
        rs.getString("url"),
        LinkStatus.fromDbValue(rs.getString("status")),
        StoreTimestamps.parse(rs.getString("last_seen"))
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final DataSource dataSource;

    public LinkJdbcRepository(NamedParameterJdbcTemplate jdbc, DataSource dataSource) {
        this.jdbc = jdbc;
        this.dataSource = dataSource;
    }

    /**
     * Checks out a connection for the exclusive use of the caller until the handle is closed.
     */
    public LinkStoreHandle openHandle() {
        try {
            Connection connection = dataSource.getConnection();
            return new LinkStoreHandle(connection);
        } catch (SQLException e) {
            throw new CannotGetJdbcConnectionException("Failed to open link store handle", e);
        }
    }

    public LinkRecord find(String address) {
        return find(jdbc, address);
    }

    public void save(LinkRecord record) {
        upsert(jdbc, record);
    }

    public List<String> findAliveAddresses() {
        return jdbc.query(
            """
                SELECT url
                FROM onion_links
                WHERE status = :status
                ORDER BY url
                """,
            new MapSqlParameterSource("status", LinkStatus.ALIVE.dbValue()),
            (rs, rowNum) -> rs.getString("url")
        );
    }

    /**
     * Removes DEAD records never seen alive or last seen before {@code cutoff}. ALIVE records are
     * never touched.
     */
    public int deleteDeadNotSeenSince(Instant cutoff) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("status", LinkStatus.DEAD.dbValue())
            .addValue("cutoff", StoreTimestamps.format(cutoff));
        return jdbc.update(
            """
                DELETE FROM onion_links
                WHERE status = :status
                  AND (last_seen IS NULL OR last_seen < :cutoff)
                """,
            params
        );
    }

    public Map<LinkStatus, Long> countByStatus() {
        Map<LinkStatus, Long> counts = new LinkedHashMap<>();
        for (LinkStatus status : LinkStatus.values()) {
            counts.put(status, 0L);
        }
        jdbc.query(
            """
                SELECT status, COUNT(*) AS total
                FROM onion_links
                GROUP BY status
                """,
            new MapSqlParameterSource(),
            rs -> {
                counts.merge(LinkStatus.fromDbValue(rs.getString("status")), rs.getLong("total"), Long::sum);
            }
        );
        return counts;
    }

    static LinkRecord find(NamedParameterJdbcTemplate jdbc, String address) {
        List<LinkRecord> rows = jdbc.query(
            """
                SELECT url, status, last_seen
                FROM onion_links
                WHERE url = :url
                """,
            new MapSqlParameterSource("url", address),
            LINK_ROW
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    static void upsert(NamedParameterJdbcTemplate jdbc, LinkRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("url", record.address())
            .addValue("status", record.status().dbValue())
            .addValue("lastSeen", StoreTimestamps.format(record.lastSeen()), Types.VARCHAR);
        jdbc.update(
            """
                INSERT INTO onion_links (url, status, last_seen)
                VALUES (:url, :status, :lastSeen)
                ON CONFLICT (url)
                DO UPDATE SET
                    status = EXCLUDED.status,
                    last_seen = EXCLUDED.last_seen
                """,
            params
        );
    }
}
