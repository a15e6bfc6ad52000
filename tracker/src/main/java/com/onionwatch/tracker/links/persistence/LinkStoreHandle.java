package com.onionwatch.tracker.links.persistence;

import com.onionwatch.tracker.links.model.LinkRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Link Store access bound to one dedicated connection. Each verifier worker opens its own handle and
 * closes it when the worker exits; handles are not meant to be shared between threads.
 */
public class LinkStoreHandle implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LinkStoreHandle.class);

    private final Connection connection;
    private final NamedParameterJdbcTemplate jdbc;

    LinkStoreHandle(Connection connection) {
        this.connection = connection;
        this.jdbc = new NamedParameterJdbcTemplate(new SingleConnectionDataSource(connection, true));
    }

    public LinkRecord find(String address) {
        return LinkJdbcRepository.find(jdbc, address);
    }

    public void save(LinkRecord record) {
        LinkJdbcRepository.upsert(jdbc, record);
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to release link store connection", e);
        }
    }
}
