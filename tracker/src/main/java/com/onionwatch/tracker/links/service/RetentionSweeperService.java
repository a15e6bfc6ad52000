package com.onionwatch.tracker.links.service;

import com.onionwatch.tracker.links.persistence.LinkJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Service
public class RetentionSweeperService {
    private static final Logger log = LoggerFactory.getLogger(RetentionSweeperService.class);

    private final LinkJdbcRepository repository;
    private final Clock clock;

    public RetentionSweeperService(LinkJdbcRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Deletes DEAD records that were never seen alive or were last seen more than {@code days} days
     * ago. ALIVE records are kept regardless of age.
     *
     * @return number of records deleted
     */
    public int sweep(int days) {
        if (days < 0) {
            throw new IllegalArgumentException("days must be >= 0 but was " + days);
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(days));
        int deleted = repository.deleteDeadNotSeenSince(cutoff);
        log.info("Cleaned {} dead links older than {} days.", deleted, days);
        return deleted;
    }
}
