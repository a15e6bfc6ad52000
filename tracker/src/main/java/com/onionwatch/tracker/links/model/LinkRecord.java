package com.onionwatch.tracker.links.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Liveness state of one tracked address.
 *
 * <p>{@code lastSeen} is only ever written by an ALIVE observation, so it is null exactly when the
 * address has never been seen alive and a DEAD observation keeps the last known alive time.
 */
public record LinkRecord(String address, LinkStatus status, Instant lastSeen) {
    public LinkRecord {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(status, "status");
    }

    public static LinkRecord firstObservation(String address, boolean alive, Instant now) {
        return new LinkRecord(address, LinkStatus.of(alive), alive ? now : null);
    }

    public LinkRecord observe(boolean alive, Instant now) {
        if (alive) {
            return new LinkRecord(address, LinkStatus.ALIVE, now);
        }
        return new LinkRecord(address, LinkStatus.DEAD, lastSeen);
    }

    /**
     * Applies a probe outcome to the stored record, or creates the record when none exists yet.
     */
    public static LinkRecord apply(LinkRecord existing, String address, boolean alive, Instant now) {
        return existing == null ? firstObservation(address, alive, now) : existing.observe(alive, now);
    }
}
