package com.onionwatch.tracker.links.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class LinkRecordTest {
    private static final String ADDRESS = "http://exampleexampleexample.onion";
    private static final Instant T1 = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant T2 = Instant.parse("2024-05-02T10:00:00Z");

    @Test
    void firstObservationSetsLastSeenOnlyWhenAlive() {
        assertThat(LinkRecord.apply(null, ADDRESS, true, T1))
            .isEqualTo(new LinkRecord(ADDRESS, LinkStatus.ALIVE, T1));
        assertThat(LinkRecord.apply(null, ADDRESS, false, T1))
            .isEqualTo(new LinkRecord(ADDRESS, LinkStatus.DEAD, null));
    }

    @Test
    void deadObservationKeepsLastKnownAliveTime() {
        LinkRecord alive = LinkRecord.firstObservation(ADDRESS, true, T1);

        LinkRecord dead = alive.observe(false, T2);

        assertThat(dead.status()).isEqualTo(LinkStatus.DEAD);
        assertThat(dead.lastSeen()).isEqualTo(T1);
    }

    @Test
    void aliveObservationRefreshesLastSeen() {
        LinkRecord dead = new LinkRecord(ADDRESS, LinkStatus.DEAD, T1);

        LinkRecord revived = dead.observe(true, T2);

        assertThat(revived.status()).isEqualTo(LinkStatus.ALIVE);
        assertThat(revived.lastSeen()).isEqualTo(T2);
    }

    @Test
    void transitionsDescribeStatusChanges() {
        LinkRecord alive = new LinkRecord(ADDRESS, LinkStatus.ALIVE, T1);
        LinkRecord dead = new LinkRecord(ADDRESS, LinkStatus.DEAD, null);

        assertThat(LinkTransition.between(null, LinkStatus.ALIVE)).isEqualTo(LinkTransition.DISCOVERED_ALIVE);
        assertThat(LinkTransition.between(null, LinkStatus.DEAD)).isEqualTo(LinkTransition.DISCOVERED_DEAD);
        assertThat(LinkTransition.between(alive, LinkStatus.ALIVE)).isEqualTo(LinkTransition.STILL_ALIVE);
        assertThat(LinkTransition.between(alive, LinkStatus.DEAD)).isEqualTo(LinkTransition.WENT_DOWN);
        assertThat(LinkTransition.between(dead, LinkStatus.ALIVE)).isEqualTo(LinkTransition.REVIVED);
        assertThat(LinkTransition.between(dead, LinkStatus.DEAD)).isEqualTo(LinkTransition.STILL_DEAD);
    }

    @Test
    void statusUsesLowercaseStoreValues() {
        assertThat(LinkStatus.ALIVE.dbValue()).isEqualTo("alive");
        assertThat(LinkStatus.fromDbValue("dead")).isEqualTo(LinkStatus.DEAD);
        assertThat(LinkStatus.fromDbValue("ALIVE")).isEqualTo(LinkStatus.ALIVE);
    }
}
