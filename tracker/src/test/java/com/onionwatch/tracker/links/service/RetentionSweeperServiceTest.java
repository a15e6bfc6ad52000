package com.onionwatch.tracker.links.service;

import com.onionwatch.tracker.links.persistence.LinkJdbcRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetentionSweeperServiceTest {
    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");

    @Mock
    private LinkJdbcRepository repository;

    @Test
    void deletesDeadRecordsOlderThanThreshold() {
        when(repository.deleteDeadNotSeenSince(Instant.parse("2024-05-03T12:00:00Z"))).thenReturn(4);

        int deleted = service().sweep(7);

        assertThat(deleted).isEqualTo(4);
        verify(repository).deleteDeadNotSeenSince(Instant.parse("2024-05-03T12:00:00Z"));
    }

    @Test
    void zeroDaysUsesTheCurrentInstant() {
        when(repository.deleteDeadNotSeenSince(NOW)).thenReturn(0);

        assertThat(service().sweep(0)).isZero();
    }

    @Test
    void rejectsNegativeDays() {
        assertThatThrownBy(() -> service().sweep(-1)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(repository);
    }

    private RetentionSweeperService service() {
        return new RetentionSweeperService(repository, Clock.fixed(NOW, ZoneOffset.UTC));
    }
}
