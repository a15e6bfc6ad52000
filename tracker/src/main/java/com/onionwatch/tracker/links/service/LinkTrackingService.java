package com.onionwatch.tracker.links.service;

import com.onionwatch.tracker.links.model.LinkStatus;
import com.onionwatch.tracker.links.model.TrackRunSummary;
import com.onionwatch.tracker.links.model.VerificationSummary;
import com.onionwatch.tracker.links.persistence.LinkJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.SortedSet;

/**
 * One tracking run: collect candidate addresses, verify them, then optionally sweep old DEAD
 * records.
 */
@Service
public class LinkTrackingService {
    private static final Logger log = LoggerFactory.getLogger(LinkTrackingService.class);

    private final AddressCollectorService collectorService;
    private final LivenessVerifierService verifierService;
    private final RetentionSweeperService sweeperService;
    private final LinkJdbcRepository repository;

    public LinkTrackingService(
        AddressCollectorService collectorService,
        LivenessVerifierService verifierService,
        RetentionSweeperService sweeperService,
        LinkJdbcRepository repository
    ) {
        this.collectorService = collectorService;
        this.verifierService = verifierService;
        this.sweeperService = sweeperService;
        this.repository = repository;
    }

    /**
     * @param cleanOldDays retention threshold in days, or {@code null} to skip the sweep
     */
    public TrackRunSummary run(Integer cleanOldDays) {
        SortedSet<String> collected = collectorService.collect();
        VerificationSummary verification = null;
        if (collected.isEmpty()) {
            log.warn("No .onion links collected; skipping verification");
        } else {
            verification = verifierService.verify(collected);
        }

        Integer swept = null;
        if (cleanOldDays != null) {
            swept = sweeperService.sweep(cleanOldDays);
        }
        Map<LinkStatus, Long> totals = repository.countByStatus();
        log.info(
            "Link store holds {} alive and {} dead links",
            totals.getOrDefault(LinkStatus.ALIVE, 0L),
            totals.getOrDefault(LinkStatus.DEAD, 0L)
        );
        return new TrackRunSummary(collected.size(), verification, swept, totals);
    }
}
