package com.onionwatch.tracker.links.service;

import com.onionwatch.tracker.config.TrackerProperties;
import com.onionwatch.tracker.links.model.LinkTransition;
import com.onionwatch.tracker.links.model.TrackRunSummary;
import com.onionwatch.tracker.links.model.VerificationSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class TrackCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(TrackCliRunner.class);

    private final TrackerProperties properties;
    private final LinkTrackingService trackingService;
    private final ConfigurableApplicationContext applicationContext;

    public TrackCliRunner(
        TrackerProperties properties,
        LinkTrackingService trackingService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.trackingService = trackingService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (CliCommand.resolve(args, properties) != CliCommand.TRACK) {
            return;
        }

        TrackRunSummary summary = trackingService.run(CliCommand.cleanOldDays(args, properties));
        VerificationSummary verification = summary.verification();
        if (verification != null) {
            log.info(
                "Summary: collected={}, alive={}, dead={}, storeErrors={}, new={}, revived={}, wentDown={}",
                summary.collected(),
                verification.alive(),
                verification.dead(),
                verification.storeErrors(),
                verification.transitionCount(LinkTransition.DISCOVERED_ALIVE)
                    + verification.transitionCount(LinkTransition.DISCOVERED_DEAD),
                verification.transitionCount(LinkTransition.REVIVED),
                verification.transitionCount(LinkTransition.WENT_DOWN)
            );
        }
        if (summary.sweptCount() != null) {
            log.info("Summary: swept={}", summary.sweptCount());
        }
        log.info("urlfetch completed.");

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
