package com.onionwatch.tracker.links.service;

import com.onionwatch.tracker.config.TrackerProperties;
import com.onionwatch.tracker.links.model.FilterRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class FilterCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(FilterCliRunner.class);

    private final TrackerProperties properties;
    private final ContentFilterService filterService;
    private final ConfigurableApplicationContext applicationContext;

    public FilterCliRunner(
        TrackerProperties properties,
        ContentFilterService filterService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.filterService = filterService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (CliCommand.resolve(args, properties) != CliCommand.FILTER) {
            return;
        }

        FilterRunSummary summary = filterService.run();
        log.info(
            "Filter run completed: scanned={}, matched={}, failed={}, pruned={}",
            summary.scanned(),
            summary.matched(),
            summary.failed(),
            summary.pruned()
        );

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
