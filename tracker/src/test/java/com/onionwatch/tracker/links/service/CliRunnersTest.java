package com.onionwatch.tracker.links.service;

import com.onionwatch.tracker.config.TrackerProperties;
import com.onionwatch.tracker.links.model.FilterRunSummary;
import com.onionwatch.tracker.links.model.TrackRunSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CliRunnersTest {

    @Mock
    private LinkTrackingService trackingService;

    @Mock
    private ContentFilterService filterService;

    @Mock
    private ConfigurableApplicationContext applicationContext;

    private TrackerProperties properties;

    @BeforeEach
    void setUp() {
        properties = new TrackerProperties();
        properties.getCli().setExitAfterRun(false);
    }

    @Test
    void trackCommandPassesCleanOldThreshold() {
        when(trackingService.run(7)).thenReturn(new TrackRunSummary(0, null, 2, Map.of()));

        new TrackCliRunner(properties, trackingService, applicationContext)
            .run(new DefaultApplicationArguments("track", "--clean-old=7"));

        verify(trackingService).run(7);
    }

    @Test
    void trackRunnerIgnoresOtherCommands() {
        new TrackCliRunner(properties, trackingService, applicationContext)
            .run(new DefaultApplicationArguments("filter"));

        verify(trackingService, never()).run(any());
    }

    @Test
    void filterRunnerRunsConfiguredFilterCommand() {
        properties.getCli().setCommand("filter");
        when(filterService.run()).thenReturn(new FilterRunSummary(0, 0, 0, 0));

        new FilterCliRunner(properties, filterService, applicationContext).run(new DefaultApplicationArguments());

        verify(filterService).run();
    }

    @Test
    void nothingRunsWithoutACommand() {
        new TrackCliRunner(properties, trackingService, applicationContext).run(new DefaultApplicationArguments());
        new FilterCliRunner(properties, filterService, applicationContext).run(new DefaultApplicationArguments());

        verify(trackingService, never()).run(any());
        verify(filterService, never()).run();
    }
}
