package com.onionwatch.tracker.links.service;

import com.onionwatch.tracker.config.TrackerProperties;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CliCommandTest {

    @Test
    void positionalArgumentWinsOverConfiguredCommand() {
        TrackerProperties properties = new TrackerProperties();
        properties.getCli().setCommand("filter");

        assertEquals(CliCommand.TRACK, CliCommand.resolve(new DefaultApplicationArguments("track"), properties));
        assertEquals(CliCommand.FILTER, CliCommand.resolve(new DefaultApplicationArguments(), properties));
    }

    @Test
    void unknownCommandsResolveToNone() {
        TrackerProperties properties = new TrackerProperties();

        assertEquals(CliCommand.NONE, CliCommand.resolve(new DefaultApplicationArguments("crawl"), properties));
        assertEquals(CliCommand.TRACK, CliCommand.parse(" TRACK "));
    }

    @Test
    void cleanOldOptionOverridesConfiguredDays() {
        TrackerProperties properties = new TrackerProperties();
        properties.getCli().setCleanOldDays(30);

        assertEquals(7, CliCommand.cleanOldDays(new DefaultApplicationArguments("track", "--clean-old=7"), properties));
        assertEquals(30, CliCommand.cleanOldDays(new DefaultApplicationArguments("track"), properties));
        assertNull(CliCommand.cleanOldDays(new DefaultApplicationArguments(), new TrackerProperties()));
    }

    @Test
    void rejectsMalformedCleanOldValues() {
        TrackerProperties properties = new TrackerProperties();

        assertThrows(IllegalArgumentException.class,
            () -> CliCommand.cleanOldDays(new DefaultApplicationArguments("--clean-old=soon"), properties));
        assertThrows(IllegalArgumentException.class,
            () -> CliCommand.cleanOldDays(new DefaultApplicationArguments("--clean-old=-3"), properties));
        assertThrows(IllegalArgumentException.class,
            () -> CliCommand.cleanOldDays(new DefaultApplicationArguments("--clean-old"), properties));
    }
}
