package com.onionwatch.tracker.links.service;

import com.onionwatch.tracker.config.TrackerProperties;
import org.springframework.boot.ApplicationArguments;

import java.util.List;
import java.util.Locale;

/**
 * Command selected for a command-line launch. A leading non-option argument ({@code track} or
 * {@code filter}) wins over {@code tracker.cli.command}.
 */
public enum CliCommand {
    TRACK,
    FILTER,
    NONE;

    static final String CLEAN_OLD_OPTION = "clean-old";

    public static CliCommand resolve(ApplicationArguments args, TrackerProperties properties) {
        List<String> positional = args == null ? List.of() : args.getNonOptionArgs();
        for (String arg : positional) {
            CliCommand command = parse(arg);
            if (command != NONE) {
                return command;
            }
        }
        return parse(properties.getCli().getCommand());
    }

    public static CliCommand parse(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "track" -> TRACK;
            case "filter" -> FILTER;
            default -> NONE;
        };
    }

    /**
     * Retention threshold for a tracking run: {@code --clean-old=N} if given, otherwise
     * {@code tracker.cli.clean-old-days}. {@code null} means no sweep.
     */
    public static Integer cleanOldDays(ApplicationArguments args, TrackerProperties properties) {
        if (args != null && args.containsOption(CLEAN_OLD_OPTION)) {
            List<String> values = args.getOptionValues(CLEAN_OLD_OPTION);
            String raw = values == null || values.isEmpty() ? "" : values.get(values.size() - 1).trim();
            if (raw.isEmpty()) {
                throw new IllegalArgumentException("--" + CLEAN_OLD_OPTION + " requires a number of days");
            }
            int days;
            try {
                days = Integer.parseInt(raw);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--" + CLEAN_OLD_OPTION + " must be a whole number of days: " + raw, e);
            }
            if (days < 0) {
                throw new IllegalArgumentException("--" + CLEAN_OLD_OPTION + " must be >= 0 but was " + days);
            }
            return days;
        }
        return properties.getCli().getCleanOldDays();
    }
}
