package com.onionwatch.tracker.links.model;

import java.util.Locale;

public enum LinkStatus {
    ALIVE,
    DEAD;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LinkStatus fromDbValue(String value) {
        if (value == null || value.isBlank()) {
            return DEAD;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public static LinkStatus of(boolean alive) {
        return alive ? ALIVE : DEAD;
    }
}
