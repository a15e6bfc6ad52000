package com.onionwatch.tracker.links.model;

public enum LinkTransition {
    DISCOVERED_ALIVE,
    DISCOVERED_DEAD,
    STILL_ALIVE,
    STILL_DEAD,
    REVIVED,
    WENT_DOWN;

    public static LinkTransition between(LinkRecord previous, LinkStatus next) {
        if (previous == null) {
            return next == LinkStatus.ALIVE ? DISCOVERED_ALIVE : DISCOVERED_DEAD;
        }
        if (previous.status() == LinkStatus.ALIVE) {
            return next == LinkStatus.ALIVE ? STILL_ALIVE : WENT_DOWN;
        }
        return next == LinkStatus.ALIVE ? REVIVED : STILL_DEAD;
    }
}
