package com.onionwatch.tracker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class WatchlistLoader {
    private static final Logger log = LoggerFactory.getLogger(WatchlistLoader.class);

    private final ObjectMapper objectMapper;

    public WatchlistLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Reads the watchlist document. A missing or unreadable file yields an empty watchlist so a run
     * still starts and simply has nothing to do.
     */
    public Watchlist load(Path path) {
        if (path == null) {
            log.error("Failed to load watchlist: no path configured");
            return Watchlist.empty();
        }
        try {
            Watchlist watchlist = objectMapper.readValue(Files.readAllBytes(path), Watchlist.class);
            if (watchlist == null) {
                log.error("Failed to load watchlist {}: document is empty", path);
                return Watchlist.empty();
            }
            log.info(
                "Loaded watchlist {}: sources={}, keywords={}, scamPatterns={}",
                path,
                watchlist.sources().size(),
                watchlist.keywords().size(),
                watchlist.scamPatterns().size()
            );
            return watchlist;
        } catch (IOException e) {
            log.error("Failed to load watchlist {}: {}", path, e.getMessage());
            return Watchlist.empty();
        }
    }
}
