package com.onionwatch.tracker.links.service;

import com.onionwatch.tracker.config.Watchlist;
import com.onionwatch.tracker.links.extract.OnionAddressExtractor;
import com.onionwatch.tracker.links.http.OnionHttpClient;
import com.onionwatch.tracker.links.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

@Service
public class AddressCollectorService {
    private static final Logger log = LoggerFactory.getLogger(AddressCollectorService.class);

    private final OnionHttpClient httpClient;
    private final OnionAddressExtractor extractor;
    private final Watchlist watchlist;

    public AddressCollectorService(
        @Qualifier("probeHttpClient") OnionHttpClient httpClient,
        OnionAddressExtractor extractor,
        Watchlist watchlist
    ) {
        this.httpClient = httpClient;
        this.extractor = extractor;
        this.watchlist = watchlist;
    }

    public SortedSet<String> collect() {
        return collect(watchlist.sources());
    }

    /**
     * Scrapes every source in turn and returns the union of the addresses found. A source that
     * cannot be fetched contributes nothing.
     */
    public SortedSet<String> collect(List<String> sources) {
        SortedSet<String> all = new TreeSet<>();
        for (String source : sources) {
            all.addAll(collectFromSource(source));
        }
        log.info("Total unique .onion links collected: {}", all.size());
        return all;
    }

    public SortedSet<String> collectFromSource(String source) {
        try {
            log.info("Scraping {}...", source);
            HttpFetchResult fetch = httpClient.get(source);
            if (fetch.isTransportFailure()) {
                log.error("Error scraping {}: {} ({})", source, fetch.errorCode(), fetch.errorMessage());
                return Collections.emptySortedSet();
            }
            if (!fetch.isSuccessful()) {
                log.warn("Source {} answered with status {}", source, fetch.statusCode());
            }
            String fetchedFrom = fetch.finalUrlOrRequested();
            if (!source.equals(fetchedFrom)) {
                log.info("Source {} redirected to {}", source, fetchedFrom);
            }
            SortedSet<String> links = extractor.extract(fetch.body());
            log.info("Found {} .onion links from {}", links.size(), source);
            return links;
        } catch (RuntimeException e) {
            log.error("Error scraping {}", source, e);
            return Collections.emptySortedSet();
        }
    }
}
