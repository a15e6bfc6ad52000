package com.onionwatch.tracker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.onionwatch.tracker.links.http.OnionHttpClient;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class TrackerConfig {

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    public Watchlist watchlist(TrackerProperties properties, ObjectMapper objectMapper) {
        String path = properties.getWatchlist().getPath();
        return new WatchlistLoader(objectMapper).load(path == null || path.isBlank() ? null : Path.of(path));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OkHttpClient okHttpClient(TrackerProperties properties) {
        return OnionHttpClient.baseClient(properties.getHttp());
    }

    @Bean(name = "probeHttpClient")
    public OnionHttpClient probeHttpClient(TrackerProperties properties, OkHttpClient okHttpClient) {
        return OnionHttpClient.create(
            okHttpClient,
            properties.getHttp().getUserAgent(),
            properties.getHttp().getRequestTimeoutSeconds()
        );
    }

    @Bean(name = "filterHttpClient")
    public OnionHttpClient filterHttpClient(TrackerProperties properties, OkHttpClient okHttpClient) {
        return OnionHttpClient.create(
            okHttpClient,
            properties.getFilter().getUserAgent(),
            properties.getFilter().getRequestTimeoutSeconds()
        );
    }
}
