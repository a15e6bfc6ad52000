package com.onionwatch.tracker.links.http;

import com.onionwatch.tracker.config.TrackerProperties;
import com.onionwatch.tracker.links.model.HttpFetchResult;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.time.Duration;

/**
 * Blocking GET client for hidden services. Requests go through the configured SOCKS5 proxy, follow
 * redirects, and never throw: transport failures come back as an {@link HttpFetchResult} carrying
 * an error code, while any received response (including 4xx and 5xx) carries its status code.
 */
public class OnionHttpClient {
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final OkHttpClient client;
    private final String userAgent;

    public OnionHttpClient(OkHttpClient client, String userAgent) {
        this.client = client;
        this.userAgent = userAgent;
    }

    public static OkHttpClient baseClient(TrackerProperties.Http http) {
        OkHttpClient.Builder builder = new OkHttpClient.Builder()
            .followRedirects(true)
            .followSslRedirects(true)
            .retryOnConnectionFailure(false)
            .connectTimeout(Duration.ofSeconds(http.getConnectTimeoutSeconds()))
            .readTimeout(Duration.ofSeconds(http.getRequestTimeoutSeconds()))
            .callTimeout(Duration.ofSeconds(http.getRequestTimeoutSeconds()));
        TrackerProperties.Proxy proxy = http.getProxy();
        if (proxy != null && proxy.isEnabled()) {
            builder.proxy(new Proxy(Proxy.Type.SOCKS, new InetSocketAddress(proxy.getHost(), proxy.getPort())));
        } else {
            builder.proxy(Proxy.NO_PROXY);
        }
        return builder.build();
    }

    public static OnionHttpClient create(OkHttpClient base, String userAgent, int timeoutSeconds) {
        Duration timeout = Duration.ofSeconds(timeoutSeconds);
        OkHttpClient client = base.newBuilder()
            .readTimeout(timeout)
            .callTimeout(timeout)
            .build();
        return new OnionHttpClient(client, userAgent);
    }

    public HttpFetchResult get(String url) {
        HttpUrl httpUrl = normalizeUrl(url);
        if (httpUrl == null) {
            return errorResult(url, "invalid_url", "URL missing host or malformed");
        }

        Request request = new Request.Builder()
            .url(httpUrl)
            .header("User-Agent", userAgent)
            .header("Accept", HTML_ACCEPT)
            .get()
            .build();
        try (Response response = client.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String body = responseBody == null ? null : responseBody.string();
            return new HttpFetchResult(url, response.request().url().uri(), response.code(), body, null, null);
        } catch (InterruptedIOException e) {
            if (Thread.currentThread().isInterrupted()) {
                return errorResult(url, "interrupted", e.getMessage());
            }
            return errorResult(url, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, "io_error", e.getMessage());
        } catch (RuntimeException e) {
            return errorResult(url, "http_error", e.getMessage());
        }
    }

    private HttpFetchResult errorResult(String url, String code, String message) {
        return new HttpFetchResult(url, null, 0, null, code, message);
    }

    private HttpUrl normalizeUrl(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "http://" + value;
        }
        return HttpUrl.parse(value);
    }
}
