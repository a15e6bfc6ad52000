package com.onionwatch.tracker.links.model;

import java.net.URI;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    /**
     * True when a response arrived at all, whatever its status code.
     */
    public boolean isResponse() {
        return errorCode == null && statusCode > 0;
    }

    public boolean isTransportFailure() {
        return errorCode != null;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }
}
