package com.bidradar.crawl.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String contentType,
    int attempts,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }

    public HttpFetchResult withAttempts(int attempts) {
        return new HttpFetchResult(
            requestedUrl,
            finalUri,
            statusCode,
            body,
            contentType,
            attempts,
            fetchedAt,
            duration,
            errorCode,
            errorMessage
        );
    }

    public String describeFailure() {
        if (errorCode != null) {
            String message = errorMessage == null || errorMessage.isBlank() ? "" : ": " + errorMessage;
            return errorCode + message;
        }
        return "http_" + statusCode;
    }
}
