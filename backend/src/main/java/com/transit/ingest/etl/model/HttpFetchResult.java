package com.transit.ingest.etl.model;

import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    int statusCode,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    int attempts,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public HttpFetchResult withAttempts(int attemptCount) {
        return new HttpFetchResult(
            requestedUrl,
            statusCode,
            body,
            contentType,
            fetchedAt,
            duration,
            attemptCount,
            errorCode,
            errorMessage
        );
    }
}
