package com.transit.ingest.etl.http;

/**
 * A page could not be fetched: non-2xx status or a transport failure that outlived its retries.
 */
public class TransportException extends RuntimeException {
    private static final int MAX_EXCERPT = 500;

    private final String url;
    private final int statusCode;
    private final String reasonCode;
    private final String bodyExcerpt;
    private final int attempts;

    public TransportException(String url, int statusCode, String reasonCode, String body, int attempts) {
        super(buildMessage(url, statusCode, reasonCode, attempts));
        this.url = url;
        this.statusCode = statusCode;
        this.reasonCode = reasonCode;
        this.bodyExcerpt = excerpt(body);
        this.attempts = attempts;
    }

    public String url() {
        return url;
    }

    public int statusCode() {
        return statusCode;
    }

    public String reasonCode() {
        return reasonCode;
    }

    public String bodyExcerpt() {
        return bodyExcerpt;
    }

    public int attempts() {
        return attempts;
    }

    static String excerpt(String body) {
        if (body == null) {
            return null;
        }
        String trimmed = body.strip();
        return trimmed.length() <= MAX_EXCERPT ? trimmed : trimmed.substring(0, MAX_EXCERPT) + "...";
    }

    private static String buildMessage(String url, int statusCode, String reasonCode, int attempts) {
        return "GET " + url + " failed: " + reasonCode
            + (statusCode > 0 ? " (status " + statusCode + ")" : "")
            + " after " + attempts + " attempt(s)";
    }
}
