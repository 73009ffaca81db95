package com.transit.ingest.etl.extract;

/**
 * A page was fetched but its body is not the structured payload the source promises.
 */
public class PayloadParseException extends RuntimeException {
    private final String url;
    private final String expected;
    private final String found;

    public PayloadParseException(String url, String expected, String found) {
        this(url, expected, found, null);
    }

    public PayloadParseException(String url, String expected, String found, Throwable cause) {
        super("Unexpected payload from " + url + ": expected " + expected + " but found " + found, cause);
        this.url = url;
        this.expected = expected;
        this.found = found;
    }

    public String url() {
        return url;
    }

    public String expected() {
        return expected;
    }

    public String found() {
        return found;
    }
}
