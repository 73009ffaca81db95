package com.transit.ingest.etl.service;

public class PipelineCancelledException extends RuntimeException {
    public PipelineCancelledException(String message) {
        super(message);
    }
}
