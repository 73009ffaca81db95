package com.transit.ingest.etl.model;

import java.time.Duration;
import java.util.Map;

/**
 * Fully resolved request settings for one extraction. {@code dataField}, when set, names the
 * array inside the response object that holds the records.
 */
public record SourceConfig(
    String endpointUrl,
    Map<String, String> queryParams,
    Map<String, String> headers,
    String dataField,
    Pagination pagination,
    Duration requestTimeout
) {
    public SourceConfig {
        if (endpointUrl == null || endpointUrl.isBlank()) {
            throw new IllegalArgumentException("endpointUrl is required");
        }
        queryParams = queryParams == null ? Map.of() : Map.copyOf(queryParams);
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        pagination = pagination == null ? Pagination.none() : pagination;
        requestTimeout = requestTimeout == null ? Duration.ofSeconds(20) : requestTimeout;
    }
}
