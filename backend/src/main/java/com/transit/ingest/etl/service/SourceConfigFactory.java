package com.transit.ingest.etl.service;

import com.transit.ingest.config.IngestProperties;
import com.transit.ingest.etl.contract.DataContract;
import com.transit.ingest.etl.model.LoadTarget;
import com.transit.ingest.etl.model.Pagination;
import com.transit.ingest.etl.model.SourceConfig;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves bound {@link IngestProperties} into the explicit values handed to the extractor
 * and loader.
 */
@Component
public class SourceConfigFactory {
    private final IngestProperties properties;

    public SourceConfigFactory(IngestProperties properties) {
        this.properties = properties;
    }

    public SourceConfig sourceFor(DataContract contract) {
        IngestProperties.Source source = properties.getSources().get(contract.name());
        if (source == null || source.getEndpoint() == null || source.getEndpoint().isBlank()) {
            throw new IllegalStateException("No source endpoint configured for dataset " + contract.name());
        }
        Map<String, String> headers = new LinkedHashMap<>();
        IngestProperties.Api api = properties.getApi();
        if (api.getApiKey() != null && !api.getApiKey().isBlank()) {
            headers.put(api.getApiKeyHeader(), api.getApiKey().trim());
        }
        Pagination pagination = new Pagination(
            source.getPaginationMode(),
            source.getPageParam(),
            source.getSizeParam(),
            source.getPageSize(),
            source.getStartPage(),
            source.getCursorParam(),
            source.getCursorField(),
            source.getMaxPages()
        );
        return new SourceConfig(
            endpointUrl(api.getBaseUrl(), source.getEndpoint()),
            source.getQueryParams(),
            headers,
            source.getDataField(),
            pagination,
            Duration.ofSeconds(properties.getRequestTimeoutSeconds())
        );
    }

    public LoadTarget loadTargetFor(DataContract contract) {
        return new LoadTarget(contract, properties.getLoad().getBatchSize(), properties.getLoad().isFailFast());
    }

    static String endpointUrl(String baseUrl, String endpoint) {
        String trimmed = endpoint.trim();
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://") || baseUrl == null || baseUrl.isBlank()) {
            return trimmed;
        }
        String base = baseUrl.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        return base + "/" + trimmed;
    }
}
