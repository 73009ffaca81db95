package com.transit.ingest.etl.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.transit.ingest.config.IngestProperties;
import com.transit.ingest.etl.http.ApiHttpClient;
import com.transit.ingest.etl.http.TransportException;
import com.transit.ingest.etl.model.ExtractionResult;
import com.transit.ingest.etl.model.HttpFetchResult;
import com.transit.ingest.etl.model.Pagination;
import com.transit.ingest.etl.model.PaginationMode;
import com.transit.ingest.etl.model.RawRecord;
import com.transit.ingest.etl.model.SourceConfig;
import com.transit.ingest.etl.service.PipelineCancelledException;
import com.transit.ingest.etl.util.FailureReasonClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.BooleanSupplier;

@Service
public class ApiExtractor {
    private static final Logger log = LoggerFactory.getLogger(ApiExtractor.class);

    private final ApiHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ExecutorService fetchExecutor;
    private final IngestProperties properties;

    public ApiExtractor(
        ApiHttpClient httpClient,
        ObjectMapper objectMapper,
        @Qualifier("fetchExecutor") ExecutorService fetchExecutor,
        IngestProperties properties
    ) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.fetchExecutor = fetchExecutor;
        this.properties = properties;
    }

    public ExtractionResult extract(SourceConfig source) {
        return extract(source, () -> false);
    }

    /**
     * Fetches every page of the source and returns the records in page order. Throws
     * {@link TransportException} or {@link PayloadParseException} on the first page that fails.
     */
    public ExtractionResult extract(SourceConfig source, BooleanSupplier stopRequested) {
        Instant startedAt = Instant.now();
        Pagination pagination = source.pagination();
        List<Page> pages = new ArrayList<>();
        boolean exhausted = switch (pagination.mode()) {
            case NONE -> {
                pages.add(fetchPage(source, 0, buildUrl(source, Map.of())));
                yield true;
            }
            case CURSOR -> fetchByCursor(source, stopRequested, pages);
            case OFFSET, PAGE -> fetchInWindows(source, stopRequested, pages);
        };

        List<RawRecord> records = new ArrayList<>();
        for (Page page : pages) {
            records.addAll(page.records());
        }
        boolean truncated = !exhausted;
        if (truncated) {
            log.warn(
                "Stopped {} at the {}-page ceiling while the API still reported more data",
                source.endpointUrl(),
                pagination.maxPages()
            );
        }
        log.info("Extracted {} records from {} page(s) of {}", records.size(), pages.size(), source.endpointUrl());
        return new ExtractionResult(records, pages.size(), truncated, startedAt, Instant.now());
    }

    private boolean fetchByCursor(SourceConfig source, BooleanSupplier stopRequested, List<Page> pages) {
        Pagination pagination = source.pagination();
        String cursor = null;
        for (int index = 0; index < pagination.maxPages(); index++) {
            checkStop(stopRequested, source);
            Map<String, String> params = new LinkedHashMap<>();
            if (cursor != null) {
                params.put(pagination.cursorParam(), cursor);
            }
            Page page = fetchPage(source, index, buildUrl(source, params));
            pages.add(page);
            cursor = page.nextCursor();
            if (cursor == null || cursor.isBlank()) {
                return true;
            }
        }
        return false;
    }

    // Pages of a window are fetched concurrently but consumed strictly by page index.
    private boolean fetchInWindows(SourceConfig source, BooleanSupplier stopRequested, List<Page> pages) {
        Pagination pagination = source.pagination();
        int concurrency = properties.getFetchConcurrency();
        int index = 0;
        while (index < pagination.maxPages()) {
            checkStop(stopRequested, source);
            int window = Math.min(concurrency, pagination.maxPages() - index);
            List<CompletableFuture<Page>> futures = new ArrayList<>(window);
            for (int offset = 0; offset < window; offset++) {
                int pageIndex = index + offset;
                String url = buildUrl(source, pageParams(pagination, pageIndex));
                futures.add(CompletableFuture.supplyAsync(() -> fetchPage(source, pageIndex, url), fetchExecutor));
            }
            for (CompletableFuture<Page> future : futures) {
                Page page = join(future);
                pages.add(page);
                if (page.rawCount() < pagination.pageSize()) {
                    futures.forEach(pending -> pending.cancel(false));
                    return true;
                }
            }
            index += window;
        }
        return false;
    }

    private Map<String, String> pageParams(Pagination pagination, int pageIndex) {
        Map<String, String> params = new LinkedHashMap<>();
        long value = pagination.mode() == PaginationMode.OFFSET
            ? (long) pageIndex * pagination.pageSize()
            : (long) pagination.startPage() + pageIndex;
        params.put(pagination.pageParam(), Long.toString(value));
        if (pagination.sizeParam() != null && !pagination.sizeParam().isBlank()) {
            params.put(pagination.sizeParam(), Integer.toString(pagination.pageSize()));
        }
        return params;
    }

    private Page join(CompletableFuture<Page> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    Page fetchPage(SourceConfig source, int pageIndex, String url) {
        HttpFetchResult fetch = httpClient.get(url, source.headers(), source.requestTimeout());
        if (!fetch.isSuccessful()) {
            String reason = fetch.errorCode() != null
                ? FailureReasonClassifier.fromErrorCode(fetch.errorCode(), fetch.errorMessage())
                : FailureReasonClassifier.fromHttpStatus(fetch.statusCode());
            String body = fetch.body() != null ? fetch.body() : fetch.errorMessage();
            throw new TransportException(url, fetch.statusCode(), reason, body, fetch.attempts());
        }
        if (fetch.body() == null || fetch.body().isBlank()) {
            throw new PayloadParseException(url, "JSON payload", "empty body");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(fetch.body());
        } catch (JsonProcessingException e) {
            throw new PayloadParseException(url, "JSON payload", "unparseable body: " + e.getOriginalMessage(), e);
        }

        JsonNode items = locateRecords(url, root, source.dataField());
        Instant extractedAt = fetch.fetchedAt();
        List<RawRecord> records = new ArrayList<>();
        if (items.isArray()) {
            for (int i = 0; i < items.size(); i++) {
                records.add(new RawRecord(pageIndex, i, items.get(i), extractedAt));
            }
        } else {
            records.add(new RawRecord(pageIndex, 0, items, extractedAt));
        }
        return new Page(pageIndex, records, nextCursor(source.pagination(), root));
    }

    private JsonNode locateRecords(String url, JsonNode root, String dataField) {
        if (dataField != null && !dataField.isBlank()) {
            JsonNode items = root.isObject() ? root.get(dataField) : null;
            if (items == null || !items.isArray()) {
                throw new PayloadParseException(
                    url,
                    "object with array field '" + dataField + "'",
                    items == null ? describe(root) : "'" + dataField + "' as " + describe(items)
                );
            }
            return items;
        }
        if (root.isArray() || root.isObject()) {
            return root;
        }
        throw new PayloadParseException(url, "array of objects or object", describe(root));
    }

    private String nextCursor(Pagination pagination, JsonNode root) {
        if (pagination.mode() != PaginationMode.CURSOR || !root.isObject()) {
            return null;
        }
        JsonNode cursor = root.get(pagination.cursorField());
        if (cursor == null || cursor.isNull() || cursor.isContainerNode()) {
            return null;
        }
        return cursor.asText();
    }

    private String describe(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "nothing";
        }
        return node.getNodeType().name().toLowerCase(Locale.ROOT);
    }

    private void checkStop(BooleanSupplier stopRequested, SourceConfig source) {
        if (stopRequested != null && stopRequested.getAsBoolean()) {
            throw new PipelineCancelledException("Extraction of " + source.endpointUrl() + " stopped at a page boundary");
        }
    }

    static String buildUrl(SourceConfig source, Map<String, String> pageParams) {
        Map<String, String> params = new LinkedHashMap<>(source.queryParams());
        params.putAll(pageParams);
        if (params.isEmpty()) {
            return source.endpointUrl();
        }
        StringBuilder url = new StringBuilder(source.endpointUrl());
        url.append(source.endpointUrl().contains("?") ? '&' : '?');
        boolean first = true;
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (!first) {
                url.append('&');
            }
            first = false;
            url.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
                .append('=')
                .append(URLEncoder.encode(entry.getValue() == null ? "" : entry.getValue(), StandardCharsets.UTF_8));
        }
        return url.toString();
    }

    record Page(int index, List<RawRecord> records, String nextCursor) {
        int rawCount() {
            return records.size();
        }
    }
}
