package com.transit.ingest.config;

import com.transit.ingest.etl.model.PaginationMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "ingest")
public class IngestProperties {
    private static final String DEFAULT_USER_AGENT = "transit-ingest/0.1 (+contact)";

    private String userAgent;
    private int requestTimeoutSeconds = 20;
    private int requestMaxAttempts = 4;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 8000;
    private int fetchConcurrency = 4;
    private Api api = new Api();
    private Load load = new Load();
    private Cli cli = new Cli();
    private Map<String, Source> sources = new LinkedHashMap<>();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxAttempts() {
        return Math.max(1, requestMaxAttempts);
    }

    public void setRequestMaxAttempts(int requestMaxAttempts) {
        this.requestMaxAttempts = Math.max(1, requestMaxAttempts);
    }

    public int getRequestRetryBaseDelayMs() {
        return requestRetryBaseDelayMs;
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
    }

    public int getRequestRetryMaxDelayMs() {
        return requestRetryMaxDelayMs;
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
    }

    public int getFetchConcurrency() {
        return Math.max(1, fetchConcurrency);
    }

    public void setFetchConcurrency(int fetchConcurrency) {
        this.fetchConcurrency = Math.max(1, fetchConcurrency);
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public Load getLoad() {
        return load;
    }

    public void setLoad(Load load) {
        this.load = load;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public Map<String, Source> getSources() {
        return sources;
    }

    public void setSources(Map<String, Source> sources) {
        this.sources = sources == null ? new LinkedHashMap<>() : sources;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Api {
        private String baseUrl = "https://api.wmata.com/Bus.svc/json";
        private String apiKey;
        private String apiKeyHeader = "api_key";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getApiKeyHeader() {
            return apiKeyHeader;
        }

        public void setApiKeyHeader(String apiKeyHeader) {
            this.apiKeyHeader = apiKeyHeader;
        }
    }

    public static class Load {
        private int batchSize = 500;
        private boolean failFast = false;

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public boolean isFailFast() {
            return failFast;
        }

        public void setFailFast(boolean failFast) {
            this.failFast = failFast;
        }
    }

    public static class Cli {
        private boolean run = false;
        private String dataset = "bus-stops";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getDataset() {
            return dataset;
        }

        public void setDataset(String dataset) {
            this.dataset = dataset;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    public static class Source {
        private String endpoint;
        private String dataField;
        private Map<String, String> queryParams = new LinkedHashMap<>();
        private PaginationMode paginationMode = PaginationMode.NONE;
        private String pageParam = "page";
        private String sizeParam = "pageSize";
        private int pageSize = 100;
        private int startPage = 1;
        private String cursorParam = "cursor";
        private String cursorField = "nextCursor";
        private int maxPages = 50;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getDataField() {
            return dataField;
        }

        public void setDataField(String dataField) {
            this.dataField = dataField;
        }

        public Map<String, String> getQueryParams() {
            return queryParams;
        }

        public void setQueryParams(Map<String, String> queryParams) {
            this.queryParams = queryParams == null ? new LinkedHashMap<>() : queryParams;
        }

        public PaginationMode getPaginationMode() {
            return paginationMode == null ? PaginationMode.NONE : paginationMode;
        }

        public void setPaginationMode(PaginationMode paginationMode) {
            this.paginationMode = paginationMode;
        }

        public String getPageParam() {
            return pageParam;
        }

        public void setPageParam(String pageParam) {
            this.pageParam = pageParam;
        }

        public String getSizeParam() {
            return sizeParam;
        }

        public void setSizeParam(String sizeParam) {
            this.sizeParam = sizeParam;
        }

        public int getPageSize() {
            return Math.max(1, pageSize);
        }

        public void setPageSize(int pageSize) {
            this.pageSize = Math.max(1, pageSize);
        }

        public int getStartPage() {
            return Math.max(0, startPage);
        }

        public void setStartPage(int startPage) {
            this.startPage = Math.max(0, startPage);
        }

        public String getCursorParam() {
            return cursorParam;
        }

        public void setCursorParam(String cursorParam) {
            this.cursorParam = cursorParam;
        }

        public String getCursorField() {
            return cursorField;
        }

        public void setCursorField(String cursorField) {
            this.cursorField = cursorField;
        }

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }
    }
}
