package com.transit.ingest.etl.http;

import com.transit.ingest.config.IngestProperties;
import com.transit.ingest.etl.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ApiHttpClientRetryTest {
    private MockWebServer server;
    private ExecutorService executor;
    private ApiHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);

        IngestProperties properties = new IngestProperties();
        properties.setRequestTimeoutSeconds(5);
        properties.setRequestMaxAttempts(3);
        properties.setRequestRetryBaseDelayMs(1);
        properties.setRequestRetryMaxDelayMs(5);
        client = new ApiHttpClient(properties, executor);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void recoversWhenServerErrorsStayBelowAttemptCeiling() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.enqueue(new MockResponse().setResponseCode(502).setBody("bad gateway"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("[]"));

        HttpFetchResult result = client.get(server.url("/stops").toString(), Map.of(), Duration.ofSeconds(5));

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void givesUpOnceAttemptCeilingIsReached() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(503).setBody("busy " + i));
        }
        server.enqueue(new MockResponse().setResponseCode(200).setBody("[]"));

        HttpFetchResult result = client.get(server.url("/stops").toString(), Map.of(), Duration.ofSeconds(5));

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.statusCode()).isEqualTo(503);
        assertThat(result.body()).isEqualTo("busy 2");
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void neverRetriesClientErrors() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("invalid api key"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("[]"));

        HttpFetchResult result = client.get(server.url("/stops").toString(), Map.of(), Duration.ofSeconds(5));

        assertThat(result.statusCode()).isEqualTo(401);
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void retriesTimedOutRequests() {
        server.enqueue(new MockResponse().setBody("[]").setHeadersDelay(2, TimeUnit.SECONDS));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("[{\"id\":1}]"));

        HttpFetchResult result = client.get(server.url("/stops").toString(), Map.of(), Duration.ofMillis(300));

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).isEqualTo("[{\"id\":1}]");
        assertThat(result.attempts()).isEqualTo(2);
    }

    @Test
    void sendsConfiguredHeaders() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("[]"));

        client.get(server.url("/stops").toString(), Map.of("api_key", "secret"), Duration.ofSeconds(5));

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getHeader("api_key")).isEqualTo("secret");
        assertThat(request.getHeader("Accept")).isEqualTo("application/json");
        assertThat(request.getHeader("User-Agent")).startsWith("transit-ingest/");
    }

    @Test
    void rejectsMalformedUrlWithoutSendingAnything() {
        HttpFetchResult result = client.get("http:// bad host", Map.of(), Duration.ofSeconds(1));

        assertThat(result.errorCode()).isEqualTo("invalid_url");
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(server.getRequestCount()).isZero();
    }
}
