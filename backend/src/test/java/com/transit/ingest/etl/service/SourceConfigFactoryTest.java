package com.transit.ingest.etl.service;

import com.transit.ingest.config.IngestProperties;
import com.transit.ingest.etl.contract.TestContracts;
import com.transit.ingest.etl.contract.TransitContracts;
import com.transit.ingest.etl.model.LoadTarget;
import com.transit.ingest.etl.model.PaginationMode;
import com.transit.ingest.etl.model.SourceConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceConfigFactoryTest {

    @Test
    void joinsBaseUrlAndEndpoint() {
        assertThat(SourceConfigFactory.endpointUrl("https://api.wmata.com/Bus.svc/json/", "/jStops"))
            .isEqualTo("https://api.wmata.com/Bus.svc/json/jStops");
        assertThat(SourceConfigFactory.endpointUrl("https://api.wmata.com/Bus.svc/json", "jStops"))
            .isEqualTo("https://api.wmata.com/Bus.svc/json/jStops");
        assertThat(SourceConfigFactory.endpointUrl("https://api.wmata.com", "http://localhost:8080/stops"))
            .isEqualTo("http://localhost:8080/stops");
        assertThat(SourceConfigFactory.endpointUrl(null, " jStops ")).isEqualTo("jStops");
    }

    @Test
    void buildsSourceWithApiKeyHeaderAndPaging() {
        IngestProperties properties = new IngestProperties();
        properties.setRequestTimeoutSeconds(7);
        properties.getApi().setBaseUrl("https://api.example.test/v1");
        properties.getApi().setApiKey(" secret ");
        IngestProperties.Source source = new IngestProperties.Source();
        source.setEndpoint("readings");
        source.setDataField("Readings");
        source.setPaginationMode(PaginationMode.PAGE);
        source.setPageSize(25);
        source.setMaxPages(3);
        source.getQueryParams().put("Route", "D80");
        properties.getSources().put(TestContracts.READINGS, source);

        SourceConfig config = new SourceConfigFactory(properties).sourceFor(TestContracts.readings());

        assertThat(config.endpointUrl()).isEqualTo("https://api.example.test/v1/readings");
        assertThat(config.headers()).containsEntry("api_key", "secret");
        assertThat(config.queryParams()).containsEntry("Route", "D80");
        assertThat(config.dataField()).isEqualTo("Readings");
        assertThat(config.pagination().mode()).isEqualTo(PaginationMode.PAGE);
        assertThat(config.pagination().pageSize()).isEqualTo(25);
        assertThat(config.pagination().startPage()).isEqualTo(1);
        assertThat(config.pagination().maxPages()).isEqualTo(3);
        assertThat(config.requestTimeout()).isEqualTo(Duration.ofSeconds(7));
    }

    @Test
    void omitsApiKeyHeaderWhenNoKeyIsConfigured() {
        IngestProperties properties = new IngestProperties();
        IngestProperties.Source source = new IngestProperties.Source();
        source.setEndpoint("jStops");
        properties.getSources().put(TransitContracts.BUS_STOPS, source);

        SourceConfig config = new SourceConfigFactory(properties).sourceFor(TransitContracts.busStops());

        assertThat(config.headers()).isEmpty();
    }

    @Test
    void failsWhenDatasetHasNoEndpoint() {
        IngestProperties properties = new IngestProperties();

        assertThatThrownBy(() -> new SourceConfigFactory(properties).sourceFor(TransitContracts.busPositions()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("bus-positions");
    }

    @Test
    void loadTargetCarriesBatchSizeAndFailFast() {
        IngestProperties properties = new IngestProperties();
        properties.getLoad().setBatchSize(50);
        properties.getLoad().setFailFast(true);

        LoadTarget target = new SourceConfigFactory(properties).loadTargetFor(TestContracts.readings());

        assertThat(target.batchSize()).isEqualTo(50);
        assertThat(target.failFast()).isTrue();
        assertThat(target.contract().tableName()).isEqualTo("readings");
    }
}
