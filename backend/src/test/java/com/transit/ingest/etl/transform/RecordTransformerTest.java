package com.transit.ingest.etl.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.transit.ingest.etl.contract.ContractField;
import com.transit.ingest.etl.contract.DataContract;
import com.transit.ingest.etl.contract.TestContracts;
import com.transit.ingest.etl.contract.TransitContracts;
import com.transit.ingest.etl.model.CleanRecord;
import com.transit.ingest.etl.model.NaturalKey;
import com.transit.ingest.etl.model.RawRecord;
import com.transit.ingest.etl.model.RejectReason;
import com.transit.ingest.etl.model.RejectType;
import com.transit.ingest.etl.model.TransformResult;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecordTransformerTest {
    private static final Instant EXTRACTED_AT = Instant.parse("2024-03-01T08:20:00.123456789Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RecordTransformer transformer = new RecordTransformer();

    @Test
    void collapsesDuplicatesAndRejectsUncoercibleValues() throws Exception {
        List<RawRecord> raw = page("[{\"id\":\"1\",\"value\":\"10\"},{\"id\":\"1\",\"value\":\"20\"},{\"id\":\"2\",\"value\":\"bad\"}]");

        TransformResult result = transformer.transform(raw, TestContracts.readings());

        assertThat(result.clean()).hasSize(1);
        assertThat(result.clean().get(0).key()).isEqualTo(NaturalKey.of(1L));
        assertThat(result.clean().get(0).get("id")).isEqualTo(1L);
        assertThat(result.clean().get(0).get("value")).isEqualTo(20L);
        assertThat(result.duplicatesCollapsed()).isEqualTo(1);
        assertThat(result.rejected()).hasSize(1);
        RejectReason reason = result.rejected().get(0).reason();
        assertThat(reason.type()).isEqualTo(RejectType.TYPE_COERCION);
        assertThat(reason.field()).isEqualTo("value");
        assertThat(reason.rawValue()).isEqualTo("bad");
        assertThat(reason.targetType()).isEqualTo("INTEGER");
        assertThat(result.rejected().get(0).raw().payload().get("id").asText()).isEqualTo("2");
        assertThat(result.inputCount()).isEqualTo(raw.size());
    }

    @Test
    void survivorTakesPositionOfLastOccurrence() throws Exception {
        List<RawRecord> raw = page("[{\"id\":1,\"value\":1},{\"id\":2,\"value\":1},{\"id\":1,\"value\":2},{\"id\":3,\"value\":1}]");

        TransformResult result = transformer.transform(raw, TestContracts.readings());

        assertThat(result.clean()).extracting(record -> record.get("id")).containsExactly(2L, 1L, 3L);
        assertThat(result.clean().get(1).get("value")).isEqualTo(2L);
        assertThat(result.duplicatesCollapsed()).isEqualTo(1);
    }

    @Test
    void dedupSpansPagesInExtractionOrder() throws Exception {
        List<RawRecord> raw = new ArrayList<>(page(0, "[{\"id\":5,\"value\":1}]"));
        raw.addAll(page(1, "[{\"id\":5,\"value\":9}]"));

        TransformResult result = transformer.transform(raw, TestContracts.readings());

        assertThat(result.clean()).singleElement().satisfies(record -> assertThat(record.get("value")).isEqualTo(9L));
    }

    @Test
    void everyInputIsAccountedFor() throws Exception {
        List<RawRecord> raw = page("[{\"id\":1},{\"id\":1},{\"value\":3},{\"id\":\"x\"},\"oops\",{\"id\":2,\"value\":\"7\"},null]");

        TransformResult result = transformer.transform(raw, TestContracts.readings());

        assertThat(result.clean()).hasSize(2);
        assertThat(result.rejected()).hasSize(4);
        assertThat(result.duplicatesCollapsed()).isEqualTo(1);
        assertThat(result.clean().size() + result.rejected().size() + result.duplicatesCollapsed()).isEqualTo(raw.size());
        assertThat(result.rejected()).extracting(rejected -> rejected.reason().type())
            .containsExactly(RejectType.VALIDATION, RejectType.TYPE_COERCION, RejectType.MALFORMED_RECORD, RejectType.MALFORMED_RECORD);
    }

    @Test
    void missingRequiredFieldIsAValidationReject() throws Exception {
        TransformResult result = transformer.transform(
            page("[{\"StopID\":\"1001\",\"Lat\":38.9,\"Lon\":-77.0}]"),
            TransitContracts.busStops()
        );

        assertThat(result.clean()).isEmpty();
        RejectReason reason = result.rejected().get(0).reason();
        assertThat(reason.type()).isEqualTo(RejectType.VALIDATION);
        assertThat(reason.field()).isEqualTo("stop_name");
        assertThat(reason.rule()).isEqualTo("required");
    }

    @Test
    void blankTextCountsAsMissing() throws Exception {
        TransformResult result = transformer.transform(
            page("[{\"StopID\":\"1001\",\"Name\":\"   \",\"Lat\":38.9,\"Lon\":-77.0}]"),
            TransitContracts.busStops()
        );

        assertThat(result.rejected().get(0).reason().describe()).isEqualTo("VALIDATION(stop_name, required, null)");
    }

    @Test
    void enforcesBoundsAndLength() throws Exception {
        String longName = "x".repeat(201);
        TransformResult result = transformer.transform(
            page("[{\"StopID\":\"1\",\"Name\":\"A\",\"Lat\":\"95\",\"Lon\":-77.0},"
                + "{\"StopID\":\"2\",\"Name\":\"" + longName + "\",\"Lat\":38.9,\"Lon\":-77.0},"
                + "{\"StopID\":\"-3\",\"Name\":\"C\",\"Lat\":38.9,\"Lon\":-77.0}]"),
            TransitContracts.busStops()
        );

        assertThat(result.clean()).isEmpty();
        assertThat(result.rejected()).extracting(rejected -> rejected.reason().field() + ":" + rejected.reason().rule())
            .containsExactly("lat:max", "stop_name:max_length", "stop_id:min");
    }

    @Test
    void normalizesTextAndMatchesSourceNamesIgnoringCase() throws Exception {
        TransformResult result = transformer.transform(
            page("[{\"stopid\":\" 1001 \",\"NAME\":\"  Main   St \\t& 5th  \",\"lat\":\"38.878586\",\"lon\":\"-76.989626\"}]"),
            TransitContracts.busStops()
        );

        CleanRecord record = result.clean().get(0);
        assertThat(record.get("stop_id")).isEqualTo(1001L);
        assertThat(record.get("stop_name")).isEqualTo("Main St & 5th");
        assertThat((BigDecimal) record.get("lat")).isEqualByComparingTo("38.878586");
        assertThat((BigDecimal) record.get("lon")).isEqualByComparingTo("-76.989626");
    }

    @Test
    void transformsBusPositionWithCaseFoldingDefaultsAndExtractionTime() throws Exception {
        TransformResult result = transformer.transform(
            page("[{\"VehicleID\":\"7201\",\"DateTime\":\"2024-03-01T08:15:30\",\"TripID\":\"123\",\"RouteID\":\" d80 \","
                + "\"DirectionNum\":\"0\",\"DirectionText\":\"northbound\",\"Lat\":38.9,\"Lon\":-77.03,"
                + "\"Deviation\":-2.5,\"TripStartTime\":\"2024-03-01T08:00:00\",\"TripEndTime\":\"2024-03-01T09:00:00\","
                + "\"BlockNumber\":\"\"}]"),
            TransitContracts.busPositions()
        );

        assertThat(result.rejected()).isEmpty();
        CleanRecord record = result.clean().get(0);
        assertThat(record.key()).isEqualTo(NaturalKey.of(7201L, LocalDateTime.of(2024, 3, 1, 8, 15, 30)));
        assertThat(record.get("route_id")).isEqualTo("D80");
        assertThat(record.get("direction_text")).isEqualTo("NORTHBOUND");
        assertThat(record.get("block_number")).isEqualTo("UNASSIGNED");
        assertThat((BigDecimal) record.get("deviation")).isEqualByComparingTo("-2.5");
        assertThat(record.get("observed_at")).isEqualTo(LocalDateTime.of(2024, 3, 1, 8, 20, 0, 123_456_000));
    }

    @Test
    void rejectsValuesOutsideAllowedSet() throws Exception {
        TransformResult result = transformer.transform(
            page("[{\"VehicleID\":\"7201\",\"DateTime\":\"2024-03-01T08:15:30\",\"RouteID\":\"D80\","
                + "\"DirectionText\":\"sideways\",\"Lat\":38.9,\"Lon\":-77.03}]"),
            TransitContracts.busPositions()
        );

        assertThat(result.rejected().get(0).reason().describe()).isEqualTo("VALIDATION(direction_text, allowed_values, SIDEWAYS)");
    }

    @Test
    void acceptsDocumentedDateTimestampAndFlagFormats() throws Exception {
        DataContract contract = DataContract.builder("formats", "formats")
            .field(ContractField.integer("id").required())
            .field(ContractField.date("service_date"))
            .field(ContractField.timestamp("seen_at"))
            .field(ContractField.flag("active"))
            .naturalKey("id")
            .build();

        TransformResult result = transformer.transform(page("["
            + "{\"id\":1,\"service_date\":\"2024-03-01\",\"seen_at\":\"2024-03-01 08:15:30\",\"active\":\"yes\"},"
            + "{\"id\":2,\"service_date\":\"2024/03/01\",\"seen_at\":\"2024-03-01T13:15:30+05:00\",\"active\":\"0\"},"
            + "{\"id\":3,\"service_date\":\"03/01/2024\",\"seen_at\":1709280930000,\"active\":true},"
            + "{\"id\":4,\"service_date\":\"March 1\"},"
            + "{\"id\":5,\"active\":\"maybe\"},"
            + "{\"id\":\"6.0\"},"
            + "{\"id\":\"3.5\"}"
            + "]"), contract);

        assertThat(result.clean()).extracting(record -> record.get("id")).containsExactly(1L, 2L, 3L, 6L);
        for (CleanRecord record : result.clean().subList(0, 3)) {
            assertThat(record.get("service_date")).isEqualTo(LocalDate.of(2024, 3, 1));
            assertThat(record.get("seen_at")).isEqualTo(LocalDateTime.of(2024, 3, 1, 8, 15, 30));
        }
        assertThat(result.clean()).extracting(record -> record.get("active")).containsExactly(true, false, true, null);
        assertThat(result.rejected()).extracting(rejected -> rejected.reason().field())
            .containsExactly("service_date", "active", "id");
        assertThat(result.rejected()).allSatisfy(rejected ->
            assertThat(rejected.reason().type()).isEqualTo(RejectType.TYPE_COERCION));
    }

    @Test
    void decimalKeysCompareByValue() throws Exception {
        DataContract contract = DataContract.builder("fares", "fares")
            .field(ContractField.decimal("amount").required())
            .naturalKey("amount")
            .build();

        TransformResult result = transformer.transform(page("[{\"amount\":\"1.50\"},{\"amount\":1.5}]"), contract);

        assertThat(result.clean()).hasSize(1);
        assertThat(result.duplicatesCollapsed()).isEqualTo(1);
    }

    @Test
    void nonObjectElementsAreMalformed() throws Exception {
        TransformResult result = transformer.transform(page("[42, [1, 2]]"), TestContracts.readings());

        assertThat(result.rejected()).extracting(rejected -> rejected.reason().describe())
            .containsExactly(
                "MALFORMED_RECORD(expected object, found number)",
                "MALFORMED_RECORD(expected object, found array)"
            );
    }

    @Test
    void rejectsDecimalsWiderThanTheColumnPrecision() throws Exception {
        TransformResult result = transformer.transform(
            page("[{\"id\":1,\"deviation\":1.5},{\"id\":2,\"deviation\":\"1e20\"},{\"id\":3,\"deviation\":\"2\"}]"),
            TestContracts.deviations()
        );

        assertThat(result.clean()).extracting(record -> record.get("id")).containsExactly(1L, 3L);
        assertThat(result.rejected()).extracting(rejected -> rejected.reason().describe())
            .containsExactly("VALIDATION(deviation, precision, 100000000000000000000)");
    }

    @Test
    void decimalPrecisionBoundaryIsThirteenIntegerDigits() throws Exception {
        TransformResult result = transformer.transform(
            page("[{\"id\":1,\"deviation\":\"9999999999999.999999\"},"
                + "{\"id\":2,\"deviation\":\"-9999999999999.9999994\"},"
                + "{\"id\":3,\"deviation\":\"10000000000000\"},"
                + "{\"id\":4,\"deviation\":\"9999999999999.9999996\"}]"),
            TestContracts.deviations()
        );

        assertThat(result.clean()).extracting(record -> record.get("id")).containsExactly(1L, 2L);
        assertThat((BigDecimal) result.clean().get(1).get("deviation")).isEqualByComparingTo("-9999999999999.999999");
        // six-place rounding of the last value adds a fourteenth integer digit
        assertThat(result.rejected()).extracting(rejected -> rejected.reason().describe())
            .containsExactly(
                "VALIDATION(deviation, precision, 10000000000000)",
                "VALIDATION(deviation, precision, 10000000000000.000000)"
            );
    }

    @Test
    void explodesRoutesIntoOneRowPerStopAndRoute() throws Exception {
        List<RawRecord> raw = page("["
            + "{\"StopID\":\"1001\",\"Name\":\"Main St\",\"Routes\":[\"d80\",\" 10a \",\"D80\"]},"
            + "{\"StopID\":\"1002\",\"Routes\":\"x2\"}"
            + "]");

        TransformResult result = transformer.transform(raw, TransitContracts.busStopRoutes());

        assertThat(result.rejected()).isEmpty();
        assertThat(result.clean()).extracting(CleanRecord::key).containsExactly(
            NaturalKey.of(1001L, "10A"),
            NaturalKey.of(1001L, "D80"),
            NaturalKey.of(1002L, "X2")
        );
        assertThat(result.clean().get(0).values().keySet()).containsExactly("stop_id", "route_id");
        assertThat(result.duplicatesCollapsed()).isEqualTo(1);
        assertThat(result.rowsExpanded()).isEqualTo(2);
        assertThat(result.inputCount()).isEqualTo(raw.size());
    }

    @Test
    void stopWithoutRoutesOrWithABadRouteIsRejectedWhole() throws Exception {
        List<RawRecord> raw = page("["
            + "{\"StopID\":\"1003\",\"Routes\":[]},"
            + "{\"StopID\":\"1004\"},"
            + "{\"StopID\":\"1005\",\"Routes\":[\"A1\",{\"id\":\"B2\"}]},"
            + "{\"StopID\":\"1006\",\"Routes\":[\"C3\",\"" + "R".repeat(17) + "\"]},"
            + "{\"StopID\":\"1007\",\"Routes\":[\"E4\"]}"
            + "]");

        TransformResult result = transformer.transform(raw, TransitContracts.busStopRoutes());

        assertThat(result.clean()).singleElement()
            .satisfies(record -> assertThat(record.key()).isEqualTo(NaturalKey.of(1007L, "E4")));
        assertThat(result.rejected()).extracting(rejected -> rejected.reason().field() + ":" + rejected.reason().type())
            .containsExactly(
                "route_id:VALIDATION",
                "route_id:VALIDATION",
                "route_id:TYPE_COERCION",
                "route_id:VALIDATION"
            );
        assertThat(result.rejected().get(0).reason().rule()).isEqualTo("required");
        assertThat(result.rejected().get(3).reason().rule()).isEqualTo("max_length");
        assertThat(result.rowsExpanded()).isZero();
        assertThat(result.inputCount()).isEqualTo(raw.size());
    }

    private List<RawRecord> page(String json) throws Exception {
        return page(0, json);
    }

    private List<RawRecord> page(int pageIndex, String json) throws Exception {
        JsonNode items = objectMapper.readTree(json);
        List<RawRecord> records = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            records.add(new RawRecord(pageIndex, i, items.get(i), EXTRACTED_AT));
        }
        return records;
    }
}
