package com.nomadtap.tap.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nomadtap.tap.error.MalformedRecordException;
import com.nomadtap.tap.model.CatalogEntry;
import com.nomadtap.tap.model.TapRecord;
import com.nomadtap.tap.schema.NomadStreams;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordMapperTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RecordMapper mapper = new RecordMapper(objectMapper);
    private final CatalogEntry nodes = CatalogEntry.discovered(NomadStreams.NODES);

    @Test
    void keepsDeclaredFieldsInSchemaOrderAndDropsUnknownOnes() throws Exception {
        TapRecord record = mapper.map(json("""
                {"Status": "ready", "ID": "n-1", "Name": "worker-1", "ModifyIndex": 42,
                 "Drain": false, "SomethingNew": "ignored"}
                """), nodes, NOW);

        assertThat(record.stream()).isEqualTo("nodes");
        assertThat(record.timeExtracted()).isEqualTo(NOW);
        assertThat(record.values()).containsOnlyKeys(NomadStreams.NODES.schema().keySet());
        assertThat(record.values().keySet()).startsWith("ID", "Name", "Datacenter");
        assertThat(record.values()).containsEntry("ID", "n-1")
                .containsEntry("Status", "ready")
                .containsEntry("ModifyIndex", 42L)
                .containsEntry("Drain", false);
    }

    @Test
    void missingFieldsBecomeNull() throws Exception {
        TapRecord record = mapper.map(json("{\"ID\": \"n-1\"}"), nodes, NOW);

        assertThat(record.values().get("Datacenter")).isNull();
        assertThat(record.values()).containsKey("Datacenter");
    }

    @Test
    void coercesNumericTextAndNestedValues() throws Exception {
        TapRecord record = mapper.map(json("""
                {"ID": "n-1", "ModifyIndex": "17", "Drivers": {"docker": {"Healthy": true}}}
                """), nodes, NOW);

        assertThat(record.values()).containsEntry("ModifyIndex", 17L);
        assertThat(record.values().get("Drivers")).isEqualTo(Map.of("docker", Map.of("Healthy", true)));
    }

    @Test
    void convertsNanosecondTimestampsToIsoStrings() throws Exception {
        CatalogEntry jobs = CatalogEntry.discovered(NomadStreams.JOBS);

        TapRecord record = mapper.map(json("""
                {"ID": "web", "Namespace": "default", "ModifyIndex": 10,
                 "SubmitTime": 1709294400123456789, "Datacenters": ["dc1", "dc2"]}
                """), jobs, NOW);

        assertThat(record.values()).containsEntry("SubmitTime", "2024-03-01T12:00:00.123456789Z");
        assertThat(record.values().get("Datacenters")).isEqualTo(List.of("dc1", "dc2"));
    }

    @Test
    void zeroTimestampMeansNever() throws Exception {
        CatalogEntry jobs = CatalogEntry.discovered(NomadStreams.JOBS);

        TapRecord record = mapper.map(json("{\"ID\": \"web\", \"Namespace\": \"default\", \"SubmitTime\": 0}"), jobs, NOW);

        assertThat(record.values().get("SubmitTime")).isNull();
    }

    @Test
    void projectsUnselectedFieldsAwayButKeepsAutomaticOnes() throws Exception {
        CatalogEntry narrowed = new CatalogEntry(NomadStreams.NODES, true,
                Map.of("Name", false, "ID", false, "Drivers", false));

        TapRecord record = mapper.map(json("{\"ID\": \"n-1\", \"Name\": \"worker-1\"}"), narrowed, NOW);

        assertThat(record.values()).containsKey("ID").doesNotContainKeys("Name", "Drivers");
    }

    @Test
    void rejectsNonObjectElements() throws Exception {
        assertThatThrownBy(() -> mapper.map(json("\"just a string\""), nodes, NOW))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("nodes")
                .hasMessageContaining("expected a JSON object");
    }

    @Test
    void rejectsMissingPrimaryKey() throws Exception {
        assertThatThrownBy(() -> mapper.map(json("{\"Name\": \"worker-1\"}"), nodes, NOW))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("primary key ID");
    }

    @Test
    void rejectsValuesThatDoNotFitTheirType() throws Exception {
        assertThatThrownBy(() -> mapper.map(json("{\"ID\": \"n-1\", \"ModifyIndex\": \"not-a-number\"}"), nodes, NOW))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("ModifyIndex");
        assertThatThrownBy(() -> mapper.map(json("{\"ID\": \"n-1\", \"Drivers\": [1, 2]}"), nodes, NOW))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("Drivers");
    }

    @Test
    void rejectsIntegersBeyondLongRange() throws Exception {
        assertThatThrownBy(() -> mapper.map(json("{\"ID\": \"n-1\", \"ModifyIndex\": 18446744073709551615}"), nodes, NOW))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("ModifyIndex");
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }
}
