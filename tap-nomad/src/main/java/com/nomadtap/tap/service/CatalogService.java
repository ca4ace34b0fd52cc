package com.nomadtap.tap.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nomadtap.tap.error.CatalogException;
import com.nomadtap.tap.model.CatalogEntry;
import com.nomadtap.tap.model.FieldType;
import com.nomadtap.tap.model.StreamDefinition;
import com.nomadtap.tap.model.StreamSelection;
import com.nomadtap.tap.schema.SchemaRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders the registry as a Singer catalog document and reads user catalogs back.
 *
 * Catalog shape:
 * <pre>
 * {"streams": [{"tap_stream_id": "jobs", "stream": "jobs", "schema": {...},
 *               "key_properties": ["ID"], "replication_method": "INCREMENTAL",
 *               "replication_key": "ModifyIndex",
 *               "metadata": [{"breadcrumb": [], "metadata": {"selected": true, ...}},
 *                            {"breadcrumb": ["properties", "Name"], "metadata": {"selected": false}}]}]}
 * </pre>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CatalogService {

    private final SchemaRegistry registry;
    private final ObjectMapper objectMapper;

    // ── Discovery ────────────────────────────────────────────────────────────

    public ObjectNode discover() {
        ObjectNode catalog = objectMapper.createObjectNode();
        ArrayNode streams = catalog.putArray("streams");
        for (StreamDefinition definition : registry.definitions()) {
            streams.add(renderStream(CatalogEntry.discovered(definition)));
        }
        return catalog;
    }

    private ObjectNode renderStream(CatalogEntry entry) {
        StreamDefinition definition = entry.definition();
        ObjectNode node = objectMapper.createObjectNode();
        node.put("tap_stream_id", definition.name());
        node.put("stream", definition.name());
        node.set("schema", renderSchema(entry));
        node.set("key_properties", objectMapper.valueToTree(definition.primaryKeys()));
        node.put("replication_method", definition.replicationMethod().name());
        if (definition.replicationKey() != null) {
            node.put("replication_key", definition.replicationKey());
        }

        ArrayNode metadata = node.putArray("metadata");
        ObjectNode streamMetadata = metadata.addObject();
        streamMetadata.putArray("breadcrumb");
        ObjectNode streamValues = streamMetadata.putObject("metadata");
        streamValues.put("inclusion", "available");
        streamValues.put("selected", entry.selected());
        streamValues.set("table-key-properties", objectMapper.valueToTree(definition.primaryKeys()));
        streamValues.put("forced-replication-method", definition.replicationMethod().name());
        if (definition.replicationKey() != null) {
            streamValues.set("valid-replication-keys", objectMapper.valueToTree(List.of(definition.replicationKey())));
        }

        for (String field : definition.schema().keySet()) {
            ObjectNode fieldMetadata = metadata.addObject();
            fieldMetadata.putArray("breadcrumb").add("properties").add(field);
            ObjectNode values = fieldMetadata.putObject("metadata");
            values.put("inclusion", definition.isAutomatic(field) ? "automatic" : "available");
            values.put("selected", entry.isFieldSelected(field));
        }
        return node;
    }

    /**
     * JSON Schema for the selected fields of an entry. Primary keys are non-nullable, everything
     * else accepts null.
     */
    public ObjectNode renderSchema(CatalogEntry entry) {
        StreamDefinition definition = entry.definition();
        ObjectNode schema = objectMapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        for (Map.Entry<String, FieldType> field : entry.selectedSchema().entrySet()) {
            FieldType type = field.getValue();
            ObjectNode property = properties.putObject(field.getKey());
            if (definition.primaryKeys().contains(field.getKey())) {
                property.put("type", type.jsonType());
            } else {
                property.putArray("type").add("null").add(type.jsonType());
            }
            if (type.format() != null) {
                property.put("format", type.format());
            }
        }
        schema.set("required", objectMapper.valueToTree(definition.primaryKeys()));
        return schema;
    }

    // ── User catalog ─────────────────────────────────────────────────────────

    /**
     * Parse a user catalog into per-stream selections, keyed by stream name.
     *
     * @throws CatalogException if the document is not valid JSON or lists no streams
     */
    public Map<String, StreamSelection> parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json == null ? "" : json);
        } catch (JsonProcessingException e) {
            throw new CatalogException("Catalog is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.path("streams").isArray()) {
            throw new CatalogException("Catalog has no \"streams\" array");
        }
        if (root.path("streams").isEmpty()) {
            throw new CatalogException("Catalog lists no streams");
        }

        Map<String, StreamSelection> selections = new LinkedHashMap<>();
        for (JsonNode stream : root.path("streams")) {
            String name = stream.hasNonNull("tap_stream_id")
                    ? stream.get("tap_stream_id").asText()
                    : stream.path("stream").asText(null);
            if (name == null || name.isBlank()) {
                throw new CatalogException("Catalog stream entry without a name: " + stream);
            }
            selections.put(name, parseSelection(stream));
        }
        log.info("Catalog lists {} streams, {} selected", selections.size(),
                selections.values().stream().filter(StreamSelection::selected).count());
        return selections;
    }

    private StreamSelection parseSelection(JsonNode stream) {
        boolean selected = stream.path("selected").asBoolean(false)
                || stream.path("schema").path("selected").asBoolean(false);
        Map<String, Boolean> fields = new LinkedHashMap<>();

        for (JsonNode item : stream.path("metadata")) {
            JsonNode breadcrumb = item.path("breadcrumb");
            JsonNode values = item.path("metadata");
            if (!values.has("selected")) {
                continue;
            }
            if (breadcrumb.isArray() && breadcrumb.isEmpty()) {
                selected = values.get("selected").asBoolean(false);
            } else if (breadcrumb.size() == 2 && "properties".equals(breadcrumb.get(0).asText())) {
                fields.put(breadcrumb.get(1).asText(), values.get("selected").asBoolean(true));
            }
        }
        return new StreamSelection(selected, fields);
    }
}
