package com.nomadtap.tap.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nomadtap.tap.error.MalformedRecordException;
import com.nomadtap.tap.model.CatalogEntry;
import com.nomadtap.tap.model.FieldType;
import com.nomadtap.tap.model.TapRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps raw Nomad API elements to schema-conformant records.
 *
 * The schema is authoritative: declared fields missing from the payload become null,
 * payload fields that are not declared (or not selected) are dropped.
 */
@Component
@RequiredArgsConstructor
public class RecordMapper {

    private static final TypeReference<Map<String, Object>> OBJECT_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<Object>> ARRAY_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    /**
     * @param raw           one element of an API page
     * @param entry         catalog entry whose selected schema shapes the record
     * @param timeExtracted when the page holding this element was fetched
     * @throws MalformedRecordException if the element is not a JSON object, a value does not fit
     *                                  its declared type, or a primary key is missing
     */
    public TapRecord map(JsonNode raw, CatalogEntry entry, Instant timeExtracted) {
        String stream = entry.streamName();
        if (raw == null || !raw.isObject()) {
            throw new MalformedRecordException(stream,
                    "expected a JSON object but got " + (raw == null ? "nothing" : raw.getNodeType()));
        }

        Map<String, Object> values = new LinkedHashMap<>();
        entry.selectedSchema().forEach((field, type) -> values.put(field, convert(stream, field, type, raw.get(field))));

        for (String key : entry.definition().primaryKeys()) {
            if (values.get(key) == null) {
                throw new MalformedRecordException(stream, "primary key " + key + " is missing");
            }
        }
        return new TapRecord(stream, values, timeExtracted);
    }

    // ── Coercion ─────────────────────────────────────────────────────────────

    private Object convert(String stream, String field, FieldType type, JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return switch (type) {
            case STRING -> node.isValueNode() ? node.asText() : node.toString();
            case INTEGER -> toLong(stream, field, node);
            case NUMBER -> toDouble(stream, field, node);
            case BOOLEAN -> toBoolean(stream, field, node);
            case TIMESTAMP_NANOS -> toTimestamp(stream, field, node);
            case OBJECT -> {
                if (!node.isObject()) {
                    throw mismatch(stream, field, type, node);
                }
                yield objectMapper.convertValue(node, OBJECT_TYPE);
            }
            case ARRAY -> {
                if (!node.isArray()) {
                    throw mismatch(stream, field, type, node);
                }
                yield objectMapper.convertValue(node, ARRAY_TYPE);
            }
        };
    }

    private Long toLong(String stream, String field, JsonNode node) {
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                throw mismatch(stream, field, FieldType.INTEGER, node);
            }
        }
        throw mismatch(stream, field, FieldType.INTEGER, node);
    }

    private Double toDouble(String stream, String field, JsonNode node) {
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                throw mismatch(stream, field, FieldType.NUMBER, node);
            }
        }
        throw mismatch(stream, field, FieldType.NUMBER, node);
    }

    private Boolean toBoolean(String stream, String field, JsonNode node) {
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
                return Boolean.parseBoolean(text);
            }
        }
        throw mismatch(stream, field, FieldType.BOOLEAN, node);
    }

    private String toTimestamp(String stream, String field, JsonNode node) {
        long nanos = toLong(stream, field, node);
        if (nanos == 0) {
            return null; // Nomad's zero value means "never"
        }
        long seconds = Math.floorDiv(nanos, 1_000_000_000L);
        long nanoAdjustment = Math.floorMod(nanos, 1_000_000_000L);
        return Instant.ofEpochSecond(seconds, nanoAdjustment).toString();
    }

    private MalformedRecordException mismatch(String stream, String field, FieldType type, JsonNode node) {
        return new MalformedRecordException(stream,
                "field " + field + " expected " + type + " but got " + node.getNodeType() + " (" + node + ")");
    }
}
