package com.nomadtap.tap.model;

import java.time.Instant;
import java.util.Map;

/**
 * One schema-conformant row. Values are keyed by field name in schema order; absent fields are null.
 */
public record TapRecord(String stream, Map<String, Object> values, Instant timeExtracted) {
}
