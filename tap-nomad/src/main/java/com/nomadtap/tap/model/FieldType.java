package com.nomadtap.tap.model;

/**
 * Column types a stream schema can declare, with their JSON Schema rendering.
 */
public enum FieldType {

    STRING("string", null),
    INTEGER("integer", null),
    NUMBER("number", null),
    BOOLEAN("boolean", null),
    /** Nomad reports times as nanoseconds since the epoch; emitted as ISO-8601 UTC strings. */
    TIMESTAMP_NANOS("string", "date-time"),
    OBJECT("object", null),
    ARRAY("array", null);

    private final String jsonType;
    private final String format;

    FieldType(String jsonType, String format) {
        this.jsonType = jsonType;
        this.format = format;
    }

    public String jsonType() {
        return jsonType;
    }

    public String format() {
        return format;
    }
}
