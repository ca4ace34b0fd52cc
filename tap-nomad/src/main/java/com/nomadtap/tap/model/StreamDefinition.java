package com.nomadtap.tap.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Static description of one extractable entity type.
 *
 * @param name              unique stream name
 * @param schema            field name to type, in declaration order
 * @param primaryKeys       non-empty, every entry declared in the schema
 * @param replicationMethod how the stream is extracted
 * @param replicationKey    required for INCREMENTAL, null for FULL_TABLE
 * @param path              API endpoint, relative to the configured base URL
 * @param sorted            whether the endpoint returns rows in non-decreasing replication key order
 */
public record StreamDefinition(
        String name,
        Map<String, FieldType> schema,
        List<String> primaryKeys,
        ReplicationMethod replicationMethod,
        String replicationKey,
        String path,
        boolean sorted
) {

    public StreamDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(replicationMethod, "replicationMethod");
        Objects.requireNonNull(path, "path");
        if (primaryKeys == null || primaryKeys.isEmpty()) {
            throw new IllegalArgumentException("Stream " + name + " must declare at least one primary key");
        }
        for (String key : primaryKeys) {
            if (!schema.containsKey(key)) {
                throw new IllegalArgumentException("Primary key " + key + " is not in the schema of " + name);
            }
        }
        if (replicationMethod == ReplicationMethod.INCREMENTAL) {
            if (replicationKey == null || !schema.containsKey(replicationKey)) {
                throw new IllegalArgumentException("Incremental stream " + name + " needs a replication key from its schema");
            }
        } else if (replicationKey != null) {
            throw new IllegalArgumentException("Full-table stream " + name + " cannot declare a replication key");
        }
        schema = Collections.unmodifiableMap(new LinkedHashMap<>(schema));
        primaryKeys = List.copyOf(primaryKeys);
    }

    public boolean isIncremental() {
        return replicationMethod == ReplicationMethod.INCREMENTAL;
    }

    /** Fields that are always extracted, whatever the catalog says. */
    public boolean isAutomatic(String field) {
        return primaryKeys.contains(field) || field.equals(replicationKey);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private final Map<String, FieldType> schema = new LinkedHashMap<>();
        private List<String> primaryKeys = List.of();
        private ReplicationMethod replicationMethod = ReplicationMethod.FULL_TABLE;
        private String replicationKey;
        private String path;
        private boolean sorted;

        private Builder(String name) {
            this.name = name;
        }

        public Builder field(String field, FieldType type) {
            schema.put(field, type);
            return this;
        }

        public Builder primaryKeys(String... keys) {
            this.primaryKeys = List.of(keys);
            return this;
        }

        public Builder fullTable() {
            this.replicationMethod = ReplicationMethod.FULL_TABLE;
            this.replicationKey = null;
            return this;
        }

        public Builder incremental(String replicationKey) {
            this.replicationMethod = ReplicationMethod.INCREMENTAL;
            this.replicationKey = replicationKey;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder sorted(boolean sorted) {
            this.sorted = sorted;
            return this;
        }

        public StreamDefinition build() {
            return new StreamDefinition(name, schema, primaryKeys, replicationMethod, replicationKey, path, sorted);
        }
    }
}
