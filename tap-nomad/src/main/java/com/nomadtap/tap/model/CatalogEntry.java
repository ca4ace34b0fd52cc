package com.nomadtap.tap.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A stream definition plus the user's selection for it.
 *
 * Field overrides only apply to non-automatic fields; primary keys and the replication key
 * are always extracted.
 */
public record CatalogEntry(StreamDefinition definition, boolean selected, Map<String, Boolean> fieldSelection) {

    public CatalogEntry {
        Objects.requireNonNull(definition, "definition");
        fieldSelection = fieldSelection == null ? Map.of() : Map.copyOf(fieldSelection);
    }

    /** Discovery default: selected, every field included. */
    public static CatalogEntry discovered(StreamDefinition definition) {
        return new CatalogEntry(definition, true, Map.of());
    }

    public String streamName() {
        return definition.name();
    }

    public boolean isFieldSelected(String field) {
        if (!definition.schema().containsKey(field)) {
            return false;
        }
        if (definition.isAutomatic(field)) {
            return true;
        }
        return fieldSelection.getOrDefault(field, Boolean.TRUE);
    }

    /** The declared schema narrowed to selected fields, in declaration order. */
    public Map<String, FieldType> selectedSchema() {
        Map<String, FieldType> projected = new LinkedHashMap<>();
        definition.schema().forEach((field, type) -> {
            if (isFieldSelected(field)) {
                projected.put(field, type);
            }
        });
        return projected;
    }
}
