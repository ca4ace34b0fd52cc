package com.nomadtap.tap.schema;

import com.nomadtap.tap.error.UnknownStreamException;
import com.nomadtap.tap.model.StreamDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only lookup of stream definitions. Populated once at construction; iteration order is
 * discovery order.
 */
public class SchemaRegistry {

    private final Map<String, StreamDefinition> definitions;

    public SchemaRegistry(List<StreamDefinition> definitions) {
        Map<String, StreamDefinition> byName = new LinkedHashMap<>();
        for (StreamDefinition definition : definitions) {
            if (byName.putIfAbsent(definition.name(), definition) != null) {
                throw new IllegalArgumentException("Duplicate stream definition: " + definition.name());
            }
        }
        this.definitions = Collections.unmodifiableMap(byName);
    }

    public StreamDefinition getDefinition(String streamName) {
        StreamDefinition definition = definitions.get(streamName);
        if (definition == null) {
            throw new UnknownStreamException(streamName);
        }
        return definition;
    }

    public boolean contains(String streamName) {
        return definitions.containsKey(streamName);
    }

    public List<StreamDefinition> definitions() {
        return List.copyOf(definitions.values());
    }
}
