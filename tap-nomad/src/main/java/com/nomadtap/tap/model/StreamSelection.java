package com.nomadtap.tap.model;

import java.util.Map;

/**
 * What a user catalog says about one stream: whether it is selected and any per-field overrides.
 */
public record StreamSelection(boolean selected, Map<String, Boolean> fieldSelection) {

    public StreamSelection {
        fieldSelection = fieldSelection == null ? Map.of() : Map.copyOf(fieldSelection);
    }

    public static StreamSelection allFields() {
        return new StreamSelection(true, Map.of());
    }
}
