package com.nomadtap.tap.service;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One decoded response: its raw elements and the continuation token (null on the last page).
 */
public record Page(List<JsonNode> items, String nextToken) {

    public Page {
        items = List.copyOf(items);
    }

    public boolean hasNext() {
        return nextToken != null && !nextToken.isBlank();
    }
}
