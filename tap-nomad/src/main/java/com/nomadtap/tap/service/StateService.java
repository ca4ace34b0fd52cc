package com.nomadtap.tap.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nomadtap.tap.error.StateCorruptionException;
import com.nomadtap.tap.model.Bookmark;
import com.nomadtap.tap.model.ReplicationState;
import com.nomadtap.tap.model.StreamDefinition;
import com.nomadtap.tap.schema.SchemaRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts between the persisted state document and {@link ReplicationState}.
 *
 * Document shape: {@code {"bookmarks": {"jobs": {"ModifyIndex": 1042}, "nodes": {"completed": true}}}}.
 * Bookmarks for streams the registry does not know are carried through untouched.
 */
@Service
@RequiredArgsConstructor
public class StateService {

    private static final TypeReference<Map<String, Object>> BOOKMARK_TYPE = new TypeReference<>() {};

    private final SchemaRegistry registry;
    private final ObjectMapper objectMapper;

    /**
     * @param json persisted document; null or blank means first run
     * @throws StateCorruptionException if the document cannot be used as a resume point
     */
    public ReplicationState parse(String json) {
        if (json == null || json.isBlank()) {
            return ReplicationState.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new StateCorruptionException("State document is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new StateCorruptionException("State document must be a JSON object");
        }
        JsonNode bookmarks = root.path("bookmarks");
        if (bookmarks.isMissingNode() || bookmarks.isNull()) {
            return ReplicationState.empty();
        }
        if (!bookmarks.isObject()) {
            throw new StateCorruptionException("State \"bookmarks\" must be an object");
        }

        Map<String, Bookmark> parsed = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = bookmarks.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String stream = field.getKey();
            JsonNode value = field.getValue();
            if (!value.isObject()) {
                throw new StateCorruptionException("Bookmark for stream " + stream + " must be an object");
            }
            checkReplicationValue(stream, value);
            parsed.put(stream, Bookmark.of(objectMapper.convertValue(value, BOOKMARK_TYPE)));
        }
        return ReplicationState.of(parsed);
    }

    public ObjectNode render(ReplicationState state) {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode bookmarks = root.putObject("bookmarks");
        state.bookmarks().forEach((stream, bookmark) -> bookmarks.set(stream, objectMapper.valueToTree(bookmark.asMap())));
        return root;
    }

    private void checkReplicationValue(String stream, JsonNode bookmark) {
        if (!registry.contains(stream)) {
            return;
        }
        StreamDefinition definition = registry.getDefinition(stream);
        if (!definition.isIncremental()) {
            return;
        }
        JsonNode value = bookmark.get(definition.replicationKey());
        if (value != null && !value.isNull() && !(value.isIntegralNumber() && value.canConvertToLong())) {
            throw new StateCorruptionException("Bookmark " + definition.replicationKey() + " for stream "
                    + stream + " must be an integer in the signed 64-bit range but was " + value);
        }
    }
}
