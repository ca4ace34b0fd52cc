package com.nomadtap.tap.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nomadtap.tap.error.OutputException;
import com.nomadtap.tap.model.TapRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.io.PrintStream;
import java.time.Instant;
import java.util.List;

/**
 * Writes the tap's output protocol: one JSON object per line, each with a {@code type} of
 * SCHEMA, RECORD or STATE.
 *
 * Output is flushed after every STATE so a consumer that persists state never gets ahead of
 * records it has not seen.
 */
@Slf4j
public class MessageWriter implements Closeable {

    private final ObjectMapper objectMapper;
    private final PrintStream out;
    private final boolean ownsStream;

    private long recordsWritten;
    private long statesWritten;

    public MessageWriter(ObjectMapper objectMapper, PrintStream out, boolean ownsStream) {
        this.objectMapper = objectMapper;
        this.out = out;
        this.ownsStream = ownsStream;
    }

    public void writeSchema(String stream, JsonNode schema, List<String> keyProperties, List<String> bookmarkProperties) {
        ObjectNode message = objectMapper.createObjectNode();
        message.put("type", "SCHEMA");
        message.put("stream", stream);
        message.set("schema", schema);
        message.set("key_properties", objectMapper.valueToTree(keyProperties));
        message.set("bookmark_properties", objectMapper.valueToTree(bookmarkProperties));
        write(message);
    }

    public void writeRecord(TapRecord record) {
        ObjectNode message = objectMapper.createObjectNode();
        message.put("type", "RECORD");
        message.put("stream", record.stream());
        message.set("record", objectMapper.valueToTree(record.values()));
        message.put("time_extracted", formatTime(record.timeExtracted()));
        write(message);
        recordsWritten++;
    }

    public void writeState(JsonNode value) {
        ObjectNode message = objectMapper.createObjectNode();
        message.put("type", "STATE");
        message.set("value", value);
        write(message);
        out.flush();
        if (out.checkError()) {
            throw new OutputException("Output stream failed while writing STATE", null);
        }
        statesWritten++;
    }

    /** Any standalone document, e.g. the discovered catalog. */
    public void writeDocument(JsonNode document) {
        try {
            out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document));
        } catch (JsonProcessingException e) {
            throw new OutputException("Could not serialise document", e);
        }
        out.flush();
    }

    public long getRecordsWritten() {
        return recordsWritten;
    }

    public long getStatesWritten() {
        return statesWritten;
    }

    private void write(ObjectNode message) {
        try {
            out.println(objectMapper.writeValueAsString(message));
        } catch (JsonProcessingException e) {
            throw new OutputException("Could not serialise " + message.path("type").asText() + " message", e);
        }
    }

    private String formatTime(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    @Override
    public void close() throws IOException {
        out.flush();
        if (ownsStream) {
            out.close();
            log.debug("Closed output after {} records and {} states", recordsWritten, statesWritten);
        }
    }
}
