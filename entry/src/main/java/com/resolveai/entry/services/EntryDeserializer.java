package com.resolveai.entry.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.resolveai.entry.models.EntryTimestamp;
import com.resolveai.entry.models.LogEntry;
import com.resolveai.entry.models.LogEntryMetadata;
import com.resolveai.entry.models.Timestamp;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;

/**
 * Rebuilds {@link LogEntry} objects from the records returned by the ingestion API.
 *
 * <p>The record's {@code payload} field names the field that holds the payload. A {@code jsonPayload} is converted
 * back to a plain map, a text payload is kept as a string. The remaining fields become the entry's metadata, and a
 * seconds/nanos timestamp is turned back into a wall-clock instant. A {@code protoPayload} is both the entry's data
 * and a pass-through metadata field, so it survives a decode and re-encode.
 */
@Slf4j
public class EntryDeserializer {

    static final String PAYLOAD_DISCRIMINATOR = "payload";
    static final String JSON_PAYLOAD = "jsonPayload";
    // protoPayload stays in the metadata and is written back unchanged
    private static final List<String> PAYLOAD_FIELDS = List.of(PAYLOAD_DISCRIMINATOR, "textPayload", JSON_PAYLOAD);

    private static final EntryDeserializer DEFAULT = new EntryDeserializer(EntryMappers.defaultMapper());

    private final ObjectMapper objectMapper;
    private final StructConverter structConverter;
    private final Clock clock;
    private final InsertIdGenerator insertIdGenerator;

    public EntryDeserializer(ObjectMapper objectMapper) {
        this(objectMapper, new StructConverter(objectMapper), Clock.systemUTC(), InsertIdGenerator.getDefault());
    }

    public EntryDeserializer(ObjectMapper objectMapper, StructConverter structConverter, Clock clock,
                             InsertIdGenerator insertIdGenerator) {
        this.objectMapper = objectMapper;
        this.structConverter = structConverter;
        this.clock = clock;
        this.insertIdGenerator = insertIdGenerator;
    }

    public static EntryDeserializer getDefault() {
        return DEFAULT;
    }

    public LogEntry fromApiResponse(JsonNode response) {
        if (response == null || !response.isObject()) {
            throw new IllegalArgumentException("An API log entry must be a JSON object");
        }

        JsonNode discriminator = response.get(PAYLOAD_DISCRIMINATOR);
        String payloadField = discriminator != null && discriminator.isTextual() ? discriminator.asText() : null;
        Object data = readPayload(payloadField, payloadField == null ? null : response.get(payloadField));

        ObjectNode metadataNode = ((ObjectNode) response).deepCopy();
        metadataNode.remove(PAYLOAD_FIELDS);
        LogEntryMetadata metadata = objectMapper.convertValue(metadataNode, LogEntryMetadata.class);

        LogEntry entry = new LogEntry(metadata, data, clock, insertIdGenerator);
        EntryTimestamp timestamp = metadata.getTimestamp();
        if (timestamp != null) {
            Timestamp pair = Timestamps.normalize(timestamp);
            entry.overwriteTimestamp(Timestamps.toInstant(pair));
        }

        if (log.isDebugEnabled()) {
            log.debug("ENTRY_DESERIALIZED | insertId={} | payload={}",
                    entry.getMetadata().getInsertId(), payloadField);
        }
        return entry;
    }

    private Object readPayload(String payloadField, JsonNode raw) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return null;
        }
        if (JSON_PAYLOAD.equals(payloadField)) {
            return structConverter.toMap(raw);
        }
        if (raw.isTextual()) {
            return raw.asText();
        }
        return objectMapper.convertValue(raw, Object.class);
    }
}
