package com.resolveai.entry.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.resolveai.entry.exceptions.UnsupportedPayloadException;
import com.resolveai.entry.models.EntryJson;
import com.resolveai.entry.models.LogEntry;
import com.resolveai.entry.models.LogEntryMetadata;
import com.resolveai.entry.models.Payload;
import com.resolveai.entry.models.ToJsonOptions;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serializes a {@link LogEntry} to the format the ingestion API expects: the metadata is copied, the payload is
 * written as {@code jsonPayload} or {@code textPayload} and the timestamp becomes a seconds/nanos pair.
 */
@Slf4j
public class EntrySerializer {

    static final String TEXT_PAYLOAD = "textPayload";
    static final String JSON_PAYLOAD = "jsonPayload";
    static final String PROTO_PAYLOAD = "protoPayload";

    private static final EntrySerializer DEFAULT = new EntrySerializer(EntryMappers.defaultMapper());

    private final ObjectMapper objectMapper;
    private final StructConverter structConverter;

    public EntrySerializer(ObjectMapper objectMapper) {
        this(objectMapper, new StructConverter(objectMapper));
    }

    public EntrySerializer(ObjectMapper objectMapper, StructConverter structConverter) {
        this.objectMapper = objectMapper;
        this.structConverter = structConverter;
    }

    public static EntrySerializer getDefault() {
        return DEFAULT;
    }

    public EntryJson toJson(LogEntry entry) {
        return toJson(entry, ToJsonOptions.defaults());
    }

    public EntryJson toJson(LogEntry entry, ToJsonOptions options) {
        LogEntryMetadata metadata = entry.getMetadata();
        EntryJson json = copyMetadata(metadata);

        Payload payload = Payload.of(entry.getData());
        if (json.getField(PROTO_PAYLOAD) != null) {
            // protoPayload is passed through as the payload, so no second payload field is written
            if (log.isDebugEnabled()) {
                log.debug("ENTRY_PROTO_PAYLOAD_KEPT | insertId={}", json.getInsertId());
            }
            payload = Payload.of(null);
        }
        switch (payload.getKind()) {
            case TEXT:
                json.setTextPayload(payload.getText());
                break;
            case STRUCTURED:
                json.setJsonPayload(toStruct(payload.getValue(), options.isRemoveCircular()));
                break;
            case UNSUPPORTED:
                if (options.isRejectUnsupportedPayload()) {
                    throw new UnsupportedPayloadException(payload.getValue().getClass());
                }
                log.warn("ENTRY_PAYLOAD_DROPPED | insertId={} | type={}",
                        metadata.getInsertId(), payload.getValue().getClass().getName());
                break;
            case UNSET:
            default:
                break;
        }

        if (metadata.getTimestamp() != null) {
            json.setTimestamp(Timestamps.normalize(metadata.getTimestamp()));
        }

        if (log.isDebugEnabled()) {
            log.debug("ENTRY_SERIALIZED | insertId={} | payload={}", json.getInsertId(), payload.getKind());
        }
        return json;
    }

    private EntryJson copyMetadata(LogEntryMetadata metadata) {
        ObjectNode tree = objectMapper.valueToTree(metadata);
        tree.remove("timestamp");
        tree.remove(TEXT_PAYLOAD);
        tree.remove(JSON_PAYLOAD);
        JsonNode insertId = tree.remove("insertId");

        Map<String, JsonNode> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> iterator = tree.fields();
        while (iterator.hasNext()) {
            Map.Entry<String, JsonNode> field = iterator.next();
            fields.put(field.getKey(), field.getValue());
        }
        return EntryJson.builder()
                .insertId(insertId == null || insertId.isNull() ? null : insertId.asText())
                .fields(fields)
                .build();
    }

    private ObjectNode toStruct(Object value, boolean removeCircular) {
        return structConverter.toStruct(value, removeCircular);
    }
}
