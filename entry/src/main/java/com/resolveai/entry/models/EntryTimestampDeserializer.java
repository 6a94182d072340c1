package com.resolveai.entry.models;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * Reads any of the accepted timestamp forms. Strings are kept as RFC3339 text, objects become seconds/nanos pairs
 * (proto JSON may carry {@code seconds} as a string) and bare numbers are epoch milliseconds.
 */
class EntryTimestampDeserializer extends StdDeserializer<EntryTimestamp> {

    EntryTimestampDeserializer() {
        super(EntryTimestamp.class);
    }

    @Override
    public EntryTimestamp deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        final JsonNode node = p.getCodec().readTree(p);
        if (node.isTextual()) {
            return EntryTimestamp.of(node.asText());
        }
        if (node.isObject()) {
            return EntryTimestamp.of(node.path("seconds").asLong(0), node.path("nanos").asInt(0));
        }
        if (node.isNumber()) {
            return EntryTimestamp.ofEpochMilli(node.asLong());
        }
        return ctxt.reportInputMismatch(EntryTimestamp.class, "Unsupported timestamp form: %s", node.getNodeType());
    }
}
