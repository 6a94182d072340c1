package com.resolveai.entry.models;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Writes wall-clock timestamps as ISO-8601 instants, RFC3339 strings verbatim and pairs as
 * {@code {"seconds": .., "nanos": ..}}.
 */
class EntryTimestampSerializer extends StdSerializer<EntryTimestamp> {

    EntryTimestampSerializer() {
        super(EntryTimestamp.class);
    }

    @Override
    public void serialize(EntryTimestamp value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        switch (value.getKind()) {
            case WALL_CLOCK:
                gen.writeString(value.getInstant().toString());
                break;
            case RFC3339:
                gen.writeString(value.getText());
                break;
            case SECONDS_NANOS:
                gen.writeStartObject();
                gen.writeNumberField("seconds", value.getPair().getSeconds());
                gen.writeNumberField("nanos", value.getPair().getNanos());
                gen.writeEndObject();
                break;
            default:
                throw new IllegalStateException("Unhandled timestamp kind: " + value.getKind());
        }
    }
}
