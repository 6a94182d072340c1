package com.resolveai.entry.models;

import com.fasterxml.jackson.databind.JsonNode;
import com.resolveai.entry.services.EntryDeserializer;
import com.resolveai.entry.services.EntrySerializer;
import com.resolveai.entry.services.InsertIdGenerator;
import lombok.Getter;
import lombok.ToString;

import java.time.Clock;
import java.time.Instant;

/**
 * The {@code LogEntry} class is a single log record: its {@link LogEntryMetadata} and the raw data that becomes its
 * payload when serialized.
 *
 * <p>The metadata is built at construction from the supplied fields over a default of {@code timestamp = now}. If no
 * insert id was supplied one is taken from the {@link InsertIdGenerator}; the ingestion API uses it as a secondary
 * ordering for entries whose timestamps are equal, so it must be unique and increasing. The data is stored as given
 * and only classified when the entry is serialized, see {@link Payload}.
 *
 * <p>An entry does not change after construction. {@link #getMetadata()} returns a copy; the only mutation is
 * {@link #overwriteTimestamp(Instant)}, used when an API record is decoded.
 */
@Getter
@ToString
public class LogEntry {

    private final LogEntryMetadata metadata;
    private final Object data;

    public LogEntry() {
        this(null, null);
    }

    public LogEntry(LogEntryMetadata metadata, Object data) {
        this(metadata, data, Clock.systemUTC(), InsertIdGenerator.getDefault());
    }

    public LogEntry(LogEntryMetadata metadata, Object data, Clock clock, InsertIdGenerator insertIdGenerator) {
        this.metadata = LogEntryMetadata.withDefaults(metadata, clock.instant());
        String insertId = this.metadata.getInsertId();
        if (insertId == null || insertId.isEmpty()) {
            this.metadata.setInsertId(insertIdGenerator.next());
        }
        this.data = data;
    }

    public LogEntryMetadata getMetadata() {
        return LogEntryMetadata.copyOf(metadata);
    }

    /**
     * Replaces the timestamp with a wall-clock instant.
     */
    public void overwriteTimestamp(Instant timestamp) {
        metadata.setTimestamp(EntryTimestamp.of(timestamp));
    }

    public Payload getPayload() {
        return Payload.of(data);
    }

    public EntryJson toJson() {
        return EntrySerializer.getDefault().toJson(this);
    }

    public EntryJson toJson(ToJsonOptions options) {
        return EntrySerializer.getDefault().toJson(this, options);
    }

    /**
     * Creates an entry from an API representation, such as one element of an {@code entries:list} response.
     */
    public static LogEntry fromApiResponse(JsonNode entry) {
        return EntryDeserializer.getDefault().fromApiResponse(entry);
    }
}
