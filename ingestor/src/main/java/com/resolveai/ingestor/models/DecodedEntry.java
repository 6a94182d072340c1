package com.resolveai.ingestor.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.resolveai.entry.models.LogEntry;
import com.resolveai.entry.models.LogEntryMetadata;
import com.resolveai.entry.models.Payload;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * {@code DecodedEntry} is the response view of a log entry rebuilt from an API record.
 */
@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DecodedEntry {
    @JsonProperty("metadata")
    private LogEntryMetadata metadata;

    @JsonProperty("data")
    private Object data;

    @JsonProperty("payloadKind")
    private Payload.Kind payloadKind;

    public static DecodedEntry from(LogEntry entry) {
        return DecodedEntry.builder()
                .metadata(entry.getMetadata())
                .data(entry.getData())
                .payloadKind(entry.getPayload().getKind())
                .build();
    }
}
