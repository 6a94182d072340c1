package com.resolveai.ingestor.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.resolveai.entry.models.LogEntryMetadata;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The {@code EntryRequest} class describes a log entry to encode: its metadata and the data that becomes its payload.
 * Both are optional.
 */
@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EntryRequest {
    @JsonProperty("metadata")
    private LogEntryMetadata metadata;

    @JsonProperty("data")
    private Object data;
}
