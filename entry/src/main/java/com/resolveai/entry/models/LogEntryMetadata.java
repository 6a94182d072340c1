package com.resolveai.entry.models;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The {@code LogEntryMetadata} class describes everything about a log entry except its payload. Fields the model does
 * not name (such as {@code httpRequest}, {@code operation} or {@code sourceLocation}) are kept in
 * {@code additionalFields} and written back out unchanged.
 */
@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LogEntryMetadata {
    @JsonProperty("logName")
    private String logName;

    @JsonProperty("resource")
    private MonitoredResource resource;

    @JsonProperty("severity")
    private LogSeverity severity;

    @JsonProperty("timestamp")
    private EntryTimestamp timestamp;

    @JsonProperty("insertId")
    private String insertId;

    @JsonProperty("labels")
    private Map<String, String> labels;

    @JsonProperty("trace")
    private String trace;

    @JsonProperty("spanId")
    private String spanId;

    @JsonProperty("traceSampled")
    private Boolean traceSampled;

    @JsonIgnore
    @Builder.Default
    private Map<String, Object> additionalFields = new LinkedHashMap<>();

    @JsonAnyGetter
    Map<String, Object> jsonAdditionalFields() {
        return additionalFields;
    }

    @JsonAnySetter
    void putAdditionalField(String name, Object value) {
        if (additionalFields == null) {
            additionalFields = new LinkedHashMap<>();
        }
        additionalFields.put(name, value);
    }

    /**
     * Builds the metadata of a new entry: a default record stamped with {@code now}, overlaid with every field the
     * caller supplied. Nested maps and the resource are copied so the result never shares state with
     * {@code supplied}.
     */
    public static LogEntryMetadata withDefaults(LogEntryMetadata supplied, Instant now) {
        LogEntryMetadata merged = LogEntryMetadata.builder()
                .timestamp(EntryTimestamp.of(now))
                .build();
        if (supplied != null) {
            overlay(supplied, merged);
        }
        return merged;
    }

    /**
     * Copies {@code source} with its resource, labels and additional fields detached. Values inside
     * {@code additionalFields} are shared.
     */
    public static LogEntryMetadata copyOf(LogEntryMetadata source) {
        LogEntryMetadata copy = LogEntryMetadata.builder().build();
        overlay(source, copy);
        return copy;
    }

    private static void overlay(LogEntryMetadata supplied, LogEntryMetadata merged) {
        if (supplied.logName != null) {
            merged.logName = supplied.logName;
        }
        if (supplied.resource != null) {
            merged.resource = supplied.resource.copy();
        }
        if (supplied.severity != null) {
            merged.severity = supplied.severity;
        }
        if (supplied.timestamp != null) {
            merged.timestamp = supplied.timestamp;
        }
        if (supplied.insertId != null) {
            merged.insertId = supplied.insertId;
        }
        if (supplied.labels != null) {
            merged.labels = new LinkedHashMap<>(supplied.labels);
        }
        if (supplied.trace != null) {
            merged.trace = supplied.trace;
        }
        if (supplied.spanId != null) {
            merged.spanId = supplied.spanId;
        }
        if (supplied.traceSampled != null) {
            merged.traceSampled = supplied.traceSampled;
        }
        if (supplied.additionalFields != null) {
            merged.additionalFields.putAll(supplied.additionalFields);
        }
    }
}
