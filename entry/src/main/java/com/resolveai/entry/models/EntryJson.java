package com.resolveai.entry.models;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The {@code EntryJson} class is a log entry in the shape the ingestion API expects. At most one of
 * {@code jsonPayload} and {@code textPayload} is set; every other metadata field is carried in {@code fields}.
 */
@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EntryJson {
    @JsonProperty("timestamp")
    private Timestamp timestamp;

    @JsonProperty("insertId")
    private String insertId;

    @JsonProperty("jsonPayload")
    private ObjectNode jsonPayload;

    @JsonProperty("textPayload")
    private String textPayload;

    @JsonIgnore
    @Builder.Default
    private Map<String, JsonNode> fields = new LinkedHashMap<>();

    @JsonAnyGetter
    Map<String, JsonNode> jsonFields() {
        return fields;
    }

    @JsonAnySetter
    void putField(String name, JsonNode value) {
        if (fields == null) {
            fields = new LinkedHashMap<>();
        }
        fields.put(name, value);
    }

    public JsonNode getField(String name) {
        return fields == null ? null : fields.get(name);
    }
}
