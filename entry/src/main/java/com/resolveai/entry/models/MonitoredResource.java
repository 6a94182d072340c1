package com.resolveai.entry.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code MonitoredResource} is a supporting data model class which describes the resource that produced a log entry,
 * e.g. {@code gce_instance} with its {@code zone} and {@code instance_id} labels.
 */
@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MonitoredResource {
    @JsonProperty("type")
    private String type;

    @JsonProperty("labels")
    private Map<String, String> labels;

    MonitoredResource copy() {
        return MonitoredResource.builder()
                .type(type)
                .labels(labels == null ? null : new LinkedHashMap<>(labels))
                .build();
    }
}
