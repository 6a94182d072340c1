package com.resolveai.entry.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The {@code Timestamp} class is the wire form of a point in time: whole seconds since the Unix epoch plus a
 * non-negative nanosecond fraction of that second.
 */
@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Timestamp {
    @JsonProperty("seconds")
    private long seconds;

    @JsonProperty("nanos")
    private int nanos;
}
