package com.resolveai.entry.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Options for serializing a log entry.
 */
@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ToJsonOptions {
    /**
     * Replace circular references in a structured payload with the string {@code [Circular]} instead of failing.
     */
    private boolean removeCircular;

    /**
     * Throw instead of dropping a payload that is neither text nor structured.
     */
    private boolean rejectUnsupportedPayload;

    public static ToJsonOptions defaults() {
        return new ToJsonOptions();
    }
}
