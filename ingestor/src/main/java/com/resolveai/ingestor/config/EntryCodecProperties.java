package com.resolveai.ingestor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Defaults applied when encoding entries, bound from {@code entries.*}.
 */
@Data
@ConfigurationProperties(prefix = "entries")
public class EntryCodecProperties {
    private boolean removeCircular = false;
    private boolean rejectUnsupportedPayload = false;
}
