package com.resolveai.ingestor.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.resolveai.entry.models.EntryJson;
import com.resolveai.entry.models.LogEntry;
import com.resolveai.ingestor.models.EntryRequest;

public interface EntryCodecService {
    /**
     * Builds a log entry from the request and serializes it to the wire format.
     *
     * @param removeCircular overrides the configured default when not {@code null}
     */
    EntryJson encode(EntryRequest request, Boolean removeCircular);

    LogEntry decode(JsonNode apiEntry);
}
