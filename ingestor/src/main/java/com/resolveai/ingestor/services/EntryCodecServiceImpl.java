package com.resolveai.ingestor.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.resolveai.entry.exceptions.CircularReferenceException;
import com.resolveai.entry.exceptions.UnsupportedPayloadException;
import com.resolveai.entry.models.EntryJson;
import com.resolveai.entry.models.LogEntry;
import com.resolveai.entry.models.Payload;
import com.resolveai.entry.models.ToJsonOptions;
import com.resolveai.entry.services.EntryDeserializer;
import com.resolveai.entry.services.EntrySerializer;
import com.resolveai.entry.services.InsertIdGenerator;
import com.resolveai.ingestor.config.EntryCodecProperties;
import com.resolveai.ingestor.models.EntryRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Slf4j
@Service
public class EntryCodecServiceImpl implements EntryCodecService {

    private final EntrySerializer entrySerializer;
    private final EntryDeserializer entryDeserializer;
    private final EntryCodecProperties properties;
    private final MetricsService metricsService;
    private final Clock clock;
    private final InsertIdGenerator insertIdGenerator;

    public EntryCodecServiceImpl(EntrySerializer entrySerializer, EntryDeserializer entryDeserializer,
                                 EntryCodecProperties properties, MetricsService metricsService, Clock clock,
                                 InsertIdGenerator insertIdGenerator) {
        this.entrySerializer = entrySerializer;
        this.entryDeserializer = entryDeserializer;
        this.properties = properties;
        this.metricsService = metricsService;
        this.clock = clock;
        this.insertIdGenerator = insertIdGenerator;
    }

    @Override
    public EntryJson encode(EntryRequest request, Boolean removeCircular) {
        Instant startTime = Instant.now();
        LogEntry entry = new LogEntry(request.getMetadata(), request.getData(), clock, insertIdGenerator);
        ToJsonOptions options = ToJsonOptions.builder()
                .removeCircular(removeCircular != null ? removeCircular : properties.isRemoveCircular())
                .rejectUnsupportedPayload(properties.isRejectUnsupportedPayload())
                .build();

        Payload.Kind kind = entry.getPayload().getKind();
        EntryJson json;
        try {
            json = entrySerializer.toJson(entry, options);
        } catch (UnsupportedPayloadException e) {
            log.warn("ENTRY_REJECTED | insertId={} | type={}",
                    entry.getMetadata().getInsertId(), e.getPayloadType().getName());
            metricsService.recordFailure("unsupported_payload");
            throw e;
        } catch (CircularReferenceException e) {
            log.warn("ENTRY_REJECTED | insertId={} | error={}", entry.getMetadata().getInsertId(), e.getMessage());
            metricsService.recordFailure("circular_reference");
            throw e;
        }

        Duration encodingTime = Duration.between(startTime, Instant.now());
        metricsService.recordEncoded(kind, encodingTime);

        if (log.isDebugEnabled()) {
            log.debug("ENTRY_ENCODED | insertId={} | payload={} | encoding_us={}",
                    json.getInsertId(), kind, encodingTime.toNanos() / 1000);
        }
        return json;
    }

    @Override
    public LogEntry decode(JsonNode apiEntry) {
        LogEntry entry;
        try {
            entry = entryDeserializer.fromApiResponse(apiEntry);
        } catch (IllegalArgumentException e) {
            log.warn("ENTRY_DECODE_FAILED | error={}", e.getMessage());
            metricsService.recordFailure("invalid_record");
            throw e;
        }

        Payload.Kind kind = entry.getPayload().getKind();
        metricsService.recordDecoded(kind);

        if (log.isDebugEnabled()) {
            log.debug("ENTRY_DECODED | insertId={} | payload={}", entry.getMetadata().getInsertId(), kind);
        }
        return entry;
    }
}
