package com.resolveai.ingestor.services;

import com.resolveai.entry.models.Payload;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Service
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final Timer encodeTime;

    // Per-payload-kind and per-failure-reason metrics
    private final ConcurrentMap<Payload.Kind, Counter> encodedPerKind = new ConcurrentHashMap<>();
    private final ConcurrentMap<Payload.Kind, Counter> decodedPerKind = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Counter> failuresPerReason = new ConcurrentHashMap<>();

    private final AtomicLong entriesEncoded = new AtomicLong(0);
    private final AtomicLong entriesDecoded = new AtomicLong(0);
    private final AtomicLong entriesFailed = new AtomicLong(0);

    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.encodeTime = Timer.builder("entries.encode.time")
                .description("Time taken to serialize an entry to its wire form")
                .register(meterRegistry);
    }

    public void recordEncoded(Payload.Kind kind, Duration encodingTime) {
        encodedPerKind.computeIfAbsent(kind, k ->
                Counter.builder("entries.encoded")
                        .description("Entries serialized to the wire format")
                        .tag("payload", k.name())
                        .register(meterRegistry))
                .increment();
        encodeTime.record(encodingTime);
        entriesEncoded.incrementAndGet();
    }

    public void recordDecoded(Payload.Kind kind) {
        decodedPerKind.computeIfAbsent(kind, k ->
                Counter.builder("entries.decoded")
                        .description("Entries rebuilt from API records")
                        .tag("payload", k.name())
                        .register(meterRegistry))
                .increment();
        entriesDecoded.incrementAndGet();
    }

    public void recordFailure(String reason) {
        failuresPerReason.computeIfAbsent(reason, r ->
                Counter.builder("entries.failed")
                        .description("Entries that could not be encoded or decoded")
                        .tag("reason", r)
                        .register(meterRegistry))
                .increment();
        entriesFailed.incrementAndGet();
    }

    public long getEntriesEncoded() {
        return entriesEncoded.get();
    }

    public long getEntriesDecoded() {
        return entriesDecoded.get();
    }

    public long getEntriesFailed() {
        return entriesFailed.get();
    }

    public long getDroppedPayloads() {
        Counter unsupported = encodedPerKind.get(Payload.Kind.UNSUPPORTED);
        return unsupported == null ? 0 : (long) unsupported.count();
    }

    public double getMeanEncodeMillis() {
        return encodeTime.mean(TimeUnit.MILLISECONDS);
    }

    public Map<String, Long> getFailuresByReason() {
        Map<String, Long> failures = new ConcurrentHashMap<>();
        failuresPerReason.forEach((reason, counter) -> failures.put(reason, (long) counter.count()));
        return failures;
    }
}
