package com.resolveai.entry.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.resolveai.entry.exceptions.CircularReferenceException;
import com.resolveai.entry.exceptions.UnsupportedPayloadException;
import com.resolveai.entry.models.EntryJson;
import com.resolveai.entry.models.EntryTimestamp;
import com.resolveai.entry.models.LogEntry;
import com.resolveai.entry.models.LogEntryMetadata;
import com.resolveai.entry.models.LogSeverity;
import com.resolveai.entry.models.MonitoredResource;
import com.resolveai.entry.models.ToJsonOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EntrySerializerTest {

    private static final long JAN_1_2020 = 1_577_836_800L;

    private ObjectMapper objectMapper;
    private EntrySerializer serializer;

    @BeforeEach
    void setUp() {
        objectMapper = EntryMappers.defaultMapper();
        serializer = new EntrySerializer(objectMapper);
    }

    @Test
    void testMapDataProducesOnlyJsonPayload() {
        // Given
        LogEntry entry = new LogEntry(null, Map.of("a", 1));

        // When
        EntryJson json = serializer.toJson(entry);

        // Then
        assertNotNull(json.getJsonPayload());
        assertNull(json.getTextPayload());
        assertEquals(1, json.getJsonPayload().get("fields").get("a").get("numberValue").asInt());
    }

    @Test
    void testStringDataProducesOnlyTextPayload() {
        EntryJson json = serializer.toJson(new LogEntry(null, "hello"));

        assertEquals("hello", json.getTextPayload());
        assertNull(json.getJsonPayload());
    }

    @Test
    void testNumberDataProducesNeitherPayload() {
        EntryJson json = serializer.toJson(new LogEntry(null, 42));

        assertNull(json.getTextPayload());
        assertNull(json.getJsonPayload());
        assertNotNull(json.getInsertId());
    }

    @Test
    void testMissingDataProducesNeitherPayload() {
        EntryJson json = serializer.toJson(new LogEntry());

        assertNull(json.getTextPayload());
        assertNull(json.getJsonPayload());
    }

    @Test
    void testUnsupportedDataRejectedWhenRequested() {
        // Given
        LogEntry entry = new LogEntry(null, List.of(1, 2, 3));
        ToJsonOptions options = ToJsonOptions.builder().rejectUnsupportedPayload(true).build();

        // When & Then
        UnsupportedPayloadException e = assertThrows(UnsupportedPayloadException.class,
                () -> serializer.toJson(entry, options));
        assertTrue(List.class.isAssignableFrom(e.getPayloadType()));
    }

    @Test
    void testBeanDataProducesJsonPayload() {
        // Given
        LogEntry entry = new LogEntry(null, new Delegate("my_username"));

        // When
        EntryJson json = serializer.toJson(entry);

        // Then
        assertEquals("my_username",
                json.getJsonPayload().get("fields").get("delegate").get("stringValue").asText());
    }

    @Test
    void testCircularPayloadRemovedWhenRequested() {
        // Given
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("self", data);
        LogEntry entry = new LogEntry(null, data);

        // When
        EntryJson json = assertDoesNotThrow(
                () -> serializer.toJson(entry, ToJsonOptions.builder().removeCircular(true).build()));

        // Then
        assertEquals("[Circular]", json.getJsonPayload().get("fields").get("self").get("stringValue").asText());
    }

    @Test
    void testCircularPayloadFailsByDefault() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("self", data);

        assertThrows(CircularReferenceException.class, () -> serializer.toJson(new LogEntry(null, data)));
    }

    @Test
    void testSelfReferencingBeanPayloadRemovedWhenRequested() {
        // Given
        Chain chain = new Chain("head");
        chain.setNext(chain);
        LogEntry entry = new LogEntry(null, chain);

        // When
        EntryJson json = assertDoesNotThrow(
                () -> serializer.toJson(entry, ToJsonOptions.builder().removeCircular(true).build()));

        // Then
        JsonNode fields = json.getJsonPayload().get("fields");
        assertEquals("head", fields.get("label").get("stringValue").asText());
        assertEquals("[Circular]", fields.get("next").get("stringValue").asText());
    }

    @Test
    void testSelfReferencingBeanPayloadFailsByDefault() {
        Chain chain = new Chain("head");
        chain.setNext(chain);

        assertThrows(CircularReferenceException.class, () -> serializer.toJson(new LogEntry(null, chain)));
    }

    @Test
    void testPayloadNamedMetadataKeysAreNotWritten() throws Exception {
        // Given
        LogEntryMetadata metadata = LogEntryMetadata.builder().insertId("abc").build();
        metadata.getAdditionalFields().put("textPayload", "old");
        metadata.getAdditionalFields().put("jsonPayload", Map.of("stale", true));

        // When
        EntryJson json = serializer.toJson(new LogEntry(metadata, "new"));
        String wire = objectMapper.writeValueAsString(json);

        // Then
        assertNull(json.getField("textPayload"));
        assertNull(json.getField("jsonPayload"));
        assertEquals(wire.indexOf("\"textPayload\""), wire.lastIndexOf("\"textPayload\""));
        assertFalse(wire.contains("\"jsonPayload\""));
        assertEquals("new", objectMapper.readTree(wire).get("textPayload").asText());
    }

    @Test
    void testProtoPayloadInMetadataIsTheOnlyPayloadWritten() throws Exception {
        // Given
        Map<String, Object> proto = Map.of("@type", "type.googleapis.com/google.cloud.audit.AuditLog");
        LogEntryMetadata metadata = LogEntryMetadata.builder().build();
        metadata.getAdditionalFields().put("protoPayload", proto);

        // When
        EntryJson json = serializer.toJson(new LogEntry(metadata, proto));
        JsonNode wire = objectMapper.readTree(objectMapper.writeValueAsString(json));

        // Then
        assertEquals("type.googleapis.com/google.cloud.audit.AuditLog",
                wire.get("protoPayload").get("@type").asText());
        assertFalse(wire.has("jsonPayload"));
        assertFalse(wire.has("textPayload"));
    }

    @Test
    void testWallClockTimestampIsNormalized() {
        // Given
        LogEntryMetadata metadata = LogEntryMetadata.builder()
                .timestamp(EntryTimestamp.ofEpochMilli(JAN_1_2020 * 1000 + 1500))
                .build();

        // When
        EntryJson json = serializer.toJson(new LogEntry(metadata, "x"));

        // Then
        assertEquals(JAN_1_2020 + 1, json.getTimestamp().getSeconds());
        assertEquals(500_000_000, json.getTimestamp().getNanos());
    }

    @Test
    void testRfc3339TimestampIsNormalized() {
        LogEntryMetadata metadata = LogEntryMetadata.builder()
                .timestamp(EntryTimestamp.of("2020-01-01T00:00:00.123456789Z"))
                .build();

        EntryJson json = serializer.toJson(new LogEntry(metadata, "x"));

        assertEquals(JAN_1_2020, json.getTimestamp().getSeconds());
        assertEquals(123_456_789, json.getTimestamp().getNanos());
    }

    @Test
    void testMetadataIsCopiedToWireRecord() throws Exception {
        // Given
        LogEntryMetadata metadata = LogEntryMetadata.builder()
                .logName("projects/demo/logs/syslog")
                .severity(LogSeverity.ERROR)
                .insertId("abc")
                .resource(MonitoredResource.builder()
                        .type("gce_instance")
                        .labels(Map.of("zone", "global", "instance_id", "3"))
                        .build())
                .labels(Map.of("env", "test"))
                .build();
        metadata.getAdditionalFields().put("httpRequest", Map.of("status", 200));

        // When
        EntryJson json = serializer.toJson(new LogEntry(metadata, "x"));
        JsonNode wire = objectMapper.readTree(objectMapper.writeValueAsString(json));

        // Then
        assertEquals("abc", wire.get("insertId").asText());
        assertEquals("ERROR", wire.get("severity").asText());
        assertEquals("projects/demo/logs/syslog", wire.get("logName").asText());
        assertEquals("gce_instance", wire.get("resource").get("type").asText());
        assertEquals("3", wire.get("resource").get("labels").get("instance_id").asText());
        assertEquals("test", wire.get("labels").get("env").asText());
        assertEquals(200, wire.get("httpRequest").get("status").asInt());
        assertTrue(wire.get("timestamp").has("seconds"));
        assertTrue(wire.get("timestamp").has("nanos"));
        assertEquals("x", wire.get("textPayload").asText());
        assertFalse(wire.has("jsonPayload"));
    }

    @Test
    void testSerializationDoesNotChangeEntry() {
        // Given
        LogEntry entry = new LogEntry(LogEntryMetadata.builder()
                .timestamp(EntryTimestamp.of("2020-01-01T00:00:00Z"))
                .build(), "x");

        // When
        serializer.toJson(entry);

        // Then
        assertEquals(EntryTimestamp.of("2020-01-01T00:00:00Z"), entry.getMetadata().getTimestamp());
    }

    static class Chain {
        private final String label;
        private Chain next;

        Chain(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }

        public Chain getNext() {
            return next;
        }

        public void setNext(Chain next) {
            this.next = next;
        }
    }

    public static class Delegate {
        private final String delegate;

        Delegate(String delegate) {
            this.delegate = delegate;
        }

        public String getDelegate() {
            return delegate;
        }
    }
}
