package com.resolveai.ingestor.controllers;

import com.resolveai.ingestor.config.EntryCodecConfig;
import com.resolveai.ingestor.services.EntryCodecServiceImpl;
import com.resolveai.ingestor.services.MetricsService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(EntryController.class)
@ContextConfiguration(classes = {
        EntryController.class,
        MetricsController.class,
        CodecExceptionHandler.class,
        EntryCodecServiceImpl.class,
        MetricsService.class,
        EntryCodecConfig.class,
        EntryControllerTest.TestConfig.class})
class EntryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @TestConfiguration
    static class TestConfig {
        @Bean
        public MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Test
    void testHealthCheck() throws Exception {
        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("Ingestor is online.\n"));
    }

    @Test
    void testEncodeTextEntry() throws Exception {
        String request = "{"
                + "\"metadata\":{\"insertId\":\"x\",\"severity\":\"INFO\","
                + "\"timestamp\":\"2020-01-01T00:00:00.123456789Z\","
                + "\"resource\":{\"type\":\"gce_instance\",\"labels\":{\"zone\":\"global\"}}},"
                + "\"data\":\"hello\""
                + "}";

        mockMvc.perform(post("/api/v1/entries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(request))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.insertId").value("x"))
                .andExpect(jsonPath("$.severity").value("INFO"))
                .andExpect(jsonPath("$.resource.type").value("gce_instance"))
                .andExpect(jsonPath("$.timestamp.seconds").value(1577836800))
                .andExpect(jsonPath("$.timestamp.nanos").value(123456789))
                .andExpect(jsonPath("$.textPayload").value("hello"))
                .andExpect(jsonPath("$.jsonPayload").doesNotExist());
    }

    @Test
    void testEncodeStructuredEntry() throws Exception {
        mockMvc.perform(post("/api/v1/entries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"data\":{\"delegate\":\"my_username\",\"attempt\":2}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.insertId", not(emptyString())))
                .andExpect(jsonPath("$.jsonPayload.fields.delegate.stringValue").value("my_username"))
                .andExpect(jsonPath("$.jsonPayload.fields.attempt.numberValue").value(2))
                .andExpect(jsonPath("$.textPayload").doesNotExist());
    }

    @Test
    void testEncodeNumberEntryHasNoPayload() throws Exception {
        mockMvc.perform(post("/api/v1/entries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"data\":42}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.textPayload").doesNotExist())
                .andExpect(jsonPath("$.jsonPayload").doesNotExist());

        mockMvc.perform(get("/api/v1/metrics/codec"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.droppedPayloads").value(greaterThanOrEqualTo(1)));
    }

    @Test
    void testDecodeEntry() throws Exception {
        String record = "{"
                + "\"insertId\":\"abc\","
                + "\"payload\":\"jsonPayload\","
                + "\"jsonPayload\":{\"fields\":{\"user\":{\"stringValue\":\"alice\"}}},"
                + "\"timestamp\":{\"seconds\":\"1577836800\",\"nanos\":500000000}"
                + "}";

        mockMvc.perform(post("/api/v1/entries/decode")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(record))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metadata.insertId").value("abc"))
                .andExpect(jsonPath("$.metadata.timestamp").value("2020-01-01T00:00:00.500Z"))
                .andExpect(jsonPath("$.data.user").value("alice"))
                .andExpect(jsonPath("$.payloadKind").value("STRUCTURED"));
    }

    @Test
    void testDecodeEntryWithUnknownSeverity() throws Exception {
        String record = "{"
                + "\"insertId\":\"abc\","
                + "\"severity\":\"VERBOSE\","
                + "\"payload\":\"textPayload\","
                + "\"textPayload\":\"hi\""
                + "}";

        mockMvc.perform(post("/api/v1/entries/decode")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(record))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metadata.severity").value("DEFAULT"))
                .andExpect(jsonPath("$.data").value("hi"));
    }

    @Test
    void testDecodeRejectsNonObject() throws Exception {
        mockMvc.perform(post("/api/v1/entries/decode")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[1, 2, 3]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_RECORD"));
    }

    @Test
    void testCodecMetrics() throws Exception {
        mockMvc.perform(get("/api/v1/metrics/codec"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entriesEncoded").exists())
                .andExpect(jsonPath("$.entriesDecoded").exists())
                .andExpect(jsonPath("$.failuresByReason").exists());
    }
}
