package com.resolveai.ingestor.controllers;

import com.resolveai.ingestor.services.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/metrics")
public class MetricsController {

    private final MetricsService metricsService;

    public MetricsController(MetricsService metricsService) {
        this.metricsService = metricsService;
    }

    @GetMapping("/codec")
    public ResponseEntity<Map<String, Object>> getCodecMetrics() {
        Map<String, Object> metrics = new HashMap<>();

        metrics.put("entriesEncoded", metricsService.getEntriesEncoded());
        metrics.put("entriesDecoded", metricsService.getEntriesDecoded());
        metrics.put("entriesFailed", metricsService.getEntriesFailed());
        metrics.put("droppedPayloads", metricsService.getDroppedPayloads());
        metrics.put("meanEncodeMillis", metricsService.getMeanEncodeMillis());
        metrics.put("failuresByReason", metricsService.getFailuresByReason());

        return ResponseEntity.ok(metrics);
    }
}
