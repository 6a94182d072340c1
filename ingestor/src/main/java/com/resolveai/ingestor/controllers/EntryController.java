package com.resolveai.ingestor.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.resolveai.entry.models.EntryJson;
import com.resolveai.ingestor.models.DecodedEntry;
import com.resolveai.ingestor.models.EntryRequest;
import com.resolveai.ingestor.services.EntryCodecService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api/v1")
public class EntryController {
    private final EntryCodecService entryCodecService;

    public EntryController(EntryCodecService entryCodecService) {
        this.entryCodecService = entryCodecService;
    }

    @GetMapping("/health")
    public ResponseEntity<String> healthCheck() {
        return ResponseEntity.ok("Ingestor is online.\n");
    }

    @PostMapping("/entries")
    public ResponseEntity<EntryJson> encodeEntry(
            @RequestBody EntryRequest request,
            @RequestParam(name = "removeCircular", required = false) Boolean removeCircular) {
        EntryJson json = entryCodecService.encode(request, removeCircular);
        log.info("Entry encoded: {}", json.getInsertId());
        return ResponseEntity.ok(json);
    }

    @PostMapping("/entries/decode")
    public ResponseEntity<DecodedEntry> decodeEntry(@RequestBody JsonNode apiEntry) {
        DecodedEntry decoded = DecodedEntry.from(entryCodecService.decode(apiEntry));
        log.info("Entry decoded: {}", decoded.getMetadata().getInsertId());
        return ResponseEntity.ok(decoded);
    }
}
