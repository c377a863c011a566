package com.tazifor.trips.controller;

import com.tazifor.trips.model.EnrichedTripRecord;
import com.tazifor.trips.model.HeatmapCell;
import com.tazifor.trips.model.ImportReport;
import com.tazifor.trips.model.RawTripRecord;
import com.tazifor.trips.model.TripStats;
import com.tazifor.trips.model.TripType;
import com.tazifor.trips.service.TripEnricher;
import com.tazifor.trips.service.TripImportService;
import com.tazifor.trips.service.TripQueryService;
import com.tazifor.trips.store.TripQuery;
import com.tazifor.trips.exception.TripImportException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * TripController - ingestion and read endpoints
 *
 * ENDPOINTS:
 * - GET  /api/trips           - filtered listing, newest pickup first
 * - GET  /api/stats           - overall, per-borough and hourly aggregates
 * - GET  /api/heatmap         - pickup density cells
 * - POST /api/trips/import    - bulk CSV import (multipart "file" or server-side "path")
 * - POST /api/trips/validate  - run validation on one record
 * - POST /api/trips/enrich    - validate and enrich one record
 */
@RestController
@RequestMapping("/api")
public class TripController {

    private final TripEnricher enricher;
    private final TripImportService importService;
    private final TripQueryService queryService;

    public TripController(TripEnricher enricher,
                          TripImportService importService,
                          TripQueryService queryService) {
        this.enricher = enricher;
        this.importService = importService;
        this.queryService = queryService;
    }

    @GetMapping("/trips")
    public List<EnrichedTripRecord> listTrips(
        @RequestParam(defaultValue = "1000") int limit,
        @RequestParam(defaultValue = "0") int offset,
        @RequestParam(required = false) String borough,
        @RequestParam(required = false) Integer hour,
        @RequestParam(required = false) Integer minDuration,
        @RequestParam(required = false) Integer maxDuration,
        @RequestParam(required = false) TripType tripType) {

        TripQuery query = TripQuery.builder()
            .limit(limit)
            .offset(offset)
            .borough(borough)
            .hour(hour)
            .minDuration(minDuration)
            .maxDuration(maxDuration)
            .tripType(tripType)
            .build();
        return queryService.findTrips(query);
    }

    @GetMapping("/stats")
    public TripStats stats() {
        return queryService.stats();
    }

    @GetMapping("/heatmap")
    public List<HeatmapCell> heatmap(@RequestParam(required = false) Integer hour,
                                     @RequestParam(required = false) String borough) {
        return queryService.heatmap(hour, borough);
    }

    @PostMapping("/trips/import")
    public ResponseEntity<?> importTrips(@RequestParam(required = false) MultipartFile file,
                                         @RequestParam(required = false) String path) {
        if (file != null && !file.isEmpty()) {
            try (Reader reader = new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8)) {
                ImportReport report = importService.importCsv(reader);
                return ResponseEntity.ok(report);
            } catch (IOException e) {
                throw new TripImportException("Failed to read uploaded file " + file.getOriginalFilename(), e);
            }
        }
        if (path != null && !path.isBlank()) {
            return ResponseEntity.ok(importService.importFile(Path.of(path)));
        }
        return ResponseEntity.badRequest()
            .body(Map.of("error", "VALIDATION_ERROR", "message", "Either a 'file' upload or a 'path' is required"));
    }

    @PostMapping("/trips/validate")
    public Map<String, Object> validate(@RequestBody RawTripRecord record) {
        return Map.of("valid", enricher.validate(record));
    }

    @PostMapping("/trips/enrich")
    public ResponseEntity<?> enrich(@RequestBody RawTripRecord record) {
        if (!enricher.validate(record)) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(Map.of("error", "VALIDATION_FAILED", "message", "Trip record failed validation"));
        }
        return ResponseEntity.ok(enricher.enrich(record));
    }
}
