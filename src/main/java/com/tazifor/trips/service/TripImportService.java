package com.tazifor.trips.service;

import com.tazifor.trips.config.TripInsightProperties;
import com.tazifor.trips.exception.TripImportException;
import com.tazifor.trips.ingest.TripCsvReader;
import com.tazifor.trips.model.EnrichedTripRecord;
import com.tazifor.trips.model.ImportReport;
import com.tazifor.trips.model.RawTripRecord;
import com.tazifor.trips.store.TripStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * TripImportService - bulk CSV load
 *
 * FLOW (per row):
 * read → validate → enrich → buffer → flush to the store every batch-size rows
 *
 * Invalid rows are counted and dropped; they never abort the import.
 * The report makes the retention rate visible: processed vs valid vs invalid,
 * plus how many valid rows were new to the store.
 */
@Slf4j
@Service
public class TripImportService {

    private final TripCsvReader csvReader;
    private final TripEnricher enricher;
    private final TripStore store;
    private final TripInsightProperties.Import settings;

    public TripImportService(TripCsvReader csvReader,
                             TripEnricher enricher,
                             TripStore store,
                             TripInsightProperties properties) {
        this.csvReader = csvReader;
        this.enricher = enricher;
        this.store = store;
        this.settings = properties.getImporter();
    }

    public ImportReport importFile(Path csv) {
        log.info("Starting trip import from {}", csv);
        try (Reader reader = Files.newBufferedReader(csv, StandardCharsets.UTF_8)) {
            return importCsv(reader);
        } catch (IOException e) {
            throw new TripImportException("Failed to read " + csv, e);
        }
    }

    public ImportReport importCsv(Reader reader) {
        Progress progress = new Progress(Math.max(1, settings.getBatchSize()), Math.max(1, settings.getProgressInterval()));
        try {
            csvReader.read(reader, progress::accept);
        } catch (IOException e) {
            throw new TripImportException("Failed to parse trip CSV after " + progress.processed + " rows", e);
        }
        progress.flush();

        ImportReport report = new ImportReport(progress.processed, progress.valid, progress.invalid,
            progress.stored, progress.batches);
        log.info("Import completed: processed={} valid={} invalid={} stored={} store={}",
            report.processed(), report.valid(), report.invalid(), report.stored(), store.name());
        return report;
    }

    /**
     * Import state for one run.
     */
    private final class Progress {
        private final int batchSize;
        private final int progressInterval;
        private final List<EnrichedTripRecord> batch = new ArrayList<>();

        private long processed;
        private long valid;
        private long invalid;
        private long stored;
        private int batches;

        private Progress(int batchSize, int progressInterval) {
            this.batchSize = batchSize;
            this.progressInterval = progressInterval;
        }

        void accept(RawTripRecord record) {
            processed++;
            if (processed % progressInterval == 0) {
                log.info("Processed {} records...", processed);
            }

            EnrichedTripRecord enriched = enricher.tryEnrich(record);
            if (enriched == null) {
                invalid++;
                return;
            }
            valid++;
            batch.add(enriched);
            if (batch.size() >= batchSize) {
                flush();
            }
        }

        void flush() {
            if (batch.isEmpty()) {
                return;
            }
            stored += store.saveAll(List.copyOf(batch));
            batches++;
            batch.clear();
        }
    }
}
