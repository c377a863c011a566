package com.tazifor.trips;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Trip Insight Engine - taxi trip enrichment and clustering
 *
 * - Validates raw trip records against a geofence and sanity thresholds
 * - Enriches them with distance, speed, time buckets and borough labels
 * - Clusters pickups by location and duration with a custom K-means
 *
 * Built with Spring Boot; trips live in memory or in Aerospike.
 */
@SpringBootApplication
public class TripInsightApplication {

    public static void main(String[] args) {
        printBanner();
        SpringApplication.run(TripInsightApplication.class, args);
    }

    private static void printBanner() {
        System.out.println("""
            ╔════════════════════════════════════════════════════════╗
            ║                                                        ║
            ║                 TRIP INSIGHT ENGINE                    ║
            ║         Trip Enrichment & Pattern Clustering           ║
            ║                                                        ║
            ╚════════════════════════════════════════════════════════╝

            🗺  Borough geofencing
            📏 Haversine distance & speed
            🧭 Spatial-temporal K-means

            Starting Trip Insight Engine...
            """);
    }
}
