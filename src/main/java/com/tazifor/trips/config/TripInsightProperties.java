package com.tazifor.trips.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Pipeline parameters (application.yml, prefix {@code trips}).
 *
 * Java defaults describe New York City and the thresholds used for the
 * NYC taxi trip-duration dataset; yml values override them.
 */
@Getter @Setter
@Configuration
@ConfigurationProperties(prefix = "trips")
public class TripInsightProperties {

    private Geo geo = new Geo();
    private Validation validation = new Validation();
    private Clustering clustering = new Clustering();
    private Import importer = new Import();

    // memory | aerospike
    private String store = "memory";

    @Getter @Setter
    public static class Geo {
        private Rect bounds = new Rect(40.4774, 40.9176, -74.2591, -73.7004);

        // priority order: the first matching region wins
        private List<Region> regions = new ArrayList<>(List.of(
            new Region("Manhattan",     40.7000, 40.8000, -74.0500, -73.9000),
            new Region("Brooklyn",      40.5700, 40.7400, -74.0500, -73.8000),
            new Region("Queens",        40.5400, 40.8000, -74.0000, -73.7000),
            new Region("Bronx",         40.7800, 40.9200, -73.9500, -73.7500),
            new Region("Staten Island", 40.5000, 40.6500, -74.3000, -74.0000)
        ));

        private double earthRadiusKm = 6371.0;
    }

    @Getter @Setter
    public static class Rect {
        private double minLat;
        private double maxLat;
        private double minLon;
        private double maxLon;

        public Rect() {
        }

        public Rect(double minLat, double maxLat, double minLon, double maxLon) {
            this.minLat = minLat;
            this.maxLat = maxLat;
            this.minLon = minLon;
            this.maxLon = maxLon;
        }
    }

    @Getter @Setter
    public static class Region extends Rect {
        private String name;

        public Region() {
        }

        public Region(String name, double minLat, double maxLat, double minLon, double maxLon) {
            super(minLat, maxLat, minLon, maxLon);
            this.name = name;
        }
    }

    @Getter @Setter
    public static class Validation {
        private int minDurationSeconds = 30;
        private int maxDurationSeconds = 10_800;   // 3 hours
        private int minPassengers = 1;
        private int maxPassengers = 6;
        private double minDistanceKm = 0.1;
        private double maxDistanceKm = 100.0;
    }

    @Getter @Setter
    public static class Clustering {
        private double durationDivisor = 1000.0;
        private double convergenceThreshold = 0.001;
        private int maxIterations = 100;

        private int defaultK = 5;
        private int minK = 1;
        private int maxK = 20;

        private int defaultSampleSize = 10_000;
        private int minSampleSize = 10;
        private int maxSampleSize = 50_000;

        private boolean parallelAssignment = false;

        // fixed seed for reproducible runs; null means unseeded
        private Long seed;
    }

    @Getter @Setter
    public static class Import {
        private int batchSize = 500;
        private int progressInterval = 5_000;
    }
}
