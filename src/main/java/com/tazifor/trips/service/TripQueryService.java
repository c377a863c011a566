package com.tazifor.trips.service;

import com.tazifor.trips.cluster.ClusterEngine;
import com.tazifor.trips.cluster.ClusterResult;
import com.tazifor.trips.config.TripInsightProperties;
import com.tazifor.trips.geo.service.GeoClassifier;
import com.tazifor.trips.model.ClusterPoint;
import com.tazifor.trips.model.EnrichedTripRecord;
import com.tazifor.trips.model.FeaturePoint;
import com.tazifor.trips.model.HeatmapCell;
import com.tazifor.trips.model.TripStats;
import com.tazifor.trips.store.TripQuery;
import com.tazifor.trips.store.TripStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.DoubleSummaryStatistics;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Read side of the service: listings, aggregates, heatmap and clustering
 * over the stored trips.
 */
@Slf4j
@Service
public class TripQueryService {

    static final int HEATMAP_MIN_TRIPS = 5;      // cells need strictly more than this
    static final int HEATMAP_MAX_CELLS = 1000;
    static final int HEATMAP_DECIMALS = 3;

    private final TripStore store;
    private final GeoClassifier geoClassifier;
    private final ClusterEngine clusterEngine;
    private final TripInsightProperties.Clustering clustering;

    public TripQueryService(TripStore store,
                            GeoClassifier geoClassifier,
                            ClusterEngine clusterEngine,
                            TripInsightProperties properties) {
        this.store = store;
        this.geoClassifier = geoClassifier;
        this.clusterEngine = clusterEngine;
        this.clustering = properties.getClustering();
    }

    public List<EnrichedTripRecord> findTrips(TripQuery query) {
        return store.find(query);
    }

    // ============================================================
    // CLUSTERING
    // ============================================================

    /**
     * Clusters up to {@code limit} stored pickups from known regions.
     * Both parameters are clamped; a missing or zero value takes the default.
     * Each clustered point is returned with its trip's distance, speed,
     * pickup borough and hour.
     */
    public ClusterResult<ClusterPoint> clusterStoredTrips(Integer k, Integer limit) {
        int kValue = clampK(k);
        int sampleSize = clampSampleSize(limit);

        // keyed by instance: equal feature points from different trips stay distinct
        Map<FeaturePoint, EnrichedTripRecord> sample = new IdentityHashMap<>();
        List<FeaturePoint> points = new ArrayList<>();
        for (EnrichedTripRecord trip : store.findAll()) {
            if (points.size() >= sampleSize) {
                break;
            }
            if (!geoClassifier.isKnownRegion(trip.getPickupRegion())) {
                continue;
            }
            FeaturePoint point = trip.toFeaturePoint();
            if (point.isComplete()) {
                sample.put(point, trip);
                points.add(point);
            }
        }

        log.debug("Clustering {} stored pickups with k={}", points.size(), kValue);
        return clusterEngine.cluster(points, kValue, clustering.getMaxIterations())
            .map(point -> ClusterPoint.of(sample.get(point)));
    }

    /**
     * Clusters caller-supplied points. {@code k} is passed through unclamped so
     * that out-of-range values hit the engine's single-cluster fallback.
     */
    public ClusterResult<FeaturePoint> clusterPoints(List<FeaturePoint> points, int k, Integer maxIterations) {
        int iterations = maxIterations != null ? maxIterations : clustering.getMaxIterations();
        return clusterEngine.cluster(points, k, iterations);
    }

    public int clampK(Integer k) {
        int value = (k == null || k == 0) ? clustering.getDefaultK() : k;
        return Math.max(clustering.getMinK(), Math.min(value, clustering.getMaxK()));
    }

    int clampSampleSize(Integer limit) {
        int value = (limit == null || limit == 0) ? clustering.getDefaultSampleSize() : limit;
        return Math.max(clustering.getMinSampleSize(), Math.min(value, clustering.getMaxSampleSize()));
    }

    // ============================================================
    // AGGREGATES
    // ============================================================

    public TripStats stats() {
        List<EnrichedTripRecord> trips = store.findAll();

        TripStats.Overall overall = new TripStats.Overall(
            trips.size(),
            average(trips, TripQueryService::duration),
            average(trips, EnrichedTripRecord::getDistanceKm),
            average(trips, EnrichedTripRecord::getSpeedKmh),
            trips.stream().map(t -> t.getRaw().getPickupDatetime()).filter(Objects::nonNull)
                .min(Comparator.naturalOrder()).orElse(null),
            trips.stream().map(t -> t.getRaw().getPickupDatetime()).filter(Objects::nonNull)
                .max(Comparator.naturalOrder()).orElse(null));

        Map<String, List<EnrichedTripRecord>> byRegion = trips.stream()
            .filter(t -> geoClassifier.isKnownRegion(t.getPickupRegion()))
            .collect(Collectors.groupingBy(EnrichedTripRecord::getPickupRegion, LinkedHashMap::new, Collectors.toList()));

        List<TripStats.RegionStats> boroughs = byRegion.entrySet().stream()
            .map(e -> new TripStats.RegionStats(
                e.getKey(),
                e.getValue().size(),
                average(e.getValue(), TripQueryService::duration),
                average(e.getValue(), EnrichedTripRecord::getDistanceKm)))
            .sorted(Comparator.comparingLong(TripStats.RegionStats::tripCount).reversed())
            .toList();

        Map<Integer, List<EnrichedTripRecord>> byHour = trips.stream()
            .collect(Collectors.groupingBy(EnrichedTripRecord::getHourOfDay, TreeMap::new, Collectors.toList()));

        List<TripStats.HourlyStats> hourly = byHour.entrySet().stream()
            .map(e -> new TripStats.HourlyStats(
                e.getKey(),
                e.getValue().size(),
                average(e.getValue(), TripQueryService::duration),
                average(e.getValue(), EnrichedTripRecord::getSpeedKmh)))
            .toList();

        return new TripStats(overall, boroughs, hourly);
    }

    /**
     * Pickup density cells, optionally restricted to one hour and/or one pickup region.
     * Only cells with more than {@value #HEATMAP_MIN_TRIPS} trips are returned,
     * densest first, at most {@value #HEATMAP_MAX_CELLS}.
     */
    public List<HeatmapCell> heatmap(Integer hour, String borough) {
        TripQuery filter = TripQuery.builder().hour(hour).borough(borough).build();

        Map<List<Double>, List<EnrichedTripRecord>> cells = new LinkedHashMap<>();
        for (EnrichedTripRecord trip : store.findAll()) {
            if (!filter.matches(trip)) {
                continue;
            }
            Double lat = trip.getRaw().getPickupLatitude();
            Double lon = trip.getRaw().getPickupLongitude();
            if (lat == null || lon == null) {
                continue;
            }
            List<Double> cell = List.of(roundHalfUp(lat), roundHalfUp(lon));
            cells.computeIfAbsent(cell, c -> new ArrayList<>()).add(trip);
        }

        return cells.entrySet().stream()
            .filter(e -> e.getValue().size() > HEATMAP_MIN_TRIPS)
            .map(e -> new HeatmapCell(
                e.getKey().get(0),
                e.getKey().get(1),
                e.getValue().size(),
                average(e.getValue(), TripQueryService::duration),
                average(e.getValue(), EnrichedTripRecord::getSpeedKmh)))
            .sorted(Comparator.comparingLong(HeatmapCell::intensity).reversed())
            .limit(HEATMAP_MAX_CELLS)
            .toList();
    }

    private static double duration(EnrichedTripRecord trip) {
        Integer duration = trip.getRaw().getTripDuration();
        return duration == null ? Double.NaN : duration;
    }

    /**
     * Mean over finite values; {@code null} if there are none.
     */
    private static Double average(List<EnrichedTripRecord> trips, ToDoubleFunction<EnrichedTripRecord> field) {
        DoubleSummaryStatistics stats = trips.stream()
            .mapToDouble(field)
            .filter(Double::isFinite)
            .summaryStatistics();
        return stats.getCount() == 0 ? null : stats.getAverage();
    }

    // half away from zero, as SQL ROUND does
    private static double roundHalfUp(double value) {
        return BigDecimal.valueOf(value).setScale(HEATMAP_DECIMALS, RoundingMode.HALF_UP).doubleValue();
    }
}
