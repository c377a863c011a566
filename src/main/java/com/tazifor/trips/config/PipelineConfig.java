package com.tazifor.trips.config;

import com.tazifor.trips.cluster.ClusterEngine;
import com.tazifor.trips.geo.model.BBox;
import com.tazifor.trips.geo.model.RegionBoundary;
import com.tazifor.trips.geo.model.RegionTable;
import com.tazifor.trips.geo.service.GeoClassifier;
import com.tazifor.trips.geo.util.DistanceModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Random;

/**
 * Wires the core pipeline components from {@link TripInsightProperties}.
 *
 * The region table is built once here and shared read-only by every component.
 */
@Slf4j
@Configuration
public class PipelineConfig {

    @Bean
    public RegionTable regionTable(TripInsightProperties properties) {
        TripInsightProperties.Geo geo = properties.getGeo();
        TripInsightProperties.Rect b = geo.getBounds();
        BBox globalBounds = new BBox(b.getMinLat(), b.getMinLon(), b.getMaxLat(), b.getMaxLon());

        List<RegionBoundary> regions = geo.getRegions().stream()
            .map(r -> RegionBoundary.of(r.getName(), r.getMinLat(), r.getMaxLat(), r.getMinLon(), r.getMaxLon()))
            .toList();

        RegionTable table = new RegionTable(globalBounds, regions);
        log.info("Region table loaded: bounds={} priority={}", globalBounds, table.regionNames());
        return table;
    }

    @Bean
    public GeoClassifier geoClassifier(RegionTable regionTable) {
        return new GeoClassifier(regionTable);
    }

    @Bean
    public DistanceModel distanceModel(TripInsightProperties properties) {
        return new DistanceModel(
            properties.getGeo().getEarthRadiusKm(),
            properties.getClustering().getDurationDivisor());
    }

    @Bean
    public ClusterEngine clusterEngine(DistanceModel distanceModel, TripInsightProperties properties) {
        TripInsightProperties.Clustering clustering = properties.getClustering();
        Random random = clustering.getSeed() != null ? new Random(clustering.getSeed()) : new Random();
        return new ClusterEngine(distanceModel, clustering.getConvergenceThreshold(),
            random, clustering.isParallelAssignment());
    }
}
