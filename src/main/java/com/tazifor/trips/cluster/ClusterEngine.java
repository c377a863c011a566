package com.tazifor.trips.cluster;

import com.tazifor.trips.geo.util.DistanceModel;
import com.tazifor.trips.model.FeatureDistance;
import com.tazifor.trips.model.FeaturePoint;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * K-means over (lat, lon, duration) feature points.
 *
 * <h3>Run</h3>
 * <ol>
 *   <li><b>Init</b>: no points gives an empty result. A {@code k} outside
 *       {@code [1, n]} returns the whole input as one cluster. Otherwise
 *       {@code k} distinct input points, drawn uniformly without replacement,
 *       become the initial centroids.</li>
 *   <li><b>Assign</b>: each point joins the centroid with the smallest
 *       {@link DistanceModel#featureDistance feature distance}. Ties go to the
 *       lowest centroid index. A point with no comparable distance (malformed
 *       point or centroid) lands in cluster 0.</li>
 *   <li><b>Update</b>: each centroid becomes the mean of its complete members.
 *       A cluster without complete members is reseeded with a random input point.</li>
 *   <li><b>Converge</b>: stop when every centroid moved less than the threshold,
 *       otherwise loop until {@code maxIterations}.</li>
 * </ol>
 * Empty clusters are kept during iteration and dropped from the result.
 *
 * <p>All run state is local; an engine instance can serve concurrent runs.
 * The {@link Random} is shared, so runs are reproducible only when they are
 * serialized on a seeded instance.</p>
 */
@Slf4j
public class ClusterEngine {

    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final double DEFAULT_CONVERGENCE_THRESHOLD = 0.001;

    private final DistanceModel distanceModel;
    private final double convergenceThreshold;
    private final Random random;
    private final boolean parallelAssignment;

    public ClusterEngine(DistanceModel distanceModel, Random random) {
        this(distanceModel, DEFAULT_CONVERGENCE_THRESHOLD, random, false);
    }

    public ClusterEngine(DistanceModel distanceModel, double convergenceThreshold,
                         Random random, boolean parallelAssignment) {
        this.distanceModel = distanceModel;
        this.convergenceThreshold = convergenceThreshold;
        this.random = random;
        this.parallelAssignment = parallelAssignment;
    }

    public ClusterResult<FeaturePoint> cluster(List<FeaturePoint> points, int k) {
        return cluster(points, k, DEFAULT_MAX_ITERATIONS);
    }

    /**
     * @param maxIterations iteration budget; values below 1 are treated as 1 so
     *                      that every point still receives an assignment
     */
    public ClusterResult<FeaturePoint> cluster(List<FeaturePoint> points, int k, int maxIterations) {
        if (points == null || points.isEmpty()) {
            return ClusterResult.empty();
        }
        int n = points.size();
        if (k <= 0 || k > n) {
            log.debug("Degenerate cluster request k={} for {} points, returning a single cluster", k, n);
            return ClusterResult.singleCluster(points);
        }

        int budget = Math.max(1, maxIterations);
        List<FeaturePoint> centroids = initialCentroids(points, k);
        List<List<FeaturePoint>> clusters = List.of();
        ClusterResult.Termination termination = ClusterResult.Termination.MAX_ITERATIONS_REACHED;
        int iterations = 0;

        while (iterations < budget) {
            iterations++;
            clusters = assign(points, centroids);
            List<FeaturePoint> updated = update(points, clusters);

            if (converged(centroids, updated)) {
                termination = ClusterResult.Termination.CONVERGED;
                break;
            }
            centroids = updated;
        }

        ClusterResult<FeaturePoint> result = ClusterResult.of(clusters, n, iterations, termination);
        log.debug("Clustered {} points into {} groups (k={}) after {} iterations: {}",
            n, result.clusterCount(), k, iterations, termination);
        return result;
    }

    /**
     * k distinct indices by a partial Fisher-Yates shuffle.
     */
    private List<FeaturePoint> initialCentroids(List<FeaturePoint> points, int k) {
        int[] indices = IntStream.range(0, points.size()).toArray();
        List<FeaturePoint> centroids = new ArrayList<>(k);
        for (int i = 0; i < k; i++) {
            int j = i + random.nextInt(indices.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            centroids.add(points.get(indices[i]));
        }
        return centroids;
    }

    List<List<FeaturePoint>> assign(List<FeaturePoint> points, List<FeaturePoint> centroids) {
        IntStream range = IntStream.range(0, points.size());
        if (parallelAssignment) {
            range = range.parallel();
        }
        int[] nearest = range.map(i -> nearestCentroid(points.get(i), centroids)).toArray();

        List<List<FeaturePoint>> clusters = new ArrayList<>(centroids.size());
        for (int c = 0; c < centroids.size(); c++) {
            clusters.add(new ArrayList<>());
        }
        for (int i = 0; i < nearest.length; i++) {
            clusters.get(nearest[i]).add(points.get(i));
        }
        return clusters;
    }

    int nearestCentroid(FeaturePoint point, List<FeaturePoint> centroids) {
        int best = 0;
        FeatureDistance bestDistance = distanceModel.featureDistance(point, centroids.get(0));
        for (int c = 1; c < centroids.size(); c++) {
            FeatureDistance d = distanceModel.featureDistance(point, centroids.get(c));
            // strict: ties keep the earlier index
            if (d.compareTo(bestDistance) < 0) {
                best = c;
                bestDistance = d;
            }
        }
        return best;
    }

    private List<FeaturePoint> update(List<FeaturePoint> points, List<List<FeaturePoint>> clusters) {
        List<FeaturePoint> updated = new ArrayList<>(clusters.size());
        for (List<FeaturePoint> cluster : clusters) {
            FeaturePoint mean = mean(cluster);
            if (mean == null) {
                mean = points.get(random.nextInt(points.size()));
            }
            updated.add(mean);
        }
        return updated;
    }

    /**
     * Mean of the complete members, or {@code null} if there are none.
     */
    private static FeaturePoint mean(List<FeaturePoint> cluster) {
        double lat = 0;
        double lon = 0;
        double duration = 0;
        int count = 0;
        for (FeaturePoint p : cluster) {
            if (p == null || !p.isComplete()) {
                continue;
            }
            lat += p.lat();
            lon += p.lon();
            duration += p.duration();
            count++;
        }
        if (count == 0) {
            return null;
        }
        return FeaturePoint.of(lat / count, lon / count, duration / count);
    }

    private boolean converged(List<FeaturePoint> previous, List<FeaturePoint> updated) {
        for (int c = 0; c < previous.size(); c++) {
            if (!distanceModel.featureDistance(previous.get(c), updated.get(c)).isBelow(convergenceThreshold)) {
                return false;
            }
        }
        return true;
    }
}
