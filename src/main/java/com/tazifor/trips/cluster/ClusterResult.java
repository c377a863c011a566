package com.tazifor.trips.cluster;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Result of one clustering run. {@code clusters} never contains an empty group.
 *
 * @param clusters     non-empty point groups
 * @param clusterCount {@code clusters.size()}
 * @param totalPoints  number of input points (equals the sum of group sizes)
 * @param iterations   assign/update rounds executed
 * @param termination  why the run stopped
 * @param <P>          member type: the clustered feature points, or a view derived from them
 */
public record ClusterResult<P>(List<List<P>> clusters,
                               int clusterCount,
                               int totalPoints,
                               int iterations,
                               Termination termination) {

    public enum Termination {
        EMPTY_INPUT,              // no points, nothing to do
        DEGENERATE,               // k outside [1, n]: whole input returned as one cluster
        CONVERGED,                // every centroid moved less than the threshold
        MAX_ITERATIONS_REACHED    // iteration budget exhausted; a normal outcome
    }

    public ClusterResult {
        // members may be null (malformed rows), which List.copyOf rejects
        clusters = clusters.stream()
            .map(cluster -> Collections.unmodifiableList(new ArrayList<>(cluster)))
            .toList();
    }

    public static <P> ClusterResult<P> empty() {
        return new ClusterResult<>(List.of(), 0, 0, 0, Termination.EMPTY_INPUT);
    }

    public static <P> ClusterResult<P> singleCluster(List<P> points) {
        return new ClusterResult<>(List.of(points), 1, points.size(), 0, Termination.DEGENERATE);
    }

    static <P> ClusterResult<P> of(List<List<P>> assignment, int totalPoints,
                                   int iterations, Termination termination) {
        List<List<P>> nonEmpty = assignment.stream()
            .filter(cluster -> !cluster.isEmpty())
            .toList();
        return new ClusterResult<>(nonEmpty, nonEmpty.size(), totalPoints, iterations, termination);
    }

    /**
     * Same grouping and run metadata, every member replaced by {@code mapper(member)}.
     */
    public <R> ClusterResult<R> map(Function<? super P, ? extends R> mapper) {
        List<List<R>> mapped = clusters.stream()
            .map(cluster -> cluster.stream().<R>map(mapper).toList())
            .toList();
        return new ClusterResult<>(mapped, clusterCount, totalPoints, iterations, termination);
    }
}
