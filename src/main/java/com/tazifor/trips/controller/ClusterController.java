package com.tazifor.trips.controller;

import com.tazifor.trips.cluster.ClusterResult;
import com.tazifor.trips.model.ClusterPoint;
import com.tazifor.trips.model.FeaturePoint;
import com.tazifor.trips.service.TripQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * ClusterController - spatial-temporal trip clustering
 *
 * ENDPOINTS:
 * - GET  /api/clusters?k=5&limit=10000 - cluster stored pickups
 *        k is clamped to [1, 20], limit to [10, 50000]
 * - POST /api/clusters                 - cluster an explicit list of points
 */
@RestController
@RequestMapping("/api/clusters")
public class ClusterController {

    private final TripQueryService queryService;

    public ClusterController(TripQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping
    public ClusterResult<ClusterPoint> clusterStoredTrips(@RequestParam(required = false) Integer k,
                                            @RequestParam(required = false) Integer limit) {
        return queryService.clusterStoredTrips(k, limit);
    }

    @PostMapping
    public ResponseEntity<?> clusterPoints(@RequestBody ClusterRequest request) {
        if (request.points() == null) {
            return ResponseEntity.badRequest()
                .body(Map.of("error", "VALIDATION_ERROR", "message", "points are required"));
        }
        int k = request.k() != null ? request.k() : queryService.clampK(null);
        return ResponseEntity.ok(queryService.clusterPoints(request.points(), k, request.maxIterations()));
    }

    public record ClusterRequest(List<FeaturePoint> points, Integer k, Integer maxIterations) {
    }
}
