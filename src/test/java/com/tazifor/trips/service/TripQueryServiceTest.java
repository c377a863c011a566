package com.tazifor.trips.service;

import com.tazifor.trips.TestFixtures;
import com.tazifor.trips.cluster.ClusterEngine;
import com.tazifor.trips.cluster.ClusterResult;
import com.tazifor.trips.config.TripInsightProperties;
import com.tazifor.trips.model.ClusterPoint;
import com.tazifor.trips.model.EnrichedTripRecord;
import com.tazifor.trips.model.FeaturePoint;
import com.tazifor.trips.model.HeatmapCell;
import com.tazifor.trips.model.TripStats;
import com.tazifor.trips.store.InMemoryTripStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TripQueryServiceTest {

    private final TripEnricher enricher = TestFixtures.enricher();

    @Mock
    private ClusterEngine clusterEngine;

    private InMemoryTripStore store;
    private TripQueryService queryService;

    @BeforeEach
    void setUp() {
        store = new InMemoryTripStore();
        queryService = new TripQueryService(store, TestFixtures.nycClassifier(), clusterEngine, new TripInsightProperties());
    }

    private EnrichedTripRecord trip(String id, int hour, int duration, double lat, double lon) {
        return enricher.enrich(TestFixtures.validTrip()
            .id(id)
            .pickupDatetime(LocalDateTime.of(2016, 3, 11, hour, 0))
            .tripDuration(duration)
            .pickupLatitude(lat)
            .pickupLongitude(lon)
            .build());
    }

    @Nested
    class Clamping {

        @ParameterizedTest
        @CsvSource({",5", "0,5", "7,7", "1,1", "20,20", "21,20", "-3,1"})
        void clampsK(Integer requested, int expected) {
            assertThat(queryService.clampK(requested)).isEqualTo(expected);
        }

        @ParameterizedTest
        @CsvSource({",10000", "0,10000", "5,10", "10,10", "2500,2500", "50000,50000", "100000,50000"})
        void clampsSampleSize(Integer requested, int expected) {
            assertThat(queryService.clampSampleSize(requested)).isEqualTo(expected);
        }
    }

    @Nested
    class StoredClustering {

        @Test
        void samplesKnownRegionPickupsWithClampedParameters() {
            store.saveAll(List.of(
                trip("a", 9, 600, 40.7580, -73.9855),
                trip("unknown", 9, 600, 40.8800, -74.2000),
                trip("b", 10, 900, 40.6500, -73.9500)));
            when(clusterEngine.cluster(anyList(), anyInt(), anyInt())).thenReturn(ClusterResult.empty());

            queryService.clusterStoredTrips(99, null);

            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<FeaturePoint>> points = ArgumentCaptor.forClass(List.class);
            verify(clusterEngine).cluster(points.capture(), eq(20), eq(100));
            assertThat(points.getValue()).containsExactly(
                FeaturePoint.of(40.7580, -73.9855, 600),
                FeaturePoint.of(40.6500, -73.9500, 900));
        }

        @Test
        void sampleIsCappedAtTheLimit() {
            List<EnrichedTripRecord> trips = new ArrayList<>();
            for (int i = 0; i < 15; i++) {
                trips.add(trip("t" + i, 9, 600 + i, 40.7580, -73.9855));
            }
            store.saveAll(trips);
            when(clusterEngine.cluster(anyList(), anyInt(), anyInt())).thenReturn(ClusterResult.empty());

            queryService.clusterStoredTrips(null, 12);

            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<FeaturePoint>> points = ArgumentCaptor.forClass(List.class);
            verify(clusterEngine).cluster(points.capture(), eq(5), eq(100));
            assertThat(points.getValue()).hasSize(12);
        }

        @Test
        void clusteredPointsCarryTheirTripAttributes() {
            EnrichedTripRecord midtown = trip("a", 9, 600, 40.7580, -73.9855);
            EnrichedTripRecord twin = trip("b", 17, 600, 40.7580, -73.9855);
            store.saveAll(List.of(midtown, twin));
            when(clusterEngine.cluster(anyList(), anyInt(), anyInt()))
                .thenAnswer(invocation -> ClusterResult.singleCluster(invocation.getArgument(0)));

            ClusterResult<ClusterPoint> result = queryService.clusterStoredTrips(1, null);

            // identical feature points still map back to their own trips
            assertThat(result.clusters()).singleElement().satisfies(cluster -> assertThat(cluster)
                .extracting(ClusterPoint::hourOfDay, ClusterPoint::pickupBorough, ClusterPoint::duration)
                .containsExactly(tuple(9, "Manhattan", 600), tuple(17, "Manhattan", 600)));
            assertThat(result.clusters().get(0).get(0).distanceKm()).isEqualTo(midtown.getDistanceKm());
            assertThat(result.clusters().get(0).get(0).speedKmh()).isEqualTo(midtown.getSpeedKmh());
            assertThat(result.clusters().get(0).get(0).lat()).isEqualTo(40.7580);
            assertThat(result.totalPoints()).isEqualTo(2);
        }

        @Test
        void explicitPointsKeepTheRequestedK() {
            List<FeaturePoint> input = List.of(FeaturePoint.of(40.75, -73.98, 600));
            when(clusterEngine.cluster(input, 42, 7)).thenReturn(ClusterResult.singleCluster(input));

            ClusterResult<FeaturePoint> result = queryService.clusterPoints(input, 42, 7);

            assertThat(result.termination()).isEqualTo(ClusterResult.Termination.DEGENERATE);
        }
    }

    @Nested
    class Aggregates {

        @Test
        void statsOrderBoroughsByCountAndHoursAscending() {
            store.saveAll(List.of(
                trip("b1", 18, 900, 40.6500, -73.9500),
                trip("m1", 9, 600, 40.7580, -73.9855),
                trip("m2", 18, 1200, 40.7600, -73.9800),
                trip("u1", 9, 300, 40.8800, -74.2000)));

            TripStats stats = queryService.stats();

            assertThat(stats.overall().totalTrips()).isEqualTo(4);
            assertThat(stats.overall().avgDuration()).isEqualTo(750.0);
            assertThat(stats.overall().earliestTrip()).isEqualTo(LocalDateTime.of(2016, 3, 11, 9, 0));
            assertThat(stats.overall().latestTrip()).isEqualTo(LocalDateTime.of(2016, 3, 11, 18, 0));

            assertThat(stats.boroughs())
                .extracting(TripStats.RegionStats::pickupBorough, TripStats.RegionStats::tripCount)
                .containsExactly(
                    tuple("Manhattan", 2L),
                    tuple("Brooklyn", 1L));
            assertThat(stats.boroughs().get(0).avgDuration()).isEqualTo(900.0);

            assertThat(stats.hourly())
                .extracting(TripStats.HourlyStats::hourOfDay, TripStats.HourlyStats::tripCount)
                .containsExactly(
                    tuple(9, 2L),
                    tuple(18, 2L));
        }

        @Test
        void statsOnEmptyStoreHaveNoAverages() {
            TripStats stats = queryService.stats();

            assertThat(stats.overall().totalTrips()).isZero();
            assertThat(stats.overall().avgDuration()).isNull();
            assertThat(stats.overall().earliestTrip()).isNull();
            assertThat(stats.boroughs()).isEmpty();
            assertThat(stats.hourly()).isEmpty();
        }

        @Test
        void heatmapKeepsOnlyDenseCells() {
            List<EnrichedTripRecord> trips = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                trips.add(trip("dense" + i, 8, 600, 40.7581, -73.9851));
            }
            for (int i = 0; i < 5; i++) {
                trips.add(trip("sparse" + i, 8, 600, 40.7001, -73.9501));
            }
            store.saveAll(trips);

            List<HeatmapCell> cells = queryService.heatmap(null, null);

            assertThat(cells).singleElement().satisfies(cell -> {
                assertThat(cell.lat()).isEqualTo(40.758);
                assertThat(cell.lon()).isEqualTo(-73.985);
                assertThat(cell.intensity()).isEqualTo(6);
                assertThat(cell.avgDuration()).isEqualTo(600.0);
            });
        }

        @Test
        void heatmapFiltersByHourAndBorough() {
            List<EnrichedTripRecord> trips = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                trips.add(trip("morning" + i, 8, 600, 40.7581, -73.9851));
                trips.add(trip("evening" + i, 19, 600, 40.7581, -73.9851));
            }
            store.saveAll(trips);

            assertThat(queryService.heatmap(8, null)).singleElement()
                .extracting(HeatmapCell::intensity).isEqualTo(6L);
            assertThat(queryService.heatmap(null, "Manhattan")).singleElement()
                .extracting(HeatmapCell::intensity).isEqualTo(12L);
            assertThat(queryService.heatmap(null, "Brooklyn")).isEmpty();
        }
    }
}
