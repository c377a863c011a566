package com.tazifor.trips.service;

import com.tazifor.trips.TestFixtures;
import com.tazifor.trips.config.TripInsightProperties;
import com.tazifor.trips.exception.InvalidInputException;
import com.tazifor.trips.geo.util.DistanceModel;
import com.tazifor.trips.model.EnrichedTripRecord;
import com.tazifor.trips.model.EnrichmentReport;
import com.tazifor.trips.model.RawTripRecord;
import com.tazifor.trips.model.TripType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TripEnricherTest {

    private final TripEnricher enricher = TestFixtures.enricher();

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        void acceptsTypicalTrip() {
            assertThat(enricher.validate(TestFixtures.validTrip().build())).isTrue();
        }

        @Test
        void rejectsNull() {
            assertThat(enricher.validate(null)).isFalse();
        }

        @Test
        void rejectsPickupAtOrigin() {
            RawTripRecord trip = TestFixtures.validTrip().pickupLatitude(0.0).pickupLongitude(0.0).build();
            assertThat(enricher.validate(trip)).isFalse();
        }

        @Test
        void rejectsDropoffOutsideCity() {
            RawTripRecord trip = TestFixtures.validTrip().dropoffLatitude(41.2).build();
            assertThat(enricher.validate(trip)).isFalse();
        }

        @Test
        void rejectsMissingFields() {
            assertThat(enricher.validate(TestFixtures.validTrip().pickupLongitude(null).build())).isFalse();
            assertThat(enricher.validate(TestFixtures.validTrip().tripDuration(null).build())).isFalse();
            assertThat(enricher.validate(TestFixtures.validTrip().passengerCount(null).build())).isFalse();
        }

        @Test
        void rejectsNonFiniteCoordinatesWithoutThrowing() {
            RawTripRecord trip = TestFixtures.validTrip().dropoffLongitude(Double.NaN).build();
            assertThat(enricher.validate(trip)).isFalse();
        }

        @ParameterizedTest
        @ValueSource(ints = {29, 10801, 0, -5})
        void rejectsDurationOutsideRange(int seconds) {
            assertThat(enricher.validate(TestFixtures.validTrip().tripDuration(seconds).build())).isFalse();
        }

        @ParameterizedTest
        @ValueSource(ints = {30, 10800})
        void durationBoundsAreInclusive(int seconds) {
            assertThat(enricher.validate(TestFixtures.validTrip().tripDuration(seconds).build())).isTrue();
        }

        @ParameterizedTest
        @ValueSource(ints = {0, 7, 9})
        void rejectsPassengerCountOutsideRange(int passengers) {
            assertThat(enricher.validate(TestFixtures.validTrip().passengerCount(passengers).build())).isFalse();
        }

        @Test
        void rejectsTripsShorterThanMinimumDistance() {
            // ~11 m apart
            RawTripRecord trip = TestFixtures.validTrip().dropoffLatitude(40.7581).dropoffLongitude(-73.9855).build();
            assertThat(enricher.validate(trip)).isFalse();
        }
    }

    @Nested
    @DisplayName("validate at the exact thresholds")
    @ExtendWith(MockitoExtension.class)
    class Thresholds {

        @Mock
        private DistanceModel distanceModel;

        private TripEnricher stubbed;

        @BeforeEach
        void setUp() {
            stubbed = new TripEnricher(TestFixtures.nycClassifier(), distanceModel, new TripInsightProperties());
        }

        @Test
        void minimumDurationDistanceAndPassengersPass() {
            when(distanceModel.greatCircleDistanceKm(anyDouble(), anyDouble(), anyDouble(), anyDouble()))
                .thenReturn(0.1);
            RawTripRecord trip = TestFixtures.validTrip().tripDuration(30).passengerCount(1).build();

            assertThat(stubbed.validate(trip)).isTrue();
        }

        @Test
        void durationOneSecondShortFailsBeforeDistanceIsComputed() {
            RawTripRecord trip = TestFixtures.validTrip().tripDuration(29).passengerCount(1).build();

            assertThat(stubbed.validate(trip)).isFalse();
            verify(distanceModel, never()).greatCircleDistanceKm(anyDouble(), anyDouble(), anyDouble(), anyDouble());
        }

        @Test
        void maximumDistancePasses() {
            when(distanceModel.greatCircleDistanceKm(anyDouble(), anyDouble(), anyDouble(), anyDouble()))
                .thenReturn(100.0);
            assertThat(stubbed.validate(TestFixtures.validTrip().build())).isTrue();
        }

        @Test
        void justOverMaximumDistanceFails() {
            when(distanceModel.greatCircleDistanceKm(anyDouble(), anyDouble(), anyDouble(), anyDouble()))
                .thenReturn(100.0001);
            assertThat(stubbed.validate(TestFixtures.validTrip().build())).isFalse();
        }

        @Test
        void justUnderMinimumDistanceFails() {
            when(distanceModel.greatCircleDistanceKm(anyDouble(), anyDouble(), anyDouble(), anyDouble()))
                .thenReturn(0.0999);
            assertThat(stubbed.validate(TestFixtures.validTrip().build())).isFalse();
        }
    }

    @Nested
    @DisplayName("enrich")
    class Enrich {

        @Test
        void derivesGeometryAndTimeBuckets() {
            EnrichedTripRecord trip = enricher.enrich(TestFixtures.validTrip().build());

            assertThat(trip.getDistanceKm()).isEqualTo(6.923);
            assertThat(trip.getSpeedKmh()).isEqualTo(20.77);
            assertThat(trip.getFarePerKm()).isEqualTo(173.34);
            assertThat(trip.getHourOfDay()).isEqualTo(17);
            assertThat(trip.getDayOfWeek()).isEqualTo(5);   // Friday
            assertThat(trip.getMonth()).isEqualTo(3);
            assertThat(trip.getPickupRegion()).isEqualTo("Manhattan");
            assertThat(trip.getDropoffRegion()).isEqualTo("Brooklyn");
            assertThat(trip.getTripType()).isEqualTo(TripType.CROSS_REGION);
        }

        @Test
        void keepsRawRecordUntouched() {
            RawTripRecord raw = TestFixtures.validTrip().build();
            EnrichedTripRecord trip = enricher.enrich(raw);

            assertThat(trip.getRaw()).isSameAs(raw);
            assertThat(raw).isEqualTo(TestFixtures.validTrip().build());
        }

        @Test
        void sundayIsDayZero() {
            RawTripRecord raw = TestFixtures.validTrip()
                .pickupDatetime(LocalDateTime.of(2016, 3, 13, 0, 5)).build();
            EnrichedTripRecord trip = enricher.enrich(raw);

            assertThat(trip.getDayOfWeek()).isZero();
            assertThat(trip.getHourOfDay()).isZero();
        }

        @Test
        void sameRegionIsWithinRegion() {
            RawTripRecord raw = TestFixtures.validTrip().dropoffLatitude(40.7300).dropoffLongitude(-73.9900).build();
            EnrichedTripRecord trip = enricher.enrich(raw);

            assertThat(trip.getDropoffRegion()).isEqualTo("Manhattan");
            assertThat(trip.getTripType()).isEqualTo(TripType.WITHIN_REGION);
        }

        @Test
        void unknownEndpointIsAlwaysWithinRegion() {
            // dropoff in the north-west corner of the city bounds, outside every borough
            RawTripRecord raw = TestFixtures.validTrip().dropoffLatitude(40.90).dropoffLongitude(-74.20).build();
            EnrichedTripRecord trip = enricher.enrich(raw);

            assertThat(trip.getDropoffRegion()).isEqualTo("Unknown");
            assertThat(trip.getTripType()).isEqualTo(TripType.WITHIN_REGION);
        }

        @Test
        void isPure() {
            RawTripRecord raw = TestFixtures.validTrip().build();
            assertThat(enricher.enrich(raw)).isEqualTo(enricher.enrich(raw));
        }

        @Test
        void zeroDurationYieldsInfiniteSpeed() {
            EnrichedTripRecord trip = enricher.enrich(TestFixtures.validTrip().tripDuration(0).build());
            assertThat(trip.getSpeedKmh()).isInfinite();
        }

        @Test
        void missingTimestampIsInvalidInput() {
            assertThatThrownBy(() -> enricher.enrich(TestFixtures.validTrip().pickupDatetime(null).build()))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("pickup_datetime");
        }

        @Test
        void nonFiniteCoordinateIsInvalidInput() {
            assertThatThrownBy(() -> enricher.enrich(
                TestFixtures.validTrip().pickupLatitude(Double.POSITIVE_INFINITY).build()))
                .isInstanceOf(InvalidInputException.class);
        }
    }

    @Nested
    @DisplayName("enrichAll")
    class EnrichAll {

        @Test
        void countsAndDropsRejectedRecords() {
            List<RawTripRecord> batch = List.of(
                TestFixtures.validTrip().id("a").build(),
                TestFixtures.validTrip().id("b").tripDuration(5).build(),
                TestFixtures.validTrip().id("c").passengerCount(9).build(),
                TestFixtures.validTrip().id("d").pickupDatetime(null).build(),
                TestFixtures.validTrip().id("e").build());

            EnrichmentReport report = enricher.enrichAll(batch);

            assertThat(report.processed()).isEqualTo(5);
            assertThat(report.valid()).isEqualTo(2);
            assertThat(report.invalid()).isEqualTo(3);
            assertThat(report.records()).extracting(EnrichedTripRecord::getId).containsExactly("a", "e");
            assertThat(report.retentionRate()).isEqualTo(0.4);
        }

        @Test
        void emptyBatchReportsZeros() {
            EnrichmentReport report = enricher.enrichAll(List.of());
            assertThat(report.processed()).isZero();
            assertThat(report.records()).isEmpty();
            assertThat(report.retentionRate()).isZero();
        }
    }
}
