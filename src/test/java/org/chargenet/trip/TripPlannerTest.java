package org.chargenet.trip;

import org.chargenet.core.geo.Coordinate;
import org.chargenet.network.ChargeNetwork;
import org.chargenet.network.ChargeStation;
import org.chargenet.network.Leg;
import org.chargenet.oracle.BoundingBox;
import org.chargenet.oracle.Directions;
import org.chargenet.oracle.DirectionsLeg;
import org.chargenet.oracle.RoutingOracle;
import org.chargenet.oracle.RoutingOracleException;
import org.chargenet.routing.PathNotFoundException;
import org.chargenet.routing.PathNotNeededException;
import org.chargenet.simulate.PolynomialChargeCurve;
import org.chargenet.testutil.NetworkFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("TripPlanner Tests")
class TripPlannerTest {
    private static final double EPS = 1e-9d;
    private static final String POLYLINE = "_p~iF~ps|U_ulLnnqC_mqNvxq`@";

    private final NetworkFixtures.LineFixture line = NetworkFixtures.line();
    private final RoutingOracle oracle = mock(RoutingOracle.class);
    private final TripPlanner planner = new TripPlanner(line.network(), oracle, PolynomialChargeCurve.generic());

    private TripRequest.TripRequestBuilder request() {
        return TripRequest.builder()
                .start(new Coordinate(0.0d, 0.1d))
                .end(new Coordinate(0.0d, 1.9d))
                .minLegMeters(0.0d)
                .evRangeMeters(200_000.0d)
                .minBattery(0.15d)
                .maxBattery(0.90d)
                .startBattery(0.40d);
    }

    private List<Coordinate> lineWaypoints() {
        return List.of(line.a().coordinate(), line.b().coordinate(), line.c().coordinate());
    }

    @Test
    @DisplayName("Plans stops, battery states and totals from the oracle's fresh legs")
    void testPlan() {
        BoundingBox bounds = new BoundingBox(new Coordinate(0.1d, 2.0d), new Coordinate(-0.1d, 0.0d));
        when(oracle.directions(lineWaypoints())).thenReturn(Directions.builder()
                .leg(DirectionsLeg.of(101_000.0d, 3_700.0d))
                .leg(DirectionsLeg.of(99_000.0d, 3_500.0d))
                .overviewPolyline(POLYLINE)
                .bounds(bounds)
                .build());

        TripPlan plan = planner.plan(request().build());

        assertEquals(2, plan.getStops().size());
        assertSame(line.a(), plan.getStops().get(0).getStation());
        assertSame(line.b(), plan.getStops().get(1).getStation());
        assertSame(line.c(), plan.getDestination());

        assertEquals(0.40d, plan.getStops().get(0).getState().getBatteryStart(), EPS);
        assertEquals(0.655d, plan.getStops().get(0).getState().getBatteryEnd(), EPS);
        assertEquals(0.15d, plan.getStops().get(1).getState().getBatteryStart(), EPS);
        assertEquals(0.645d, plan.getStops().get(1).getState().getBatteryEnd(), EPS);
        assertEquals(0.15d, plan.getArrivalBattery(), EPS);

        assertEquals(200_000.0d, plan.totalDrivingDistanceMeters(), EPS);
        assertEquals(7_200.0d, plan.totalDrivingTimeSeconds(), EPS);
        assertTrue(plan.totalChargeTimeSeconds() > 0.0d);
        assertEquals(plan.totalDrivingTimeSeconds() + plan.totalChargeTimeSeconds(), plan.totalTimeSeconds(), EPS);

        assertEquals(POLYLINE, plan.getOverviewPolyline());
        assertEquals(3, plan.getRoutePoints().size());
        assertEquals(bounds, plan.getBounds());
    }

    @Test
    @DisplayName("Stored leg distances are not used once the oracle answers")
    void testOracleDistancesOverrideStoredLegs() {
        when(oracle.directions(lineWaypoints())).thenReturn(Directions.builder()
                .leg(DirectionsLeg.of(150_000.0d, 5_000.0d))
                .leg(DirectionsLeg.of(50_000.0d, 2_000.0d))
                .build());

        TripPlan plan = planner.plan(request().build());

        assertEquals(150_000.0d, plan.getStops().get(0).getState().getDrivingDistanceMeters());
        assertNotEquals(line.ab().drivingDistanceMeters(), plan.getStops().get(0).getState().getDrivingDistanceMeters());
        assertTrue(plan.getRoutePoints().isEmpty());
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Coordinates snapping to one station raise PathNotNeeded")
        void testPathNotNeeded() {
            TripRequest request = request().end(new Coordinate(0.0d, 0.2d)).build();

            PathNotNeededException ex = assertThrows(PathNotNeededException.class, () -> planner.plan(request));
            assertEquals("no path was needed since the start and end coordinates snapped to the same charge station",
                    TripPlanner.describeFailure(ex));
            verify(oracle, never()).directions(any());
        }

        @Test
        @DisplayName("Effective range admitting no leg raises PathNotFound")
        void testPathNotFound() {
            TripRequest request = request().maxBattery(0.55d).build();

            PathNotFoundException ex = assertThrows(PathNotFoundException.class, () -> planner.plan(request));
            assertEquals("no path was found between these two coordinates", TripPlanner.describeFailure(ex));
        }

        @Test
        @DisplayName("Oracle failures propagate with their own message")
        void testOracleFailure() {
            when(oracle.directions(any())).thenThrow(new RoutingOracleException("OVER_QUERY_LIMIT"));

            RoutingOracleException ex = assertThrows(RoutingOracleException.class,
                    () -> planner.plan(request().build()));
            assertEquals("no path was found due to a routing service error: OVER_QUERY_LIMIT",
                    TripPlanner.describeFailure(ex));
        }

        @Test
        @DisplayName("Any fault raised by the oracle client is reported as an oracle failure")
        void testOracleClientFaultWrapped() {
            IllegalStateException cause = new IllegalStateException("HTTP 503 from directions API");
            when(oracle.directions(any())).thenThrow(cause);

            RoutingOracleException ex = assertThrows(RoutingOracleException.class,
                    () -> planner.plan(request().build()));
            assertSame(cause, ex.getCause());
            assertEquals(RoutingOracleException.REASON_CODE, ex.getReasonCode());
            assertEquals("no path was found due to a routing service error: "
                            + "routing oracle call failed: HTTP 503 from directions API",
                    TripPlanner.describeFailure(ex));
        }

        @Test
        @DisplayName("Oracle leg count mismatch raises an oracle failure")
        void testLegCountMismatch() {
            when(oracle.directions(any())).thenReturn(Directions.builder()
                    .leg(DirectionsLeg.of(200_000.0d, 7_200.0d))
                    .build());

            assertThrows(RoutingOracleException.class, () -> planner.plan(request().build()));
        }

        @Test
        @DisplayName("Effective range beyond the network range is rejected")
        void testRangeBeyondNetwork() {
            ChargeNetwork small = new ChargeNetwork(0, 100_000.0d);
            ChargeStation a = NetworkFixtures.station("A", 0.0d, 0.0d);
            ChargeStation b = NetworkFixtures.station("B", 0.0d, 1.0d);
            small.addStation(a);
            small.addStation(b);
            small.commitLegs(List.of(new Leg(a, b, 99_000.0d, 3_600.0d)));
            TripPlanner smallPlanner = new TripPlanner(small, oracle, PolynomialChargeCurve.generic());

            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                    () -> smallPlanner.plan(request().build()));
            assertEquals(ex.getMessage(), TripPlanner.describeFailure(ex));
        }

        @Test
        @DisplayName("Unrelated failures keep their message")
        void testOtherFailureMessage() {
            assertEquals("boom", TripPlanner.describeFailure(new IllegalStateException("boom")));
            assertEquals("NullPointerException", TripPlanner.describeFailure(new NullPointerException()));
        }
    }
}
