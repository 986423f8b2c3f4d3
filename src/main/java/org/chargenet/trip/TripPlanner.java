package org.chargenet.trip;

import lombok.extern.slf4j.Slf4j;
import org.chargenet.core.geo.Coordinate;
import org.chargenet.network.ChargeNetwork;
import org.chargenet.network.ChargeStation;
import org.chargenet.oracle.Directions;
import org.chargenet.oracle.DirectionsLeg;
import org.chargenet.oracle.Polyline;
import org.chargenet.oracle.RoutingOracle;
import org.chargenet.oracle.RoutingOracleException;
import org.chargenet.routing.PathNotFoundException;
import org.chargenet.routing.PathNotNeededException;
import org.chargenet.routing.PathResult;
import org.chargenet.simulate.ChargeCurve;
import org.chargenet.simulate.LegMeasurement;
import org.chargenet.simulate.PathSimulation;
import org.chargenet.simulate.PathSimulator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Answers trip queries against a loaded network.
 *
 * <p>Both coordinates snap to their nearest station. The path comes from the network's
 * leg search; fresh driving distances and times for it come from a single oracle call,
 * and those feed the charging simulation.</p>
 */
@Slf4j
public final class TripPlanner {
    private final ChargeNetwork network;
    private final RoutingOracle oracle;
    private final ChargeCurve chargeCurve;

    public TripPlanner(ChargeNetwork network, RoutingOracle oracle, ChargeCurve chargeCurve) {
        this.network = Objects.requireNonNull(network, "network");
        this.oracle = Objects.requireNonNull(oracle, "oracle");
        this.chargeCurve = Objects.requireNonNull(chargeCurve, "chargeCurve");
    }

    /**
     * Plans a trip.
     *
     * @throws IllegalArgumentException when the request is invalid or its effective range
     *                                  exceeds the network range.
     * @throws PathNotNeededException when both coordinates snap to the same station.
     * @throws PathNotFoundException when no path fits the leg-length window.
     * @throws RoutingOracleException when the oracle fails or its answer does not match the path.
     */
    public TripPlan plan(TripRequest request) {
        Objects.requireNonNull(request, "request").validate();
        double effectiveRange = request.effectiveRangeMeters();
        if (effectiveRange > network.evRangeMeters()) {
            throw new IllegalArgumentException("effective range " + effectiveRange
                    + " m exceeds the network range " + network.evRangeMeters() + " m");
        }

        ChargeStation start = nearest(request.getStart());
        ChargeStation end = nearest(request.getEnd());
        PathResult path = network.findPath(start, end, request.getMinLegMeters(), effectiveRange);
        List<ChargeStation> stations = path.stations();
        log.debug("path of {} legs found after settling {} stations", path.getLegs().size(), path.getSettledStations());

        List<Coordinate> waypoints = new ArrayList<>(stations.size());
        for (ChargeStation station : stations) {
            waypoints.add(station.coordinate());
        }
        Directions directions = callOracle(waypoints);
        List<LegMeasurement> measurements = measure(directions, path.getLegs().size());

        PathSimulation simulation = PathSimulator.simulate(measurements, request.batteryProfile(), chargeCurve);
        TripPlan.TripPlanBuilder plan = TripPlan.builder()
                .request(request)
                .destination(end)
                .arrivalBattery(simulation.getArrivalBattery())
                .overviewPolyline(directions.getOverviewPolyline())
                .routePoints(decode(directions.getOverviewPolyline()))
                .bounds(directions.getBounds())
                .simulation(simulation);
        for (int i = 0; i < simulation.getLegStates().size(); i++) {
            plan.stop(new TripStop(stations.get(i), simulation.getLegStates().get(i)));
        }
        return plan.build();
    }

    /**
     * Maps a planning failure to a message fit for an end user. Failures other than the
     * path and oracle kinds keep their own message.
     */
    public static String describeFailure(RuntimeException failure) {
        Objects.requireNonNull(failure, "failure");
        if (failure instanceof PathNotNeededException) {
            return "no path was needed since the start and end coordinates snapped to the same charge station";
        }
        if (failure instanceof PathNotFoundException) {
            return "no path was found between these two coordinates";
        }
        if (failure instanceof RoutingOracleException) {
            return "no path was found due to a routing service error: "
                    + ((RoutingOracleException) failure).getDetail();
        }
        return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
    }

    private ChargeStation nearest(Coordinate coordinate) {
        return network.nearestStation(coordinate.getLatitude(), coordinate.getLongitude());
    }

    private Directions callOracle(List<Coordinate> waypoints) {
        try {
            return oracle.directions(waypoints);
        } catch (RoutingOracleException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new RoutingOracleException("routing oracle call failed: " + ex.getMessage(), ex);
        }
    }

    private static List<LegMeasurement> measure(Directions directions, int expectedLegs) {
        if (directions == null) {
            throw new RoutingOracleException("routing oracle returned no directions");
        }
        if (directions.getLegs().size() != expectedLegs) {
            throw new RoutingOracleException("routing oracle returned " + directions.getLegs().size()
                    + " legs for a path of " + expectedLegs);
        }
        List<LegMeasurement> measurements = new ArrayList<>(expectedLegs);
        for (DirectionsLeg leg : directions.getLegs()) {
            if (!leg.isWellFormed()) {
                throw new RoutingOracleException("routing oracle returned a malformed leg: " + leg);
            }
            measurements.add(LegMeasurement.of(leg.getDistanceMeters(), leg.getDurationSeconds()));
        }
        return measurements;
    }

    private static List<Coordinate> decode(String polyline) {
        try {
            return Polyline.decode(polyline == null ? "" : polyline);
        } catch (IllegalArgumentException ex) {
            throw new RoutingOracleException("routing oracle returned a malformed polyline", ex);
        }
    }
}
