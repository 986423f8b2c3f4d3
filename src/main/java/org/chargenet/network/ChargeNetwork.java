package org.chargenet.network;

import it.unimi.dsi.fastutil.objects.Reference2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.ReferenceArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.chargenet.routing.AStarLegPlanner;
import org.chargenet.routing.LegLengthWindow;
import org.chargenet.routing.PathNotFoundException;
import org.chargenet.routing.PathNotNeededException;
import org.chargenet.routing.PathResult;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Charge-network graph: charge stations as vertices, resolved driving legs as
 * undirected edges.
 *
 * <p>Invariants:</p>
 * <ul>
 * <li>every leg in an adjacency set has both endpoints as vertices of this network;</li>
 * <li>no leg longer than {@link #evRangeMeters()} is ever admitted. The check happens
 * at insertion only.</li>
 * </ul>
 *
 * <p>Vertices are identity-keyed and kept in insertion order, so iteration (and
 * therefore candidate generation, export and search tie-breaks) is deterministic.
 * Not thread-safe for mutation; concurrent reads are fine once loading is done.</p>
 */
@Slf4j
public final class ChargeNetwork {
    @Getter
    @Accessors(fluent = true)
    private final int minChargersAtStation;
    @Getter
    @Accessors(fluent = true)
    private final double evRangeMeters;

    private final Reference2ObjectLinkedOpenHashMap<ChargeStation, Set<Leg>> adjacency =
            new Reference2ObjectLinkedOpenHashMap<>();

    /**
     * Creates an empty network.
     *
     * @param minChargersAtStation minimum DC fast charger count a station needs to be listed.
     * @param evRangeMeters maximum driving distance of any admitted leg.
     */
    public ChargeNetwork(int minChargersAtStation, double evRangeMeters) {
        if (minChargersAtStation < 0) {
            throw new IllegalArgumentException("minChargersAtStation must be >= 0, got " + minChargersAtStation);
        }
        if (!Double.isFinite(evRangeMeters) || evRangeMeters <= 0.0d) {
            throw new IllegalArgumentException("evRangeMeters must be finite and > 0, got " + evRangeMeters);
        }
        this.minChargersAtStation = minChargersAtStation;
        this.evRangeMeters = evRangeMeters;
    }

    /**
     * Returns whether a station with {@code dcFastChargerCount} chargers qualifies for this network.
     */
    public boolean meetsChargerThreshold(int dcFastChargerCount) {
        return dcFastChargerCount >= minChargersAtStation;
    }

    /**
     * Adds a vertex with no incident legs.
     *
     * @throws DuplicateStationException when the station is already present.
     */
    public void addStation(ChargeStation station) {
        Objects.requireNonNull(station, "station");
        if (adjacency.containsKey(station)) {
            throw new DuplicateStationException(station);
        }
        adjacency.put(station, new LinkedHashSet<>());
    }

    public boolean contains(ChargeStation station) {
        return adjacency.containsKey(station);
    }

    public int stationCount() {
        return adjacency.size();
    }

    /**
     * Returns all vertices in insertion order.
     */
    public List<ChargeStation> stations() {
        return Collections.unmodifiableList(new ReferenceArrayList<>(adjacency.keySet()));
    }

    /**
     * Returns the legs incident to {@code station}.
     *
     * @throws UnknownStationException when the station is not a vertex.
     */
    public Set<Leg> legsOf(ChargeStation station) {
        Set<Leg> legs = adjacency.get(station);
        if (legs == null) {
            throw new UnknownStationException(station);
        }
        return Collections.unmodifiableSet(legs);
    }

    /**
     * Returns every committed leg once.
     */
    public Set<Leg> legs() {
        Set<Leg> all = new LinkedHashSet<>();
        for (Set<Leg> legs : adjacency.values()) {
            all.addAll(legs);
        }
        return all;
    }

    /**
     * Returns every unordered pair of stations whose great-circle distance is strictly
     * below the network range.
     *
     * <p>Road distance is never below great-circle distance, so the result is a superset
     * of the legs that can survive {@link #commitLegs(Collection)}.</p>
     */
    public Set<StationPair> candidateLegs() {
        List<ChargeStation> stations = new ReferenceArrayList<>(adjacency.keySet());
        Set<StationPair> candidates = new LinkedHashSet<>();
        int size = stations.size();
        for (int i = 0; i < size; i++) {
            ChargeStation a = stations.get(i);
            for (int j = i + 1; j < size; j++) {
                ChargeStation b = stations.get(j);
                if (a.greatCircleMetersTo(b) < evRangeMeters) {
                    candidates.add(new StationPair(a, b));
                }
            }
        }
        log.debug("generated {} candidate legs over {} stations", candidates.size(), size);
        return candidates;
    }

    /**
     * Attaches each leg within range to both of its endpoints; longer legs are dropped.
     * A leg whose endpoints already share a leg is ignored and the existing leg kept.
     *
     * @return number of legs newly attached.
     * @throws UnknownStationException when a leg endpoint is not a vertex. Nothing is
     * attached in that case.
     */
    public int commitLegs(Collection<Leg> legs) {
        Objects.requireNonNull(legs, "legs");
        for (Leg leg : legs) {
            StationPair endpoints = leg.endpoints();
            if (!adjacency.containsKey(endpoints.first())) {
                throw new UnknownStationException(endpoints.first());
            }
            if (!adjacency.containsKey(endpoints.second())) {
                throw new UnknownStationException(endpoints.second());
            }
        }

        int admitted = 0;
        for (Leg leg : legs) {
            if (leg.drivingDistanceMeters() > evRangeMeters) {
                continue;
            }
            StationPair endpoints = leg.endpoints();
            if (adjacency.get(endpoints.first()).add(leg)) {
                adjacency.get(endpoints.second()).add(leg);
                admitted++;
            }
        }
        return admitted;
    }

    /**
     * Runs the leg search and returns the path with its totals.
     *
     * @param minLegMeters shortest leg the path may use.
     * @param maxLegMeters longest leg the path may use.
     * @throws PathNotNeededException when {@code start == goal}.
     * @throws PathNotFoundException when no path exists inside the leg-length window.
     * @throws UnknownStationException when an endpoint is not a vertex.
     */
    public PathResult findPath(ChargeStation start, ChargeStation goal, double minLegMeters, double maxLegMeters) {
        if (start == goal) {
            throw new PathNotNeededException(start);
        }
        return AStarLegPlanner.aStar().plan(this, start, goal, LegLengthWindow.of(minLegMeters, maxLegMeters));
    }

    /**
     * Returns the legs of the shortest path from {@code start} to {@code goal}, in travel order.
     *
     * @see #findPath(ChargeStation, ChargeStation, double, double)
     */
    public List<Leg> shortestPath(ChargeStation start, ChargeStation goal, double minLegMeters, double maxLegMeters) {
        return findPath(start, goal, minLegMeters, maxLegMeters).getLegs();
    }

    /**
     * Returns the vertex closest, by great-circle distance, to the given point.
     * Ties go to the earlier-inserted station.
     *
     * @throws IllegalStateException when the network is empty.
     */
    public ChargeStation nearestStation(double latitude, double longitude) {
        if (adjacency.isEmpty()) {
            throw new IllegalStateException("network has no charge stations");
        }
        ChargeStation probe = ChargeStation.at(latitude, longitude);
        ChargeStation best = null;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (ChargeStation station : adjacency.keySet()) {
            double distance = probe.greatCircleKmTo(station);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = station;
            }
        }
        return best;
    }

    @Override
    public String toString() {
        return "ChargeNetwork{stations=" + adjacency.size()
                + ", minChargersAtStation=" + minChargersAtStation
                + ", evRangeMeters=" + evRangeMeters + "}";
    }
}
