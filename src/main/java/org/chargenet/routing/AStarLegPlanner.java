package org.chargenet.routing;

import it.unimi.dsi.fastutil.objects.Reference2DoubleOpenHashMap;
import it.unimi.dsi.fastutil.objects.Reference2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ReferenceOpenHashSet;
import lombok.extern.slf4j.Slf4j;
import org.chargenet.network.ChargeNetwork;
import org.chargenet.network.ChargeStation;
import org.chargenet.network.Leg;
import org.chargenet.network.UnknownStationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * A* leg search over a {@link ChargeNetwork}.
 *
 * <p>Edge weight is the leg driving distance; legs outside the query's
 * {@link LegLengthWindow} are never relaxed. The frontier is a binary heap keyed on
 * {@code (f, sequence)} where {@code sequence} strictly decreases with every push, so
 * among equal f-scores the most recently pushed station is expanded first.</p>
 *
 * <p>Improved g-scores push a fresh frontier entry instead of mutating a queued one;
 * stale entries are skipped on pop. With a consistent heuristic a station is settled
 * on its first valid pop and never reopened.</p>
 */
@Slf4j
public final class AStarLegPlanner {
    private static final double INF = Double.POSITIVE_INFINITY;

    private final boolean useHeuristic;

    /**
     * Creates a planner in A* ({@code true}) or plain Dijkstra ({@code false}) priority mode.
     */
    public AStarLegPlanner(boolean useHeuristic) {
        this.useHeuristic = useHeuristic;
    }

    /**
     * Default great-circle A* planner.
     */
    public static AStarLegPlanner aStar() {
        return new AStarLegPlanner(true);
    }

    /**
     * Computes the shortest path by driving distance from {@code start} to {@code goal}.
     *
     * @throws PathNotNeededException when {@code start} and {@code goal} are the same vertex.
     * @throws UnknownStationException when either station is not in {@code network}.
     * @throws PathNotFoundException when no admissible path exists.
     */
    public PathResult plan(ChargeNetwork network, ChargeStation start, ChargeStation goal, LegLengthWindow window) {
        Objects.requireNonNull(network, "network");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(goal, "goal");
        Objects.requireNonNull(window, "window");

        if (start == goal) {
            throw new PathNotNeededException(start);
        }
        if (!network.contains(start)) {
            throw new UnknownStationException(start);
        }
        if (!network.contains(goal)) {
            throw new UnknownStationException(goal);
        }

        GoalBoundHeuristic heuristic = useHeuristic ? GreatCircleHeuristic.bindGoal(goal) : GreatCircleHeuristic.none();

        Reference2DoubleOpenHashMap<ChargeStation> gScore = new Reference2DoubleOpenHashMap<>();
        gScore.defaultReturnValue(INF);
        Reference2ObjectOpenHashMap<ChargeStation, Leg> previousLeg = new Reference2ObjectOpenHashMap<>();
        ReferenceOpenHashSet<ChargeStation> settled = new ReferenceOpenHashSet<>();
        PriorityQueue<FrontierEntry> frontier = new PriorityQueue<>();

        long sequence = 0L;
        gScore.put(start, 0.0d);
        frontier.add(new FrontierEntry(start, 0.0d, 0.0d, sequence--));

        while (!frontier.isEmpty()) {
            FrontierEntry entry = frontier.poll();
            ChargeStation current = entry.station();
            if (settled.contains(current) || entry.gScore() > gScore.getDouble(current)) {
                continue;
            }
            settled.add(current);

            if (current == goal) {
                List<Leg> path = reconstructPath(previousLeg, start, goal);
                log.debug("leg search settled {} stations, path has {} legs", settled.size(), path.size());
                return toResult(start, goal, path, settled.size());
            }

            double currentG = entry.gScore();
            for (Leg leg : network.legsOf(current)) {
                double distance = leg.drivingDistanceMeters();
                if (!window.admits(distance)) {
                    continue;
                }
                ChargeStation neighbour = leg.otherEndpoint(current);
                if (settled.contains(neighbour)) {
                    continue;
                }
                double tentativeG = currentG + distance;
                if (tentativeG < gScore.getDouble(neighbour)) {
                    gScore.put(neighbour, tentativeG);
                    previousLeg.put(neighbour, leg);
                    double fScore = tentativeG + heuristic.estimateFrom(neighbour);
                    frontier.add(new FrontierEntry(neighbour, tentativeG, fScore, sequence--));
                }
            }
        }

        log.debug("leg search exhausted frontier after settling {} stations", settled.size());
        throw new PathNotFoundException(start, goal, settled.size());
    }

    /**
     * Walks predecessor legs from goal back to start and returns them in travel order.
     */
    private static List<Leg> reconstructPath(
            Reference2ObjectOpenHashMap<ChargeStation, Leg> previousLeg,
            ChargeStation start,
            ChargeStation goal
    ) {
        List<Leg> reversed = new ArrayList<>();
        ChargeStation cursor = goal;
        while (cursor != start) {
            Leg leg = previousLeg.get(cursor);
            if (leg == null) {
                throw new IllegalStateException("broken predecessor chain at " + cursor);
            }
            reversed.add(leg);
            cursor = leg.otherEndpoint(cursor);
        }
        Collections.reverse(reversed);
        return reversed;
    }

    private static PathResult toResult(ChargeStation start, ChargeStation goal, List<Leg> path, int settledStations) {
        double totalDistance = 0.0d;
        double totalTime = 0.0d;
        for (Leg leg : path) {
            totalDistance += leg.drivingDistanceMeters();
            totalTime += leg.drivingTimeSeconds();
        }
        return PathResult.builder()
                .start(start)
                .goal(goal)
                .legs(path)
                .totalDistanceMeters(totalDistance)
                .totalTimeSeconds(totalTime)
                .settledStations(settledStations)
                .build();
    }

    /**
     * Frontier entry ordered by f-score, then by descending push order (LIFO on ties).
     */
    record FrontierEntry(ChargeStation station, double gScore, double fScore, long sequence)
            implements Comparable<FrontierEntry> {
        @Override
        public int compareTo(FrontierEntry other) {
            int byF = Double.compare(fScore, other.fScore);
            if (byF != 0) {
                return byF;
            }
            return Long.compare(sequence, other.sequence);
        }
    }
}
