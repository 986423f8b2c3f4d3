package org.chargenet.routing;

import org.chargenet.network.ChargeNetwork;
import org.chargenet.network.ChargeStation;
import org.chargenet.network.Leg;
import org.chargenet.network.UnknownStationException;
import org.chargenet.testutil.NetworkFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("A* Leg Planner Tests")
class AStarLegPlannerTest {

    @Nested
    @DisplayName("Line network")
    class LineNetwork {
        private final NetworkFixtures.LineFixture line = NetworkFixtures.line();

        @Test
        @DisplayName("Window excluding the long leg routes through the middle station")
        void testWindowExcludesLongLeg() {
            List<Leg> path = line.network().shortestPath(line.a(), line.c(), 0.0d, 150_000.0d);

            assertEquals(List.of(line.ab(), line.bc()), path);
        }

        @Test
        @DisplayName("Window excluding the short legs forces the direct leg")
        void testWindowExcludesShortLegs() {
            PathResult result = line.network().findPath(line.a(), line.c(), 150_000.0d, 300_000.0d);

            assertEquals(List.of(line.ac()), result.getLegs());
            assertEquals(250_000.0d, result.getTotalDistanceMeters());
            assertEquals(9_000.0d, result.getTotalTimeSeconds());
        }

        @Test
        @DisplayName("Unbounded window picks the shorter two-leg path")
        void testUnboundedPicksShortest() {
            PathResult result = line.network().findPath(line.a(), line.c(), 0.0d, Double.POSITIVE_INFINITY);

            assertEquals(List.of(line.ab(), line.bc()), result.getLegs());
            assertEquals(200_000.0d, result.getTotalDistanceMeters());
            assertEquals(7_200.0d, result.getTotalTimeSeconds());
            assertEquals(List.of(line.a(), line.b(), line.c()), result.stations());
        }

        @Test
        @DisplayName("Window bounds are inclusive")
        void testInclusiveBounds() {
            List<Leg> path = line.network().shortestPath(line.a(), line.c(), 100_000.0d, 100_000.0d);

            assertEquals(List.of(line.ab(), line.bc()), path);
        }

        @Test
        @DisplayName("Reverse query returns legs in reverse travel order")
        void testReverseQuery() {
            List<Leg> path = line.network().shortestPath(line.c(), line.a(), 0.0d, 150_000.0d);

            assertEquals(List.of(line.bc(), line.ab()), path);
        }

        @Test
        @DisplayName("Same start and goal raises PathNotNeeded")
        void testPathNotNeeded() {
            PathNotNeededException ex = assertThrows(PathNotNeededException.class,
                    () -> line.network().shortestPath(line.a(), line.a(), 0.0d, 150_000.0d));

            assertEquals(PathNotNeededException.REASON_CODE, ex.getReasonCode());
        }

        @Test
        @DisplayName("Window admitting no leg raises PathNotFound")
        void testPathNotFound() {
            PathNotFoundException ex = assertThrows(PathNotFoundException.class,
                    () -> line.network().shortestPath(line.a(), line.c(), 0.0d, 90_000.0d));

            assertEquals(PathNotFoundException.REASON_CODE, ex.getReasonCode());
            assertEquals(1, ex.getSettledStations());
        }

        @Test
        @DisplayName("Unknown endpoints raise UnknownStation")
        void testUnknownEndpoint() {
            ChargeStation outsider = NetworkFixtures.station("X", 5.0d, 5.0d);

            assertThrows(UnknownStationException.class,
                    () -> line.network().shortestPath(line.a(), outsider, 0.0d, 150_000.0d));
            assertThrows(UnknownStationException.class,
                    () -> line.network().shortestPath(outsider, line.a(), 0.0d, 150_000.0d));
        }

        @Test
        @DisplayName("Invalid window is rejected")
        void testInvalidWindow() {
            assertThrows(IllegalArgumentException.class,
                    () -> line.network().shortestPath(line.a(), line.c(), 200_000.0d, 100_000.0d));
        }
    }

    @Test
    @DisplayName("Equal-cost ties expand the most recently discovered station first")
    void testLifoTieBreak() {
        ChargeNetwork network = new ChargeNetwork(0, NetworkFixtures.WIDE_RANGE_METERS);
        ChargeStation s = NetworkFixtures.station("S", 0.0d, 0.0d);
        ChargeStation x = NetworkFixtures.station("X", 1.0d, 1.0d);
        ChargeStation y = NetworkFixtures.station("Y", -1.0d, 1.0d);
        ChargeStation g = NetworkFixtures.station("G", 0.0d, 2.0d);
        network.addStation(s);
        network.addStation(x);
        network.addStation(y);
        network.addStation(g);
        Leg sx = new Leg(s, x, 10.0d, 1.0d);
        Leg sy = new Leg(s, y, 10.0d, 1.0d);
        Leg xg = new Leg(x, g, 10.0d, 1.0d);
        Leg yg = new Leg(y, g, 10.0d, 1.0d);
        network.commitLegs(List.of(sx, sy, xg, yg));

        PathResult result = new AStarLegPlanner(false).plan(network, s, g, LegLengthWindow.unbounded());

        assertEquals(List.of(sy, yg), result.getLegs());
    }

    @Test
    @DisplayName("A later, cheaper discovery replaces the first g-score found")
    void testImprovedGScoreWins() {
        ChargeNetwork network = new ChargeNetwork(0, NetworkFixtures.WIDE_RANGE_METERS);
        ChargeStation s = NetworkFixtures.station("S", 0.0d, 0.0d);
        ChargeStation m = NetworkFixtures.station("M", 0.0d, 0.5d);
        ChargeStation t = NetworkFixtures.station("T", 0.0d, 1.0d);
        ChargeStation g = NetworkFixtures.station("G", 0.0d, 3.0d);
        network.addStation(s);
        network.addStation(m);
        network.addStation(t);
        network.addStation(g);
        Leg st = new Leg(s, t, 500_000.0d, 1.0d);
        Leg sm = new Leg(s, m, 60_000.0d, 1.0d);
        Leg mt = new Leg(m, t, 60_000.0d, 1.0d);
        Leg tg = new Leg(t, g, 230_000.0d, 1.0d);
        network.commitLegs(List.of(st, sm, mt, tg));

        PathResult result = AStarLegPlanner.aStar().plan(network, s, g, LegLengthWindow.unbounded());

        assertEquals(List.of(sm, mt, tg), result.getLegs());
        assertEquals(350_000.0d, result.getTotalDistanceMeters());
    }

    @Test
    @DisplayName("A* matches a reference Dijkstra on random networks")
    void testMatchesReferenceDijkstra() {
        Random random = new Random(424242L);
        int compared = 0;
        for (int round = 0; round < 20; round++) {
            ChargeNetwork network = NetworkFixtures.randomNetwork(random, 30, 0.35d);
            List<ChargeStation> stations = network.stations();
            LegLengthWindow window = LegLengthWindow.of(50_000.0d, 900_000.0d);
            for (int query = 0; query < 10; query++) {
                ChargeStation start = stations.get(random.nextInt(stations.size()));
                ChargeStation goal = stations.get(random.nextInt(stations.size()));
                if (start == goal) {
                    continue;
                }
                double expected = referenceDistance(network, start, goal, window);
                if (Double.isInfinite(expected)) {
                    assertThrows(PathNotFoundException.class,
                            () -> AStarLegPlanner.aStar().plan(network, start, goal, window));
                    continue;
                }
                PathResult aStar = AStarLegPlanner.aStar().plan(network, start, goal, window);
                PathResult dijkstra = new AStarLegPlanner(false).plan(network, start, goal, window);

                assertEquals(expected, aStar.getTotalDistanceMeters(), 1e-6d);
                assertEquals(expected, dijkstra.getTotalDistanceMeters(), 1e-6d);
                assertTrue(aStar.getSettledStations() <= dijkstra.getSettledStations());
                assertPathIsConnected(aStar, window);
                compared++;
            }
        }
        assertTrue(compared > 40, "too few reachable queries: " + compared);
    }

    private static void assertPathIsConnected(PathResult result, LegLengthWindow window) {
        ChargeStation cursor = result.getStart();
        Set<ChargeStation> visited = new HashSet<>();
        visited.add(cursor);
        for (Leg leg : result.getLegs()) {
            assertTrue(leg.touches(cursor));
            assertTrue(window.admits(leg.drivingDistanceMeters()));
            cursor = leg.otherEndpoint(cursor);
            assertTrue(visited.add(cursor), "path revisits " + cursor);
        }
        assertSame(result.getGoal(), cursor);
    }

    /**
     * Plain O(n^2) Dijkstra over the admitted legs.
     */
    private static double referenceDistance(
            ChargeNetwork network,
            ChargeStation start,
            ChargeStation goal,
            LegLengthWindow window
    ) {
        Map<ChargeStation, Double> dist = new IdentityHashMap<>();
        Map<ChargeStation, Boolean> done = new HashMap<>();
        for (ChargeStation station : network.stations()) {
            dist.put(station, Double.POSITIVE_INFINITY);
        }
        dist.put(start, 0.0d);
        List<ChargeStation> pending = new ArrayList<>(network.stations());
        while (!pending.isEmpty()) {
            ChargeStation best = null;
            for (ChargeStation station : pending) {
                if (best == null || dist.get(station) < dist.get(best)) {
                    best = station;
                }
            }
            pending.remove(best);
            done.put(best, true);
            if (Double.isInfinite(dist.get(best))) {
                break;
            }
            for (Leg leg : network.legsOf(best)) {
                if (!window.admits(leg.drivingDistanceMeters())) {
                    continue;
                }
                ChargeStation next = leg.otherEndpoint(best);
                double candidate = dist.get(best) + leg.drivingDistanceMeters();
                if (!done.containsKey(next) && candidate < dist.get(next)) {
                    dist.put(next, candidate);
                }
            }
        }
        return dist.get(goal);
    }
}
