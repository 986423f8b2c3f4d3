package org.chargenet.cluster;

import lombok.experimental.UtilityClass;
import org.chargenet.network.ChargeStation;

import java.util.List;

/**
 * Selection primitives for divisive clustering. Both scans are order-sensitive on
 * ties: the first station (or pair) in list order wins.
 */
@UtilityClass
public final class ClusterSelection {

    /**
     * Two stations plus their great-circle distance.
     */
    public record DiameterPair(ChargeStation first, ChargeStation second, double distanceKm) {
    }

    /**
     * Returns the station minimising mean great-circle distance to every station in
     * {@code stations}.
     *
     * @throws IllegalArgumentException when {@code stations} is empty.
     */
    public static ChargeStation lowestAverageDistance(List<ChargeStation> stations) {
        requireNonEmpty(stations);
        int size = stations.size();
        ChargeStation best = null;
        double bestAverage = Double.POSITIVE_INFINITY;
        for (int i = 0; i < size; i++) {
            ChargeStation candidate = stations.get(i);
            double sum = 0.0d;
            for (int j = 0; j < size; j++) {
                sum += candidate.greatCircleKmTo(stations.get(j));
            }
            double average = sum / size;
            if (average < bestAverage) {
                bestAverage = average;
                best = candidate;
            }
        }
        return best;
    }

    /**
     * Returns the pair of stations furthest apart. A singleton yields the station
     * paired with itself at distance 0.
     *
     * @throws IllegalArgumentException when {@code stations} is empty.
     */
    public static DiameterPair furthestApart(List<ChargeStation> stations) {
        requireNonEmpty(stations);
        int size = stations.size();
        ChargeStation first = stations.get(0);
        ChargeStation second = stations.get(0);
        double max = 0.0d;
        for (int i = 0; i < size; i++) {
            ChargeStation a = stations.get(i);
            for (int j = i + 1; j < size; j++) {
                ChargeStation b = stations.get(j);
                double distance = a.greatCircleKmTo(b);
                if (distance > max) {
                    max = distance;
                    first = a;
                    second = b;
                }
            }
        }
        return new DiameterPair(first, second, max);
    }

    private static void requireNonEmpty(List<ChargeStation> stations) {
        if (stations == null || stations.isEmpty()) {
            throw new IllegalArgumentException("stations must be non-empty");
        }
    }
}
