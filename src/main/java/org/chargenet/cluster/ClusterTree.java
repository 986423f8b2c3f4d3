package org.chargenet.cluster;

import it.unimi.dsi.fastutil.objects.ReferenceOpenHashSet;
import lombok.extern.slf4j.Slf4j;
import org.chargenet.network.ChargeStation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Divisive hierarchical clustering of charge stations.
 *
 * <p>Each node picks as centroid the station with the lowest mean great-circle
 * distance to its set. If the set's diameter (largest pairwise distance) fits
 * {@code maxClusterDiameterKm} the node becomes a leaf holding the whole set;
 * otherwise every station is assigned to whichever diameter endpoint it is strictly
 * nearer to (ties go to the second endpoint) and both halves recurse.</p>
 *
 * <p>Input order is normalised once by (latitude, longitude), keeping the caller's
 * order for exact coordinate duplicates, so ties in centroid and diameter selection
 * resolve the same way on every run. The tree is immutable after {@link #build}.</p>
 */
@Slf4j
public final class ClusterTree {
    private static final Comparator<ChargeStation> COORDINATE_ORDER =
            Comparator.comparingDouble(ChargeStation::latitude).thenComparingDouble(ChargeStation::longitude);

    private final ClusterNode root;
    private final double maxClusterDiameterKm;
    private final List<LeafCluster> leaves;

    private ClusterTree(ClusterNode root, double maxClusterDiameterKm) {
        this.root = root;
        this.maxClusterDiameterKm = maxClusterDiameterKm;
        List<LeafCluster> collected = new ArrayList<>();
        root.collectLeaves(collected);
        this.leaves = Collections.unmodifiableList(collected);
    }

    /**
     * Clusters {@code stations} until every leaf's diameter is at most {@code maxClusterDiameterKm}.
     *
     * @throws IllegalArgumentException when {@code stations} is empty, contains the same
     * station twice, or the diameter is negative/NaN.
     */
    public static ClusterTree build(Collection<ChargeStation> stations, double maxClusterDiameterKm) {
        Objects.requireNonNull(stations, "stations");
        if (stations.isEmpty()) {
            throw new IllegalArgumentException("stations must be non-empty");
        }
        if (!(maxClusterDiameterKm >= 0.0d)) {
            throw new IllegalArgumentException("maxClusterDiameterKm must be >= 0, got " + maxClusterDiameterKm);
        }

        List<ChargeStation> ordered = new ArrayList<>(stations);
        if (new ReferenceOpenHashSet<>(ordered).size() != ordered.size()) {
            throw new IllegalArgumentException("stations must not contain the same station twice");
        }
        ordered.sort(COORDINATE_ORDER);

        ClusterNode root = split(ordered, maxClusterDiameterKm);
        ClusterTree tree = new ClusterTree(root, maxClusterDiameterKm);
        log.info("clustered {} stations into {} clusters (diameter {} km, depth {})",
                ordered.size(), tree.leafCount(), maxClusterDiameterKm, tree.depth());
        return tree;
    }

    private static ClusterNode split(List<ChargeStation> stations, double maxClusterDiameterKm) {
        ChargeStation centroid = ClusterSelection.lowestAverageDistance(stations);
        ClusterSelection.DiameterPair diameter = ClusterSelection.furthestApart(stations);

        if (diameter.distanceKm() <= maxClusterDiameterKm) {
            return new LeafCluster(centroid, stations, diameter.distanceKm());
        }

        ChargeStation a = diameter.first();
        ChargeStation b = diameter.second();
        List<ChargeStation> nearA = new ArrayList<>();
        List<ChargeStation> nearB = new ArrayList<>();
        for (ChargeStation station : stations) {
            if (station.greatCircleKmTo(a) < station.greatCircleKmTo(b)) {
                nearA.add(station);
            } else {
                nearB.add(station);
            }
        }
        return new SplitCluster(centroid, split(nearA, maxClusterDiameterKm), split(nearB, maxClusterDiameterKm));
    }

    public ClusterNode root() {
        return root;
    }

    public double maxClusterDiameterKm() {
        return maxClusterDiameterKm;
    }

    /**
     * Returns leaf clusters in tree order.
     */
    public List<LeafCluster> leaves() {
        return leaves;
    }

    /**
     * Returns the station groups of every leaf, in tree order.
     */
    public List<List<ChargeStation>> leafClusters() {
        List<List<ChargeStation>> clusters = new ArrayList<>(leaves.size());
        for (LeafCluster leaf : leaves) {
            clusters.add(leaf.members());
        }
        return clusters;
    }

    /**
     * Returns the centroid of every leaf, in tree order.
     */
    public List<ChargeStation> finalCentroids() {
        List<ChargeStation> centroids = new ArrayList<>(leaves.size());
        for (LeafCluster leaf : leaves) {
            centroids.add(leaf.centroid());
        }
        return centroids;
    }

    public int leafCount() {
        return leaves.size();
    }

    public int depth() {
        return root.depth();
    }

    public int stationCount() {
        return root.size();
    }
}
