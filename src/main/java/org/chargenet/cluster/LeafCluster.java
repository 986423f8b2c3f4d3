package org.chargenet.cluster;

import org.chargenet.network.ChargeStation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Terminal cluster whose diameter fits the tree's limit.
 */
public final class LeafCluster implements ClusterNode {
    private final ChargeStation centroid;
    private final List<ChargeStation> members;
    private final double diameterKm;

    LeafCluster(ChargeStation centroid, List<ChargeStation> members, double diameterKm) {
        this.centroid = Objects.requireNonNull(centroid, "centroid");
        this.members = Collections.unmodifiableList(members);
        this.diameterKm = diameterKm;
    }

    @Override
    public ChargeStation centroid() {
        return centroid;
    }

    /**
     * Stations of this cluster, centroid included.
     */
    public List<ChargeStation> members() {
        return members;
    }

    /**
     * Largest pairwise great-circle distance among {@link #members()}.
     */
    public double diameterKm() {
        return diameterKm;
    }

    @Override
    public int size() {
        return members.size();
    }

    @Override
    public void collectLeaves(List<LeafCluster> out) {
        out.add(this);
    }

    @Override
    public int depth() {
        return 1;
    }
}
