package org.chargenet.cluster;

import org.chargenet.network.ChargeStation;

import java.util.List;
import java.util.Objects;

/**
 * Internal cluster split around its diameter pair.
 */
public final class SplitCluster implements ClusterNode {
    private final ChargeStation centroid;
    private final ClusterNode near;
    private final ClusterNode far;
    private final int size;

    SplitCluster(ChargeStation centroid, ClusterNode near, ClusterNode far) {
        this.centroid = Objects.requireNonNull(centroid, "centroid");
        this.near = Objects.requireNonNull(near, "near");
        this.far = Objects.requireNonNull(far, "far");
        this.size = near.size() + far.size();
    }

    @Override
    public ChargeStation centroid() {
        return centroid;
    }

    /**
     * Sub-cluster of stations strictly nearer the first diameter endpoint.
     */
    public ClusterNode near() {
        return near;
    }

    /**
     * Sub-cluster of the remaining stations.
     */
    public ClusterNode far() {
        return far;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public void collectLeaves(List<LeafCluster> out) {
        near.collectLeaves(out);
        far.collectLeaves(out);
    }

    @Override
    public int depth() {
        return 1 + Math.max(near.depth(), far.depth());
    }
}
