package org.chargenet.cluster;

import org.chargenet.network.ChargeStation;

import java.util.List;

/**
 * Node of a {@link ClusterTree}: either a {@link LeafCluster} holding stations or a
 * {@link SplitCluster} holding two sub-clusters.
 */
public interface ClusterNode {

    /**
     * Station of this node's set with the lowest mean great-circle distance to the others.
     */
    ChargeStation centroid();

    /**
     * Number of stations represented below this node.
     */
    int size();

    /**
     * Appends this node's leaf clusters, in tree order, to {@code out}.
     */
    void collectLeaves(List<LeafCluster> out);

    /**
     * Height of this node; a leaf has depth 1.
     */
    int depth();
}
