package org.chargenet.build;

import lombok.extern.slf4j.Slf4j;
import org.chargenet.cluster.ClusterTree;
import org.chargenet.network.ChargeNetwork;
import org.chargenet.network.ChargeStation;
import org.chargenet.network.StationPair;
import org.chargenet.oracle.BatchDeclinedException;
import org.chargenet.oracle.LegResolution;
import org.chargenet.oracle.LegResolver;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Builds a charge network from raw station listings.
 *
 * <p>Pipeline: charger-count filter, divisive clustering down to one centroid per
 * cluster, candidate legs between centroids within range, oracle resolution, commit.</p>
 */
@Slf4j
public final class NetworkBuilder {
    private final NetworkBuildConfig config;
    private final LegResolver resolver;

    public NetworkBuilder(NetworkBuildConfig config, LegResolver resolver) {
        this.config = Objects.requireNonNull(config, "config");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /**
     * Runs the pipeline over {@code listings}.
     *
     * @throws IllegalArgumentException when the configuration is invalid.
     * @throws BatchDeclinedException when the oracle batch is declined.
     */
    public NetworkBuildReport build(Collection<StationListing> listings) {
        Objects.requireNonNull(listings, "listings");
        ChargeNetwork network = new ChargeNetwork(config.getMinChargersAtStation(), config.getEvRangeMeters());
        double maxDiameterKm = config.getMaxClusterDiameterKm();
        if (!(maxDiameterKm >= 0.0d)) {
            throw new IllegalArgumentException("maxClusterDiameterKm must be >= 0, got " + maxDiameterKm);
        }

        List<ChargeStation> qualifying = new ArrayList<>();
        for (StationListing listing : listings) {
            if (network.meetsChargerThreshold(listing.getDcFastChargerCount())) {
                qualifying.add(listing.getStation());
            }
        }
        log.info("{} of {} charge stations have at least {} DC fast chargers",
                qualifying.size(), listings.size(), network.minChargersAtStation());

        NetworkBuildReport.NetworkBuildReportBuilder report = NetworkBuildReport.builder()
                .network(network)
                .listedStations(listings.size())
                .qualifyingStations(qualifying.size());
        if (qualifying.isEmpty()) {
            log.info("no qualifying charge stations; network is empty");
            return report.build();
        }

        ClusterTree tree = ClusterTree.build(qualifying, maxDiameterKm);
        for (ChargeStation centroid : tree.finalCentroids()) {
            network.addStation(centroid);
        }
        log.info("clustered {} charge stations into {} centroids (depth {})",
                qualifying.size(), tree.leafCount(), tree.depth());

        Set<StationPair> candidates = network.candidateLegs();
        log.info("{} candidate legs within {} m", candidates.size(), network.evRangeMeters());
        LegResolution resolution = resolver.resolve(candidates);
        int committed = network.commitLegs(resolution.getResolvedLegs());
        log.info("committed {} of {} resolved legs", committed, resolution.getResolvedLegs().size());

        return report
                .centroidStations(network.stationCount())
                .candidateLegs(candidates.size())
                .resolvedLegs(resolution.getResolvedLegs().size())
                .committedLegs(committed)
                .build();
    }
}
