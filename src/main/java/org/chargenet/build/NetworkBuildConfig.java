package org.chargenet.build;

import lombok.Builder;
import lombok.Value;

/**
 * Configuration for {@link NetworkBuilder}.
 */
@Value
@Builder
public class NetworkBuildConfig {
    /**
     * Minimum DC fast charger count a station needs to be kept.
     */
    @Builder.Default
    int minChargersAtStation = 4;

    /**
     * Longest leg admitted into the network, in meters.
     */
    @Builder.Default
    double evRangeMeters = 700_000.0d;

    /**
     * Stations within this great-circle diameter collapse into one centroid.
     */
    @Builder.Default
    double maxClusterDiameterKm = 60.0d;
}
