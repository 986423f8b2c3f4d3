package org.chargenet.build;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.chargenet.network.ChargeNetwork;

/**
 * Finished network plus the counts of each pipeline stage.
 */
@Value
@Builder
public class NetworkBuildReport {
    @NonNull
    ChargeNetwork network;
    int listedStations;
    int qualifyingStations;
    int centroidStations;
    int candidateLegs;
    int resolvedLegs;
    int committedLegs;
}
