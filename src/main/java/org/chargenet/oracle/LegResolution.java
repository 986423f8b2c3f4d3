package org.chargenet.oracle;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.chargenet.network.Leg;
import org.chargenet.network.StationPair;

import java.util.List;

/**
 * Outcome of resolving a batch of candidate pairs.
 */
@Value
@Builder
public class LegResolution {
    @Singular
    List<Leg> resolvedLegs;
    @Singular
    List<StationPair> failedPairs;
    int attempted;
}
