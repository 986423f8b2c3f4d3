package org.chargenet.oracle;

import lombok.extern.slf4j.Slf4j;
import org.chargenet.network.Leg;
import org.chargenet.network.StationPair;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Resolves candidate station pairs into driving legs, one oracle call per pair.
 *
 * <p>The whole batch is put through a {@link BatchConfirmation} gate first, since each
 * call is billable. Pairs whose call fails or returns a malformed answer are logged and
 * dropped; the rest of the batch still resolves.</p>
 */
@Slf4j
public final class LegResolver {
    private final RoutingOracle oracle;
    private final BatchConfirmation confirmation;

    public LegResolver(RoutingOracle oracle, BatchConfirmation confirmation) {
        this.oracle = Objects.requireNonNull(oracle, "oracle");
        this.confirmation = Objects.requireNonNull(confirmation, "confirmation");
    }

    /**
     * Resolves every pair in iteration order.
     *
     * @throws BatchDeclinedException when the gate declines; no oracle call is made.
     */
    public LegResolution resolve(Collection<StationPair> pairs) {
        Objects.requireNonNull(pairs, "pairs");
        int callCount = pairs.size();
        if (!confirmation.confirm(callCount)) {
            throw new BatchDeclinedException(callCount);
        }

        LegResolution.LegResolutionBuilder resolution = LegResolution.builder().attempted(callCount);
        int resolved = 0;
        for (StationPair pair : pairs) {
            try {
                resolution.resolvedLeg(resolveOne(pair));
                resolved++;
            } catch (RuntimeException ex) {
                log.warn("dropping leg {}: {}", pair, ex.getMessage());
                resolution.failedPair(pair);
            }
        }
        log.info("successfully completed {}/{} legs", resolved, callCount);
        return resolution.build();
    }

    private Leg resolveOne(StationPair pair) {
        Directions directions = oracle.directions(List.of(
                pair.first().coordinate(), pair.second().coordinate()));
        if (directions == null || directions.getLegs().isEmpty()) {
            throw new RoutingOracleException("no route returned for " + pair);
        }
        DirectionsLeg leg = directions.getLegs().get(0);
        if (!leg.isWellFormed()) {
            throw new RoutingOracleException("malformed leg " + leg + " returned for " + pair);
        }
        return pair.resolve(leg.getDistanceMeters(), leg.getDurationSeconds());
    }
}
