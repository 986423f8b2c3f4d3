package org.chargenet.trip;

import lombok.NonNull;
import lombok.Value;
import org.chargenet.network.ChargeStation;
import org.chargenet.simulate.LegChargeState;

/**
 * A station that begins a leg of the trip, with its charging state.
 */
@Value
public class TripStop {
    @NonNull
    ChargeStation station;
    @NonNull
    LegChargeState state;
}
