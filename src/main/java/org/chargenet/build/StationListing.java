package org.chargenet.build;

import lombok.NonNull;
import lombok.Value;
import org.chargenet.network.ChargeStation;

/**
 * A raw station record with its DC fast charger count.
 */
@Value
public class StationListing {
    @NonNull
    ChargeStation station;
    int dcFastChargerCount;
}
