package org.chargenet.persist;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Vertices keyed by export id, plus the deduplicated leg list.
 */
@JsonPropertyOrder({"charge_stations", "legs"})
public final class GraphDocument {
    private final Map<String, StationDocument> chargeStations;
    private final List<LegDocument> legs;

    @JsonCreator
    public GraphDocument(
            @JsonProperty("charge_stations") Map<String, StationDocument> chargeStations,
            @JsonProperty("legs") List<LegDocument> legs) {
        this.chargeStations = chargeStations == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(chargeStations));
        this.legs = legs == null ? List.of() : Collections.unmodifiableList(legs);
    }

    @JsonProperty("charge_stations")
    public Map<String, StationDocument> getChargeStations() {
        return chargeStations;
    }

    @JsonProperty("legs")
    public List<LegDocument> getLegs() {
        return legs;
    }
}
