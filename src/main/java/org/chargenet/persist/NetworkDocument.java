package org.chargenet.persist;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Top-level JSON document of an exported network.
 */
@JsonPropertyOrder({"min_chargers_at_station", "ev_range", "graph"})
public final class NetworkDocument {
    private final int minChargersAtStation;
    private final double evRange;
    private final GraphDocument graph;

    @JsonCreator
    public NetworkDocument(
            @JsonProperty(value = "min_chargers_at_station", required = true) int minChargersAtStation,
            @JsonProperty(value = "ev_range", required = true) double evRange,
            @JsonProperty(value = "graph", required = true) @JsonAlias("_graph") GraphDocument graph) {
        this.minChargersAtStation = minChargersAtStation;
        this.evRange = evRange;
        this.graph = graph;
    }

    @JsonProperty("min_chargers_at_station")
    public int getMinChargersAtStation() {
        return minChargersAtStation;
    }

    /**
     * Leg range in meters.
     */
    @JsonProperty("ev_range")
    public double getEvRange() {
        return evRange;
    }

    @JsonProperty("graph")
    public GraphDocument getGraph() {
        return graph;
    }
}
