package org.chargenet.persist;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * One undirected leg: two endpoint ids, road distance in meters and driving time in seconds.
 */
@JsonPropertyOrder({"endpoint_ids", "driving_distance", "driving_time"})
public final class LegDocument {
    private final List<String> endpointIds;
    private final double drivingDistance;
    private final double drivingTime;

    @JsonCreator
    public LegDocument(
            @JsonProperty(value = "endpoint_ids", required = true) List<String> endpointIds,
            @JsonProperty(value = "driving_distance", required = true) double drivingDistance,
            @JsonProperty(value = "driving_time", required = true) double drivingTime) {
        this.endpointIds = endpointIds == null ? List.of() : List.copyOf(endpointIds);
        this.drivingDistance = drivingDistance;
        this.drivingTime = drivingTime;
    }

    @JsonProperty("endpoint_ids")
    public List<String> getEndpointIds() {
        return endpointIds;
    }

    @JsonProperty("driving_distance")
    public double getDrivingDistance() {
        return drivingDistance;
    }

    @JsonProperty("driving_time")
    public double getDrivingTime() {
        return drivingTime;
    }
}
