package org.chargenet.persist;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One charge station record. {@code open_date} is ISO {@code YYYY-MM-DD} or {@code null}.
 */
@JsonPropertyOrder({"name", "address", "hours", "phone", "lat", "lng", "open_date"})
public final class StationDocument {
    private final String name;
    private final String address;
    private final String hours;
    private final String phone;
    private final Double lat;
    private final Double lng;
    private final String openDate;

    @JsonCreator
    public StationDocument(
            @JsonProperty("name") String name,
            @JsonProperty("address") String address,
            @JsonProperty("hours") String hours,
            @JsonProperty("phone") String phone,
            @JsonProperty(value = "lat", required = true) Double lat,
            @JsonProperty(value = "lng", required = true) Double lng,
            @JsonProperty("open_date") String openDate) {
        this.name = name;
        this.address = address;
        this.hours = hours;
        this.phone = phone;
        this.lat = lat;
        this.lng = lng;
        this.openDate = openDate;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("address")
    public String getAddress() {
        return address;
    }

    @JsonProperty("hours")
    public String getHours() {
        return hours;
    }

    @JsonProperty("phone")
    public String getPhone() {
        return phone;
    }

    @JsonProperty("lat")
    public Double getLat() {
        return lat;
    }

    @JsonProperty("lng")
    public Double getLng() {
        return lng;
    }

    @JsonProperty("open_date")
    public String getOpenDate() {
        return openDate;
    }
}
