package org.chargenet.network;

import lombok.Builder;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.chargenet.core.geo.Coordinate;
import org.chargenet.core.geo.GeoMath;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable charge-station vertex.
 *
 * <p>Equality is object identity: two stations carrying identical fields remain
 * distinct vertices (duplicate coordinates are legal). {@code equals} and
 * {@code hashCode} are deliberately inherited from {@link Object}.</p>
 */
@Getter
@Accessors(fluent = true)
public final class ChargeStation {
    public static final String NOT_AVAILABLE = "not available";
    private static final DateTimeFormatter DISPLAY_DATE = DateTimeFormatter.ofPattern("MMMM d yyyy", Locale.ENGLISH);

    private final String name;
    private final String address;
    private final String hours;
    private final String phone;
    private final double latitude;
    private final double longitude;
    private final LocalDate openDate;

    @Builder
    public ChargeStation(
            String name,
            String address,
            String hours,
            String phone,
            double latitude,
            double longitude,
            LocalDate openDate
    ) {
        this.name = name;
        this.address = address;
        this.hours = hours;
        this.phone = phone;
        this.latitude = latitude;
        this.longitude = longitude;
        this.openDate = openDate;
    }

    /**
     * Creates an anonymous station at the given coordinate.
     */
    public static ChargeStation at(double latitude, double longitude) {
        return new ChargeStation(null, null, null, null, latitude, longitude, null);
    }

    public Coordinate coordinate() {
        return new Coordinate(latitude, longitude);
    }

    public double greatCircleKmTo(ChargeStation other) {
        return GeoMath.greatCircleDistanceKm(latitude, longitude, other.latitude, other.longitude);
    }

    public double greatCircleMetersTo(ChargeStation other) {
        return GeoMath.greatCircleDistanceMeters(latitude, longitude, other.latitude, other.longitude);
    }

    /**
     * Returns user-facing fields in display order; missing values read {@value #NOT_AVAILABLE}.
     */
    public Map<String, String> displayFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("name", orNotAvailable(name));
        fields.put("address", orNotAvailable(address));
        fields.put("hours", orNotAvailable(hours));
        fields.put("phone", orNotAvailable(phone));
        fields.put("lat", Double.toString(latitude));
        fields.put("lng", Double.toString(longitude));
        fields.put("open_date", openDate == null ? NOT_AVAILABLE : DISPLAY_DATE.format(openDate));
        return fields;
    }

    private static String orNotAvailable(String value) {
        return value == null ? NOT_AVAILABLE : value;
    }

    @Override
    public String toString() {
        return "ChargeStation{" + (name == null ? "" : name + " ") + "@" + latitude + "," + longitude + "}";
    }
}
