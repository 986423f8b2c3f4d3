package org.chargenet.core.geo;

import lombok.Value;

/**
 * Geodetic latitude/longitude pair in degrees.
 *
 * <p>The plain constructor performs no range checks (callers own that contract);
 * use {@link #validated(double, double)} at trust boundaries.</p>
 */
@Value
public class Coordinate {
    double latitude;
    double longitude;

    /**
     * Creates a coordinate after checking {@code -90 <= lat <= 90} and
     * {@code -180 <= lng <= 180}.
     *
     * @throws InvalidCoordinateException when either component is out of range or NaN.
     */
    public static Coordinate validated(double latitude, double longitude) {
        if (!(latitude >= -90.0d && latitude <= 90.0d)) {
            throw new InvalidCoordinateException("latitude out of range [-90, 90]: " + latitude);
        }
        if (!(longitude >= -180.0d && longitude <= 180.0d)) {
            throw new InvalidCoordinateException("longitude out of range [-180, 180]: " + longitude);
        }
        return new Coordinate(latitude, longitude);
    }

    @Override
    public String toString() {
        return "(" + latitude + ", " + longitude + ")";
    }
}
