package org.chargenet.core.geo;

import lombok.experimental.UtilityClass;

/**
 * Great-circle distance helpers shared by clustering and path search.
 *
 * <p>All inputs are degrees. Results are symmetric bit-for-bit: only absolute
 * coordinate differences and commutative products enter the formula, so swapping
 * the operands never changes the floating-point evaluation order.</p>
 */
@UtilityClass
public final class GeoMath {
    public static final double EARTH_MEAN_RADIUS_KM = 6_371.0d;
    public static final double METERS_PER_KM = 1_000.0d;

    /**
     * Computes great-circle distance in kilometers using the haversine formulation.
     */
    public static double greatCircleDistanceKm(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        double lat1Rad = Math.toRadians(lat1Deg);
        double lat2Rad = Math.toRadians(lat2Deg);
        double deltaLatRad = Math.toRadians(Math.abs(lat1Deg - lat2Deg));
        double deltaLonRad = Math.toRadians(wrapDeltaLongitudeDegrees(Math.abs(lon1Deg - lon2Deg)));

        double a = haversine(deltaLatRad) + Math.cos(lat1Rad) * Math.cos(lat2Rad) * haversine(deltaLonRad);
        double c = 2.0d * Math.asin(Math.sqrt(clamp(a, 0.0d, 1.0d)));
        return EARTH_MEAN_RADIUS_KM * c;
    }

    public static double greatCircleDistanceKm(Coordinate p1, Coordinate p2) {
        return greatCircleDistanceKm(p1.getLatitude(), p1.getLongitude(), p2.getLatitude(), p2.getLongitude());
    }

    /**
     * Computes great-circle distance in meters.
     */
    public static double greatCircleDistanceMeters(Coordinate p1, Coordinate p2) {
        return greatCircleDistanceKm(p1, p2) * METERS_PER_KM;
    }

    public static double greatCircleDistanceMeters(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        return greatCircleDistanceKm(lat1Deg, lon1Deg, lat2Deg, lon2Deg) * METERS_PER_KM;
    }

    /**
     * Folds an absolute longitude delta into {@code [0, 180]} so pairs straddling
     * the anti-meridian take the short way round.
     */
    static double wrapDeltaLongitudeDegrees(double absDeltaLonDeg) {
        double wrapped = absDeltaLonDeg % 360.0d;
        return wrapped > 180.0d ? 360.0d - wrapped : wrapped;
    }

    private static double haversine(double angleRad) {
        double s = Math.sin(angleRad * 0.5d);
        return s * s;
    }

    private static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}
