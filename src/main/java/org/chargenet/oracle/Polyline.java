package org.chargenet.oracle;

import lombok.experimental.UtilityClass;
import org.chargenet.core.geo.Coordinate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decoder for Google's encoded polyline format (1e-5 degree precision).
 */
@UtilityClass
public final class Polyline {

    /**
     * Decodes {@code encoded} into its coordinate sequence.
     *
     * @throws IllegalArgumentException when the string ends inside a value, holds a
     *                                  character outside {@code '?'..'~'}, or encodes a
     *                                  value wider than 32 bits.
     */
    public static List<Coordinate> decode(String encoded) {
        Objects.requireNonNull(encoded, "encoded");
        List<Coordinate> path = new ArrayList<>();
        int[] cursor = {0};
        int lat = 0;
        int lng = 0;
        while (cursor[0] < encoded.length()) {
            lat += nextDelta(encoded, cursor);
            lng += nextDelta(encoded, cursor);
            path.add(new Coordinate(lat / 1E5, lng / 1E5));
        }
        return path;
    }

    private static int nextDelta(String encoded, int[] cursor) {
        int shift = 0;
        int result = 0;
        int b;
        do {
            if (cursor[0] >= encoded.length()) {
                throw new IllegalArgumentException("truncated polyline at index " + cursor[0]);
            }
            if (shift > 30) {
                throw new IllegalArgumentException("polyline value overflows at index " + cursor[0]);
            }
            b = encoded.charAt(cursor[0]) - 63;
            if (b < 0 || b > 63) {
                throw new IllegalArgumentException("invalid polyline character '" + encoded.charAt(cursor[0])
                        + "' at index " + cursor[0]);
            }
            cursor[0]++;
            result |= (b & 0x1f) << shift;
            shift += 5;
        } while (b >= 0x20);
        return (result & 1) != 0 ? ~(result >> 1) : (result >> 1);
    }
}
