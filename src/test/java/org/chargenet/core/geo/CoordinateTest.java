package org.chargenet.core.geo;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Coordinate Tests")
class CoordinateTest {

    @Test
    @DisplayName("Validated coordinate keeps its components")
    void testValidated() {
        Coordinate coordinate = Coordinate.validated(-90.0d, 180.0d);

        assertEquals(-90.0d, coordinate.getLatitude());
        assertEquals(180.0d, coordinate.getLongitude());
        assertEquals(new Coordinate(-90.0d, 180.0d), coordinate);
    }

    @ParameterizedTest
    @CsvSource({"90.5, 0", "-91, 0", "0, 180.01", "0, -181", "NaN, 0", "0, NaN"})
    @DisplayName("Out-of-range components are rejected with a reason code")
    void testOutOfRange(double latitude, double longitude) {
        InvalidCoordinateException ex = assertThrows(InvalidCoordinateException.class,
                () -> Coordinate.validated(latitude, longitude));

        assertEquals(InvalidCoordinateException.REASON_CODE, ex.getReasonCode());
    }
}
