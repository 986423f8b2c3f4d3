package org.chargenet.oracle;

import lombok.NonNull;
import lombok.Value;
import org.chargenet.core.geo.Coordinate;

/**
 * Viewport enclosing a route.
 */
@Value
public class BoundingBox {
    @NonNull
    Coordinate northeast;
    @NonNull
    Coordinate southwest;
}
