package org.chargenet.simulate;

/**
 * Time-to-charge curve of a vehicle.
 *
 * <p>{@link #secondsToCharge(double)} is the time to charge an empty battery to
 * {@code level}; it must be monotonically non-decreasing. The simulation may ask for
 * levels above {@code 1.0} when oracle distances exceed the planned ones, so
 * implementations must stay defined (and monotonic) there.</p>
 */
@FunctionalInterface
public interface ChargeCurve {

    /**
     * Seconds to charge from {@code 0.0} to {@code level}.
     */
    double secondsToCharge(double level);

    /**
     * Seconds to charge from {@code fromLevel} to {@code toLevel}.
     */
    default double chargeSeconds(double fromLevel, double toLevel) {
        return secondsToCharge(toLevel) - secondsToCharge(fromLevel);
    }
}
