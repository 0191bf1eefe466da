package org.trackstats;

import java.util.OptionalDouble;

/**
 * Running minimum and maximum of a series. Each bound stays unset until a value is offered to it.
 */
public final class Extremes {

    private boolean hasMin;
    private boolean hasMax;
    private double min;
    private double max;

    /** Offers {@code value} to both bounds. */
    void expand(double value) {
        offerMin(value);
        offerMax(value);
    }

    void offerMin(double value) {
        if (!hasMin || value < min) {
            min = value;
            hasMin = true;
        }
    }

    void offerMax(double value) {
        if (!hasMax || value > max) {
            max = value;
            hasMax = true;
        }
    }

    public OptionalDouble getMin() {
        return hasMin ? OptionalDouble.of(min) : OptionalDouble.empty();
    }

    public OptionalDouble getMax() {
        return hasMax ? OptionalDouble.of(max) : OptionalDouble.empty();
    }

    @Override
    public String toString() {
        return "[" + (hasMin ? min : "-") + ", " + (hasMax ? max : "-") + "]";
    }
}
