package org.trackstats;

import java.util.OptionalDouble;

/**
 * Running sum of an optional sensor reading (heart rate, cadence, temperature).
 * <p>
 * The average divides by the number of points of the whole document, not by the number of
 * readings, so points without the reading pull the average down. A document where no point
 * carries a finite reading has no average.
 */
public final class SensorAverage {

    private double total;
    private int samples;
    private OptionalDouble average = OptionalDouble.empty();

    void add(Number value) {
        if (value != null && Double.isFinite(value.doubleValue())) {
            total += value.doubleValue();
            samples++;
        }
    }

    void finish(int pointCount) {
        average = pointCount > 0 && samples > 0 ? OptionalDouble.of(total / pointCount) : OptionalDouble.empty();
    }

    public OptionalDouble getAverage() {
        return average;
    }
}
