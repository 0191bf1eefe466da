package org.trackstats;

/**
 * Values derived for a single point while the track is aggregated.
 */
public final class PointMetadata {

    private final double cumulativeDistance;
    private final long cumulativeTime;
    private final double velocity;
    private final Double gradient;

    PointMetadata(double cumulativeDistance, long cumulativeTime, double velocity, Double gradient) {
        this.cumulativeDistance = cumulativeDistance;
        this.cumulativeTime = cumulativeTime;
        this.velocity = velocity;
        this.gradient = gradient;
    }

    /** Distance in meters from the track start up to, not including, this point's own leg. */
    public double getCumulativeDistance() {
        return cumulativeDistance;
    }

    /** Elapsed milliseconds from the track start. */
    public long getCumulativeTime() {
        return cumulativeTime;
    }

    /** Speed in km/h since the previous point, 0 when unknown. */
    public double getVelocity() {
        return velocity;
    }

    /** Slope in percent since the last elevation reference, {@code null} while undefined. */
    public Double getGradient() {
        return gradient;
    }

    @Override
    public String toString() {
        return "PointMetadata{cumdist=" + cumulativeDistance + ", cumtime=" + cumulativeTime
                + ", vel=" + velocity + ", grd=" + gradient + "}";
    }
}
