package org.trackstats;

import java.util.Properties;

/**
 * Tuning of the statistics pass.
 * <ul>
 *   <li>{@code maxPointInterval}: time steps of this length or longer (ms) count as a pause and
 *   are left out of the moving time and velocity extrema. Default 15000.</li>
 *   <li>{@code elevationThreshold}: elevation changes up to this size (m) are treated as sensor
 *   noise by the gain/loss and gradient computation. Default 4.</li>
 * </ul>
 * Zero or negative values select the default.
 */
public final class TrackStatisticsOptions {

    public static final long DEFAULT_MAX_POINT_INTERVAL_MS = 15000;
    public static final double DEFAULT_ELEVATION_THRESHOLD_M = 4; // approximate noise level of GPS elevation data

    public static final String MAX_POINT_INTERVAL_KEY = "trackstats.max-point-interval-ms";
    public static final String ELEVATION_THRESHOLD_KEY = "trackstats.elevation-threshold-m";

    private final long maxPointInterval;
    private final double elevationThreshold;

    public TrackStatisticsOptions(long maxPointInterval, double elevationThreshold) {
        this.maxPointInterval = maxPointInterval > 0 ? maxPointInterval : DEFAULT_MAX_POINT_INTERVAL_MS;
        this.elevationThreshold = elevationThreshold > 0 ? elevationThreshold : DEFAULT_ELEVATION_THRESHOLD_M;
    }

    public static TrackStatisticsOptions defaults() {
        return new TrackStatisticsOptions(DEFAULT_MAX_POINT_INTERVAL_MS, DEFAULT_ELEVATION_THRESHOLD_M);
    }

    /**
     * Reads the options from {@link #MAX_POINT_INTERVAL_KEY} and {@link #ELEVATION_THRESHOLD_KEY}.
     *
     * @throws IllegalArgumentException if a value is present but not a number
     */
    public static TrackStatisticsOptions fromProperties(Properties props) {
        long interval = parseLong(props.getProperty(MAX_POINT_INTERVAL_KEY), DEFAULT_MAX_POINT_INTERVAL_MS, MAX_POINT_INTERVAL_KEY);
        double threshold = parseDouble(props.getProperty(ELEVATION_THRESHOLD_KEY), DEFAULT_ELEVATION_THRESHOLD_M, ELEVATION_THRESHOLD_KEY);
        return new TrackStatisticsOptions(interval, threshold);
    }

    private static long parseLong(String value, long fallback, String key) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    private static double parseDouble(String value, double fallback, String key) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    public long getMaxPointInterval() {
        return maxPointInterval;
    }

    public double getElevationThreshold() {
        return elevationThreshold;
    }

    @Override
    public String toString() {
        return "TrackStatisticsOptions{maxPointInterval=" + maxPointInterval + "ms, elevationThreshold=" + elevationThreshold + "m}";
    }
}
