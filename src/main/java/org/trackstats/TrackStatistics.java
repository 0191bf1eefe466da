package org.trackstats;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Aggregated statistics of one track document, possibly made of several tracks, routes and
 * segments.
 * <p>
 * Instances are filled by {@link TrackStatisticsAggregator} and are read-only for callers once
 * {@link #isFinished()} returns {@code true}. Extrema and averages are empty until a sample
 * contributed to them.
 */
public class TrackStatistics {

    private final List<ProcessedTrackPoint> points = new ArrayList<>();
    private final Extremes elevation = new Extremes();
    private final Extremes velocity = new Extremes();
    private final Extremes gradient = new Extremes();
    private final SensorAverage heartRate = new SensorAverage();
    private final SensorAverage cadence = new SensorAverage();
    private final SensorAverage temperature = new SensorAverage();

    private String name;
    private String description;
    private String author;
    private String copyright;

    private double distance;
    private double elevationGain;
    private double elevationLoss;
    private Instant startTime;
    private Instant endTime;
    private long totalTime;
    private long movingTime;
    private int waypoints;
    private boolean finished;

    // --- mutation, reserved to the aggregator ---

    void addPoint(ProcessedTrackPoint point) {
        points.add(point);
    }

    void addDistance(double delta) {
        distance += delta;
    }

    void addElevationChange(double delta) {
        if (delta > 0) {
            elevationGain += delta;
        } else {
            elevationLoss += -delta;
        }
    }

    void addTotalTime(long millis) {
        totalTime += millis;
    }

    void addMovingTime(long millis) {
        movingTime += millis;
    }

    void setStartTime(Instant startTime) {
        this.startTime = startTime;
    }

    void setEndTime(Instant endTime) {
        this.endTime = endTime;
    }

    void setInfo(TrackDocument.Info info) {
        this.name = info.getName();
        this.description = info.getDescription();
        this.author = info.getAuthor();
        this.copyright = info.getCopyright();
    }

    Extremes elevationExtremes() {
        return elevation;
    }

    Extremes velocityExtremes() {
        return velocity;
    }

    Extremes gradientExtremes() {
        return gradient;
    }

    SensorAverage heartRateSum() {
        return heartRate;
    }

    SensorAverage cadenceSum() {
        return cadence;
    }

    SensorAverage temperatureSum() {
        return temperature;
    }

    void finish() {
        int count = points.size();
        heartRate.finish(count);
        cadence.finish(count);
        temperature.finish(count);
        finished = true;
    }

    /**
     * Counts a waypoint of the document. Waypoints are handled outside of the point aggregation
     * and must be counted before the statistics are finished.
     *
     * @throws IllegalStateException if the statistics are already finished
     */
    public void incrementWaypoints() {
        if (finished) {
            throw new IllegalStateException("Statistics already finished, waypoints can no longer be counted");
        }
        waypoints++;
    }

    // --- read API ---

    public boolean isFinished() {
        return finished;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getAuthor() {
        return author;
    }

    public String getCopyright() {
        return copyright;
    }

    /** Total 3D distance in meters. */
    public double getDistance() {
        return distance;
    }

    public double getElevationGain() {
        return elevationGain;
    }

    public double getElevationLoss() {
        return elevationLoss;
    }

    public OptionalDouble getElevationMax() {
        return elevation.getMax();
    }

    public OptionalDouble getElevationMin() {
        return elevation.getMin();
    }

    /** Fastest admitted leg in km/h. */
    public OptionalDouble getVelocityMax() {
        return velocity.getMax();
    }

    /** Slowest admitted leg in km/h, stationary legs excluded. */
    public OptionalDouble getVelocityMin() {
        return velocity.getMin();
    }

    public OptionalDouble getGradientMax() {
        return gradient.getMax();
    }

    public OptionalDouble getGradientMin() {
        return gradient.getMin();
    }

    public Optional<Instant> getStartTime() {
        return Optional.ofNullable(startTime);
    }

    public Optional<Instant> getEndTime() {
        return Optional.ofNullable(endTime);
    }

    /** Sum of all time steps in milliseconds. */
    public long getTotalTime() {
        return totalTime;
    }

    /** Sum of the time steps shorter than the max point interval, in milliseconds. */
    public long getMovingTime() {
        return movingTime;
    }

    public OptionalDouble getAverageHeartRate() {
        return heartRate.getAverage();
    }

    public OptionalDouble getAverageCadence() {
        return cadence.getAverage();
    }

    public OptionalDouble getAverageTemperature() {
        return temperature.getAverage();
    }

    public int getWaypoints() {
        return waypoints;
    }

    public int getPointCount() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    /** Average speed over the moving time, in km/h. */
    public OptionalDouble getMovingSpeed() {
        return speed(movingTime);
    }

    /** Average speed over the total time, in km/h. */
    public OptionalDouble getTotalSpeed() {
        return speed(totalTime);
    }

    /** Moving time per kilometer, in milliseconds. */
    public OptionalDouble getMovingPace() {
        if (distance <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(movingTime / UnitConversions.metersToKm(distance));
    }

    private OptionalDouble speed(long millis) {
        if (millis <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(UnitConversions.metersToKm(distance) / UnitConversions.millisToHours(millis));
    }

    public ProcessedTrackPoint getPoint(int index) {
        return points.get(index);
    }

    public List<ProcessedTrackPoint> getPoints() {
        return Collections.unmodifiableList(points);
    }

    /**
     * Finds the processed point closest to a coordinate.
     *
     * @param approximate compare with {@code |dlat| + |dlon|} instead of the haversine distance
     * @return index of the closest point, empty when the track has no points
     */
    public OptionalInt closestPointIndex(double latitude, double longitude, boolean approximate) {
        if (points.isEmpty()) {
            return OptionalInt.empty();
        }
        int best = 0;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int i = 0; i < points.size(); i++) {
            TrackPoint p = points.get(i).getPoint();
            double d = approximate
                    ? Math.abs(latitude - p.getLatitude()) + Math.abs(longitude - p.getLongitude())
                    : GeoDistance.haversineDistance(latitude, longitude, p.getLatitude(), p.getLongitude());
            if (d < bestDistance) {
                best = i;
                bestDistance = d;
            }
        }
        return OptionalInt.of(best);
    }

    /**
     * Chart data for one metric along the track, one entry per point in track order.
     * The returned series is lazy and can be iterated any number of times.
     */
    public ChartSeries series(ChartSeries.Metric metric, ChartSeries.XAxis axis, UnitSystem units) {
        return new ChartSeries(getPoints(), metric, axis, units);
    }

    public ChartSeries series(ChartSeries.Metric metric, ChartSeries.XAxis axis) {
        return series(metric, axis, UnitSystem.METRIC);
    }
}
