package org.trackstats;

import java.time.Instant;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Flat snapshot of finished {@link TrackStatistics} converted to one unit system, ready to be
 * printed or serialized. Values that are undefined for the track are {@code null}.
 */
public class TrackSummary {

    private String name;
    private String description;
    private String author;
    private String units;
    private int points;
    private int waypoints;
    private double distance;
    private double elevationGain;
    private double elevationLoss;
    private Double elevationMax;
    private Double elevationMin;
    private Double velocityMax;
    private Double velocityMin;
    private Double gradientMax;
    private Double gradientMin;
    private String startTime;
    private String endTime;
    private long totalTime;
    private long movingTime;
    private String totalDuration;
    private String movingDuration;
    private Double movingSpeed;
    private Double totalSpeed;
    private String movingPace;
    private Double averageHeartRate;
    private Double averageCadence;
    private Double averageTemperature;

    TrackSummary() {
    }

    public static TrackSummary of(TrackStatistics stats, UnitSystem unitSystem) {
        if (!stats.isFinished()) {
            throw new IllegalStateException("Statistics are not finished yet");
        }
        TrackSummary summary = new TrackSummary();
        summary.name = stats.getName();
        summary.description = stats.getDescription();
        summary.author = stats.getAuthor();
        summary.units = unitSystem.name().toLowerCase(Locale.ROOT);
        summary.points = stats.getPointCount();
        summary.waypoints = stats.getWaypoints();
        summary.distance = unitSystem.distance(stats.getDistance());
        summary.elevationGain = unitSystem.elevation(stats.getElevationGain());
        summary.elevationLoss = unitSystem.elevation(stats.getElevationLoss());
        summary.elevationMax = elevation(stats.getElevationMax(), unitSystem);
        summary.elevationMin = elevation(stats.getElevationMin(), unitSystem);
        summary.velocityMax = speed(stats.getVelocityMax(), unitSystem);
        summary.velocityMin = speed(stats.getVelocityMin(), unitSystem);
        summary.gradientMax = boxed(stats.getGradientMax());
        summary.gradientMin = boxed(stats.getGradientMin());
        summary.startTime = stats.getStartTime().map(Instant::toString).orElse(null);
        summary.endTime = stats.getEndTime().map(Instant::toString).orElse(null);
        summary.totalTime = stats.getTotalTime();
        summary.movingTime = stats.getMovingTime();
        summary.totalDuration = DurationFormatter.format(stats.getTotalTime());
        summary.movingDuration = DurationFormatter.format(stats.getMovingTime());
        summary.movingSpeed = speed(stats.getMovingSpeed(), unitSystem);
        summary.totalSpeed = speed(stats.getTotalSpeed(), unitSystem);
        summary.movingPace = pace(stats, unitSystem);
        summary.averageHeartRate = boxed(stats.getAverageHeartRate());
        summary.averageCadence = boxed(stats.getAverageCadence());
        summary.averageTemperature = boxed(stats.getAverageTemperature());
        return summary;
    }

    private static Double boxed(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }

    private static Double elevation(OptionalDouble meters, UnitSystem unitSystem) {
        return meters.isPresent() ? unitSystem.elevation(meters.getAsDouble()) : null;
    }

    private static Double speed(OptionalDouble kmh, UnitSystem unitSystem) {
        if (kmh.isEmpty()) {
            return null;
        }
        return unitSystem == UnitSystem.METRIC ? kmh.getAsDouble() : UnitConversions.kmToMiles(kmh.getAsDouble());
    }

    private static String pace(TrackStatistics stats, UnitSystem unitSystem) {
        double length = unitSystem.distance(stats.getDistance());
        if (length <= 0) {
            return null;
        }
        long perUnit = Math.round(stats.getMovingTime() / length);
        return DurationFormatter.format(perUnit) + "/" + unitSystem.getDistanceUnit();
    }

    /** Human readable multi-line rendering. */
    public String toText() {
        String distanceUnit = "metric".equals(units) ? "km" : "mi";
        String elevationUnit = "metric".equals(units) ? "m" : "ft";
        String speedUnit = "metric".equals(units) ? "km/h" : "mph";
        StringBuilder sb = new StringBuilder();
        if (name != null) {
            sb.append("Track: ").append(name).append('\n');
        }
        sb.append(String.format(Locale.US, "Points: %d, waypoints: %d%n", points, waypoints));
        sb.append(String.format(Locale.US, "Distance: %.2f %s%n", distance, distanceUnit));
        sb.append(String.format(Locale.US, "Elevation: +%.0f %s / -%.0f %s, range %s .. %s%n",
                elevationGain, elevationUnit, elevationLoss, elevationUnit,
                format(elevationMin, "%.0f"), format(elevationMax, "%.0f")));
        sb.append(String.format(Locale.US, "Time: total %s, moving %s%n", totalDuration, movingDuration));
        sb.append(String.format(Locale.US, "Speed: moving %s %s, total %s %s, max %s %s%n",
                format(movingSpeed, "%.2f"), speedUnit, format(totalSpeed, "%.2f"), speedUnit,
                format(velocityMax, "%.2f"), speedUnit));
        if (movingPace != null) {
            sb.append("Pace: ").append(movingPace).append('\n');
        }
        sb.append(String.format(Locale.US, "Gradient: %s .. %s %%%n", format(gradientMin, "%.1f"), format(gradientMax, "%.1f")));
        sb.append(String.format(Locale.US, "Averages: hr %s bpm, cadence %s rpm, temperature %s degrees",
                format(averageHeartRate, "%.0f"), format(averageCadence, "%.0f"), format(averageTemperature, "%.1f")));
        return sb.toString();
    }

    private static String format(Double value, String pattern) {
        return value != null ? String.format(Locale.US, pattern, value) : "n/a";
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

    public String getUnits() {
        return units;
    }

    public int getPoints() {
        return points;
    }

    public int getWaypoints() {
        return waypoints;
    }

    public double getDistance() {
        return distance;
    }

    public double getElevationGain() {
        return elevationGain;
    }

    public double getElevationLoss() {
        return elevationLoss;
    }

    public Double getElevationMax() {
        return elevationMax;
    }

    public Double getElevationMin() {
        return elevationMin;
    }

    public Double getVelocityMax() {
        return velocityMax;
    }

    public Double getVelocityMin() {
        return velocityMin;
    }

    public Double getGradientMax() {
        return gradientMax;
    }

    public Double getGradientMin() {
        return gradientMin;
    }

    public String getStartTime() {
        return startTime;
    }

    public String getEndTime() {
        return endTime;
    }

    public long getTotalTime() {
        return totalTime;
    }

    public long getMovingTime() {
        return movingTime;
    }

    public String getTotalDuration() {
        return totalDuration;
    }

    public String getMovingDuration() {
        return movingDuration;
    }

    public Double getMovingSpeed() {
        return movingSpeed;
    }

    public Double getTotalSpeed() {
        return totalSpeed;
    }

    public String getMovingPace() {
        return movingPace;
    }

    public Double getAverageHeartRate() {
        return averageHeartRate;
    }

    public Double getAverageCadence() {
        return averageCadence;
    }

    public Double getAverageTemperature() {
        return averageTemperature;
    }
}
