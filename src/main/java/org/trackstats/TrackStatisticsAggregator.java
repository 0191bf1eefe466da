package org.trackstats;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Computes {@link TrackStatistics} in a single forward pass over the points of one document.
 * <p>
 * The previous point and the last elevation reference are carried across segments, so a
 * document split into several segments (or tracks and routes) gives the same result as one
 * segment holding all its points: the step between the last point of a segment and the first
 * point of the next one counts towards distance and time.
 * <p>
 * An instance handles exactly one document and is not thread-safe; use {@link #reset()} or a new
 * instance for the next document.
 */
public class TrackStatisticsAggregator {

    private static final Logger LOGGER = LoggerFactory.getLogger(TrackStatisticsAggregator.class);

    private final TrackStatisticsOptions options;

    private TrackStatistics stats;
    private ProcessedTrackPoint lastPoint;
    private TrackPoint elevationReference;
    private Double referenceGradient;

    public TrackStatisticsAggregator(TrackStatisticsOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        reset();
    }

    public TrackStatisticsAggregator() {
        this(TrackStatisticsOptions.defaults());
    }

    /**
     * Aggregates a complete document and finalizes the result.
     */
    public static TrackStatistics compute(TrackDocument document, TrackStatisticsOptions options) {
        TrackStatisticsAggregator aggregator = new TrackStatisticsAggregator(options);
        aggregator.getStatistics().setInfo(document.getInfo());
        for (List<TrackPoint> segment : document.getSegments()) {
            aggregator.processSegment(segment);
        }
        for (int i = 0; i < document.getWaypoints(); i++) {
            aggregator.getStatistics().incrementWaypoints();
        }
        return aggregator.finish();
    }

    /** Drops all state and starts a new, empty document. */
    public void reset() {
        stats = new TrackStatistics();
        lastPoint = null;
        elevationReference = null;
        referenceGradient = null;
    }

    public TrackStatisticsOptions getOptions() {
        return options;
    }

    /**
     * The statistics being built. Values are partial until {@link #finish()} has been called.
     */
    public TrackStatistics getStatistics() {
        return stats;
    }

    public void processSegment(List<TrackPoint> segment) {
        LOGGER.debug("Processing segment of {} points", segment.size());
        for (TrackPoint point : segment) {
            process(point);
        }
    }

    /**
     * Adds one point to the statistics.
     *
     * @return the point with its derived metadata
     * @throws IllegalStateException if the document was already finished
     */
    public ProcessedTrackPoint process(TrackPoint point) {
        Objects.requireNonNull(point, "point");
        if (stats.isFinished()) {
            throw new IllegalStateException("Statistics already finished, reset() before processing a new document");
        }

        double cumulativeDistance = stats.getDistance();
        long cumulativeTime = 0;
        double velocity = 0;

        if (point.hasElevation()) {
            stats.elevationExtremes().expand(point.getElevation());
        }

        if (lastPoint != null) {
            TrackPoint previous = lastPoint.getPoint();
            double distance = GeoDistance.spatialDistance(previous, point);
            stats.addDistance(distance);

            long dt = Math.abs(point.getTimestamp() - previous.getTimestamp());
            stats.addTotalTime(dt);
            if (dt < options.getMaxPointInterval()) {
                stats.addMovingTime(dt);
                if (dt > 0) {
                    velocity = 3600 * distance / dt; // m per ms to km/h
                    stats.velocityExtremes().offerMax(velocity);
                    if (velocity > 0) {
                        stats.velocityExtremes().offerMin(velocity);
                    }
                } else {
                    LOGGER.trace("Zero time step at {}, velocity left undefined", point);
                }
            }
            cumulativeTime = lastPoint.getMetadata().getCumulativeTime() + dt;
        } else if (stats.getStartTime().isEmpty()) {
            stats.setStartTime(point.getTime());
        }

        Double gradient = filterElevation(point);

        stats.heartRateSum().add(point.getHeartRate());
        stats.cadenceSum().add(point.getCadence());
        stats.temperatureSum().add(point.getTemperature());
        stats.setEndTime(point.getTime());

        ProcessedTrackPoint processed = new ProcessedTrackPoint(point,
                new PointMetadata(cumulativeDistance, cumulativeTime, velocity, gradient));
        stats.addPoint(processed);
        lastPoint = processed;
        return processed;
    }

    /**
     * Counts elevation changes larger than the noise threshold against the last reference point
     * and returns the gradient of {@code point}.
     */
    private Double filterElevation(TrackPoint point) {
        if (!point.hasElevation()) {
            return referenceGradient;
        }
        if (elevationReference == null) {
            elevationReference = point;
            referenceGradient = null;
            return null;
        }

        double rise = point.getElevation() - elevationReference.getElevation();
        if (Math.abs(rise) <= options.getElevationThreshold()) {
            return referenceGradient;
        }

        stats.addElevationChange(rise);

        double distance = GeoDistance.spatialDistance(elevationReference, point);
        double run = distance * distance - rise * rise;
        Double gradient = null;
        if (run > 0) {
            double value = 100 * rise / Math.sqrt(run);
            if (Double.isFinite(value)) {
                gradient = value;
                stats.gradientExtremes().expand(value);
            }
        }
        if (gradient == null) {
            LOGGER.trace("No horizontal run between {} and {}, gradient undefined", elevationReference, point);
        }

        elevationReference = point;
        referenceGradient = gradient;
        return gradient;
    }

    /**
     * Computes the averages and marks the statistics read-only. Calling it again returns the same
     * instance.
     */
    public TrackStatistics finish() {
        if (!stats.isFinished()) {
            stats.finish();
            if (stats.isEmpty()) {
                LOGGER.debug("Finished empty track, no averages computed");
            } else {
                LOGGER.debug("Finished track of {} points: {} m, total {} ms, moving {} ms",
                        stats.getPointCount(), stats.getDistance(), stats.getTotalTime(), stats.getMovingTime());
            }
        }
        return stats;
    }
}
