package org.trackstats;

import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * A metric plotted against cumulative distance or time, one {@link ChartPoint} per track point.
 * <p>
 * Entries are computed while iterating; every call to {@link #iterator()} starts over.
 */
public final class ChartSeries implements Iterable<ChartSeries.ChartPoint> {

    public enum Metric {
        ELEVATION(p -> p.getElevation(), null),
        HEART_RATE(p -> toDouble(p.getHeartRate()), "bpm"),
        CADENCE(p -> toDouble(p.getCadence()), "rpm"),
        TEMPERATURE(p -> p.getTemperature(), "degrees");

        private final Function<TrackPoint, Double> reader;
        private final String unit; // null: elevation unit of the unit system

        Metric(Function<TrackPoint, Double> reader, String unit) {
            this.reader = reader;
            this.unit = unit;
        }

        Double read(TrackPoint point, UnitSystem units) {
            Double value = reader.apply(point);
            if (value == null || !Double.isFinite(value)) {
                return null;
            }
            return this == ELEVATION ? units.elevation(value) : value;
        }

        String unit(UnitSystem units) {
            return unit != null ? unit : units.getElevationUnit();
        }

        private static Double toDouble(Integer value) {
            return value != null ? value.doubleValue() : null;
        }
    }

    public enum XAxis {
        DISTANCE,
        TIME
    }

    /** One chart sample: converted x and y plus a ready-made tooltip label. */
    public static final class ChartPoint {
        private final double x;
        private final Double y;
        private final String label;

        ChartPoint(double x, Double y, String label) {
            this.x = x;
            this.y = y;
            this.label = label;
        }

        public double getX() {
            return x;
        }

        /** The metric value, {@code null} when the point does not carry it. */
        public Double getY() {
            return y;
        }

        public String getLabel() {
            return label;
        }

        @Override
        public String toString() {
            return "(" + x + ", " + y + ", " + label + ")";
        }
    }

    private final List<ProcessedTrackPoint> points;
    private final Metric metric;
    private final XAxis axis;
    private final UnitSystem units;

    ChartSeries(List<ProcessedTrackPoint> points, Metric metric, XAxis axis, UnitSystem units) {
        this.points = points;
        this.metric = metric;
        this.axis = axis;
        this.units = units;
    }

    public int size() {
        return points.size();
    }

    @Override
    public Iterator<ChartPoint> iterator() {
        return new Iterator<>() {
            private int next;

            @Override
            public boolean hasNext() {
                return next < points.size();
            }

            @Override
            public ChartPoint next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return toChartPoint(points.get(next++));
            }
        };
    }

    private ChartPoint toChartPoint(ProcessedTrackPoint processed) {
        PointMetadata meta = processed.getMetadata();
        double x;
        String xUnit;
        if (axis == XAxis.DISTANCE) {
            x = units.distance(meta.getCumulativeDistance());
            xUnit = units.getDistanceUnit();
        } else {
            x = UnitConversions.millisToHours(meta.getCumulativeTime());
            xUnit = "h";
        }
        Double y = metric.read(processed.getPoint(), units);
        String yText = y != null ? String.format(Locale.US, "%.0f", y) : "n/a";
        String label = String.format(Locale.US, "%.2f %s, %s %s", x, xUnit, yText, metric.unit(units));
        return new ChartPoint(x, y, label);
    }
}
