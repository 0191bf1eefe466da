package org.trackstats;

import java.time.Instant;
import java.util.Objects;

/**
 * One track sample as delivered by the ingestion layer. Immutable.
 * <p>
 * Elevation and the sensor readings are optional and {@code null} when the source did not carry
 * them. The time is never {@code null}: samples without a usable timestamp get {@link #NO_TIME}.
 */
public final class TrackPoint {

    /** Stand-in time for samples without a (valid) timestamp. */
    public static final Instant NO_TIME = Instant.EPOCH;

    private final double latitude;
    private final double longitude;
    private final Double elevation;
    private final Instant time;
    private final Integer heartRate;
    private final Integer cadence;
    private final Double temperature;
    private final String name;

    private TrackPoint(Builder builder) {
        this.latitude = builder.latitude;
        this.longitude = builder.longitude;
        this.elevation = builder.elevation;
        this.time = hasMillisecondRange(builder.time) ? builder.time : NO_TIME;
        this.heartRate = builder.heartRate;
        this.cadence = builder.cadence;
        this.temperature = builder.temperature;
        this.name = builder.name;
    }

    /**
     * Tells whether {@code time} is set and fits an epoch millisecond timestamp.
     */
    static boolean hasMillisecondRange(Instant time) {
        if (time == null) {
            return false;
        }
        try {
            time.toEpochMilli();
            return true;
        } catch (ArithmeticException e) {
            return false;
        }
    }

    public static Builder builder(double latitude, double longitude) {
        return new Builder(latitude, longitude);
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    public Double getElevation() {
        return elevation;
    }

    public boolean hasElevation() {
        return elevation != null && Double.isFinite(elevation);
    }

    public Instant getTime() {
        return time;
    }

    public long getTimestamp() {
        return time.toEpochMilli();
    }

    public Integer getHeartRate() {
        return heartRate;
    }

    public Integer getCadence() {
        return cadence;
    }

    public Double getTemperature() {
        return temperature;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TrackPoint)) {
            return false;
        }
        TrackPoint that = (TrackPoint) o;
        return Double.compare(that.latitude, latitude) == 0
                && Double.compare(that.longitude, longitude) == 0
                && Objects.equals(elevation, that.elevation)
                && time.equals(that.time)
                && Objects.equals(heartRate, that.heartRate)
                && Objects.equals(cadence, that.cadence)
                && Objects.equals(temperature, that.temperature)
                && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(latitude, longitude, elevation, time, heartRate, cadence, temperature, name);
    }

    @Override
    public String toString() {
        return "TrackPoint{lat=" + latitude + ", lon=" + longitude + ", ele=" + elevation + ", time=" + time + "}";
    }

    public static final class Builder {
        private final double latitude;
        private final double longitude;
        private Double elevation;
        private Instant time;
        private Integer heartRate;
        private Integer cadence;
        private Double temperature;
        private String name;

        private Builder(double latitude, double longitude) {
            this.latitude = latitude;
            this.longitude = longitude;
        }

        public Builder elevation(Double elevation) {
            this.elevation = elevation;
            return this;
        }

        public Builder time(Instant time) {
            this.time = time;
            return this;
        }

        public Builder timestamp(long epochMillis) {
            this.time = Instant.ofEpochMilli(epochMillis);
            return this;
        }

        public Builder heartRate(Integer heartRate) {
            this.heartRate = heartRate;
            return this;
        }

        public Builder cadence(Integer cadence) {
            this.cadence = cadence;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public TrackPoint build() {
            return new TrackPoint(this);
        }
    }
}
