package org.trackstats;

public final class ProcessedTrackPoint {

    private final TrackPoint point;
    private final PointMetadata metadata;

    ProcessedTrackPoint(TrackPoint point, PointMetadata metadata) {
        this.point = point;
        this.metadata = metadata;
    }

    public TrackPoint getPoint() {
        return point;
    }

    public PointMetadata getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return point + " " + metadata;
    }
}
