package org.trackstats;

public final class GeoDistance {

    public static final double EARTH_RADIUS = 6371e3; // Earth's radius in meters

    private GeoDistance() {
    }

    /**
     * Calculate the Haversine distance between two geographic points.
     *
     * @param lat1 Latitude of the first point.
     * @param lon1 Longitude of the first point.
     * @param lat2 Latitude of the second point.
     * @param lon2 Longitude of the second point.
     * @return The surface distance between the points in meters.
     */
    public static double haversineDistance(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2) +
                Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2)) *
                        Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS * c;
    }

    /**
     * Great-circle distance between two track points, elevation ignored.
     */
    public static double surfaceDistance(TrackPoint a, TrackPoint b) {
        return haversineDistance(a.getLatitude(), a.getLongitude(), b.getLatitude(), b.getLongitude());
    }

    /**
     * Distance between two track points including the elevation change.
     * <p>
     * The surface distance is the horizontal leg and {@code b.elevation - a.elevation} the vertical
     * leg. When either point has no elevation the vertical leg is 0 and the result is the surface
     * distance.
     *
     * @return The distance in meters, never NaN for finite coordinates.
     */
    public static double spatialDistance(TrackPoint a, TrackPoint b) {
        double planar = surfaceDistance(a, b);
        if (!a.hasElevation() || !b.hasElevation()) {
            return planar;
        }
        double height = b.getElevation() - a.getElevation();
        return Math.sqrt(planar * planar + height * height);
    }
}
