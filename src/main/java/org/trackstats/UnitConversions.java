package org.trackstats;

public final class UnitConversions {

    private static final double KM_PER_MILE = 1.60934;
    private static final double METERS_PER_MILE = 1609.34;
    private static final double FEET_PER_METER = 3.28084;
    private static final double MILLIS_PER_HOUR = 3600000.0;

    private UnitConversions() {
    }

    public static double kmToMiles(double km) {
        return km / KM_PER_MILE;
    }

    public static double metersToFeet(double meters) {
        return meters * FEET_PER_METER;
    }

    public static double metersToKm(double meters) {
        return meters / 1000.0;
    }

    public static double metersToMiles(double meters) {
        return meters / METERS_PER_MILE;
    }

    public static double millisToHours(double millis) {
        return millis / MILLIS_PER_HOUR;
    }
}
