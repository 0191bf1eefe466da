package org.trackstats;

public enum UnitSystem {
    METRIC("km", "m"),
    IMPERIAL("mi", "ft");

    private final String distanceUnit;
    private final String elevationUnit;

    UnitSystem(String distanceUnit, String elevationUnit) {
        this.distanceUnit = distanceUnit;
        this.elevationUnit = elevationUnit;
    }

    /** Long distance, from meters to km or mi. */
    public double distance(double meters) {
        return this == METRIC ? UnitConversions.metersToKm(meters) : UnitConversions.metersToMiles(meters);
    }

    /** Height, from meters to m or ft. */
    public double elevation(double meters) {
        return this == METRIC ? meters : UnitConversions.metersToFeet(meters);
    }

    public String getDistanceUnit() {
        return distanceUnit;
    }

    public String getElevationUnit() {
        return elevationUnit;
    }
}
