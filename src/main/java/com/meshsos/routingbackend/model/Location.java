package com.meshsos.routingbackend.model;

import lombok.Value;

/**
 * Geographic position in decimal degrees (WGS84).
 * <p>
 * Callers must supply {@code -90 <= lat <= 90} and {@code -180 <= lon <= 180};
 * coordinates are neither validated nor clamped here.
 */
@Value
public class Location {
    double lat;
    double lon;

    /**
     * Great-circle distance to another location, in kilometers.
     */
    public double distanceTo(Location other) {
        return GeoDistanceCalculator.distanceKm(this, other);
    }
}
