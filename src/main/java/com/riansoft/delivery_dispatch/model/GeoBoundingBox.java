package com.riansoft.delivery_dispatch.model;

/**
 * Inclusive latitude/longitude rectangle describing the service area.
 */
public class GeoBoundingBox {
    public final double minLatitude;
    public final double maxLatitude;
    public final double minLongitude;
    public final double maxLongitude;

    public GeoBoundingBox(double minLatitude, double maxLatitude, double minLongitude, double maxLongitude) {
        if (minLatitude > maxLatitude) {
            throw new IllegalArgumentException("minLatitude " + minLatitude + " > maxLatitude " + maxLatitude);
        }
        if (minLongitude > maxLongitude) {
            throw new IllegalArgumentException("minLongitude " + minLongitude + " > maxLongitude " + maxLongitude);
        }
        this.minLatitude = minLatitude;
        this.maxLatitude = maxLatitude;
        this.minLongitude = minLongitude;
        this.maxLongitude = maxLongitude;
    }

    public boolean contains(double latitude, double longitude) {
        return latitude >= minLatitude && latitude <= maxLatitude
                && longitude >= minLongitude && longitude <= maxLongitude;
    }

    @Override
    public String toString() {
        return String.format("lat[%s, %s] lon[%s, %s]", minLatitude, maxLatitude, minLongitude, maxLongitude);
    }
}
