package com.phillippitts.livefacts.domain;

/**
 * Immutable WGS84 coordinate pair reported by a tracking client.
 *
 * @param latitude  latitude in degrees, between -90 and 90
 * @param longitude longitude in degrees, between -180 and 180
 */
public record Coordinates(double latitude, double longitude) {

    /**
     * Compact constructor with range validation.
     *
     * @throws IllegalArgumentException if either component is NaN or out of range
     */
    public Coordinates {
        if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new IllegalArgumentException("Latitude must be between -90 and 90, got: " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new IllegalArgumentException("Longitude must be between -180 and 180, got: " + longitude);
        }
    }

    public static Coordinates of(double latitude, double longitude) {
        return new Coordinates(latitude, longitude);
    }
}
