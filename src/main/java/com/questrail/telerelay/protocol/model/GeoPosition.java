package com.questrail.telerelay.protocol.model;

/**
 * A latitude/longitude fix in decimal degrees.
 */
public record GeoPosition(double latitude, double longitude)
{
    public GeoPosition
    {
        if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new IllegalArgumentException("latitude out of range: " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new IllegalArgumentException("longitude out of range: " + longitude);
        }
    }

    @Override
    public String toString()
    {
        return "(" + latitude + ", " + longitude + ")";
    }
}
