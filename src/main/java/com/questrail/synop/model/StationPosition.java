package com.questrail.synop.model;

/**
 * Position of a sea or mobile land station.
 *
 * <p>Sea stations report latitude, longitude and the globe quadrant. Mobile
 * land stations add the Marsden square, elevation and its confidence; for sea
 * stations those components are {@code null}.</p>
 */
public record StationPosition(
    Observation<Double> latitude,
    Observation<Double> longitude,
    Observation<Integer> quadrant,
    Observation<Integer> marsdenSquare,
    Observation<Integer> elevation,
    Observation<Confidence> confidence
) {
    public static StationPosition of(double latitude, double longitude) {
        return new StationPosition(Observation.of(latitude), Observation.of(longitude), null, null, null, null);
    }
}
