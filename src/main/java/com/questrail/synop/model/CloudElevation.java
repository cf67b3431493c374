package com.questrail.synop.model;

/**
 * Direction and elevation of a cloud (57CDaec).
 */
public record CloudElevation(
    Observation<String> genus,
    Observation<CardinalDirection> direction,
    Observation<ElevationAngle> elevation
) {
}
