package com.questrail.synop.model;

/**
 * Direction of drift of low, middle and high cloud (56DLDMDH).
 */
public record CloudDrift(
    Observation<CardinalDirection> low,
    Observation<CardinalDirection> middle,
    Observation<CardinalDirection> high
) {
}
