package com.questrail.synop.model;

/**
 * Direction and speed of the ship over the past three hours (222Dsvs).
 */
public record ShipDisplacement(Observation<CardinalDirection> direction, Observation<ShipSpeed> speed)
{
}
