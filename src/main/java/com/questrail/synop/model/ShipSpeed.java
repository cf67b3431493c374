package com.questrail.synop.model;

/**
 * Ship's average speed (code table 4451), reported in knots and km/h together.
 */
public record ShipSpeed(ValueRange knots, ValueRange kilometresPerHour)
{
}
