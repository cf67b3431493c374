package com.questrail.synop.model;

/**
 * Wind direction and speed. The speed unit follows the wind indicator.
 */
public record Wind(Observation<WindDirection> direction, Observation<Integer> speed)
{
}
