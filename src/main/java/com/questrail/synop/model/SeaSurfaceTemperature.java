package com.questrail.synop.model;

/**
 * Sea surface temperature (0ssTwTwTw).
 */
public record SeaSurfaceTemperature(Observation<Double> temperature, Observation<SstMeasurement> measurement)
{
}
