package com.questrail.synop.model;

/**
 * Wet-bulb temperature (8swTbTbTb).
 */
public record WetBulbTemperature(Observation<Double> temperature, Observation<WetBulbStatus> status)
{
}
