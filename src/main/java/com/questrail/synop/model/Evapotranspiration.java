package com.questrail.synop.model;

/**
 * Daily evaporation or evapotranspiration (5EEEiE).
 */
public record Evapotranspiration(Observation<Double> amount, Observation<String> type)
{
}
