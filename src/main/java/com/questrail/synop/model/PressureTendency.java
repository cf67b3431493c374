package com.questrail.synop.model;

/**
 * Characteristic and amount of the three-hour pressure tendency (5appp).
 */
public record PressureTendency(Observation<Integer> tendency, Observation<Double> change)
{
}
