package com.questrail.synop.model;

/**
 * Exact time of observation (9GGgg).
 */
public record ExactObservationTime(Observation<Integer> hour, Observation<Integer> minute)
{
}
