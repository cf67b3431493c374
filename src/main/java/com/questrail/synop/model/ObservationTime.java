package com.questrail.synop.model;

/**
 * Day of month and hour of observation (YYGG).
 */
public record ObservationTime(Observation<Integer> day, Observation<Integer> hour)
{
}
