package com.questrail.synop.model;

/**
 * State of the ground with snow or ice and total snow depth (4E'sss).
 */
public record GroundStateSnow(Observation<Integer> state, Observation<Amount> depth)
{
}
