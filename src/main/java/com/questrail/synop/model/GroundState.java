package com.questrail.synop.model;

/**
 * State of the ground without snow and ground temperature (3EsnTgTg).
 */
public record GroundState(Observation<Integer> state, Observation<Integer> temperature)
{
}
