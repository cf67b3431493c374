package com.questrail.synop.model;

/**
 * Geopotential height of a standard isobaric surface (4ahhh).
 */
public record Geopotential(Observation<Integer> surface, Observation<Integer> height)
{
}
