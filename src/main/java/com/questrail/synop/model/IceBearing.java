package com.questrail.synop.model;

/**
 * Bearing of the principal ice edge (code table 0739).
 */
public record IceBearing(String point, boolean inShore, boolean inIce)
{
}
