package com.questrail.synop.model;

/**
 * Elevation angle of a cloud top or phenomenon (code table 1004).
 */
public record ElevationAngle(Integer degrees, Quantifier quantifier, boolean visible)
{
    public static final ElevationAngle NOT_VISIBLE = new ElevationAngle(null, null, false);
}
