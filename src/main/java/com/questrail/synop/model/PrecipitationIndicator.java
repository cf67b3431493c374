package com.questrail.synop.model;

/**
 * Precipitation indicator (iR): which sections carry the precipitation group.
 */
public record PrecipitationIndicator(int code, boolean inGroup1, boolean inGroup3)
{
    public static PrecipitationIndicator of(int code) {
        return new PrecipitationIndicator(code, code == 0 || code == 1, code == 0 || code == 2);
    }
}
