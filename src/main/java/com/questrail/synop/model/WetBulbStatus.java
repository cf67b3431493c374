package com.questrail.synop.model;

/**
 * Sign and type of wet-bulb temperature (code table 3855).
 */
public record WetBulbStatus(Sign sign, boolean measured)
{
    public enum Sign
    {
        POSITIVE,
        NEGATIVE,
        ICED
    }

    public boolean negative() {
        return sign != Sign.POSITIVE;
    }
}
