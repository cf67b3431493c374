package com.questrail.synop.model;

/**
 * Wind speed indicator (iw). The speed unit is carried as the observation unit.
 */
public record WindIndicator(int code, boolean estimated)
{
    public static final String METRES_PER_SECOND = "m/s";
    public static final String KNOTS = "KT";

    public String speedUnit() {
        return code < 2 ? METRES_PER_SECOND : KNOTS;
    }
}
