package com.questrail.synop.model;

/**
 * True wind direction in degrees (code table 0877).
 */
public record WindDirection(Integer degrees, boolean calm, boolean variable)
{
    public static final WindDirection CALM = new WindDirection(null, true, false);
    public static final WindDirection VARIABLE = new WindDirection(null, false, true);

    public static WindDirection degrees(int degrees) {
        return new WindDirection(degrees, false, false);
    }
}
