package com.questrail.synop.model;

/**
 * One radiation group following a sunshine group (jFFFF).
 *
 * @param type   radiation type digit, 0 to 5
 * @param amount amount in J/cm2 for daily sunshine, kJ/m2 for hourly
 */
public record Radiation(int type, Observation<Integer> amount)
{
    public static final String DAILY_UNIT = "J/cm2";
    public static final String HOURLY_UNIT = "kJ/m2";
}
