package com.questrail.synop.model;

import java.util.List;

/**
 * Duration of sunshine (55SSS for the past day, 553SS for the past hour)
 * and the radiation groups reported with it.
 */
public record Sunshine(Observation<Double> amount, Observation<Integer> duration, List<Radiation> radiation)
{
    public static final int DAILY = 24;
    public static final int HOURLY = 1;

    public Sunshine {
        radiation = radiation == null ? List.of() : List.copyOf(radiation);
    }
}
