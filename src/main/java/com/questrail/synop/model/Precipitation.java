package com.questrail.synop.model;

/**
 * Amount of precipitation and the period it fell over.
 *
 * <p>The six-hour-class group (6RRRt) uses code table 3590 and a period from
 * code table 4019. The 24-hour group (7RRRR) uses code table 3590A and always
 * covers 24 hours.</p>
 */
public record Precipitation(Observation<Amount> amount, Observation<Integer> timeBeforeObs)
{
    public static final int DAILY_HOURS = 24;

    /**
     * Whether this precipitation is reported through the 24-hour 7RRRR group.
     */
    public boolean isDailyTotal() {
        if (amount != null && amount.table() != null) {
            return "3590A".equals(amount.table());
        }
        return timeBeforeObs != null
            && timeBeforeObs.available()
            && timeBeforeObs.value() == DAILY_HOURS
            && timeBeforeObs.table() == null;
    }
}
