package com.questrail.synop.model;

/**
 * Period preceding the observation that a reported value refers to.
 *
 * <p>Exact periods have equal bounds. Code table 4077 also reports one-hour
 * windows such as "6 to 7 hours".</p>
 */
public record TimeBeforeObservation(int fromMinutes, int toMinutes)
{
    public TimeBeforeObservation {
        if (fromMinutes < 0 || toMinutes < fromMinutes) {
            throw new IllegalArgumentException("Invalid period " + fromMinutes + ".." + toMinutes);
        }
    }

    public static TimeBeforeObservation minutes(int minutes) {
        return new TimeBeforeObservation(minutes, minutes);
    }

    public static TimeBeforeObservation hours(int hours) {
        return minutes(hours * 60);
    }

    public static TimeBeforeObservation hourWindow(int fromHours, int toHours) {
        return new TimeBeforeObservation(fromHours * 60, toHours * 60);
    }

    public boolean isExact() {
        return fromMinutes == toMinutes;
    }

    /**
     * The period covered by past weather (W1W2) at a given observation hour:
     * 6 h at the main synoptic hours, 3 h at the intermediate hours, otherwise
     * 2 h or 1 h.
     *
     * @return the period, or {@code null} when the hour is unknown
     */
    public static TimeBeforeObservation pastWeatherPeriod(Integer hour) {
        if (hour == null) {
            return null;
        }
        if (hour % 6 == 0) {
            return hours(6);
        }
        if (hour % 3 == 0) {
            return hours(3);
        }
        return hour % 2 == 0 ? hours(2) : hours(1);
    }
}
