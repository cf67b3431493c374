package com.questrail.synop.internal.table;

import com.questrail.synop.model.TimeBeforeObservation;

/**
 * Code table 4077, time form: 00..60 count six-minute steps and 61..66 are the
 * one-hour windows from 6-7 h to 11-12 h before the observation.
 */
final class TimeBeforeObservationTable implements CodeTable<TimeBeforeObservation>
{
    @Override
    public String id() {
        return "4077T";
    }

    @Override
    public TimeBeforeObservation decode(int code) throws InvalidCodeException {
        if (code >= 0 && code <= 60) {
            return TimeBeforeObservation.minutes(code * 6);
        }
        if (code >= 61 && code <= 66) {
            return TimeBeforeObservation.hourWindow(code - 55, code - 54);
        }
        throw InvalidCodeException.invalidCode(id(), code);
    }

    @Override
    public int encode(TimeBeforeObservation value) throws InvalidCodeException {
        if (value == null) {
            throw InvalidCodeException.unencodable(id(), null);
        }
        if (value.isExact()) {
            int minutes = value.fromMinutes();
            if (minutes % 6 == 0 && minutes <= 360) {
                return minutes / 6;
            }
        } else if (value.fromMinutes() % 60 == 0 && value.toMinutes() == value.fromMinutes() + 60) {
            int code = value.fromMinutes() / 60 + 55;
            if (code >= 61 && code <= 66) {
                return code;
            }
        }
        throw InvalidCodeException.unencodable(id(), value);
    }
}
