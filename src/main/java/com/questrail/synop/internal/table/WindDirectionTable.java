package com.questrail.synop.internal.table;

import com.questrail.synop.model.WindDirection;

/**
 * Code table 0877: true direction, in tens of degrees, from which the wind is
 * blowing. 00 is calm and 99 is variable.
 */
final class WindDirectionTable implements CodeTable<WindDirection>
{
    @Override
    public String id() {
        return "0877";
    }

    @Override
    public WindDirection decode(int code) throws InvalidCodeException {
        if (code == 0) {
            return WindDirection.CALM;
        }
        if (code == 99) {
            return WindDirection.VARIABLE;
        }
        if (code >= 1 && code <= 36) {
            return WindDirection.degrees(code * 10);
        }
        throw InvalidCodeException.invalidCode(id(), code);
    }

    @Override
    public int encode(WindDirection value) throws InvalidCodeException {
        if (value == null) {
            throw InvalidCodeException.unencodable(id(), null);
        }
        if (value.calm()) {
            return 0;
        }
        if (value.variable()) {
            return 99;
        }
        Integer degrees = value.degrees();
        if (degrees == null || degrees < 0 || degrees > 360) {
            throw InvalidCodeException.unencodable(id(), value);
        }
        int code = (int) Math.round(degrees / 10.0);
        // North is reported as 36, never as 00 (calm)
        return code == 0 ? 36 : code;
    }
}
