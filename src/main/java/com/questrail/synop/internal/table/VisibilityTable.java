package com.questrail.synop.internal.table;

import com.questrail.synop.model.Quantifier;
import com.questrail.synop.model.Visibility;

/**
 * VisibilityTable
 * -----------------------------------------------------------------------------
 * Code table 4377: horizontal visibility at the surface, in metres.
 *
 * <ul>
 *   <li>00 is below 100 m; 01..50 are steps of 100 m.</li>
 *   <li>51..55 are not used.</li>
 *   <li>56..80 are steps of 1 km from 6 km; 81..88 are steps of 5 km from
 *       35 km; 89 is above 70 km.</li>
 *   <li>90..99 are the coarse maritime scale and set the use-90 flag.</li>
 * </ul>
 */
final class VisibilityTable implements CodeTable<Visibility>
{
    private static final double[] SCALE_90 = {50, 200, 500, 1000, 2000, 4000, 10000, 20000};

    @Override
    public String id() {
        return "4377";
    }

    @Override
    public Visibility decode(int code) throws InvalidCodeException {
        if (code == 0) {
            return new Visibility(100, Quantifier.IS_LESS, false);
        }
        if (code >= 1 && code <= 50) {
            return new Visibility(code * 100, null, false);
        }
        if (code >= 56 && code <= 80) {
            return new Visibility((code - 50) * 1000, null, false);
        }
        if (code >= 81 && code <= 88) {
            return new Visibility((code - 74) * 5000, null, false);
        }
        if (code == 89) {
            return new Visibility(70000, Quantifier.IS_GREATER, false);
        }
        if (code == 90) {
            return new Visibility(50, Quantifier.IS_LESS, true);
        }
        if (code >= 91 && code <= 98) {
            return new Visibility(SCALE_90[code - 91], null, true);
        }
        if (code == 99) {
            return new Visibility(50000, Quantifier.IS_GREATER_OR_EQUAL, true);
        }
        throw InvalidCodeException.invalidCode(id(), code);
    }

    @Override
    public int encode(Visibility value) throws InvalidCodeException {
        if (value == null || value.metres() < 0) {
            throw InvalidCodeException.unencodable(id(), value);
        }
        return value.use90() ? encode90(value) : encodeFine(value);
    }

    private static int encodeFine(Visibility value) {
        double metres = value.metres();
        if (value.quantifier() == Quantifier.IS_LESS || metres < 100) {
            return 0;
        }
        if (value.quantifier() == Quantifier.IS_GREATER || metres > 70000) {
            return 89;
        }
        if (metres <= 5000) {
            return (int) Math.round(metres / 100);
        }
        if (metres <= 30000) {
            return (int) Math.round(metres / 1000) + 50;
        }
        return (int) Math.round(metres / 5000) + 74;
    }

    private static int encode90(Visibility value) {
        double metres = value.metres();
        if (value.quantifier() == Quantifier.IS_LESS || metres < SCALE_90[0]) {
            return 90;
        }
        if (value.quantifier() == Quantifier.IS_GREATER_OR_EQUAL || metres >= 50000) {
            return 99;
        }
        int code = 91;
        for (int i = 0; i < SCALE_90.length; i++) {
            if (metres >= SCALE_90[i]) {
                code = 91 + i;
            }
        }
        return code;
    }
}
