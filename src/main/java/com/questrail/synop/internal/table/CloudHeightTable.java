package com.questrail.synop.internal.table;

import com.questrail.synop.model.CloudHeight;
import com.questrail.synop.model.Quantifier;

/**
 * CloudHeightTable
 * -----------------------------------------------------------------------------
 * Code table 1677: height of the base of a cloud layer, in metres.
 *
 * <ul>
 *   <li>00 is below 30 m; 01..50 are steps of 30 m.</li>
 *   <li>51..55 are not used.</li>
 *   <li>56..80 are steps of 300 m from 1800 m; 81..88 are steps of 1500 m from
 *       10500 m; 89 is above 21000 m.</li>
 *   <li>90..99 are the coarse ranges of table 1600 and set the use-90 flag.</li>
 * </ul>
 *
 * Encoding is the exact reverse lookup: a value produced by {@link #decode(int)}
 * always maps back to the code it came from.
 */
final class CloudHeightTable implements CodeTable<CloudHeight>
{
    private static final double[][] RANGES_90 = {
        {0, 50}, {50, 100}, {100, 200}, {200, 300}, {300, 600},
        {600, 1000}, {1000, 1500}, {1500, 2000}, {2000, 2500}
    };

    @Override
    public String id() {
        return "1677";
    }

    @Override
    public CloudHeight decode(int code) throws InvalidCodeException {
        if (code == 0) {
            return new CloudHeight(30.0, null, null, Quantifier.IS_LESS, false);
        }
        if (code >= 1 && code <= 50) {
            return CloudHeight.of(code * 30);
        }
        if (code >= 56 && code <= 80) {
            return CloudHeight.of((code - 50) * 300);
        }
        if (code >= 81 && code <= 88) {
            return CloudHeight.of((code - 80) * 1500 + 9000);
        }
        if (code == 89) {
            return new CloudHeight(21000.0, null, null, Quantifier.IS_GREATER, false);
        }
        if (code >= 90 && code <= 98) {
            double[] range = RANGES_90[code - 90];
            return new CloudHeight(null, range[0], range[1], null, true);
        }
        if (code == 99) {
            return new CloudHeight(2500.0, null, null, Quantifier.IS_GREATER, true);
        }
        throw InvalidCodeException.invalidCode(id(), code);
    }

    @Override
    public int encode(CloudHeight value) throws InvalidCodeException {
        if (value == null) {
            throw InvalidCodeException.unencodable(id(), null);
        }
        if (value.use90()) {
            return encode90(value);
        }
        Double height = value.value();
        if (height == null) {
            throw InvalidCodeException.unencodable(id(), value);
        }
        if (value.quantifier() == Quantifier.IS_LESS) {
            return 0;
        }
        if (value.quantifier() == Quantifier.IS_GREATER) {
            return 89;
        }
        return encodeHeight(height, value);
    }

    private int encodeHeight(double height, CloudHeight value) throws InvalidCodeException {
        if (height < 30) {
            return 0;
        }
        if (height <= 1500) {
            return (int) Math.round(height / 30);
        }
        if (height <= 9000) {
            return (int) Math.round(height / 300) + 50;
        }
        if (height <= 21000) {
            return (int) Math.round((height - 9000) / 1500) + 80;
        }
        if (height > 21000) {
            return 89;
        }
        throw InvalidCodeException.unencodable(id(), value);
    }

    private int encode90(CloudHeight value) throws InvalidCodeException {
        if (value.min() != null && value.max() != null) {
            for (int i = 0; i < RANGES_90.length; i++) {
                if (RANGES_90[i][0] == value.min() && RANGES_90[i][1] == value.max()) {
                    return 90 + i;
                }
            }
        }
        Double height = value.value();
        if (height == null) {
            throw InvalidCodeException.unencodable(id(), value);
        }
        if (height >= 2500) {
            return 99;
        }
        for (int i = 0; i < RANGES_90.length; i++) {
            if (height >= RANGES_90[i][0] && height < RANGES_90[i][1]) {
                return 90 + i;
            }
        }
        throw InvalidCodeException.unencodable(id(), value);
    }
}
