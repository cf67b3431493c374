package com.questrail.synop.internal.table;

import com.questrail.synop.model.Amount;
import com.questrail.synop.model.AmountQualifier;
import com.questrail.synop.model.Quantifier;

/**
 * Code table 3889: total depth of snow, in centimetres.
 */
final class SnowDepthTable implements CodeTable<Amount>
{
    @Override
    public String id() {
        return "3889";
    }

    @Override
    public Amount decode(int code) throws InvalidCodeException {
        if (code >= 1 && code <= 996) {
            return Amount.of(code);
        }
        return switch (code) {
            case 997 -> Amount.bounded(0.5, Quantifier.IS_LESS);
            case 998 -> Amount.qualified(AmountQualifier.NOT_CONTINUOUS);
            case 999 -> Amount.qualified(AmountQualifier.MEASUREMENT_IMPOSSIBLE);
            default -> throw InvalidCodeException.invalidCode(id(), code);
        };
    }

    @Override
    public int encode(Amount value) throws InvalidCodeException {
        if (value == null) {
            throw InvalidCodeException.unencodable(id(), null);
        }
        if (value.is(AmountQualifier.NOT_CONTINUOUS)) {
            return 998;
        }
        if (value.is(AmountQualifier.MEASUREMENT_IMPOSSIBLE)) {
            return 999;
        }
        Double depth = value.value();
        if (depth == null) {
            throw InvalidCodeException.unencodable(id(), value);
        }
        if (value.quantifier() == Quantifier.IS_LESS || depth < 0.5) {
            return 997;
        }
        int code = (int) Math.round(depth);
        if (code < 1 || code > 996) {
            throw InvalidCodeException.unencodable(id(), value);
        }
        return code;
    }
}
