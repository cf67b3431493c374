package com.questrail.synop.internal.table;

import com.questrail.synop.model.Amount;
import com.questrail.synop.model.AmountQualifier;
import com.questrail.synop.model.Quantifier;

/**
 * Code table 3590: amount of precipitation, in millimetres.
 *
 * <p>The three-digit form (RRR) counts whole millimetres up to 988 with 990 as
 * a trace and 991..999 as tenths. The four-digit form used by the 24-hour
 * total (RRRR, identified as "3590A") counts tenths up to 999.7 with 9999 as
 * a trace.</p>
 */
final class PrecipitationAmountTable implements CodeTable<Amount>
{
    private final boolean tenths;

    PrecipitationAmountTable(boolean tenths) {
        this.tenths = tenths;
    }

    @Override
    public String id() {
        return tenths ? "3590A" : "3590";
    }

    @Override
    public Amount decode(int code) throws InvalidCodeException {
        return tenths ? decodeTenths(code) : decodeWhole(code);
    }

    @Override
    public int encode(Amount value) throws InvalidCodeException {
        if (value == null) {
            throw InvalidCodeException.unencodable(id(), null);
        }
        return tenths ? encodeTenths(value) : encodeWhole(value);
    }

    private Amount decodeWhole(int code) throws InvalidCodeException {
        if (code >= 0 && code <= 988) {
            return Amount.of(code);
        }
        if (code == 989) {
            return Amount.bounded(989, Quantifier.IS_GREATER_OR_EQUAL);
        }
        if (code == 990) {
            return new Amount(0.0, null, AmountQualifier.TRACE);
        }
        if (code >= 991 && code <= 999) {
            return Amount.of((code - 990) / 10.0);
        }
        throw InvalidCodeException.invalidCode(id(), code);
    }

    private int encodeWhole(Amount value) throws InvalidCodeException {
        if (value.is(AmountQualifier.TRACE)) {
            return 990;
        }
        Double amount = value.value();
        if (amount == null || amount < 0) {
            throw InvalidCodeException.unencodable(id(), value);
        }
        if (value.quantifier() == Quantifier.IS_GREATER_OR_EQUAL || amount >= 989) {
            return 989;
        }
        if (amount > 0 && amount < 1) {
            int tenthsCode = (int) Math.round(amount * 10);
            return tenthsCode == 10 ? 1 : 990 + Math.max(tenthsCode, 1);
        }
        return (int) Math.round(amount);
    }

    private Amount decodeTenths(int code) throws InvalidCodeException {
        if (code >= 0 && code <= 9997) {
            return Amount.of(code / 10.0);
        }
        if (code == 9998) {
            return Amount.bounded(999.8, Quantifier.IS_GREATER_OR_EQUAL);
        }
        if (code == 9999) {
            return new Amount(0.0, null, AmountQualifier.TRACE);
        }
        throw InvalidCodeException.invalidCode(id(), code);
    }

    private int encodeTenths(Amount value) throws InvalidCodeException {
        if (value.is(AmountQualifier.TRACE)) {
            return 9999;
        }
        Double amount = value.value();
        if (amount == null || amount < 0) {
            throw InvalidCodeException.unencodable(id(), value);
        }
        if (value.quantifier() == Quantifier.IS_GREATER_OR_EQUAL || amount >= 999.8) {
            return 9998;
        }
        return (int) Math.round(amount * 10);
    }
}
