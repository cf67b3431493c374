package com.questrail.synop.model;

/**
 * A measured amount (precipitation, snow depth, deposit diameter).
 *
 * @param value      the amount, {@code null} when only a qualifier was reported
 * @param quantifier bound qualifier for saturated codes
 * @param qualifier  special condition such as a trace of precipitation
 */
public record Amount(Double value, Quantifier quantifier, AmountQualifier qualifier)
{
    public static Amount of(double value) {
        return new Amount(value, null, null);
    }

    public static Amount bounded(double value, Quantifier quantifier) {
        return new Amount(value, quantifier, null);
    }

    public static Amount qualified(AmountQualifier qualifier) {
        return new Amount(null, null, qualifier);
    }

    public boolean is(AmountQualifier qualifier) {
        return this.qualifier == qualifier;
    }
}
