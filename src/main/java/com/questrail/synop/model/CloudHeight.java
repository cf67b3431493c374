package com.questrail.synop.model;

/**
 * Height of the base of a cloud layer (code table 1677).
 *
 * <p>Codes 90 to 98 report a range instead of a value; {@code min}
 * and {@code max} are set and {@code value} is {@code null}.</p>
 */
public record CloudHeight(Double value, Double min, Double max, Quantifier quantifier, boolean use90)
{
    public static CloudHeight of(double value) {
        return new CloudHeight(value, null, null, null, false);
    }
}
