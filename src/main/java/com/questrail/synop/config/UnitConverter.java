package com.questrail.synop.config;

/**
 * Converts a numeric value between two unit tags.
 *
 * <p>The encoder consults the converter whenever an observation carries a unit
 * that differs from the canonical unit of the group it is written to, for
 * example a temperature given in {@code K} for an sTTT group that holds
 * {@code Cel}.</p>
 *
 * Implementations must be stateless and thread-safe.
 */
@FunctionalInterface
public interface UnitConverter
{
    /**
     * @throws IllegalArgumentException if the two units cannot be converted
     */
    double convert(double value, String fromUnit, String toUnit);
}
