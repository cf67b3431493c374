package com.questrail.synop.model;

/**
 * A bucketed value: closed lower bound, open upper bound.
 *
 * <p>The last bucket of a range table has no upper bound and carries a
 * quantifier. A range with neither bound represents "unknown".</p>
 */
public record ValueRange(Double min, Double max, Quantifier quantifier)
{
    public static final ValueRange UNKNOWN = new ValueRange(null, null, null);

    public static ValueRange of(double min, double max) {
        return new ValueRange(min, max, null);
    }

    public static ValueRange openEnded(double min, Quantifier quantifier) {
        return new ValueRange(min, null, quantifier);
    }

    public boolean isUnknown() {
        return min == null && max == null;
    }
}
