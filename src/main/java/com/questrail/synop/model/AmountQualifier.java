package com.questrail.synop.model;

/**
 * Special conditions some amount tables report instead of, or alongside, a number.
 */
public enum AmountQualifier
{
    TRACE,
    NON_MEASURABLE,
    INACCURATE,
    NOT_CONTINUOUS,
    MEASUREMENT_IMPOSSIBLE
}
