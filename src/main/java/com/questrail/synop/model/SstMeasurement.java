package com.questrail.synop.model;

/**
 * Sign and method of a sea surface temperature measurement (code table 3850).
 */
public record SstMeasurement(String method, boolean negative)
{
}
