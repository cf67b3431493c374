package com.questrail.synop.model;

/**
 * Confidence of a mobile land station's reported elevation (im).
 */
public enum Confidence
{
    EXCELLENT,
    GOOD,
    FAIR,
    POOR
}
