package com.questrail.synop.model;

/**
 * Cloud cover in oktas (code table 2700). Code 9 means the sky is obscured.
 */
public record CloudCover(Integer oktas, boolean obscured)
{
    public static final CloudCover OBSCURED = new CloudCover(null, true);

    public static CloudCover oktas(int oktas) {
        return new CloudCover(oktas, false);
    }
}
