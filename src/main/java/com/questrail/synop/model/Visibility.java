package com.questrail.synop.model;

/**
 * Horizontal visibility (code table 4377).
 *
 * @param metres     visibility, or the lower bound of the reported band
 * @param quantifier bound qualifier for the saturated codes
 * @param use90      whether the value came from the 90-99 band
 */
public record Visibility(double metres, Quantifier quantifier, boolean use90)
{
}
