package com.questrail.synop.model;

/**
 * Period and height of wind waves.
 *
 * <ul>
 *   <li>1PwaPwaHwaHwa: instrumental, height in half metres</li>
 *   <li>2PwPwHwHw: estimated, height in half metres</li>
 *   <li>70HwaHwaHwa: instrumental height in tenths of a metre, no period</li>
 * </ul>
 *
 * <p>A confused sea (period code 99) is reported with an unavailable period.</p>
 */
public record WindWaves(
    Observation<Integer> period,
    Observation<Double> height,
    boolean instrumental,
    boolean accurate,
    boolean confused
) {
}
