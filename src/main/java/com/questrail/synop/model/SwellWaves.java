package com.questrail.synop.model;

/**
 * Direction, period and height of one swell wave system.
 *
 * <p>The direction comes from the shared 3dw1dw1dw2dw2 group and the period and
 * height from the 4- or 5-group. Components not reported are {@code null}.</p>
 */
public record SwellWaves(
    Observation<WindDirection> direction,
    Observation<Integer> period,
    Observation<Double> height
) {
    public boolean hasWaveGroup() {
        return period != null || height != null;
    }
}
