package com.questrail.synop.model;

/**
 * Ice accretion on ships (6IsEsEsRs).
 */
public record IceAccretion(
    Observation<IceAccretionSource> source,
    Observation<Integer> thickness,
    Observation<Integer> rate
) {
}
