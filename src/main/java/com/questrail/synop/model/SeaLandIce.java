package com.questrail.synop.model;

/**
 * Sea or land ice information following the {@code ICE} indicator.
 *
 * <p>Either the coded ciSibiDizi group is present, or the block is plain
 * language and only {@code text} is set.</p>
 */
public record SeaLandIce(
    String text,
    Observation<Integer> concentration,
    Observation<Integer> development,
    Observation<Integer> landOrigin,
    Observation<IceBearing> bearing,
    Observation<Integer> conditionTrend
) {
    public static SeaLandIce text(String text) {
        return new SeaLandIce(text, null, null, null, null, null);
    }

    public boolean isText() {
        return text != null;
    }
}
