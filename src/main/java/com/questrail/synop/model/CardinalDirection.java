package com.questrail.synop.model;

/**
 * Direction in compass points (code table 0700).
 *
 * <p>Code 0 means calm or stationary, code 9 all directions or unknown;
 * neither has a compass point.</p>
 */
public record CardinalDirection(String point, boolean calmOrStationary, boolean allDirections)
{
    public static final CardinalDirection STATIONARY = new CardinalDirection(null, true, false);
    public static final CardinalDirection ALL_DIRECTIONS = new CardinalDirection(null, false, true);

    public static CardinalDirection of(String point) {
        return new CardinalDirection(point, false, false);
    }
}
