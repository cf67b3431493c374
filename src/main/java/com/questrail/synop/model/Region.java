package com.questrail.synop.model;

import java.util.Optional;

/**
 * WMO regional association of the reporting station.
 *
 * <p>{@link #SHIP} is used for sea stations that do not carry a
 * buoy-style callsign.</p>
 */
public enum Region
{
    I("I"),
    II("II"),
    III("III"),
    IV("IV"),
    V("V"),
    VI("VI"),
    ANTARCTIC("Antarctic"),
    SHIP("SHIP");

    private final String label;

    Region(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<Region> fromLabel(String label) {
        for (Region region : values()) {
            if (region.label.equals(label)) {
                return Optional.of(region);
            }
        }
        return Optional.empty();
    }
}
