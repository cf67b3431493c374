package com.questrail.synop.model;

import java.util.Optional;

/**
 * Station type indicator (MMMM) heading every SYNOP report.
 */
public enum StationType
{
    /** Fixed land station (FM-12). */
    AAXX,
    /** Sea station (FM-13). */
    BBXX,
    /** Mobile land station (FM-14). */
    OOXX;

    public static Optional<StationType> fromCode(String code) {
        for (StationType type : values()) {
            if (type.name().equals(code)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Whether the report identifies itself with a callsign instead of a station index.
     */
    public boolean hasCallsign() {
        return this != AAXX;
    }
}
