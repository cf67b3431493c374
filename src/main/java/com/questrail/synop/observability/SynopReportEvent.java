package com.questrail.synop.observability;

import java.time.Instant;
import java.util.List;

/**
 * Record summarising one completed decode or encode call.
 */
public record SynopReportEvent(
    Instant timestamp,
    Direction direction,
    String telegram,
    int fieldCount,
    List<String> notImplemented
) {
    public enum Direction {
        DECODED,
        ENCODED
    }

    public SynopReportEvent {
        notImplemented = notImplemented == null ? List.of() : List.copyOf(notImplemented);
    }
}
