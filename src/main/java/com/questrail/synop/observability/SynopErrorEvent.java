package com.questrail.synop.observability;

import java.time.Instant;

/**
 * Record representing a failed decode or encode call.
 */
public record SynopErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
