package com.questrail.synop.observability;

import java.time.Instant;

/**
 * Record representing a recoverable anomaly found while decoding.
 *
 * @param group the raw group the anomaly was found in, if known
 * @param cause the underlying exception, if any
 */
public record SynopWarningEvent(
    Instant timestamp,
    String group,
    String message,
    Throwable cause
) {
}
