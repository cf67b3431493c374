package com.questrail.synop.observability;

/**
 * Main interface for receiving SYNOP codec observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Sinks may be called concurrently from every thread that decodes or
 * encodes through a shared codec and must be thread-safe.</p>
 */
public interface SynopObservabilitySink {
    /**
     * Called after a telegram has been decoded or a report has been encoded.
     * @param event summary of the completed call
     */
    void onReport(SynopReportEvent event);

    /**
     * Called for a recoverable anomaly: an invalid code whose component was
     * omitted, a group gated out by region, or a group that was not recognised.
     * @param event the warning details
     */
    void onWarning(SynopWarningEvent event);

    /**
     * Called when a decode or encode call fails.
     * @param event the error event
     */
    void onError(SynopErrorEvent event);
}
