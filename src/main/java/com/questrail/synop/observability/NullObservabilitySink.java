package com.questrail.synop.observability;

/**
 * Sink used when the codec is configured without one.
 *
 * <p>Decoded and encoded report events, warnings about groups that could
 * not be decoded, and fatal decode or encode errors are all
 * dropped. The codec still throws for fatal errors, so callers that only need
 * the exception lose nothing.</p>
 */
public final class NullObservabilitySink implements SynopObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onReport(SynopReportEvent event) {}

    @Override
    public void onWarning(SynopWarningEvent event) {}

    @Override
    public void onError(SynopErrorEvent event) {}
}
