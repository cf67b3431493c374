package com.questrail.synop.codec.impl;

import com.questrail.synop.codec.SynopEncoder;
import com.questrail.synop.config.SynopCodecConfig;
import com.questrail.synop.internal.encode.ReportEncoder;
import com.questrail.synop.internal.encode.SynopEncodeException;
import com.questrail.synop.model.SynopReport;
import com.questrail.synop.observability.SynopErrorEvent;
import com.questrail.synop.observability.SynopObservabilitySink;
import com.questrail.synop.observability.SynopReportEvent;

import java.time.Clock;
import java.util.Objects;

/**
 * DefaultSynopEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link SynopEncoder}, delegating group layout to
 * {@link ReportEncoder}.
 */
public final class DefaultSynopEncoder implements SynopEncoder
{
    private final SynopObservabilitySink sink;
    private final Clock clock;
    private final ReportEncoder reportEncoder;

    public DefaultSynopEncoder(SynopCodecConfig config) {
        this(config, Clock.systemUTC());
    }

    public DefaultSynopEncoder(SynopCodecConfig config, Clock clock) {
        Objects.requireNonNull(config, "config");
        this.sink = config.observabilitySink();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.reportEncoder = new ReportEncoder(config);
    }

    @Override
    public String encode(SynopReport report)
    {
        Objects.requireNonNull(report, "report");
        try {
            String telegram = reportEncoder.encode(report);
            sink.onReport(new SynopReportEvent(clock.instant(), SynopReportEvent.Direction.ENCODED,
                    telegram, report.fields().size(), report.notImplemented()));
            return telegram;
        }
        catch (SynopEncodeException e) {
            sink.onError(new SynopErrorEvent(clock.instant(), "Failed to encode report: " + e.getMessage(), e));
            throw e;
        }
    }
}
