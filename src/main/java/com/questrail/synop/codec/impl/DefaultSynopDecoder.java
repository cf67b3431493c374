package com.questrail.synop.codec.impl;

import com.questrail.synop.codec.SynopDecoder;
import com.questrail.synop.config.SynopCodecConfig;
import com.questrail.synop.internal.decode.ReportDecoder;
import com.questrail.synop.internal.decode.SynopDecodeException;
import com.questrail.synop.model.SynopReport;
import com.questrail.synop.observability.SynopErrorEvent;
import com.questrail.synop.observability.SynopObservabilitySink;
import com.questrail.synop.observability.SynopReportEvent;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * DefaultSynopDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link SynopDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Splitting the telegram on runs of whitespace</li>
 *   <li>Decoding the groups with {@link ReportDecoder}</li>
 *   <li>Reporting the outcome to the observability sink</li>
 * </ol>
 */
public final class DefaultSynopDecoder implements SynopDecoder
{
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final SynopObservabilitySink sink;
    private final Clock clock;
    private final ReportDecoder reportDecoder;

    public DefaultSynopDecoder(SynopCodecConfig config) {
        this(config, Clock.systemUTC());
    }

    public DefaultSynopDecoder(SynopCodecConfig config, Clock clock) {
        Objects.requireNonNull(config, "config");
        this.sink = config.observabilitySink();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.reportDecoder = new ReportDecoder(sink, clock);
    }

    @Override
    public SynopReport decode(String telegram)
    {
        try {
            if (telegram == null || telegram.isBlank()) {
                throw new SynopDecodeException("Telegram is empty");
            }
            List<String> groups = Arrays.asList(WHITESPACE.split(telegram.strip()));
            SynopReport report = reportDecoder.decode(groups);
            sink.onReport(new SynopReportEvent(clock.instant(), SynopReportEvent.Direction.DECODED,
                    telegram, report.fields().size(), report.notImplemented()));
            return report;
        }
        catch (SynopDecodeException e) {
            sink.onError(new SynopErrorEvent(clock.instant(), "Failed to decode '" + telegram + "': "
                    + e.getMessage(), e));
            throw e;
        }
    }
}
