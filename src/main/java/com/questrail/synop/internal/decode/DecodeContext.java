package com.questrail.synop.internal.decode;

import com.questrail.synop.internal.field.FieldCodec;
import com.questrail.synop.internal.table.InvalidCodeException;
import com.questrail.synop.model.Observation;
import com.questrail.synop.model.Region;
import com.questrail.synop.model.StationType;
import com.questrail.synop.model.SynopReport;
import com.questrail.synop.model.TimeBeforeObservation;
import com.questrail.synop.observability.SynopObservabilitySink;
import com.questrail.synop.observability.SynopWarningEvent;

import java.time.Clock;
import java.util.Objects;

/**
 * DecodeContext
 * -----------------------------------------------------------------------------
 * Per-call state of one decode: the report under construction and the values
 * carried forward from earlier groups.
 *
 * <p>A context is created for a single telegram and discarded afterwards. It
 * is never shared between threads.</p>
 */
final class DecodeContext
{
    private final SynopReport.Builder report = SynopReport.builder();
    private final SynopObservabilitySink sink;
    private final Clock clock;

    private StationType stationType;
    private Region region;
    private String windUnit;
    private Integer observationHour;
    private Observation<TimeBeforeObservation> groupPeriod;
    private SwellAccumulator swell;

    DecodeContext(SynopObservabilitySink sink, Clock clock) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    SynopReport.Builder report() {
        return report;
    }

    /**
     * Decodes one component, or returns {@code null} after a warning if the
     * code is invalid.
     */
    <T> Observation<T> decode(FieldCodec<T> codec, String raw, String group) {
        try {
            return codec.decode(raw);
        } catch (InvalidCodeException e) {
            warn(group, e.getMessage(), e);
            return null;
        }
    }

    void warn(String group, String message) {
        warn(group, message, null);
    }

    void warn(String group, String message, Throwable cause) {
        sink.onWarning(new SynopWarningEvent(clock.instant(), group, message, cause));
    }

    /**
     * Records a group the decoder does not interpret, keeping its raw text.
     */
    void notImplemented(String group, String reason) {
        report.notImplemented(group);
        warn(group, reason);
    }

    /**
     * Swell groups seen so far in Section 2, created on first use.
     */
    SwellAccumulator swell() {
        if (swell == null) {
            swell = new SwellAccumulator();
        }
        return swell;
    }

    boolean hasSwell() {
        return swell != null;
    }

    StationType stationType() {
        return stationType;
    }

    void stationType(StationType stationType) {
        this.stationType = stationType;
    }

    Region region() {
        return region;
    }

    void region(Region region) {
        this.region = region;
    }

    String windUnit() {
        return windUnit;
    }

    void windUnit(String windUnit) {
        this.windUnit = windUnit;
    }

    Integer observationHour() {
        return observationHour;
    }

    void observationHour(Integer observationHour) {
        this.observationHour = observationHour;
    }

    /**
     * The period set by the last 907tt group, or {@code null}.
     */
    Observation<TimeBeforeObservation> groupPeriod() {
        return groupPeriod;
    }

    void groupPeriod(Observation<TimeBeforeObservation> groupPeriod) {
        this.groupPeriod = groupPeriod;
    }

    /**
     * The time before observation in force for groups that do not state their
     * own: the last 907tt period if there is one, otherwise the past weather
     * period implied by the observation hour.
     */
    Observation<TimeBeforeObservation> effectivePeriod() {
        if (groupPeriod != null) {
            return groupPeriod;
        }
        TimeBeforeObservation period = TimeBeforeObservation.pastWeatherPeriod(observationHour);
        return period == null ? null : Observation.of(period);
    }
}
