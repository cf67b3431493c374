package com.questrail.synop.internal.encode;

import com.questrail.synop.config.SynopCodecConfig;
import com.questrail.synop.internal.field.FieldCodec;
import com.questrail.synop.internal.table.CodeTables;
import com.questrail.synop.internal.table.InvalidCodeException;
import com.questrail.synop.model.CloudHeight;
import com.questrail.synop.model.Observation;
import com.questrail.synop.model.SynopField;
import com.questrail.synop.model.SynopReport;
import com.questrail.synop.model.TimeBeforeObservation;
import com.questrail.synop.model.Visibility;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * EncodeContext
 * -----------------------------------------------------------------------------
 * Per-call state of one encode: the report being encoded, the groups emitted
 * so far and the values carried forward between groups.
 *
 * <h2>Carried state</h2>
 * <ul>
 *   <li>The wind speed unit announced by iw.</li>
 *   <li>The running time-before-observation period. It starts as the past
 *       weather period of the observation hour and changes whenever a 907tt
 *       group is emitted.</li>
 * </ul>
 */
final class EncodeContext
{
    private final SynopReport report;
    private final SynopCodecConfig config;
    private final List<String> groups = new ArrayList<>();

    private String windUnit;
    private Observation<TimeBeforeObservation> runningPeriod;

    EncodeContext(SynopReport report, SynopCodecConfig config) {
        this.report = Objects.requireNonNull(report, "report");
        this.config = Objects.requireNonNull(config, "config");
    }

    SynopReport report() {
        return report;
    }

    /**
     * @throws SynopEncodeException if the report has no value for the field
     */
    <T> T require(SynopField<T> field) {
        return report.get(field)
                .orElseThrow(() -> new SynopEncodeException("Missing required field '" + field.name() + "'"));
    }

    <T> String encode(FieldCodec<T> codec, Observation<T> observation) {
        try {
            return codec.encode(observation, config.unitConverter());
        } catch (InvalidCodeException e) {
            throw new SynopEncodeException(e.getMessage(), e);
        }
    }

    /**
     * Converts a numeric observation to {@code unit}. Observations without a
     * unit, and a {@code null} target, are taken as already converted.
     */
    double convert(Observation<? extends Number> observation, String unit) {
        double value = observation.value().doubleValue();
        if (observation.unit() == null || unit == null || observation.unit().equals(unit)) {
            return value;
        }
        try {
            return config.unitConverter().convert(value, observation.unit(), unit);
        } catch (IllegalArgumentException e) {
            throw new SynopEncodeException(e.getMessage(), e);
        }
    }

    void emit(String group) {
        groups.add(group);
    }

    List<String> groups() {
        return groups;
    }

    /**
     * Applies the configured code range to a visibility that was not decoded
     * from table 4377.
     */
    Observation<Visibility> visibility(Observation<Visibility> observation) {
        if (observation == null || !observation.available() || decodedFrom(observation, CodeTables.VISIBILITY.id())) {
            return observation;
        }
        return config.visibilityUse90Override()
                .map(use90 -> {
                    Visibility v = observation.value();
                    return observation.withValue(new Visibility(v.metres(), v.quantifier(), use90));
                })
                .orElse(observation);
    }

    /**
     * Applies the configured code range to a cloud height that was not decoded
     * from table 1677.
     */
    Observation<CloudHeight> cloudHeight(Observation<CloudHeight> observation) {
        if (observation == null || !observation.available() || decodedFrom(observation, CodeTables.CLOUD_HEIGHT.id())) {
            return observation;
        }
        return config.cloudHeightUse90Override()
                .map(use90 -> {
                    CloudHeight h = observation.value();
                    return observation.withValue(new CloudHeight(h.value(), h.min(), h.max(), h.quantifier(), use90));
                })
                .orElse(observation);
    }

    private static boolean decodedFrom(Observation<?> observation, String table) {
        return observation.hasProvenance() && table.equals(observation.table());
    }

    String windUnit() {
        return windUnit;
    }

    void windUnit(String windUnit) {
        this.windUnit = windUnit;
    }

    Observation<TimeBeforeObservation> runningPeriod() {
        return runningPeriod;
    }

    void runningPeriod(Observation<TimeBeforeObservation> runningPeriod) {
        this.runningPeriod = runningPeriod;
    }
}
