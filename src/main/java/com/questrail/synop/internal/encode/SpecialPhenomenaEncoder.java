package com.questrail.synop.internal.encode;

import com.questrail.synop.internal.field.FieldCodec;
import com.questrail.synop.internal.field.Fields;
import com.questrail.synop.internal.table.CodeTables;
import com.questrail.synop.internal.table.InvalidCodeException;
import com.questrail.synop.model.CardinalDirection;
import com.questrail.synop.model.Observation;
import com.questrail.synop.model.SpecialPhenomena.DepositDiameter;
import com.questrail.synop.model.SpecialPhenomena.HighestGust;
import com.questrail.synop.model.SpecialPhenomena.VisibilityDirection;
import com.questrail.synop.model.SynopField;
import com.questrail.synop.model.SynopReport;
import com.questrail.synop.model.TimeBeforeObservation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * SpecialPhenomenaEncoder
 * -----------------------------------------------------------------------------
 * Emits the 9SpSpspsp groups in increasing sub-header order.
 *
 * <p>A 907tt group is written in front of a 911ff or 931ss group whenever its
 * period differs from the one in force, which starts as the past weather
 * period of the observation hour.</p>
 */
final class SpecialPhenomenaEncoder
{
    private static final String TOWARDS_SEA = "towardsSea";
    private static final int TEN_MINUTES = 10;

    void encode(EncodeContext ctx) {
        SynopReport report = ctx.report();

        report.get(SynopField.VARIABLE_LOCATION_INTENSITY)
                .ifPresent(v -> ctx.emit("900" + ctx.encode(Fields.VARIABLE_LOCATION_INTENSITY, v)));
        report.get(SynopField.PRECIPITATION_TIME)
                .ifPresent(p -> ctx.emit("909" + ctx.encode(Fields.PRECIPITATION_TIME, p.time())
                        + ctx.encode(Fields.PRECIPITATION_CHARACTER, p.character())));
        report.get(SynopField.HIGHEST_GUSTS).ifPresent(gusts -> gusts.forEach(g -> encodeGust(g, ctx)));
        report.get(SynopField.SEA_CONDITION)
                .ifPresent(s -> ctx.emit("924" + ctx.encode(Fields.SEA_STATE, s.state())
                        + ctx.encode(Fields.SEA_VISIBILITY, s.visibility())));
        report.get(SynopField.FROZEN_DEPOSIT)
                .ifPresent(f -> ctx.emit("927" + ctx.encode(Fields.FROZEN_DEPOSIT, f.deposit())
                        + ctx.encode(Fields.DEPOSIT_VARIATION, f.variation())));
        report.get(SynopField.SNOW_COVER_REGULARITY)
                .ifPresent(s -> ctx.emit("928" + ctx.encode(Fields.SNOW_COVER, s.cover())
                        + ctx.encode(Fields.SNOW_COVER_REGULARITY, s.regularity())));
        report.get(SynopField.DRIFT_SNOW)
                .ifPresent(d -> ctx.emit("929" + ctx.encode(Fields.DRIFT_SNOW, d.phenomena())
                        + ctx.encode(Fields.DRIFT_SNOW_EVOLUTION, d.evolution())));
        report.get(SynopField.SNOW_FALL).ifPresent(s -> {
            emitPeriod(s.timeBeforeObs(), ctx);
            ctx.emit("931" + ctx.encode(Fields.NEW_SNOW_DEPTH, s.amount()));
        });
        report.get(SynopField.DEPOSIT_DIAMETERS).ifPresent(list -> encodeDepositDiameters(list, ctx));
        report.get(SynopField.CLOUD_EVOLUTION)
                .ifPresent(c -> ctx.emit("940" + ctx.encode(Fields.CLOUD_GENUS, c.genus())
                        + ctx.encode(Fields.CLOUD_EVOLUTION, c.evolution())));
        report.get(SynopField.LOW_CLOUD_CONCENTRATION)
                .ifPresent(c -> ctx.emit("944" + ctx.encode(Fields.LOW_CLOUD_CONCENTRATION, c.cloudType())
                        + ctx.encode(Fields.DIRECTION, c.direction())));
        report.get(SynopField.MOUNTAIN_CONDITION)
                .ifPresent(m -> ctx.emit("950" + ctx.encode(Fields.MOUNTAIN_CONDITION, m.conditions())
                        + ctx.encode(Fields.CLOUD_EVOLUTION, m.evolution())));
        report.get(SynopField.VALLEY_CLOUDS)
                .ifPresent(v -> ctx.emit("951" + ctx.encode(Fields.VALLEY_CLOUDS, v.condition())
                        + ctx.encode(Fields.VALLEY_CLOUDS_EVOLUTION, v.evolution())));
        report.get(SynopField.VISIBILITY_DIRECTIONS).ifPresent(list -> encodeVisibilityDirections(list, ctx));
        report.get(SynopField.OPTICAL_PHENOMENA)
                .ifPresent(o -> ctx.emit("990" + ctx.encode(Fields.OPTICAL_PHENOMENA, o.phenomena())
                        + ctx.encode(Fields.INTENSITY, o.intensity())));
        report.get(SynopField.MIRAGE)
                .ifPresent(m -> ctx.emit("991" + ctx.encode(Fields.MIRAGE, m.mirageType())
                        + ctx.encode(Fields.DIRECTION, m.direction())));
        report.get(SynopField.CONDENSATION_TRAILS)
                .ifPresent(c -> ctx.emit("992" + ctx.encode(Fields.CONDENSATION_TRAIL, c.trail())
                        + ctx.encode(Fields.TRAIL_TIME, c.time())));
        report.get(SynopField.SPECIAL_CLOUDS)
                .ifPresent(c -> ctx.emit("993" + ctx.encode(Fields.SPECIAL_CLOUDS, c.cloudType())
                        + ctx.encode(Fields.DIRECTION, c.direction())));
        report.get(SynopField.DAY_DARKNESS)
                .ifPresent(d -> ctx.emit("994" + ctx.encode(Fields.DAY_DARKNESS, d.darkness())
                        + ctx.encode(Fields.DIRECTION, d.direction())));
        report.get(SynopField.SUDDEN_TEMPERATURE_CHANGE)
                .ifPresent(t -> ctx.emit(encodeSuddenChange("996", "997", t, Fields.SUDDEN_TEMPERATURE_CHANGE, ctx)));
        report.get(SynopField.SUDDEN_HUMIDITY_CHANGE)
                .ifPresent(h -> ctx.emit(encodeSuddenChange("998", "999", h, Fields.SUDDEN_HUMIDITY_CHANGE, ctx)));
    }

    private static void encodeGust(HighestGust gust, EncodeContext ctx) {
        Integer measurePeriod = gust.measurePeriodMinutes();
        if (measurePeriod != null && measurePeriod != TEN_MINUTES) {
            throw new SynopEncodeException("Gust measure period must be 10 minutes, not " + measurePeriod);
        }
        String speed = ctx.encode(Fields.speed(ctx.windUnit()), gust.speed());
        if (measurePeriod != null) {
            ctx.emit("910" + speed);
        } else {
            emitPeriod(gust.timeBeforeObs(), ctx);
            ctx.emit("911" + speed);
        }
        if (gust.direction() != null) {
            ctx.emit("915" + ctx.encode(Fields.WIND_DIRECTION, gust.direction()));
        }
    }

    /**
     * Writes 907tt when {@code period} is not the one in force and makes it
     * the new running period.
     */
    private static void emitPeriod(Observation<TimeBeforeObservation> period, EncodeContext ctx) {
        if (period == null || period.equals(ctx.runningPeriod())) {
            return;
        }
        ctx.emit("907" + ctx.encode(Fields.TIME_BEFORE_OBSERVATION, period));
        ctx.runningPeriod(period);
    }

    private static void encodeDepositDiameters(List<DepositDiameter> diameters, EncodeContext ctx) {
        List<DepositDiameter> sorted = new ArrayList<>(diameters);
        sorted.sort(Comparator.comparingInt(d -> d.type().code()));
        for (DepositDiameter diameter : sorted) {
            ctx.emit("93" + diameter.type().code() + ctx.encode(Fields.DEPOSIT_DIAMETER, diameter.diameter()));
        }
    }

    private static void encodeVisibilityDirections(List<VisibilityDirection> directions, EncodeContext ctx) {
        List<String> groups = new ArrayList<>(directions.size());
        for (VisibilityDirection direction : directions) {
            groups.add("98" + directionCode(direction.direction())
                    + ctx.encode(Fields.VISIBILITY, ctx.visibility(direction.visibility())));
        }
        groups.sort(Comparator.comparing((String g) -> g.substring(0, 3)));
        groups.forEach(ctx::emit);
    }

    private static int directionCode(Observation<String> direction) {
        if (direction == null || !direction.available()) {
            throw new SynopEncodeException("Visibility direction is required for 98DvVV");
        }
        if (TOWARDS_SEA.equals(direction.value())) {
            return 0;
        }
        if (direction.hasProvenance() && CodeTables.DIRECTION.id().equals(direction.table())) {
            return direction.code();
        }
        try {
            int code = CodeTables.DIRECTION.encode(CardinalDirection.of(direction.value()));
            if (code < 1 || code > 8) {
                throw new SynopEncodeException("'" + direction.value() + "' is not a compass point");
            }
            return code;
        } catch (InvalidCodeException e) {
            throw new SynopEncodeException(e.getMessage(), e);
        }
    }

    private static String encodeSuddenChange(String rising, String falling, Observation<Integer> change,
                                             FieldCodec<Integer> codec,
                                             EncodeContext ctx) {
        boolean negative = change.available() && change.value() < 0;
        Observation<Integer> magnitude = negative ? change.withValue(-change.value()) : change;
        return (negative ? falling : rising) + ctx.encode(codec, magnitude);
    }
}
