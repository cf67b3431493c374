package com.questrail.synop.internal.decode;

import com.questrail.synop.internal.field.Codes;
import com.questrail.synop.internal.field.Fields;
import com.questrail.synop.model.CardinalDirection;
import com.questrail.synop.model.Observation;
import com.questrail.synop.model.SpecialPhenomena.CloudEvolution;
import com.questrail.synop.model.SpecialPhenomena.CondensationTrails;
import com.questrail.synop.model.SpecialPhenomena.DayDarkness;
import com.questrail.synop.model.SpecialPhenomena.DepositDiameter;
import com.questrail.synop.model.SpecialPhenomena.DepositType;
import com.questrail.synop.model.SpecialPhenomena.DriftSnow;
import com.questrail.synop.model.SpecialPhenomena.FrozenDeposit;
import com.questrail.synop.model.SpecialPhenomena.HighestGust;
import com.questrail.synop.model.SpecialPhenomena.LowCloudConcentration;
import com.questrail.synop.model.SpecialPhenomena.Mirage;
import com.questrail.synop.model.SpecialPhenomena.MountainCondition;
import com.questrail.synop.model.SpecialPhenomena.OpticalPhenomena;
import com.questrail.synop.model.SpecialPhenomena.PrecipitationTime;
import com.questrail.synop.model.SpecialPhenomena.SeaCondition;
import com.questrail.synop.model.SpecialPhenomena.SnowCoverRegularity;
import com.questrail.synop.model.SpecialPhenomena.SnowFall;
import com.questrail.synop.model.SpecialPhenomena.SpecialClouds;
import com.questrail.synop.model.SpecialPhenomena.ValleyClouds;
import com.questrail.synop.model.SpecialPhenomena.VisibilityDirection;
import com.questrail.synop.model.SynopField;
import com.questrail.synop.model.SynopReport;
import com.questrail.synop.model.TimeBeforeObservation;
import com.questrail.synop.model.WindDirection;

/**
 * SpecialPhenomenaDecoder
 * -----------------------------------------------------------------------------
 * Decodes the run of 9SpSpspsp groups that closes Section 3.
 *
 * <h2>Ordering</h2>
 * <ul>
 *   <li>Sub-headers must increase through the run. A repeated or decreasing
 *       sub-header is kept verbatim as not implemented.</li>
 *   <li>A 907tt group starts a new sequence, so {@code 90710 91120 90706 91115}
 *       reports two gusts over different periods.</li>
 *   <li>907tt may appear anywhere and sets the period for the 911ff and 931ss
 *       groups that follow it. A 907tt that nothing uses is kept as not
 *       implemented.</li>
 *   <li>915dd gives the direction of the gust reported by the group just
 *       before it.</li>
 * </ul>
 *
 * <p>Groups 912 to 914 (gusts at other levels and mean winds) and 989
 * (variation of visibility) are recognised but not interpreted.</p>
 */
final class SpecialPhenomenaDecoder
{
    private static final String TOWARDS_SEA = "towardsSea";

    /**
     * Decoding state of one run; discarded when the run ends.
     */
    private static final class Run
    {
        int lastSubHeader = -1;
        String period;
        boolean periodUsed;
        HighestGust gust;
    }

    void decode(String first, GroupCursor cursor, DecodeContext ctx) {
        Run run = new Run();
        String group = first;
        while (true) {
            decodeOne(group, run, ctx);
            if (!Section3Decoder.continues(cursor.peek(), '9')) {
                break;
            }
            group = cursor.next();
        }
        flushGust(run, ctx);
        releasePeriod(run, ctx);
    }

    private void decodeOne(String group, Run run, DecodeContext ctx) {
        int tens = Codes.digit(group, 1);
        int units = Codes.digit(group, 2);
        if (tens < 0 || units < 0) {
            flushGust(run, ctx);
            ctx.notImplemented(group, "Unrecognised special phenomena group");
            return;
        }
        int subHeader = tens * 10 + units;
        String body = group.substring(3);

        if (subHeader == 15) {
            if (run.gust == null) {
                ctx.notImplemented(group, "915dd is not preceded by a gust group");
                return;
            }
            Observation<WindDirection> direction = ctx.decode(Fields.WIND_DIRECTION, body, group);
            HighestGust gust = run.gust;
            run.gust = new HighestGust(gust.speed(), direction, gust.measurePeriodMinutes(), gust.timeBeforeObs());
            flushGust(run, ctx);
            return;
        }
        flushGust(run, ctx);

        if (subHeader == 7) {
            releasePeriod(run, ctx);
            Observation<TimeBeforeObservation> period = ctx.decode(Fields.TIME_BEFORE_OBSERVATION, body, group);
            if (period != null) {
                ctx.groupPeriod(period);
                run.period = group;
                run.periodUsed = false;
                run.lastSubHeader = subHeader;
            }
            return;
        }
        if (subHeader <= run.lastSubHeader) {
            ctx.notImplemented(group, "Special phenomena group is out of sequence");
            return;
        }
        run.lastSubHeader = subHeader;
        decodeSubHeader(subHeader, group, body, run, ctx);
    }

    private void decodeSubHeader(int subHeader, String group, String body, Run run, DecodeContext ctx) {
        SynopReport.Builder report = ctx.report();
        String first = body.substring(0, 1);
        String second = body.substring(1);
        switch (subHeader) {
            case 0 -> Section1Decoder.putIfPresent(report, SynopField.VARIABLE_LOCATION_INTENSITY,
                    ctx.decode(Fields.VARIABLE_LOCATION_INTENSITY, body, group));
            case 9 -> report.put(SynopField.PRECIPITATION_TIME, new PrecipitationTime(
                    ctx.decode(Fields.PRECIPITATION_TIME, first, group),
                    ctx.decode(Fields.PRECIPITATION_CHARACTER, second, group)));
            case 10 -> run.gust = new HighestGust(
                    ctx.decode(Fields.speed(ctx.windUnit()), body, group), null, 10, null);
            case 11 -> run.gust = new HighestGust(
                    ctx.decode(Fields.speed(ctx.windUnit()), body, group), null, null, usePeriod(run, ctx));
            case 24 -> report.put(SynopField.SEA_CONDITION, new SeaCondition(
                    ctx.decode(Fields.SEA_STATE, first, group),
                    ctx.decode(Fields.SEA_VISIBILITY, second, group)));
            case 27 -> report.put(SynopField.FROZEN_DEPOSIT, new FrozenDeposit(
                    ctx.decode(Fields.FROZEN_DEPOSIT, first, group),
                    ctx.decode(Fields.DEPOSIT_VARIATION, second, group)));
            case 28 -> report.put(SynopField.SNOW_COVER_REGULARITY, new SnowCoverRegularity(
                    ctx.decode(Fields.SNOW_COVER, first, group),
                    ctx.decode(Fields.SNOW_COVER_REGULARITY, second, group)));
            case 29 -> report.put(SynopField.DRIFT_SNOW, new DriftSnow(
                    ctx.decode(Fields.DRIFT_SNOW, first, group),
                    ctx.decode(Fields.DRIFT_SNOW_EVOLUTION, second, group)));
            case 31 -> report.put(SynopField.SNOW_FALL, new SnowFall(
                    ctx.decode(Fields.NEW_SNOW_DEPTH, body, group), usePeriod(run, ctx)));
            case 33, 34, 35, 36, 37 -> report.append(SynopField.DEPOSIT_DIAMETERS, new DepositDiameter(
                    DepositType.fromCode(subHeader - 30),
                    ctx.decode(Fields.DEPOSIT_DIAMETER, body, group)));
            case 40 -> report.put(SynopField.CLOUD_EVOLUTION, new CloudEvolution(
                    ctx.decode(Fields.CLOUD_GENUS, first, group),
                    ctx.decode(Fields.CLOUD_EVOLUTION, second, group)));
            case 44 -> report.put(SynopField.LOW_CLOUD_CONCENTRATION, new LowCloudConcentration(
                    ctx.decode(Fields.LOW_CLOUD_CONCENTRATION, first, group),
                    ctx.decode(Fields.DIRECTION, second, group)));
            case 50 -> report.put(SynopField.MOUNTAIN_CONDITION, new MountainCondition(
                    ctx.decode(Fields.MOUNTAIN_CONDITION, first, group),
                    ctx.decode(Fields.CLOUD_EVOLUTION, second, group)));
            case 51 -> report.put(SynopField.VALLEY_CLOUDS, new ValleyClouds(
                    ctx.decode(Fields.VALLEY_CLOUDS, first, group),
                    ctx.decode(Fields.VALLEY_CLOUDS_EVOLUTION, second, group)));
            case 80, 81, 82, 83, 84, 85, 86, 87, 88 -> decodeVisibilityDirection(subHeader, group, body, ctx);
            case 90 -> report.put(SynopField.OPTICAL_PHENOMENA, new OpticalPhenomena(
                    ctx.decode(Fields.OPTICAL_PHENOMENA, first, group),
                    ctx.decode(Fields.INTENSITY, second, group)));
            case 91 -> report.put(SynopField.MIRAGE, new Mirage(
                    ctx.decode(Fields.MIRAGE, first, group),
                    ctx.decode(Fields.DIRECTION, second, group)));
            case 92 -> report.put(SynopField.CONDENSATION_TRAILS, new CondensationTrails(
                    ctx.decode(Fields.CONDENSATION_TRAIL, first, group),
                    ctx.decode(Fields.TRAIL_TIME, second, group)));
            case 93 -> report.put(SynopField.SPECIAL_CLOUDS, new SpecialClouds(
                    ctx.decode(Fields.SPECIAL_CLOUDS, first, group),
                    ctx.decode(Fields.DIRECTION, second, group)));
            case 94 -> report.put(SynopField.DAY_DARKNESS, new DayDarkness(
                    ctx.decode(Fields.DAY_DARKNESS, first, group),
                    ctx.decode(Fields.DIRECTION, second, group)));
            case 96, 97 -> putSuddenChange(SynopField.SUDDEN_TEMPERATURE_CHANGE,
                    ctx.decode(Fields.SUDDEN_TEMPERATURE_CHANGE, body, group), subHeader == 97, group, ctx);
            case 98, 99 -> putSuddenChange(SynopField.SUDDEN_HUMIDITY_CHANGE,
                    ctx.decode(Fields.SUDDEN_HUMIDITY_CHANGE, body, group), subHeader == 99, group, ctx);
            default -> ctx.notImplemented(group, "Special phenomena group 9" + group.substring(1, 3)
                    + " is not interpreted");
        }
    }

    private static void decodeVisibilityDirection(int subHeader, String group, String body, DecodeContext ctx) {
        Observation<String> direction;
        if (subHeader == 80) {
            direction = Observation.of("0", TOWARDS_SEA, null);
        } else {
            Observation<CardinalDirection> point =
                    ctx.decode(Fields.DIRECTION, String.valueOf(subHeader - 80), group);
            if (point == null) {
                return;
            }
            direction = Observation.coded(point.raw(), point.value().point(), null, point.table(), point.code());
        }
        ctx.report().append(SynopField.VISIBILITY_DIRECTIONS, new VisibilityDirection(
                direction, ctx.decode(Fields.VISIBILITY, body, group)));
    }

    private static void putSuddenChange(SynopField<Observation<Integer>> field, Observation<Integer> change,
                                        boolean negative, String group, DecodeContext ctx) {
        if (ctx.report().has(field)) {
            ctx.notImplemented(group, "Duplicate sudden change group");
            return;
        }
        if (change != null && change.available() && negative) {
            change = change.withValue(-change.value());
        }
        Section1Decoder.putIfPresent(ctx.report(), field, change);
    }

    private static Observation<TimeBeforeObservation> usePeriod(Run run, DecodeContext ctx) {
        if (run.period != null) {
            run.periodUsed = true;
        }
        return ctx.effectivePeriod();
    }

    private static void flushGust(Run run, DecodeContext ctx) {
        if (run.gust != null) {
            ctx.report().append(SynopField.HIGHEST_GUSTS, run.gust);
            run.gust = null;
        }
    }

    private static void releasePeriod(Run run, DecodeContext ctx) {
        if (run.period != null && !run.periodUsed) {
            ctx.notImplemented(run.period, "907tt is not followed by a group it applies to");
        }
        run.period = null;
    }
}
