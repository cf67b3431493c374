package com.questrail.synop.internal.decode;

import com.questrail.synop.internal.field.Codes;
import com.questrail.synop.internal.field.Fields;
import com.questrail.synop.model.CloudDrift;
import com.questrail.synop.model.CloudElevation;
import com.questrail.synop.model.CloudLayer;
import com.questrail.synop.model.Evapotranspiration;
import com.questrail.synop.model.GroundState;
import com.questrail.synop.model.GroundStateSnow;
import com.questrail.synop.model.LocalPrecipitation;
import com.questrail.synop.model.Observation;
import com.questrail.synop.model.Precipitation;
import com.questrail.synop.model.Radiation;
import com.questrail.synop.model.Region;
import com.questrail.synop.model.Sunshine;
import com.questrail.synop.model.SynopField;
import com.questrail.synop.model.SynopReport;
import com.questrail.synop.model.Wind;

import java.util.ArrayList;
import java.util.List;

/**
 * Section3Decoder
 * -----------------------------------------------------------------------------
 * Decodes the climatological section (333 and groups 0 to 9).
 *
 * <h2>Regional groups</h2>
 * <ul>
 *   <li>Group 0 is 0TTRR in Region I and 0ddff (maximum wind) in the
 *       Antarctic. It is not interpreted elsewhere.</li>
 *   <li>Group 3 (EsTT) is only reported by land stations.</li>
 * </ul>
 *
 * <h2>Group 5 family</h2>
 * Group 5 opens a run of 5xxxx groups ordered by their second digit:
 * evapotranspiration (0..4), sunshine (5, repeatable), cloud drift (6), cloud
 * elevation (7) and the 24-hour pressure change (8 or 9). Each sunshine group
 * may be followed by radiation groups j FFFF with j strictly increasing from
 * 0 to 5.
 */
final class Section3Decoder extends NumberedSectionDecoder
{
    private static final int EVAPOTRANSPIRATION = 0;
    private static final int SUNSHINE = 5;
    private static final int CLOUD_DRIFT = 6;
    private static final int CLOUD_ELEVATION = 7;
    private static final int PRESSURE_CHANGE = 8;

    private final SpecialPhenomenaDecoder specialPhenomena = new SpecialPhenomenaDecoder();

    Section3Decoder() {
        super(0, 9);
    }

    void decode(GroupCursor cursor, DecodeContext ctx) {
        decodeGroups(cursor, ctx);
    }

    @Override
    protected void decodeGroup(int header, String group, GroupCursor cursor, DecodeContext ctx) {
        SynopReport.Builder report = ctx.report();
        switch (header) {
            case 0 -> decodeRegionalGroup(group, ctx);
            case 1 -> Section1Decoder.putIfPresent(report, SynopField.MAXIMUM_TEMPERATURE,
                    ctx.decode(Fields.TEMPERATURE, group.substring(1), group));
            case 2 -> Section1Decoder.putIfPresent(report, SynopField.MINIMUM_TEMPERATURE,
                    ctx.decode(Fields.TEMPERATURE, group.substring(1), group));
            case 3 -> decodeGroundState(group, ctx);
            case 4 -> report.put(SynopField.GROUND_STATE_SNOW, new GroundStateSnow(
                    ctx.decode(Fields.GROUND_STATE_SNOW, group.substring(1, 2), group),
                    ctx.decode(Fields.SNOW_DEPTH, group.substring(2), group)));
            case 5 -> decodeFiveFamily(group, cursor, ctx);
            case 6 -> report.put(SynopField.PRECIPITATION_S3, Section1Decoder.decodePrecipitation(group, ctx));
            case 7 -> decodeDailyPrecipitation(group, ctx);
            case 8 -> decodeCloudLayers(group, cursor, ctx);
            case 9 -> specialPhenomena.decode(group, cursor, ctx);
            default -> ctx.notImplemented(group, "Unsupported Section 3 group");
        }
    }

    private static void decodeRegionalGroup(String group, DecodeContext ctx) {
        Region region = ctx.region();
        if (region == Region.I) {
            Observation<Integer> temperature = ctx.decode(Fields.GROUND_TEMPERATURE, group.substring(1, 3), group);
            if (temperature != null && temperature.available() && temperature.value() >= 50) {
                temperature = temperature.withValue(50 - temperature.value());
            }
            Section1Decoder.putIfPresent(ctx.report(), SynopField.GROUND_MINIMUM_TEMPERATURE, temperature);
            ctx.report().put(SynopField.LOCAL_PRECIPITATION, new LocalPrecipitation(
                    ctx.decode(Fields.LOCAL_PRECIPITATION_CHARACTER, group.substring(3, 4), group),
                    ctx.decode(Fields.LOCAL_PRECIPITATION_TIME, group.substring(4), group)));
        } else if (region == Region.ANTARCTIC) {
            ctx.report().put(SynopField.MAX_WIND, new Wind(
                    ctx.decode(Fields.WIND_DIRECTION, group.substring(1, 3), group),
                    ctx.decode(Fields.speed(ctx.windUnit()), group.substring(3), group)));
        } else {
            ctx.notImplemented(group, "Section 3 group 0 is not defined for region "
                    + (region == null ? "unknown" : region.label()));
        }
    }

    private static void decodeGroundState(String group, DecodeContext ctx) {
        Region region = ctx.region();
        if (region == null || region == Region.SHIP) {
            ctx.notImplemented(group, "Ground state is only reported by land stations");
            return;
        }
        String temperatureCode = group.substring(2);
        Observation<Integer> temperature;
        if (Codes.isUnavailable(temperatureCode)) {
            temperature = Observation.unavailable(temperatureCode);
        } else {
            char sign = temperatureCode.charAt(0);
            temperature = ctx.decode(Fields.GROUND_TEMPERATURE, temperatureCode.substring(1), group);
            if (sign != '0' && sign != '1') {
                ctx.warn(group, "'" + sign + "' is not a valid temperature sign");
                temperature = null;
            } else if (sign == '1' && temperature != null && temperature.available()) {
                temperature = temperature.withValue(-temperature.value());
            }
        }
        ctx.report().put(SynopField.GROUND_STATE, new GroundState(
                ctx.decode(Fields.GROUND_STATE, group.substring(1, 2), group), temperature));
    }

    private static void decodeDailyPrecipitation(String group, DecodeContext ctx) {
        Precipitation precipitation = new Precipitation(
                ctx.decode(Fields.PRECIPITATION_AMOUNT_24H, group.substring(1), group),
                Observation.of(Precipitation.DAILY_HOURS, Fields.HOUR));
        SynopField<Precipitation> slot = ctx.report().has(SynopField.PRECIPITATION_S3)
                ? SynopField.PRECIPITATION_24H
                : SynopField.PRECIPITATION_S3;
        ctx.report().put(slot, precipitation);
    }

    private static void decodeCloudLayers(String group, GroupCursor cursor, DecodeContext ctx) {
        String layer = group;
        while (true) {
            ctx.report().append(SynopField.CLOUD_LAYERS, new CloudLayer(
                    ctx.decode(Fields.CLOUD_COVER, layer.substring(1, 2), layer),
                    ctx.decode(Fields.CLOUD_GENUS, layer.substring(2, 3), layer),
                    ctx.decode(Fields.CLOUD_HEIGHT, layer.substring(3), layer)));
            if (!continues(cursor.peek(), '8')) {
                return;
            }
            layer = cursor.next();
        }
    }

    static boolean continues(String next, char header) {
        return next != null
            && next.length() == 5
            && next.charAt(0) == header
            && !Sections.isMarker(next);
    }

    // -------------------------------------------------------------------------
    // Group 5 family
    // -------------------------------------------------------------------------

    private static int familyLevel(String group) {
        int second = Codes.digit(group, 1);
        if (second < 0) {
            return -1;
        }
        if (second <= 4) {
            return EVAPOTRANSPIRATION;
        }
        return second == 9 ? PRESSURE_CHANGE : second;
    }

    private static void decodeFiveFamily(String first, GroupCursor cursor, DecodeContext ctx) {
        String group = first;
        int level = familyLevel(group);
        if (level < 0) {
            ctx.notImplemented(group, "Unrecognised group in the group 5 family");
            return;
        }
        while (true) {
            switch (level) {
                case EVAPOTRANSPIRATION -> ctx.report().put(SynopField.EVAPOTRANSPIRATION, new Evapotranspiration(
                        ctx.decode(Fields.EVAPORATION, group.substring(1, 4), group),
                        ctx.decode(Fields.EVAPORATION_TYPE, group.substring(4), group)));
                case SUNSHINE -> decodeSunshine(group, cursor, ctx);
                case CLOUD_DRIFT -> ctx.report().put(SynopField.CLOUD_DRIFT_DIRECTION, new CloudDrift(
                        ctx.decode(Fields.DIRECTION, group.substring(2, 3), group),
                        ctx.decode(Fields.DIRECTION, group.substring(3, 4), group),
                        ctx.decode(Fields.DIRECTION, group.substring(4), group)));
                case CLOUD_ELEVATION -> ctx.report().put(SynopField.CLOUD_ELEVATION, new CloudElevation(
                        ctx.decode(Fields.CLOUD_GENUS, group.substring(2, 3), group),
                        ctx.decode(Fields.DIRECTION, group.substring(3, 4), group),
                        ctx.decode(Fields.ELEVATION_ANGLE, group.substring(4), group)));
                default -> {
                    Observation<Double> change = ctx.decode(Fields.PRESSURE_CHANGE, group.substring(2), group);
                    Section1Decoder.putIfPresent(ctx.report(), SynopField.PRESSURE_CHANGE,
                            Section2Decoder.signed(change, group.charAt(1) == '9'));
                }
            }

            String next = cursor.peek();
            if (!continues(next, '5')) {
                return;
            }
            int nextLevel = familyLevel(next);
            if (nextLevel < 0 || nextLevel < level || (nextLevel == level && level != SUNSHINE)) {
                return;
            }
            level = nextLevel;
            group = cursor.next();
        }
    }

    private static void decodeSunshine(String group, GroupCursor cursor, DecodeContext ctx) {
        char form = group.charAt(2);
        Observation<Double> amount;
        Observation<Integer> duration;
        if (form == '3') {
            amount = ctx.decode(Fields.HOURLY_SUNSHINE, group.substring(3), group);
            duration = Observation.of(Sunshine.HOURLY, Fields.HOUR);
        } else if (form >= '0' && form <= '2') {
            amount = ctx.decode(Fields.DAILY_SUNSHINE, group.substring(2), group);
            duration = Observation.of(Sunshine.DAILY, Fields.HOUR);
        } else if (Codes.isUnavailable(group.substring(2))) {
            amount = Observation.unavailable(group.substring(2));
            duration = null;
        } else {
            ctx.notImplemented(group, "Unrecognised sunshine group");
            return;
        }
        String unit = duration != null && duration.value() == Sunshine.HOURLY
                ? Radiation.HOURLY_UNIT
                : Radiation.DAILY_UNIT;
        ctx.report().append(SynopField.SUNSHINE, new Sunshine(amount, duration, decodeRadiation(cursor, unit, ctx)));
    }

    private static List<Radiation> decodeRadiation(GroupCursor cursor, String unit, DecodeContext ctx) {
        List<Radiation> radiation = new ArrayList<>();
        int last = -1;
        while (true) {
            String next = cursor.peek();
            if (next == null || next.length() != 5 || Sections.isMarker(next)) {
                return radiation;
            }
            int j = Codes.digit(next, 0);
            if (j <= last || j > 5) {
                return radiation;
            }
            int second = Codes.digit(next, 1);
            if (j == 5 && (second < 0 || second > 4)) {
                return radiation;
            }
            cursor.next();
            Observation<Integer> amount = ctx.decode(Fields.RADIATION, next.substring(1), next);
            radiation.add(new Radiation(j, amount == null ? null : amount.withUnit(unit)));
            last = j;
        }
    }
}
