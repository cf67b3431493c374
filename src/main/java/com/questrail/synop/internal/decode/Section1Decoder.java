package com.questrail.synop.internal.decode;

import com.questrail.synop.internal.field.Fields;
import com.questrail.synop.model.CloudTypes;
import com.questrail.synop.model.ExactObservationTime;
import com.questrail.synop.model.Geopotential;
import com.questrail.synop.model.Observation;
import com.questrail.synop.model.Precipitation;
import com.questrail.synop.model.PrecipitationIndicator;
import com.questrail.synop.model.PressureTendency;
import com.questrail.synop.model.SynopField;
import com.questrail.synop.model.SynopReport;
import com.questrail.synop.model.TimeBeforeObservation;
import com.questrail.synop.model.ValueRange;
import com.questrail.synop.model.Visibility;
import com.questrail.synop.model.Weather;
import com.questrail.synop.model.WeatherIndicator;
import com.questrail.synop.model.Wind;
import com.questrail.synop.model.WindDirection;

import java.util.regex.Pattern;

/**
 * Section1Decoder
 * -----------------------------------------------------------------------------
 * Decodes the land station data common to all station types: the mandatory
 * iihVV and Nddff groups followed by the numbered groups 1 to 9.
 */
final class Section1Decoder extends NumberedSectionDecoder
{
    private static final Pattern GROUP = Pattern.compile("^[\\d/]{5}$");
    private static final Pattern EXTENDED_SPEED = Pattern.compile("^00\\d{3}$");

    Section1Decoder() {
        super(1, 9);
    }

    void decode(GroupCursor cursor, DecodeContext ctx) {
        decodeCloudBaseAndVisibility(cursor.next(), ctx);
        if (!cursor.hasNext()) {
            return;
        }
        decodeCloudCoverAndWind(cursor.next(), cursor, ctx);
        decodeGroups(cursor, ctx);
    }

    private void decodeCloudBaseAndVisibility(String group, DecodeContext ctx) {
        if (!GROUP.matcher(group).matches()) {
            throw new SynopDecodeException("Invalid iihVV group '" + group + "'");
        }
        SynopReport.Builder report = ctx.report();
        Observation<PrecipitationIndicator> precipitation =
                ctx.decode(Fields.PRECIPITATION_INDICATOR, group.substring(0, 1), group);
        Observation<WeatherIndicator> weather =
                ctx.decode(Fields.WEATHER_INDICATOR, group.substring(1, 2), group);
        Observation<ValueRange> cloudBase = ctx.decode(Fields.LOWEST_CLOUD_BASE, group.substring(2, 3), group);
        Observation<Visibility> visibility = ctx.decode(Fields.VISIBILITY, group.substring(3), group);
        putIfPresent(report, SynopField.PRECIPITATION_INDICATOR, precipitation);
        putIfPresent(report, SynopField.WEATHER_INDICATOR, weather);
        putIfPresent(report, SynopField.LOWEST_CLOUD_BASE, cloudBase);
        putIfPresent(report, SynopField.VISIBILITY, visibility);
    }

    private void decodeCloudCoverAndWind(String group, GroupCursor cursor, DecodeContext ctx) {
        if (!GROUP.matcher(group).matches()) {
            throw new SynopDecodeException("Invalid Nddff group '" + group + "'");
        }
        putIfPresent(ctx.report(), SynopField.CLOUD_COVER,
                ctx.decode(Fields.CLOUD_COVER, group.substring(0, 1), group));

        Observation<WindDirection> direction = ctx.decode(Fields.WIND_DIRECTION, group.substring(1, 3), group);
        String ff = group.substring(3);
        Observation<Integer> speed = ctx.decode(Fields.speed(ctx.windUnit()), ff, group);
        String next = cursor.peek();
        if ("99".equals(ff) && next != null && EXTENDED_SPEED.matcher(next).matches()) {
            cursor.next();
            speed = Observation.of(ff + " " + next, Integer.parseInt(next.substring(2)), ctx.windUnit());
        }
        if (direction != null && direction.available() && direction.value().calm()
                && speed != null && speed.available() && speed.value() > 0) {
            ctx.warn(group, "Wind is calm but the speed is " + speed.value() + "; speed ignored");
            speed = null;
        }
        ctx.report().put(SynopField.SURFACE_WIND, new Wind(direction, speed));
    }

    @Override
    protected void decodeGroup(int header, String group, GroupCursor cursor, DecodeContext ctx) {
        SynopReport.Builder report = ctx.report();
        String body = group.substring(1);
        switch (header) {
            case 1 -> putIfPresent(report, SynopField.AIR_TEMPERATURE, ctx.decode(Fields.TEMPERATURE, body, group));
            case 2 -> {
                if (body.charAt(0) == '9') {
                    putIfPresent(report, SynopField.RELATIVE_HUMIDITY,
                            ctx.decode(Fields.RELATIVE_HUMIDITY, body.substring(1), group));
                } else {
                    putIfPresent(report, SynopField.DEWPOINT_TEMPERATURE,
                            ctx.decode(Fields.TEMPERATURE, body, group));
                }
            }
            case 3 -> putIfPresent(report, SynopField.STATION_PRESSURE, ctx.decode(Fields.PRESSURE, body, group));
            case 4 -> decodePressureOrGeopotential(group, ctx);
            case 5 -> report.put(SynopField.PRESSURE_TENDENCY, decodeTendency(group, ctx));
            case 6 -> report.put(SynopField.PRECIPITATION_S1, decodePrecipitation(group, ctx));
            case 7 -> report.put(SynopField.WEATHER, new Weather(
                    ctx.decode(Fields.PRESENT_WEATHER, group.substring(1, 3), group),
                    ctx.decode(Fields.PAST_WEATHER, group.substring(3, 4), group),
                    ctx.decode(Fields.PAST_WEATHER, group.substring(4), group),
                    TimeBeforeObservation.pastWeatherPeriod(ctx.observationHour())));
            case 8 -> report.put(SynopField.CLOUD_TYPES, new CloudTypes(
                    ctx.decode(Fields.CLOUD_COVER, group.substring(1, 2), group),
                    ctx.decode(Fields.LOW_CLOUD_TYPE, group.substring(2, 3), group),
                    ctx.decode(Fields.MIDDLE_CLOUD_TYPE, group.substring(3, 4), group),
                    ctx.decode(Fields.HIGH_CLOUD_TYPE, group.substring(4), group)));
            case 9 -> report.put(SynopField.EXACT_OBS_TIME, new ExactObservationTime(
                    ctx.decode(Fields.EXACT_HOUR, group.substring(1, 3), group),
                    ctx.decode(Fields.EXACT_MINUTE, group.substring(3), group)));
            default -> ctx.notImplemented(group, "Unsupported Section 1 group");
        }
    }

    private static void decodePressureOrGeopotential(String group, DecodeContext ctx) {
        char a = group.charAt(1);
        if (a == '0' || a == '9') {
            putIfPresent(ctx.report(), SynopField.SEA_LEVEL_PRESSURE,
                    ctx.decode(Fields.PRESSURE, group.substring(1), group));
        } else if ("12578/".indexOf(a) >= 0) {
            ctx.report().put(SynopField.GEOPOTENTIAL, decodeGeopotential(group, ctx));
        } else {
            ctx.warn(group, "'" + a + "' is not a valid isobaric surface");
        }
    }

    /**
     * 4ahhh: the height of a standard isobaric surface, in geopotential metres,
     * with the leading digit omitted according to the surface.
     */
    static Geopotential decodeGeopotential(String group, DecodeContext ctx) {
        Observation<Integer> surface = ctx.decode(Fields.ISOBARIC_SURFACE, group.substring(1, 2), group);
        Observation<Integer> height = ctx.decode(Fields.GEOPOTENTIAL_HEIGHT, group.substring(2), group);
        if (height != null && height.available() && surface != null && surface.available()) {
            int hhh = height.value();
            int adjusted = switch (surface.code()) {
                case 2 -> hhh < 300 ? hhh + 1000 : hhh;
                case 7 -> hhh < 500 ? hhh + 3000 : hhh + 2000;
                case 8 -> hhh + 1000;
                default -> hhh;
            };
            height = height.withValue(adjusted);
        }
        return new Geopotential(surface, height);
    }

    static PressureTendency decodeTendency(String group, DecodeContext ctx) {
        Observation<Integer> tendency = ctx.decode(Fields.PRESSURE_CHARACTERISTIC, group.substring(1, 2), group);
        Observation<Double> change = ctx.decode(Fields.PRESSURE_CHANGE, group.substring(2), group);
        if (change != null && change.available() && tendency != null && tendency.available()
                && tendency.value() >= 5) {
            change = change.withValue(-change.value());
        }
        return new PressureTendency(tendency, change);
    }

    static Precipitation decodePrecipitation(String group, DecodeContext ctx) {
        return new Precipitation(
                ctx.decode(Fields.PRECIPITATION_AMOUNT, group.substring(1, 4), group),
                ctx.decode(Fields.PRECIPITATION_PERIOD, group.substring(4), group));
    }

    static <T> void putIfPresent(SynopReport.Builder report, SynopField<Observation<T>> field,
                                 Observation<T> observation) {
        if (observation != null) {
            report.put(field, observation);
        }
    }
}
