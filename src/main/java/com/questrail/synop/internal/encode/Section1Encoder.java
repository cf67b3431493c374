package com.questrail.synop.internal.encode;

import com.questrail.synop.internal.field.Fields;
import com.questrail.synop.model.CloudTypes;
import com.questrail.synop.model.ExactObservationTime;
import com.questrail.synop.model.Geopotential;
import com.questrail.synop.model.Observation;
import com.questrail.synop.model.Precipitation;
import com.questrail.synop.model.PressureTendency;
import com.questrail.synop.model.SynopField;
import com.questrail.synop.model.SynopReport;
import com.questrail.synop.model.Weather;
import com.questrail.synop.model.Wind;

/**
 * Section1Encoder
 * -----------------------------------------------------------------------------
 * Emits iihVV, Nddff (with 00fff for speeds above 99) and the numbered groups
 * 1 to 9 that have a value in the report.
 */
final class Section1Encoder
{
    private static final int MAX_TWO_DIGIT_SPEED = 99;

    void encode(EncodeContext ctx) {
        SynopReport report = ctx.report();
        ctx.emit(ctx.encode(Fields.PRECIPITATION_INDICATOR, report.get(SynopField.PRECIPITATION_INDICATOR).orElse(null))
                + ctx.encode(Fields.WEATHER_INDICATOR, report.get(SynopField.WEATHER_INDICATOR).orElse(null))
                + ctx.encode(Fields.LOWEST_CLOUD_BASE, report.get(SynopField.LOWEST_CLOUD_BASE).orElse(null))
                + ctx.encode(Fields.VISIBILITY, ctx.visibility(report.get(SynopField.VISIBILITY).orElse(null))));
        encodeCloudCoverAndWind(ctx);

        report.get(SynopField.AIR_TEMPERATURE)
                .ifPresent(t -> ctx.emit("1" + ctx.encode(Fields.TEMPERATURE, t)));
        if (report.has(SynopField.DEWPOINT_TEMPERATURE)) {
            ctx.emit("2" + ctx.encode(Fields.TEMPERATURE, report.get(SynopField.DEWPOINT_TEMPERATURE).get()));
        } else {
            report.get(SynopField.RELATIVE_HUMIDITY)
                    .ifPresent(h -> ctx.emit("29" + ctx.encode(Fields.RELATIVE_HUMIDITY, h)));
        }
        report.get(SynopField.STATION_PRESSURE)
                .ifPresent(p -> ctx.emit("3" + ctx.encode(Fields.PRESSURE, p)));
        if (report.has(SynopField.SEA_LEVEL_PRESSURE)) {
            ctx.emit("4" + ctx.encode(Fields.PRESSURE, report.get(SynopField.SEA_LEVEL_PRESSURE).get()));
        } else {
            report.get(SynopField.GEOPOTENTIAL).ifPresent(g -> ctx.emit(encodeGeopotential(g, ctx)));
        }
        report.get(SynopField.PRESSURE_TENDENCY).ifPresent(t -> ctx.emit(encodeTendency(t, ctx)));
        report.get(SynopField.PRECIPITATION_S1).ifPresent(p -> ctx.emit(encodePrecipitation(p, ctx)));
        report.get(SynopField.WEATHER).ifPresent(w -> ctx.emit(encodeWeather(w, ctx)));
        report.get(SynopField.CLOUD_TYPES).ifPresent(c -> ctx.emit(encodeCloudTypes(c, ctx)));
        report.get(SynopField.EXACT_OBS_TIME).ifPresent(t -> ctx.emit(encodeExactTime(t, ctx)));
    }

    private static void encodeCloudCoverAndWind(EncodeContext ctx) {
        SynopReport report = ctx.report();
        String cover = ctx.encode(Fields.CLOUD_COVER, report.get(SynopField.CLOUD_COVER).orElse(null));
        Wind wind = report.get(SynopField.SURFACE_WIND).orElse(new Wind(null, null));
        String direction = ctx.encode(Fields.WIND_DIRECTION, wind.direction());

        Observation<Integer> speed = wind.speed();
        if (speed != null && speed.available()) {
            long value = Math.round(ctx.convert(speed, ctx.windUnit()));
            if (value > MAX_TWO_DIGIT_SPEED) {
                ctx.emit(cover + direction + MAX_TWO_DIGIT_SPEED);
                ctx.emit("00" + ctx.encode(Fields.EXTENDED_SPEED, Observation.of((int) value, null)));
                return;
            }
        }
        ctx.emit(cover + direction + ctx.encode(Fields.speed(ctx.windUnit()), speed));
    }

    /**
     * 4ahhh keeps only the last three digits of the height.
     */
    static String encodeGeopotential(Geopotential geopotential, EncodeContext ctx) {
        Observation<Integer> height = geopotential.height();
        if (height != null && height.available()) {
            height = height.withValue(Math.floorMod(height.value(), 1000));
        }
        return "4" + ctx.encode(Fields.ISOBARIC_SURFACE, geopotential.surface())
                + ctx.encode(Fields.GEOPOTENTIAL_HEIGHT, height);
    }

    static String encodeTendency(PressureTendency tendency, EncodeContext ctx) {
        return "5" + ctx.encode(Fields.PRESSURE_CHARACTERISTIC, tendency.tendency())
                + ctx.encode(Fields.PRESSURE_CHANGE, tendency.change());
    }

    /**
     * 6RRRt for a period total, 7RRRR for a 24-hour total.
     */
    static String encodePrecipitation(Precipitation precipitation, EncodeContext ctx) {
        if (precipitation.isDailyTotal()) {
            return "7" + ctx.encode(Fields.PRECIPITATION_AMOUNT_24H, precipitation.amount());
        }
        return "6" + ctx.encode(Fields.PRECIPITATION_AMOUNT, precipitation.amount())
                + ctx.encode(Fields.PRECIPITATION_PERIOD, precipitation.timeBeforeObs());
    }

    private static String encodeWeather(Weather weather, EncodeContext ctx) {
        return "7" + ctx.encode(Fields.PRESENT_WEATHER, weather.present())
                + ctx.encode(Fields.PAST_WEATHER, weather.past1())
                + ctx.encode(Fields.PAST_WEATHER, weather.past2());
    }

    private static String encodeCloudTypes(CloudTypes types, EncodeContext ctx) {
        return "8" + ctx.encode(Fields.CLOUD_COVER, types.amount())
                + ctx.encode(Fields.LOW_CLOUD_TYPE, types.lowCloudType())
                + ctx.encode(Fields.MIDDLE_CLOUD_TYPE, types.middleCloudType())
                + ctx.encode(Fields.HIGH_CLOUD_TYPE, types.highCloudType());
    }

    private static String encodeExactTime(ExactObservationTime time, EncodeContext ctx) {
        return "9" + ctx.encode(Fields.EXACT_HOUR, time.hour()) + ctx.encode(Fields.EXACT_MINUTE, time.minute());
    }
}
