package com.questrail.synop.internal.encode;

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
import com.questrail.synop.model.Sunshine;
import com.questrail.synop.model.SynopField;
import com.questrail.synop.model.SynopReport;
import com.questrail.synop.model.Wind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Section3Encoder
 * -----------------------------------------------------------------------------
 * Emits 333 and the climatological groups 0 to 9 present in the report.
 */
final class Section3Encoder
{
    private final SpecialPhenomenaEncoder specialPhenomena = new SpecialPhenomenaEncoder();

    void encode(EncodeContext ctx) {
        SynopReport report = ctx.report();
        if (!report.hasSection(3)) {
            return;
        }
        ctx.emit("333");

        encodeRegionalGroup(report, ctx);
        report.get(SynopField.MAXIMUM_TEMPERATURE)
                .ifPresent(t -> ctx.emit("1" + ctx.encode(Fields.TEMPERATURE, t)));
        report.get(SynopField.MINIMUM_TEMPERATURE)
                .ifPresent(t -> ctx.emit("2" + ctx.encode(Fields.TEMPERATURE, t)));
        report.get(SynopField.GROUND_STATE).ifPresent(g -> ctx.emit(encodeGroundState(g, ctx)));
        report.get(SynopField.GROUND_STATE_SNOW).ifPresent(g -> ctx.emit(encodeGroundStateSnow(g, ctx)));
        encodeFiveFamily(report, ctx);

        Precipitation precipitation = report.get(SynopField.PRECIPITATION_S3).orElse(null);
        boolean daily = precipitation != null && precipitation.isDailyTotal();
        if (precipitation != null && !daily) {
            ctx.emit(Section1Encoder.encodePrecipitation(precipitation, ctx));
        }
        if (daily) {
            ctx.emit(Section1Encoder.encodePrecipitation(precipitation, ctx));
        } else {
            report.get(SynopField.PRECIPITATION_24H)
                    .ifPresent(p -> ctx.emit("7" + ctx.encode(Fields.PRECIPITATION_AMOUNT_24H, p.amount())));
        }

        report.get(SynopField.CLOUD_LAYERS).ifPresent(layers -> encodeCloudLayers(layers, ctx));
        specialPhenomena.encode(ctx);
    }

    /**
     * 0ddff (maximum wind) or 0TTRR (ground minimum and local precipitation);
     * whichever the report carries.
     */
    private static void encodeRegionalGroup(SynopReport report, EncodeContext ctx) {
        if (report.has(SynopField.MAX_WIND)) {
            Wind wind = report.get(SynopField.MAX_WIND).get();
            ctx.emit("0" + ctx.encode(Fields.WIND_DIRECTION, wind.direction())
                    + ctx.encode(Fields.speed(ctx.windUnit()), wind.speed()));
            return;
        }
        if (!report.has(SynopField.GROUND_MINIMUM_TEMPERATURE) && !report.has(SynopField.LOCAL_PRECIPITATION)) {
            return;
        }
        Observation<Integer> temperature = report.get(SynopField.GROUND_MINIMUM_TEMPERATURE).orElse(null);
        if (temperature != null && temperature.available() && temperature.value() < 0) {
            temperature = temperature.withValue(50 - temperature.value());
        }
        LocalPrecipitation local = report.get(SynopField.LOCAL_PRECIPITATION).orElse(new LocalPrecipitation(null, null));
        ctx.emit("0" + ctx.encode(Fields.GROUND_TEMPERATURE, temperature)
                + ctx.encode(Fields.LOCAL_PRECIPITATION_CHARACTER, local.character())
                + ctx.encode(Fields.LOCAL_PRECIPITATION_TIME, local.time()));
    }

    private static String encodeGroundState(GroundState ground, EncodeContext ctx) {
        Observation<Integer> temperature = ground.temperature();
        String sTT;
        if (temperature == null || !temperature.available()) {
            sTT = Codes.missing(3);
        } else {
            int value = temperature.value();
            sTT = (value < 0 ? "1" : "0")
                    + ctx.encode(Fields.GROUND_TEMPERATURE, temperature.withValue(Math.abs(value)));
        }
        return "3" + ctx.encode(Fields.GROUND_STATE, ground.state()) + sTT;
    }

    private static String encodeGroundStateSnow(GroundStateSnow ground, EncodeContext ctx) {
        return "4" + ctx.encode(Fields.GROUND_STATE_SNOW, ground.state())
                + ctx.encode(Fields.SNOW_DEPTH, ground.depth());
    }

    private static void encodeFiveFamily(SynopReport report, EncodeContext ctx) {
        report.get(SynopField.EVAPOTRANSPIRATION).ifPresent(e -> ctx.emit(encodeEvapotranspiration(e, ctx)));
        report.get(SynopField.SUNSHINE).ifPresent(list -> list.forEach(s -> encodeSunshine(s, ctx)));
        report.get(SynopField.CLOUD_DRIFT_DIRECTION).ifPresent(d -> ctx.emit(encodeCloudDrift(d, ctx)));
        report.get(SynopField.CLOUD_ELEVATION).ifPresent(e -> ctx.emit(encodeCloudElevation(e, ctx)));
        report.get(SynopField.PRESSURE_CHANGE).ifPresent(change -> {
            boolean negative = change.available() && Math.copySign(1.0, change.value()) < 0;
            ctx.emit((negative ? "59" : "58") + ctx.encode(Fields.PRESSURE_CHANGE, change));
        });
    }

    private static String encodeEvapotranspiration(Evapotranspiration evaporation, EncodeContext ctx) {
        return "5" + ctx.encode(Fields.EVAPORATION, evaporation.amount())
                + ctx.encode(Fields.EVAPORATION_TYPE, evaporation.type());
    }

    /**
     * 553SS for one hour, 55SSS for a day, 55/// when the duration is
     * unknown; each followed by its radiation groups.
     */
    private static void encodeSunshine(Sunshine sunshine, EncodeContext ctx) {
        Observation<Integer> duration = sunshine.duration();
        if (duration == null || !duration.available()) {
            ctx.emit("55" + Codes.missing(3));
        } else if (duration.value() == Sunshine.HOURLY) {
            ctx.emit("553" + ctx.encode(Fields.HOURLY_SUNSHINE, sunshine.amount()));
        } else if (duration.value() == Sunshine.DAILY) {
            ctx.emit("55" + ctx.encode(Fields.DAILY_SUNSHINE, sunshine.amount()));
        } else {
            throw new SynopEncodeException("Sunshine duration must be 1 or 24 hours, not " + duration.value());
        }
        for (Radiation radiation : sunshine.radiation()) {
            if (radiation.type() < 0 || radiation.type() > 5) {
                throw new SynopEncodeException("Radiation type must be 0 to 5, not " + radiation.type());
            }
            ctx.emit(radiation.type() + ctx.encode(Fields.RADIATION, radiation.amount()));
        }
    }

    private static String encodeCloudDrift(CloudDrift drift, EncodeContext ctx) {
        return "56" + ctx.encode(Fields.DIRECTION, drift.low())
                + ctx.encode(Fields.DIRECTION, drift.middle())
                + ctx.encode(Fields.DIRECTION, drift.high());
    }

    private static String encodeCloudElevation(CloudElevation elevation, EncodeContext ctx) {
        return "57" + ctx.encode(Fields.CLOUD_GENUS, elevation.genus())
                + ctx.encode(Fields.DIRECTION, elevation.direction())
                + ctx.encode(Fields.ELEVATION_ANGLE, elevation.elevation());
    }

    private static void encodeCloudLayers(List<CloudLayer> layers, EncodeContext ctx) {
        List<String> groups = new ArrayList<>(layers.size());
        for (CloudLayer layer : layers) {
            groups.add("8" + ctx.encode(Fields.CLOUD_COVER, layer.cover())
                    + ctx.encode(Fields.CLOUD_GENUS, layer.genus())
                    + ctx.encode(Fields.CLOUD_HEIGHT, ctx.cloudHeight(layer.height())));
        }
        Collections.sort(groups);
        groups.forEach(ctx::emit);
    }
}
