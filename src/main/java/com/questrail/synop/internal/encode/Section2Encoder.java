package com.questrail.synop.internal.encode;

import com.questrail.synop.internal.field.Fields;
import com.questrail.synop.model.IceAccretion;
import com.questrail.synop.model.Observation;
import com.questrail.synop.model.SeaLandIce;
import com.questrail.synop.model.SeaSurfaceTemperature;
import com.questrail.synop.model.ShipDisplacement;
import com.questrail.synop.model.SwellWaves;
import com.questrail.synop.model.SynopField;
import com.questrail.synop.model.SynopReport;
import com.questrail.synop.model.WetBulbTemperature;
import com.questrail.synop.model.WindDirection;
import com.questrail.synop.model.WindWaves;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Section2Encoder
 * -----------------------------------------------------------------------------
 * Emits 222Dv with groups 0 to 8, then the ICE block.
 *
 * <h2>Wind waves</h2>
 * The stored list is searched once per header, first match wins:
 * <ul>
 *   <li>1PPHH: the first instrumental entry that is not an accurate height</li>
 *   <li>2PPHH: the first estimated entry</li>
 *   <li>70HHH: the first accurate height</li>
 * </ul>
 */
final class Section2Encoder
{
    private static final String CONFUSED_SEA = "99";

    void encode(EncodeContext ctx) {
        SynopReport report = ctx.report();
        if (hasMaritimeGroups(report)) {
            encodeMaritime(report, ctx);
        }
        report.get(SynopField.SEA_LAND_ICE).ifPresent(ice -> encodeIce(ice, ctx));
    }

    private static boolean hasMaritimeGroups(SynopReport report) {
        return report.fields().stream()
                .anyMatch(field -> field.section() == 2 && field != SynopField.SEA_LAND_ICE);
    }

    private static void encodeMaritime(SynopReport report, EncodeContext ctx) {
        ShipDisplacement displacement = report.get(SynopField.DISPLACEMENT).orElse(null);
        if (displacement == null) {
            ctx.emit("22200");
        } else {
            ctx.emit("222" + ctx.encode(Fields.DIRECTION, displacement.direction())
                    + ctx.encode(Fields.SHIP_SPEED, displacement.speed()));
        }

        report.get(SynopField.SEA_SURFACE_TEMPERATURE).ifPresent(sst -> ctx.emit(encodeSeaTemperature(sst, ctx)));

        List<WindWaves> windWaves = report.get(SynopField.WIND_WAVES).orElse(List.of());
        first(windWaves, w -> w.instrumental() && !w.accurate())
                .ifPresent(w -> ctx.emit("1" + encodeWaves(w, ctx)));
        first(windWaves, w -> !w.instrumental())
                .ifPresent(w -> ctx.emit("2" + encodeWaves(w, ctx)));

        List<SwellWaves> swells = report.get(SynopField.SWELL_WAVES).orElse(List.of());
        if (swells.stream().anyMatch(s -> s.direction() != null)) {
            ctx.emit("3" + ctx.encode(Fields.WIND_DIRECTION, swellDirection(swells, 0))
                    + ctx.encode(Fields.WIND_DIRECTION, swellDirection(swells, 1)));
        }
        for (int i = 0; i < Math.min(2, swells.size()); i++) {
            SwellWaves swell = swells.get(i);
            if (swell.hasWaveGroup()) {
                ctx.emit((4 + i) + ctx.encode(Fields.WAVE_PERIOD, swell.period())
                        + ctx.encode(Fields.WAVE_HEIGHT, swell.height()));
            }
        }

        report.get(SynopField.ICE_ACCRETION).ifPresent(ice -> ctx.emit(encodeIceAccretion(ice, ctx)));
        first(windWaves, WindWaves::accurate)
                .ifPresent(w -> ctx.emit("70" + ctx.encode(Fields.ACCURATE_WAVE_HEIGHT, w.height())));
        report.get(SynopField.WET_BULB_TEMPERATURE).ifPresent(wb -> ctx.emit(encodeWetBulb(wb, ctx)));
    }

    private static Optional<WindWaves> first(List<WindWaves> waves, Predicate<WindWaves> match) {
        return waves.stream().filter(match).findFirst();
    }

    private static String encodeSeaTemperature(SeaSurfaceTemperature sst, EncodeContext ctx) {
        return "0" + ctx.encode(Fields.SST_MEASUREMENT, sst.measurement())
                + ctx.encode(Fields.TEMPERATURE_MAGNITUDE, sst.temperature());
    }

    private static String encodeWaves(WindWaves waves, EncodeContext ctx) {
        String period = waves.confused() ? CONFUSED_SEA : ctx.encode(Fields.WAVE_PERIOD, waves.period());
        return period + ctx.encode(Fields.WAVE_HEIGHT, waves.height());
    }

    private static Observation<WindDirection> swellDirection(List<SwellWaves> swells, int index) {
        return index < swells.size() ? swells.get(index).direction() : null;
    }

    private static String encodeIceAccretion(IceAccretion ice, EncodeContext ctx) {
        return "6" + ctx.encode(Fields.ICE_ACCRETION_SOURCE, ice.source())
                + ctx.encode(Fields.ICE_THICKNESS, ice.thickness())
                + ctx.encode(Fields.ICE_ACCRETION_RATE, ice.rate());
    }

    private static String encodeWetBulb(WetBulbTemperature wetBulb, EncodeContext ctx) {
        return "8" + ctx.encode(Fields.WET_BULB_STATUS, wetBulb.status())
                + ctx.encode(Fields.TEMPERATURE_MAGNITUDE, wetBulb.temperature());
    }

    private static void encodeIce(SeaLandIce ice, EncodeContext ctx) {
        ctx.emit("ICE");
        if (ice.isText()) {
            if (!ice.text().isBlank()) {
                ctx.emit(ice.text());
            }
            return;
        }
        ctx.emit(ctx.encode(Fields.ICE_CONCENTRATION, ice.concentration())
                + ctx.encode(Fields.ICE_DEVELOPMENT, ice.development())
                + ctx.encode(Fields.ICE_OF_LAND_ORIGIN, ice.landOrigin())
                + ctx.encode(Fields.ICE_BEARING, ice.bearing())
                + ctx.encode(Fields.ICE_CONDITION_TREND, ice.conditionTrend()));
    }
}
