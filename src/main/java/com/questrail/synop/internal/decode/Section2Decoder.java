package com.questrail.synop.internal.decode;

import com.questrail.synop.internal.field.Fields;
import com.questrail.synop.model.IceAccretion;
import com.questrail.synop.model.Observation;
import com.questrail.synop.model.SeaLandIce;
import com.questrail.synop.model.SeaSurfaceTemperature;
import com.questrail.synop.model.ShipDisplacement;
import com.questrail.synop.model.SstMeasurement;
import com.questrail.synop.model.SwellWaves;
import com.questrail.synop.model.SynopField;
import com.questrail.synop.model.WetBulbStatus;
import com.questrail.synop.model.WetBulbTemperature;
import com.questrail.synop.model.WindWaves;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Section2Decoder
 * -----------------------------------------------------------------------------
 * Decodes the maritime section (222Dv and groups 0 to 8) and the ICE block
 * that may follow it.
 *
 * <p>Section 2 is accepted from any station type; coastal land stations use
 * it too.</p>
 */
final class Section2Decoder extends NumberedSectionDecoder
{
    private static final Pattern ICE_GROUP = Pattern.compile("^[\\d/]{5}$");
    private static final String CONFUSED_SEA = "99";

    Section2Decoder() {
        super(0, 8);
    }

    void decode(String marker, GroupCursor cursor, DecodeContext ctx) {
        ctx.report().put(SynopField.DISPLACEMENT, new ShipDisplacement(
                ctx.decode(Fields.DIRECTION, marker.substring(3, 4), marker),
                ctx.decode(Fields.SHIP_SPEED, marker.substring(4), marker)));
        decodeGroups(cursor, ctx);
        if (ctx.hasSwell()) {
            List<SwellWaves> swells = ctx.swell().build();
            if (!swells.isEmpty()) {
                ctx.report().put(SynopField.SWELL_WAVES, swells);
            }
        }
    }

    @Override
    protected void decodeGroup(int header, String group, GroupCursor cursor, DecodeContext ctx) {
        switch (header) {
            case 0 -> ctx.report().put(SynopField.SEA_SURFACE_TEMPERATURE, decodeSeaTemperature(group, ctx));
            case 1 -> ctx.report().append(SynopField.WIND_WAVES, decodeWindWaves(group, true, ctx));
            case 2 -> ctx.report().append(SynopField.WIND_WAVES, decodeWindWaves(group, false, ctx));
            case 3 -> ctx.swell().directions(
                    ctx.decode(Fields.WIND_DIRECTION, group.substring(1, 3), group),
                    ctx.decode(Fields.WIND_DIRECTION, group.substring(3), group));
            case 4, 5 -> ctx.swell().waves(header - 4,
                    ctx.decode(Fields.WAVE_PERIOD, group.substring(1, 3), group),
                    ctx.decode(Fields.WAVE_HEIGHT, group.substring(3), group));
            case 6 -> ctx.report().put(SynopField.ICE_ACCRETION, new IceAccretion(
                    ctx.decode(Fields.ICE_ACCRETION_SOURCE, group.substring(1, 2), group),
                    ctx.decode(Fields.ICE_THICKNESS, group.substring(2, 4), group),
                    ctx.decode(Fields.ICE_ACCRETION_RATE, group.substring(4), group)));
            case 7 -> decodeAccurateWaveHeight(group, ctx);
            case 8 -> ctx.report().put(SynopField.WET_BULB_TEMPERATURE, decodeWetBulb(group, ctx));
            default -> ctx.notImplemented(group, "Unsupported Section 2 group");
        }
    }

    private static SeaSurfaceTemperature decodeSeaTemperature(String group, DecodeContext ctx) {
        Observation<SstMeasurement> measurement = ctx.decode(Fields.SST_MEASUREMENT, group.substring(1, 2), group);
        Observation<Double> temperature = ctx.decode(Fields.TEMPERATURE_MAGNITUDE, group.substring(2), group);
        boolean negative = measurement != null && measurement.available() && measurement.value().negative();
        return new SeaSurfaceTemperature(signed(temperature, negative), measurement);
    }

    private static WindWaves decodeWindWaves(String group, boolean instrumental, DecodeContext ctx) {
        String pp = group.substring(1, 3);
        Observation<Double> height = ctx.decode(Fields.WAVE_HEIGHT, group.substring(3), group);
        if (CONFUSED_SEA.equals(pp)) {
            return new WindWaves(Observation.unavailable(pp), height, instrumental, false, true);
        }
        return new WindWaves(ctx.decode(Fields.WAVE_PERIOD, pp, group), height, instrumental, false, false);
    }

    private static void decodeAccurateWaveHeight(String group, DecodeContext ctx) {
        if (group.charAt(1) != '0') {
            ctx.warn(group, "Accurate wave height group must start with 70");
            return;
        }
        Observation<Double> height = ctx.decode(Fields.ACCURATE_WAVE_HEIGHT, group.substring(2), group);
        ctx.report().append(SynopField.WIND_WAVES, new WindWaves(null, height, true, true, false));
    }

    private static WetBulbTemperature decodeWetBulb(String group, DecodeContext ctx) {
        Observation<WetBulbStatus> status = ctx.decode(Fields.WET_BULB_STATUS, group.substring(1, 2), group);
        Observation<Double> temperature = ctx.decode(Fields.TEMPERATURE_MAGNITUDE, group.substring(2), group);
        boolean negative = status != null && status.available() && status.value().negative();
        return new WetBulbTemperature(signed(temperature, negative), status);
    }

    static Observation<Double> signed(Observation<Double> magnitude, boolean negative) {
        if (magnitude == null || !magnitude.available() || !negative) {
            return magnitude;
        }
        return magnitude.withValue(-magnitude.value());
    }

    /**
     * ICE followed by either one cSbDz group or plain language, running up to
     * the next section marker.
     */
    void decodeIce(GroupCursor cursor, DecodeContext ctx) {
        List<String> groups = new ArrayList<>();
        while (cursor.hasNext() && !Sections.isMarker(cursor.peek())) {
            groups.add(cursor.next());
        }
        if (groups.size() == 1 && ICE_GROUP.matcher(groups.get(0)).matches()) {
            String group = groups.get(0);
            ctx.report().put(SynopField.SEA_LAND_ICE, new SeaLandIce(
                    null,
                    ctx.decode(Fields.ICE_CONCENTRATION, group.substring(0, 1), group),
                    ctx.decode(Fields.ICE_DEVELOPMENT, group.substring(1, 2), group),
                    ctx.decode(Fields.ICE_OF_LAND_ORIGIN, group.substring(2, 3), group),
                    ctx.decode(Fields.ICE_BEARING, group.substring(3, 4), group),
                    ctx.decode(Fields.ICE_CONDITION_TREND, group.substring(4), group)));
        } else {
            ctx.report().put(SynopField.SEA_LAND_ICE, SeaLandIce.text(String.join(" ", groups)));
        }
    }
}
