package com.questrail.synop.internal.decode;

import com.questrail.synop.internal.field.Codes;
import com.questrail.synop.internal.field.Fields;
import com.questrail.synop.internal.table.CodeTables;
import com.questrail.synop.internal.table.InvalidCodeException;
import com.questrail.synop.mapping.RegionIndex;
import com.questrail.synop.model.Confidence;
import com.questrail.synop.model.Observation;
import com.questrail.synop.model.ObservationTime;
import com.questrail.synop.model.Region;
import com.questrail.synop.model.StationPosition;
import com.questrail.synop.model.StationType;
import com.questrail.synop.model.SynopField;
import com.questrail.synop.model.SynopReport;
import com.questrail.synop.model.WindIndicator;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Section0Decoder
 * -----------------------------------------------------------------------------
 * Decodes the identification section: MMMM, the ship or buoy callsign,
 * YYGGiw and either the land station index or the sea station position.
 *
 * <p>Every group of this section is mandatory. A malformed group is fatal and
 * raises {@link SynopDecodeException}; a telegram that simply ends early
 * leaves a partial report.</p>
 */
final class Section0Decoder
{
    private static final Pattern BUOY_CALLSIGN =
            Pattern.compile("^(1[1-7]|2[1-6]|3[1-4]|4[1-8]|5[1-6]|6[1-6]|7[1-4])\\d{3}$");
    private static final Pattern CALLSIGN = Pattern.compile("^[A-Z\\d]{3,}$");
    private static final Pattern GROUP = Pattern.compile("^[\\d/]{5}$");
    private static final Pattern LATITUDE_GROUP = Pattern.compile("^99[\\d/]{3}$");

    void decode(GroupCursor cursor, DecodeContext ctx) {
        SynopReport.Builder report = ctx.report();

        String mmmm = cursor.next();
        StationType type = StationType.fromCode(mmmm)
                .orElseThrow(() -> new SynopDecodeException("Unknown station type '" + mmmm + "'"));
        ctx.stationType(type);
        report.put(SynopField.STATION_TYPE, Observation.of(mmmm, type, null));

        if (type.hasCallsign()) {
            if (!cursor.hasNext()) {
                return;
            }
            decodeCallsign(cursor.next(), type, ctx);
        }

        if (!cursor.hasNext()) {
            return;
        }
        decodeTime(cursor.next(), ctx);

        if (!cursor.hasNext()) {
            return;
        }
        if (type == StationType.AAXX) {
            decodeStationIndex(cursor.next(), ctx);
        } else {
            decodePosition(cursor, type, ctx);
        }
    }

    private void decodeCallsign(String raw, StationType type, DecodeContext ctx) {
        String callsign = raw.toUpperCase(Locale.ROOT);
        SynopReport.Builder report = ctx.report();
        if (BUOY_CALLSIGN.matcher(callsign).matches()) {
            int a1 = callsign.charAt(0) - '0';
            try {
                Region region = CodeTables.REGION.decode(a1);
                report.put(SynopField.REGION, Observation.coded(callsign.substring(0, 1), region, null,
                        CodeTables.REGION.id(), a1));
                ctx.region(region);
            } catch (InvalidCodeException e) {
                throw new SynopDecodeException("Invalid buoy identifier '" + raw + "'", e);
            }
        } else if (CALLSIGN.matcher(callsign).matches()) {
            if (type == StationType.BBXX) {
                report.put(SynopField.REGION, Observation.of(Region.SHIP));
                ctx.region(Region.SHIP);
            }
        } else {
            throw new SynopDecodeException("Invalid callsign '" + raw + "'");
        }
        report.put(SynopField.CALLSIGN, Observation.of(raw, callsign, null));
    }

    private void decodeTime(String group, DecodeContext ctx) {
        if (!GROUP.matcher(group).matches()) {
            throw new SynopDecodeException("Invalid observation time group '" + group + "'");
        }
        Observation<Integer> day = timeComponent(group.substring(0, 2), 1, 31, "day");
        Observation<Integer> hour = timeComponent(group.substring(2, 4), 0, 24, "hour");
        ctx.report().put(SynopField.OBS_TIME, new ObservationTime(day, hour));
        if (hour.available()) {
            ctx.observationHour(hour.value());
        }

        String iw = group.substring(4);
        Observation<WindIndicator> indicator;
        try {
            indicator = Fields.WIND_INDICATOR.decode(iw);
        } catch (InvalidCodeException e) {
            throw new SynopDecodeException("Invalid wind indicator '" + iw + "' in group " + group, e);
        }
        if (indicator.available()) {
            String unit = indicator.value().speedUnit();
            ctx.windUnit(unit);
            indicator = indicator.withUnit(unit);
        }
        ctx.report().put(SynopField.WIND_INDICATOR, indicator);
    }

    private static Observation<Integer> timeComponent(String raw, int min, int max, String what) {
        if (Codes.isUnavailable(raw)) {
            return Observation.unavailable(raw);
        }
        if (!Codes.isDigits(raw)) {
            throw new SynopDecodeException("Invalid " + what + " '" + raw + "'");
        }
        int value = Integer.parseInt(raw);
        if (value < min || value > max) {
            throw new SynopDecodeException("Invalid " + what + " '" + raw + "'");
        }
        return Observation.of(raw, value, null);
    }

    private void decodeStationIndex(String group, DecodeContext ctx) {
        if (!Codes.isDigits(group) || group.length() != 5) {
            throw new SynopDecodeException("Invalid station index '" + group + "'");
        }
        Region region = RegionIndex.lookup(Integer.parseInt(group))
                .orElseThrow(() -> new SynopDecodeException("Station " + group + " is not in any WMO region"));
        ctx.region(region);
        ctx.report().put(SynopField.STATION_ID, Observation.of(group, group, null));
        ctx.report().put(SynopField.REGION, Observation.of(region));
    }

    private void decodePosition(GroupCursor cursor, StationType type, DecodeContext ctx) {
        String latitudeGroup = cursor.next();
        if (!LATITUDE_GROUP.matcher(latitudeGroup).matches()) {
            throw new SynopDecodeException("Invalid latitude group '" + latitudeGroup + "'");
        }
        if (!cursor.hasNext()) {
            return;
        }
        String longitudeGroup = cursor.next();
        if (!GROUP.matcher(longitudeGroup).matches()) {
            throw new SynopDecodeException("Invalid longitude group '" + longitudeGroup + "'");
        }

        Observation<Integer> quadrant = decodeQuadrant(longitudeGroup, ctx);
        int q = quadrant != null && quadrant.available() ? quadrant.value() : 1;
        Observation<Double> latitude = bounded(ctx.decode(Fields.LATITUDE, latitudeGroup.substring(2), latitudeGroup),
                90, latitudeGroup, ctx);
        Observation<Double> longitude = bounded(ctx.decode(Fields.LONGITUDE, longitudeGroup.substring(1), longitudeGroup),
                180, longitudeGroup, ctx);
        latitude = negate(latitude, q == 3 || q == 5);
        longitude = negate(longitude, q == 5 || q == 7);

        Observation<Integer> marsden = null;
        Observation<Integer> elevation = null;
        Observation<Confidence> confidence = null;
        if (type == StationType.OOXX) {
            if (!cursor.hasNext()) {
                ctx.report().put(SynopField.STATION_POSITION,
                        new StationPosition(latitude, longitude, quadrant, null, null, null));
                return;
            }
            String marsdenGroup = cursor.next();
            if (!GROUP.matcher(marsdenGroup).matches()) {
                throw new SynopDecodeException("Invalid Marsden square group '" + marsdenGroup + "'");
            }
            marsden = decodeMarsdenSquare(marsdenGroup, latitudeGroup, longitudeGroup, ctx);

            if (cursor.hasNext()) {
                String elevationGroup = cursor.next();
                if (!GROUP.matcher(elevationGroup).matches()) {
                    throw new SynopDecodeException("Invalid elevation group '" + elevationGroup + "'");
                }
                confidence = decodeConfidence(elevationGroup, ctx);
                elevation = ctx.decode(Fields.ELEVATION, elevationGroup.substring(0, 4), elevationGroup);
                int im = Codes.digit(elevationGroup, 4);
                if (elevation != null && confidence != null && confidence.available()) {
                    elevation = elevation.withUnit(im <= 4 ? "m" : "ft");
                }
            }
        }
        ctx.report().put(SynopField.STATION_POSITION,
                new StationPosition(latitude, longitude, quadrant, marsden, elevation, confidence));
    }

    private static Observation<Integer> decodeQuadrant(String group, DecodeContext ctx) {
        String raw = group.substring(0, 1);
        if (Codes.isUnavailable(raw)) {
            return Observation.unavailable(raw);
        }
        int q = Codes.digit(raw, 0);
        if (q != 1 && q != 3 && q != 5 && q != 7) {
            ctx.warn(group, "'" + raw + "' is not a valid quadrant of the globe");
            return null;
        }
        return Observation.of(raw, q, null);
    }

    private static Observation<Double> bounded(Observation<Double> position, double limit,
                                               String group, DecodeContext ctx) {
        if (position != null && position.available() && position.value() > limit) {
            ctx.warn(group, position.value() + " is outside the range 0.." + limit);
            return null;
        }
        return position;
    }

    private static Observation<Double> negate(Observation<Double> position, boolean negative) {
        if (position == null || !position.available() || !negative) {
            return position;
        }
        return position.withValue(-position.value());
    }

    private static Observation<Integer> decodeMarsdenSquare(String group, String latitudeGroup,
                                                          String longitudeGroup, DecodeContext ctx) {
        String raw = group.substring(0, 3);
        if (Codes.isUnavailable(raw)) {
            return Observation.unavailable(raw);
        }
        if (group.charAt(3) != latitudeGroup.charAt(3) || group.charAt(4) != longitudeGroup.charAt(3)) {
            ctx.warn(group, "Unit digits of the Marsden square group do not match the position");
        }
        if (!Codes.isDigits(raw)) {
            ctx.warn(group, "'" + raw + "' is not a valid Marsden square");
            return null;
        }
        int square = Integer.parseInt(raw);
        if ((square < 1 || square > 623) && (square < 901 || square > 936)) {
            ctx.warn(group, square + " is not a valid Marsden square");
            return null;
        }
        return Observation.of(raw, square, null);
    }

    private static Observation<Confidence> decodeConfidence(String group, DecodeContext ctx) {
        String raw = group.substring(4);
        if (Codes.isUnavailable(raw)) {
            return Observation.unavailable(raw);
        }
        int im = Codes.digit(raw, 0);
        if (im < 1 || im > 8) {
            ctx.warn(group, "'" + raw + "' is not a valid elevation indicator");
            return null;
        }
        return Observation.of(raw, Confidence.values()[(im - 1) % 4], null);
    }
}
