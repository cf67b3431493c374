package com.questrail.synop.internal.encode;

import com.questrail.synop.internal.field.Codes;
import com.questrail.synop.internal.field.Fields;
import com.questrail.synop.model.Confidence;
import com.questrail.synop.model.Observation;
import com.questrail.synop.model.ObservationTime;
import com.questrail.synop.model.StationPosition;
import com.questrail.synop.model.StationType;
import com.questrail.synop.model.SynopField;
import com.questrail.synop.model.TimeBeforeObservation;
import com.questrail.synop.model.WindIndicator;

/**
 * Section0Encoder
 * -----------------------------------------------------------------------------
 * Emits MMMM, the callsign, YYGGiw and the station index or sea position.
 *
 * <p>The quadrant of the globe is taken from the report when it agrees with
 * the signs of latitude and longitude, and derived from those signs
 * otherwise.</p>
 */
final class Section0Encoder
{
    void encode(EncodeContext ctx) {
        StationType type = ctx.require(SynopField.STATION_TYPE).value();
        if (type == null) {
            throw new SynopEncodeException("Station type is unavailable");
        }
        ctx.emit(type.name());

        if (type.hasCallsign()) {
            ctx.emit(requireText(ctx.require(SynopField.CALLSIGN), "callsign"));
        }

        ObservationTime time = ctx.require(SynopField.OBS_TIME);
        Observation<WindIndicator> indicator = ctx.require(SynopField.WIND_INDICATOR);
        ctx.emit(ctx.encode(Fields.OBSERVATION_DAY, time.day())
                + ctx.encode(Fields.OBSERVATION_HOUR, time.hour())
                + ctx.encode(Fields.WIND_INDICATOR, indicator));
        if (indicator.available()) {
            ctx.windUnit(indicator.value().speedUnit());
        }
        Integer hour = time.hour() != null && time.hour().available() ? time.hour().value() : null;
        TimeBeforeObservation period = TimeBeforeObservation.pastWeatherPeriod(hour);
        ctx.runningPeriod(period == null ? null : Observation.of(period));

        if (type == StationType.AAXX) {
            ctx.emit(requireText(ctx.require(SynopField.STATION_ID), "station id"));
        } else {
            encodePosition(type, ctx);
        }
    }

    private static String requireText(Observation<String> observation, String what) {
        if (observation == null || !observation.available()) {
            throw new SynopEncodeException("The " + what + " is unavailable");
        }
        return observation.value();
    }

    private static void encodePosition(StationType type, EncodeContext ctx) {
        StationPosition position = ctx.report().get(SynopField.STATION_POSITION)
                .orElse(new StationPosition(null, null, null, null, null, null));
        Observation<Double> latitude = position.latitude();
        Observation<Double> longitude = position.longitude();

        String lat = ctx.encode(Fields.LATITUDE, latitude);
        String lon = ctx.encode(Fields.LONGITUDE, longitude);
        ctx.emit("99" + lat);
        ctx.emit(quadrant(position) + lon);

        if (type != StationType.OOXX) {
            return;
        }
        if (position.marsdenSquare() != null) {
            ctx.emit(ctx.encode(Fields.MARSDEN_SQUARE, position.marsdenSquare())
                    + lat.charAt(1) + lon.charAt(2));
        }
        if (position.elevation() != null || position.confidence() != null) {
            ctx.emit(ctx.encode(Fields.ELEVATION, position.elevation()) + elevationIndicator(position));
        }
    }

    static String quadrant(StationPosition position) {
        Observation<Integer> stored = position.quadrant();
        Boolean south = negative(position.latitude());
        Boolean west = negative(position.longitude());
        if (stored != null && stored.available() && agrees(stored.value(), south, west)) {
            return String.valueOf(stored.value());
        }
        if (south == null && west == null) {
            return stored != null && stored.available() ? String.valueOf(stored.value()) : String.valueOf(Codes.MISSING);
        }
        boolean s = Boolean.TRUE.equals(south);
        boolean w = Boolean.TRUE.equals(west);
        if (s) {
            return w ? "5" : "3";
        }
        return w ? "7" : "1";
    }

    /**
     * TRUE or FALSE for a non-zero value, {@code null} when the sign says
     * nothing about the quadrant.
     */
    private static Boolean negative(Observation<Double> position) {
        if (position == null || !position.available() || position.value() == 0.0) {
            return null;
        }
        return position.value() < 0;
    }

    private static boolean agrees(int quadrant, Boolean south, Boolean west) {
        boolean quadrantSouth = quadrant == 3 || quadrant == 5;
        boolean quadrantWest = quadrant == 5 || quadrant == 7;
        return (south == null || south == quadrantSouth) && (west == null || west == quadrantWest);
    }

    private static String elevationIndicator(StationPosition position) {
        Observation<Confidence> confidence = position.confidence();
        if (confidence == null || !confidence.available()) {
            return String.valueOf(Codes.MISSING);
        }
        boolean feet = position.elevation() != null && "ft".equals(position.elevation().unit());
        return String.valueOf(confidence.value().ordinal() + 1 + (feet ? 4 : 0));
    }
}
