package com.questrail.synop.internal.field;

import com.questrail.synop.internal.table.CodeTables;
import com.questrail.synop.model.Amount;
import com.questrail.synop.model.CardinalDirection;
import com.questrail.synop.model.CloudCover;
import com.questrail.synop.model.CloudHeight;
import com.questrail.synop.model.ElevationAngle;
import com.questrail.synop.model.IceAccretionSource;
import com.questrail.synop.model.IceBearing;
import com.questrail.synop.model.PrecipitationIndicator;
import com.questrail.synop.model.ShipSpeed;
import com.questrail.synop.model.SstMeasurement;
import com.questrail.synop.model.TimeBeforeObservation;
import com.questrail.synop.model.ValueRange;
import com.questrail.synop.model.Visibility;
import com.questrail.synop.model.WeatherIndicator;
import com.questrail.synop.model.WetBulbStatus;
import com.questrail.synop.model.WindDirection;
import com.questrail.synop.model.WindIndicator;

/**
 * Fields
 * =============================================================================
 * The component codecs of every SYNOP group, shared by the section decoders and
 * encoders so both directions agree on width, table and unit.
 *
 * <p>Components whose unit depends on earlier groups (wind and gust speeds)
 * are built per call with {@link #speed(String)}.</p>
 */
public final class Fields
{
    private Fields() {}

    public static final String OKTA = "okta";
    public static final String METRE = "m";
    public static final String MILLIMETRE = "mm";
    public static final String CENTIMETRE = "cm";
    public static final String HOUR = "h";
    public static final String DEGREE = "deg";
    public static final String PERCENT = "%";

    // Section 0
    public static final FieldCodec<WindIndicator> WIND_INDICATOR =
            new TableFieldCodec<>(CodeTables.WIND_INDICATOR, 1);
    public static final FieldCodec<Double> LATITUDE = new ScaledFieldCodec(3, DEGREE, 10);
    public static final FieldCodec<Double> LONGITUDE = new ScaledFieldCodec(4, DEGREE, 10);
    public static final FieldCodec<Integer> ELEVATION = new IntegerFieldCodec(4);
    public static final FieldCodec<Integer> OBSERVATION_DAY = new IntegerFieldCodec(2, null, 1, 31);
    public static final FieldCodec<Integer> OBSERVATION_HOUR = new IntegerFieldCodec(2, null, 0, 24);
    public static final FieldCodec<Integer> MARSDEN_SQUARE = new IntegerFieldCodec(3, null, 1, 936);

    // Section 1
    public static final FieldCodec<PrecipitationIndicator> PRECIPITATION_INDICATOR =
            new TableFieldCodec<>(CodeTables.PRECIPITATION_INDICATOR, 1);
    public static final FieldCodec<WeatherIndicator> WEATHER_INDICATOR =
            new TableFieldCodec<>(CodeTables.WEATHER_INDICATOR, 1);
    public static final FieldCodec<ValueRange> LOWEST_CLOUD_BASE =
            new TableFieldCodec<>(CodeTables.LOWEST_CLOUD_BASE, 1, METRE);
    public static final FieldCodec<Visibility> VISIBILITY =
            new TableFieldCodec<>(CodeTables.VISIBILITY, 2, METRE);
    public static final FieldCodec<CloudCover> CLOUD_COVER =
            new TableFieldCodec<>(CodeTables.CLOUD_COVER, 1, OKTA);
    public static final FieldCodec<WindDirection> WIND_DIRECTION =
            new TableFieldCodec<>(CodeTables.WIND_DIRECTION, 2, DEGREE);
    public static final FieldCodec<Integer> EXTENDED_SPEED = new IntegerFieldCodec(3);
    public static final FieldCodec<Double> TEMPERATURE = SignedTemperatureCodec.INSTANCE;
    public static final FieldCodec<Integer> RELATIVE_HUMIDITY = new IntegerFieldCodec(3, PERCENT, 0, 100);
    public static final FieldCodec<Double> PRESSURE = PressureCodec.INSTANCE;
    public static final FieldCodec<Integer> ISOBARIC_SURFACE =
            new TableFieldCodec<>(CodeTables.ISOBARIC_SURFACE, 1, "hPa");
    public static final FieldCodec<Integer> GEOPOTENTIAL_HEIGHT = new IntegerFieldCodec(3, "gpm");
    public static final FieldCodec<Integer> PRESSURE_CHARACTERISTIC =
            new TableFieldCodec<>(CodeTables.PRESSURE_CHARACTERISTIC, 1);
    public static final FieldCodec<Double> PRESSURE_CHANGE = new ScaledFieldCodec(3, "hPa", 10);
    public static final FieldCodec<Amount> PRECIPITATION_AMOUNT =
            new TableFieldCodec<>(CodeTables.PRECIPITATION_AMOUNT, 3, MILLIMETRE);
    public static final FieldCodec<Amount> PRECIPITATION_AMOUNT_24H =
            new TableFieldCodec<>(CodeTables.PRECIPITATION_AMOUNT_24H, 4, MILLIMETRE);
    public static final FieldCodec<Integer> PRECIPITATION_PERIOD =
            new TableFieldCodec<>(CodeTables.PRECIPITATION_PERIOD, 1, HOUR);
    public static final FieldCodec<Integer> PRESENT_WEATHER =
            new TableFieldCodec<>(CodeTables.PRESENT_WEATHER, 2);
    public static final FieldCodec<Integer> PAST_WEATHER =
            new TableFieldCodec<>(CodeTables.PAST_WEATHER, 1);
    public static final FieldCodec<Integer> LOW_CLOUD_TYPE =
            new TableFieldCodec<>(CodeTables.LOW_CLOUD_TYPE, 1);
    public static final FieldCodec<Integer> MIDDLE_CLOUD_TYPE =
            new TableFieldCodec<>(CodeTables.MIDDLE_CLOUD_TYPE, 1);
    public static final FieldCodec<Integer> HIGH_CLOUD_TYPE =
            new TableFieldCodec<>(CodeTables.HIGH_CLOUD_TYPE, 1);
    public static final FieldCodec<Integer> EXACT_HOUR = new IntegerFieldCodec(2, null, 0, 24);
    public static final FieldCodec<Integer> EXACT_MINUTE = new IntegerFieldCodec(2, null, 0, 59);

    // Section 2
    public static final FieldCodec<CardinalDirection> DIRECTION =
            new TableFieldCodec<>(CodeTables.DIRECTION, 1);
    public static final FieldCodec<ShipSpeed> SHIP_SPEED =
            new TableFieldCodec<>(CodeTables.SHIP_SPEED, 1);
    public static final FieldCodec<SstMeasurement> SST_MEASUREMENT =
            new TableFieldCodec<>(CodeTables.SST_MEASUREMENT, 1);
    public static final FieldCodec<Double> TEMPERATURE_MAGNITUDE = new ScaledFieldCodec(3, "Cel", 10);
    public static final FieldCodec<Integer> WAVE_PERIOD = new IntegerFieldCodec(2, "s");
    public static final FieldCodec<Double> WAVE_HEIGHT = new ScaledFieldCodec(2, METRE, 2);
    public static final FieldCodec<Double> ACCURATE_WAVE_HEIGHT = new ScaledFieldCodec(3, METRE, 10);
    public static final FieldCodec<IceAccretionSource> ICE_ACCRETION_SOURCE =
            new TableFieldCodec<>(CodeTables.ICE_ACCRETION_SOURCE, 1);
    public static final FieldCodec<Integer> ICE_THICKNESS = new IntegerFieldCodec(2, CENTIMETRE);
    public static final FieldCodec<Integer> ICE_ACCRETION_RATE =
            new TableFieldCodec<>(CodeTables.ICE_ACCRETION_RATE, 1);
    public static final FieldCodec<WetBulbStatus> WET_BULB_STATUS =
            new TableFieldCodec<>(CodeTables.WET_BULB_STATUS, 1);
    public static final FieldCodec<Integer> ICE_CONCENTRATION =
            new TableFieldCodec<>(CodeTables.ICE_CONCENTRATION, 1);
    public static final FieldCodec<Integer> ICE_DEVELOPMENT =
            new TableFieldCodec<>(CodeTables.ICE_DEVELOPMENT, 1);
    public static final FieldCodec<Integer> ICE_OF_LAND_ORIGIN =
            new TableFieldCodec<>(CodeTables.ICE_OF_LAND_ORIGIN, 1);
    public static final FieldCodec<IceBearing> ICE_BEARING =
            new TableFieldCodec<>(CodeTables.ICE_BEARING, 1);
    public static final FieldCodec<Integer> ICE_CONDITION_TREND =
            new TableFieldCodec<>(CodeTables.ICE_CONDITION_TREND, 1);

    // Section 3
    public static final FieldCodec<Integer> LOCAL_PRECIPITATION_CHARACTER =
            new TableFieldCodec<>(CodeTables.LOCAL_PRECIPITATION_CHARACTER, 1);
    public static final FieldCodec<Integer> LOCAL_PRECIPITATION_TIME =
            new TableFieldCodec<>(CodeTables.LOCAL_PRECIPITATION_TIME, 1);
    public static final FieldCodec<Integer> GROUND_TEMPERATURE = new IntegerFieldCodec(2, "Cel");
    public static final FieldCodec<Integer> GROUND_STATE =
            new TableFieldCodec<>(CodeTables.GROUND_STATE, 1);
    public static final FieldCodec<Integer> GROUND_STATE_SNOW =
            new TableFieldCodec<>(CodeTables.GROUND_STATE_SNOW, 1);
    public static final FieldCodec<Amount> SNOW_DEPTH =
            new TableFieldCodec<>(CodeTables.SNOW_DEPTH, 3, CENTIMETRE);
    public static final FieldCodec<Double> EVAPORATION = new ScaledFieldCodec(3, MILLIMETRE, 10);
    public static final FieldCodec<String> EVAPORATION_TYPE =
            new TableFieldCodec<>(CodeTables.EVAPORATION_TYPE, 1);
    public static final FieldCodec<Double> DAILY_SUNSHINE = new ScaledFieldCodec(3, HOUR, 10);
    public static final FieldCodec<Double> HOURLY_SUNSHINE = new ScaledFieldCodec(2, HOUR, 10);
    public static final FieldCodec<Integer> RADIATION = new IntegerFieldCodec(4);
    public static final FieldCodec<String> CLOUD_GENUS =
            new TableFieldCodec<>(CodeTables.CLOUD_GENUS, 1);
    public static final FieldCodec<ElevationAngle> ELEVATION_ANGLE =
            new TableFieldCodec<>(CodeTables.ELEVATION_ANGLE, 1, DEGREE);
    public static final FieldCodec<CloudHeight> CLOUD_HEIGHT =
            new TableFieldCodec<>(CodeTables.CLOUD_HEIGHT, 2, METRE);

    // Section 3, 9-groups
    public static final FieldCodec<Integer> VARIABLE_LOCATION_INTENSITY =
            new TableFieldCodec<>(CodeTables.VARIABLE_LOCATION_INTENSITY, 2);
    public static final FieldCodec<TimeBeforeObservation> TIME_BEFORE_OBSERVATION =
            new TableFieldCodec<>(CodeTables.TIME_BEFORE_OBSERVATION, 2);
    public static final FieldCodec<ValueRange> PRECIPITATION_TIME =
            new TableFieldCodec<>(CodeTables.PRECIPITATION_TIME, 1, HOUR);
    public static final FieldCodec<ValueRange> PRECIPITATION_CHARACTER =
            new TableFieldCodec<>(CodeTables.PRECIPITATION_CHARACTER, 1, HOUR);
    public static final FieldCodec<Integer> SEA_STATE =
            new TableFieldCodec<>(CodeTables.SEA_STATE, 1);
    public static final FieldCodec<ValueRange> SEA_VISIBILITY =
            new TableFieldCodec<>(CodeTables.SEA_VISIBILITY, 1, METRE);
    public static final FieldCodec<Integer> FROZEN_DEPOSIT =
            new TableFieldCodec<>(CodeTables.FROZEN_DEPOSIT, 1);
    public static final FieldCodec<Integer> DEPOSIT_VARIATION =
            new TableFieldCodec<>(CodeTables.DEPOSIT_VARIATION, 1);
    public static final FieldCodec<Integer> SNOW_COVER =
            new TableFieldCodec<>(CodeTables.SNOW_COVER, 1);
    public static final FieldCodec<Integer> SNOW_COVER_REGULARITY =
            new TableFieldCodec<>(CodeTables.SNOW_COVER_REGULARITY, 1);
    public static final FieldCodec<Integer> DRIFT_SNOW =
            new TableFieldCodec<>(CodeTables.DRIFT_SNOW, 1);
    public static final FieldCodec<Integer> DRIFT_SNOW_EVOLUTION =
            new TableFieldCodec<>(CodeTables.DRIFT_SNOW_EVOLUTION, 1);
    public static final FieldCodec<Amount> NEW_SNOW_DEPTH =
            new TableFieldCodec<>(CodeTables.NEW_SNOW_DEPTH, 2, MILLIMETRE);
    public static final FieldCodec<Amount> DEPOSIT_DIAMETER =
            new TableFieldCodec<>(CodeTables.DEPOSIT_DIAMETER, 2, MILLIMETRE);
    public static final FieldCodec<Integer> CLOUD_EVOLUTION = new IntegerFieldCodec(1, null, 0, 9);
    public static final FieldCodec<Integer> LOW_CLOUD_CONCENTRATION = new IntegerFieldCodec(1, null, 0, 9);
    public static final FieldCodec<Integer> MOUNTAIN_CONDITION = new IntegerFieldCodec(1, null, 0, 9);
    public static final FieldCodec<Integer> VALLEY_CLOUDS =
            new TableFieldCodec<>(CodeTables.VALLEY_CLOUDS, 1);
    public static final FieldCodec<Integer> VALLEY_CLOUDS_EVOLUTION =
            new TableFieldCodec<>(CodeTables.VALLEY_CLOUDS_EVOLUTION, 1);
    public static final FieldCodec<String> OPTICAL_PHENOMENA =
            new TableFieldCodec<>(CodeTables.OPTICAL_PHENOMENA, 1);
    public static final FieldCodec<String> INTENSITY =
            new TableFieldCodec<>(CodeTables.INTENSITY, 1);
    public static final FieldCodec<Integer> MIRAGE = new IntegerFieldCodec(1, null, 0, 8);
    public static final FieldCodec<Integer> CONDENSATION_TRAIL = new IntegerFieldCodec(1, null, 5, 9);
    public static final FieldCodec<Integer> TRAIL_TIME = new IntegerFieldCodec(1, null, 0, 9);
    public static final FieldCodec<Integer> SPECIAL_CLOUDS =
            new TableFieldCodec<>(CodeTables.SPECIAL_CLOUDS, 1);
    public static final FieldCodec<Integer> DAY_DARKNESS = new IntegerFieldCodec(1, null, 0, 2);
    public static final FieldCodec<Integer> SUDDEN_TEMPERATURE_CHANGE = new IntegerFieldCodec(2, "Cel");
    public static final FieldCodec<Integer> SUDDEN_HUMIDITY_CHANGE = new IntegerFieldCodec(2, PERCENT);

    /**
     * Two-digit wind or gust speed in the unit announced by iw.
     */
    public static FieldCodec<Integer> speed(String unit) {
        return new IntegerFieldCodec(2, unit);
    }
}
