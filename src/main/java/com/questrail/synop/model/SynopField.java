package com.questrail.synop.model;

import com.questrail.synop.model.SpecialPhenomena.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * SynopField
 * -----------------------------------------------------------------------------
 * Typed key for one field of a {@link SynopReport}.
 *
 * <p>There is exactly one constant per known field, declared in the order the
 * encoder emits them. The type parameter is the Java type of the stored value,
 * so report access is checked at compile time:</p>
 *
 * <pre>
 *   Optional&lt;Observation&lt;Double&gt;&gt; t = report.get(SynopField.AIR_TEMPERATURE);
 * </pre>
 *
 * <p>Repeatable groups (cloud layers, swell and wind waves, highest gusts)
 * are stored as lists.</p>
 */
public final class SynopField<T>
{
    private static final List<SynopField<?>> VALUES = new ArrayList<>();

    // Section 0
    public static final SynopField<Observation<StationType>> STATION_TYPE = define("station_type", 0);
    public static final SynopField<Observation<String>> CALLSIGN = define("callsign", 0);
    public static final SynopField<ObservationTime> OBS_TIME = define("obs_time", 0);
    public static final SynopField<Observation<WindIndicator>> WIND_INDICATOR = define("wind_indicator", 0);
    public static final SynopField<Observation<String>> STATION_ID = define("station_id", 0);
    public static final SynopField<Observation<Region>> REGION = define("region", 0);
    public static final SynopField<StationPosition> STATION_POSITION = define("station_position", 0);

    // Section 1
    public static final SynopField<Observation<PrecipitationIndicator>> PRECIPITATION_INDICATOR = define("precipitation_indicator", 1);
    public static final SynopField<Observation<WeatherIndicator>> WEATHER_INDICATOR = define("weather_indicator", 1);
    public static final SynopField<Observation<ValueRange>> LOWEST_CLOUD_BASE = define("lowest_cloud_base", 1);
    public static final SynopField<Observation<Visibility>> VISIBILITY = define("visibility", 1);
    public static final SynopField<Observation<CloudCover>> CLOUD_COVER = define("cloud_cover", 1);
    public static final SynopField<Wind> SURFACE_WIND = define("surface_wind", 1);
    public static final SynopField<Observation<Double>> AIR_TEMPERATURE = define("air_temperature", 1);
    public static final SynopField<Observation<Double>> DEWPOINT_TEMPERATURE = define("dewpoint_temperature", 1);
    public static final SynopField<Observation<Integer>> RELATIVE_HUMIDITY = define("relative_humidity", 1);
    public static final SynopField<Observation<Double>> STATION_PRESSURE = define("station_pressure", 1);
    public static final SynopField<Observation<Double>> SEA_LEVEL_PRESSURE = define("sea_level_pressure", 1);
    public static final SynopField<Geopotential> GEOPOTENTIAL = define("geopotential", 1);
    public static final SynopField<PressureTendency> PRESSURE_TENDENCY = define("pressure_tendency", 1);
    public static final SynopField<Precipitation> PRECIPITATION_S1 = define("precipitation_s1", 1);
    public static final SynopField<Weather> WEATHER = define("weather", 1);
    public static final SynopField<CloudTypes> CLOUD_TYPES = define("cloud_types", 1);
    public static final SynopField<ExactObservationTime> EXACT_OBS_TIME = define("exact_obs_time", 1);

    // Section 2
    public static final SynopField<ShipDisplacement> DISPLACEMENT = define("displacement", 2);
    public static final SynopField<SeaSurfaceTemperature> SEA_SURFACE_TEMPERATURE = define("sea_surface_temperature", 2);
    public static final SynopField<List<WindWaves>> WIND_WAVES = define("wind_waves", 2);
    public static final SynopField<List<SwellWaves>> SWELL_WAVES = define("swell_waves", 2);
    public static final SynopField<IceAccretion> ICE_ACCRETION = define("ice_accretion", 2);
    public static final SynopField<WetBulbTemperature> WET_BULB_TEMPERATURE = define("wet_bulb_temperature", 2);
    public static final SynopField<SeaLandIce> SEA_LAND_ICE = define("sea_land_ice", 2);

    // Section 3
    public static final SynopField<Observation<Integer>> GROUND_MINIMUM_TEMPERATURE = define("ground_minimum_temperature", 3);
    public static final SynopField<LocalPrecipitation> LOCAL_PRECIPITATION = define("local_precipitation", 3);
    public static final SynopField<Wind> MAX_WIND = define("max_wind", 3);
    public static final SynopField<Observation<Double>> MAXIMUM_TEMPERATURE = define("maximum_temperature", 3);
    public static final SynopField<Observation<Double>> MINIMUM_TEMPERATURE = define("minimum_temperature", 3);
    public static final SynopField<GroundState> GROUND_STATE = define("ground_state", 3);
    public static final SynopField<GroundStateSnow> GROUND_STATE_SNOW = define("ground_state_snow", 3);
    public static final SynopField<Evapotranspiration> EVAPOTRANSPIRATION = define("evapotranspiration", 3);
    public static final SynopField<List<Sunshine>> SUNSHINE = define("sunshine", 3);
    public static final SynopField<CloudDrift> CLOUD_DRIFT_DIRECTION = define("cloud_drift_direction", 3);
    public static final SynopField<CloudElevation> CLOUD_ELEVATION = define("cloud_elevation", 3);
    public static final SynopField<Observation<Double>> PRESSURE_CHANGE = define("pressure_change", 3);
    public static final SynopField<Precipitation> PRECIPITATION_S3 = define("precipitation_s3", 3);
    public static final SynopField<Precipitation> PRECIPITATION_24H = define("precipitation_24h", 3);
    public static final SynopField<List<CloudLayer>> CLOUD_LAYERS = define("cloud_layer", 3);
    public static final SynopField<Observation<Integer>> VARIABLE_LOCATION_INTENSITY = define("variable_location_intensity", 3);
    public static final SynopField<PrecipitationTime> PRECIPITATION_TIME = define("precipitation_time", 3);
    public static final SynopField<List<HighestGust>> HIGHEST_GUSTS = define("highest_gust", 3);
    public static final SynopField<SeaCondition> SEA_CONDITION = define("sea_condition", 3);
    public static final SynopField<FrozenDeposit> FROZEN_DEPOSIT = define("frozen_deposit", 3);
    public static final SynopField<SnowCoverRegularity> SNOW_COVER_REGULARITY = define("snow_cover_regularity", 3);
    public static final SynopField<DriftSnow> DRIFT_SNOW = define("drift_snow", 3);
    public static final SynopField<SnowFall> SNOW_FALL = define("snow_fall", 3);
    public static final SynopField<List<DepositDiameter>> DEPOSIT_DIAMETERS = define("deposit_diameter", 3);
    public static final SynopField<CloudEvolution> CLOUD_EVOLUTION = define("cloud_evolution", 3);
    public static final SynopField<LowCloudConcentration> LOW_CLOUD_CONCENTRATION = define("max_low_cloud_concentration", 3);
    public static final SynopField<MountainCondition> MOUNTAIN_CONDITION = define("mountain_condition", 3);
    public static final SynopField<ValleyClouds> VALLEY_CLOUDS = define("valley_clouds", 3);
    public static final SynopField<List<VisibilityDirection>> VISIBILITY_DIRECTIONS = define("visibility_direction", 3);
    public static final SynopField<OpticalPhenomena> OPTICAL_PHENOMENA = define("optical_phenomena", 3);
    public static final SynopField<Mirage> MIRAGE = define("mirage", 3);
    public static final SynopField<CondensationTrails> CONDENSATION_TRAILS = define("condensation_trails", 3);
    public static final SynopField<SpecialClouds> SPECIAL_CLOUDS = define("special_clouds", 3);
    public static final SynopField<DayDarkness> DAY_DARKNESS = define("day_darkness", 3);
    public static final SynopField<Observation<Integer>> SUDDEN_TEMPERATURE_CHANGE = define("sudden_temperature_change", 3);
    public static final SynopField<Observation<Integer>> SUDDEN_HUMIDITY_CHANGE = define("sudden_humidity_change", 3);

    // Sections 4 and 5 are preserved verbatim
    public static final SynopField<List<String>> SECTION_4 = define("section4", 4);
    public static final SynopField<List<String>> SECTION_5 = define("section5", 5);

    private final String name;
    private final int section;
    private final int ordinal;

    private SynopField(String name, int section, int ordinal) {
        this.name = name;
        this.section = section;
        this.ordinal = ordinal;
    }

    private static <T> SynopField<T> define(String name, int section) {
        SynopField<T> field = new SynopField<>(name, section, VALUES.size());
        VALUES.add(field);
        return field;
    }

    /**
     * All fields in encode order.
     */
    public static List<SynopField<?>> values() {
        return Collections.unmodifiableList(VALUES);
    }

    public static Optional<SynopField<?>> forName(String name) {
        return VALUES.stream().filter(f -> f.name.equals(name)).findFirst();
    }

    /** snake_case field name used in rendered output. */
    public String name() {
        return name;
    }

    /** Section number (0 to 5) the field belongs to. */
    public int section() {
        return section;
    }

    public int ordinal() {
        return ordinal;
    }

    @Override
    public String toString() {
        return name;
    }
}
