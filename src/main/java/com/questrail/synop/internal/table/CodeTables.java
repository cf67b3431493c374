package com.questrail.synop.internal.table;

import com.questrail.synop.model.Amount;
import com.questrail.synop.model.AmountQualifier;
import com.questrail.synop.model.CardinalDirection;
import com.questrail.synop.model.CloudCover;
import com.questrail.synop.model.CloudHeight;
import com.questrail.synop.model.ElevationAngle;
import com.questrail.synop.model.IceAccretionSource;
import com.questrail.synop.model.IceBearing;
import com.questrail.synop.model.PrecipitationIndicator;
import com.questrail.synop.model.Quantifier;
import com.questrail.synop.model.Region;
import com.questrail.synop.model.ShipSpeed;
import com.questrail.synop.model.SstMeasurement;
import com.questrail.synop.model.TimeBeforeObservation;
import com.questrail.synop.model.ValueRange;
import com.questrail.synop.model.Visibility;
import com.questrail.synop.model.WetBulbStatus;
import com.questrail.synop.model.WetBulbStatus.Sign;
import com.questrail.synop.model.WeatherIndicator;
import com.questrail.synop.model.WindDirection;
import com.questrail.synop.model.WindIndicator;

/**
 * CodeTables
 * =============================================================================
 * The WMO code tables used by the SYNOP codec, one shared stateless instance
 * per table.
 *
 * <p>Tables are grouped below by shape: simple ranges, positional lookups,
 * value ranges and the decode-only tables. The tables with numeric formulas
 * (0877, 1677, 3590, 3889, 4077, 4377) live in their own classes.</p>
 */
public final class CodeTables
{
    private CodeTables() {}

    // -------------------------------------------------------------------------
    // Simple ranges
    // -------------------------------------------------------------------------

    public static final SimpleCodeTable PRESSURE_CHARACTERISTIC = new SimpleCodeTable("0200", 0, 8);
    public static final SimpleCodeTable GROUND_STATE = new SimpleCodeTable("0901", 0, 9);
    public static final SimpleCodeTable GROUND_STATE_SNOW = new SimpleCodeTable("0975", 0, 9);
    public static final SimpleCodeTable ICE_ACCRETION_RATE = new SimpleCodeTable("3551", 0, 4);
    public static final SimpleCodeTable SEA_STATE = new SimpleCodeTable("3700", 0, 9);
    public static final SimpleCodeTable PRESENT_WEATHER = new SimpleCodeTable("4677", 0, 99);
    public static final SimpleCodeTable PAST_WEATHER = new SimpleCodeTable("4561", 0, 9);
    public static final SimpleCodeTable LOW_CLOUD_TYPE = new SimpleCodeTable("0513", 0, 9);
    public static final SimpleCodeTable MIDDLE_CLOUD_TYPE = new SimpleCodeTable("0515", 0, 9);
    public static final SimpleCodeTable HIGH_CLOUD_TYPE = new SimpleCodeTable("0509", 0, 9);
    public static final SimpleCodeTable FROZEN_DEPOSIT = new SimpleCodeTable("3764", 0, 7);
    public static final SimpleCodeTable DEPOSIT_VARIATION = new SimpleCodeTable("3955", 0, 9);
    public static final SimpleCodeTable SNOW_COVER = new SimpleCodeTable("3765", 0, 8);
    public static final SimpleCodeTable SNOW_COVER_REGULARITY = new SimpleCodeTable("3775", 0, 8);
    public static final SimpleCodeTable DRIFT_SNOW = new SimpleCodeTable("3766", 0, 9);
    public static final SimpleCodeTable DRIFT_SNOW_EVOLUTION = new SimpleCodeTable("3776", 0, 7);
    public static final SimpleCodeTable SPECIAL_CLOUDS = new SimpleCodeTable("0521", 1, 5);
    public static final SimpleCodeTable VALLEY_CLOUDS = new SimpleCodeTable("2754", 0, 9);
    public static final SimpleCodeTable VALLEY_CLOUDS_EVOLUTION = new SimpleCodeTable("2864", 0, 9);
    public static final SimpleCodeTable ICE_CONCENTRATION = new SimpleCodeTable("0639", 0, 9);
    public static final SimpleCodeTable ICE_DEVELOPMENT = new SimpleCodeTable("3739", 0, 9);
    public static final SimpleCodeTable ICE_OF_LAND_ORIGIN = new SimpleCodeTable("0439", 0, 9);
    public static final SimpleCodeTable ICE_CONDITION_TREND = new SimpleCodeTable("5239", 0, 9);
    public static final SimpleCodeTable VARIABLE_LOCATION_INTENSITY = new SimpleCodeTable("4077Z", 76, 99);

    // Regional Association I national practice for 0TTRR
    public static final SimpleCodeTable LOCAL_PRECIPITATION_CHARACTER = new SimpleCodeTable("167", 0, 9);
    public static final SimpleCodeTable LOCAL_PRECIPITATION_TIME = new SimpleCodeTable("168", 0, 9);

    // -------------------------------------------------------------------------
    // Positional lookups
    // -------------------------------------------------------------------------

    /** 0161: WMO region from the A1 digit of a buoy identifier. */
    public static final LookupCodeTable<Region> REGION = new LookupCodeTable<>("0161",
            null, Region.I, Region.II, Region.III, Region.IV, Region.V, Region.VI, Region.ANTARCTIC);

    /** 1819: whether precipitation is reported in Section 1 and Section 3. */
    public static final LookupCodeTable<PrecipitationIndicator> PRECIPITATION_INDICATOR = new LookupCodeTable<>("1819",
            PrecipitationIndicator.of(0), PrecipitationIndicator.of(1), PrecipitationIndicator.of(2),
            PrecipitationIndicator.of(3), PrecipitationIndicator.of(4));

    /** 1855: wind speed unit and whether the speed was estimated. */
    public static final LookupCodeTable<WindIndicator> WIND_INDICATOR = new LookupCodeTable<>("1855",
            new WindIndicator(0, true), new WindIndicator(1, false), null,
            new WindIndicator(3, true), new WindIndicator(4, false));

    /** 1860: station operation and whether weather groups are included. */
    public static final LookupCodeTable<WeatherIndicator> WEATHER_INDICATOR = new LookupCodeTable<>("1860",
            null, WeatherIndicator.of(1), WeatherIndicator.of(2), WeatherIndicator.of(3),
            WeatherIndicator.of(4), WeatherIndicator.of(5), WeatherIndicator.of(6), WeatherIndicator.of(7));

    /** 0264: standard isobaric surface, in hPa. */
    public static final LookupCodeTable<Integer> ISOBARIC_SURFACE = new LookupCodeTable<>("0264",
            null, 1000, 925, null, null, 500, null, 700, 850);

    /** 0500: cloud genus. */
    public static final LookupCodeTable<String> CLOUD_GENUS = new LookupCodeTable<>("0500",
            "Ci", "Cc", "Cs", "Ac", "As", "Ns", "Sc", "St", "Cu", "Cb");

    /** 0700: direction, or bearing, in octants. */
    public static final LookupCodeTable<CardinalDirection> DIRECTION = new LookupCodeTable<>("0700",
            CardinalDirection.STATIONARY,
            CardinalDirection.of("NE"), CardinalDirection.of("E"), CardinalDirection.of("SE"),
            CardinalDirection.of("S"), CardinalDirection.of("SW"), CardinalDirection.of("W"),
            CardinalDirection.of("NW"), CardinalDirection.of("N"),
            CardinalDirection.ALL_DIRECTIONS);

    /** 0739: true bearing of the principal ice edge. */
    public static final LookupCodeTable<IceBearing> ICE_BEARING = new LookupCodeTable<>("0739",
            new IceBearing(null, true, false),
            point("NE"), point("E"), point("SE"), point("S"),
            point("SW"), point("W"), point("NW"), point("N"),
            new IceBearing(null, false, true));

    /** 1004: elevation angle of the top of a cloud. */
    public static final LookupCodeTable<ElevationAngle> ELEVATION_ANGLE = new LookupCodeTable<>("1004",
            ElevationAngle.NOT_VISIBLE,
            new ElevationAngle(45, Quantifier.IS_GREATER, true),
            angle(30), angle(20), angle(15), angle(12), angle(9), angle(7), angle(6),
            new ElevationAngle(5, Quantifier.IS_LESS, true));

    /** 1751: source of ice accretion on ships. */
    public static final LookupCodeTable<IceAccretionSource> ICE_ACCRETION_SOURCE = new LookupCodeTable<>("1751",
            null,
            new IceAccretionSource(true, false, false),
            new IceAccretionSource(false, true, false),
            new IceAccretionSource(true, true, false),
            new IceAccretionSource(false, false, true),
            new IceAccretionSource(true, false, true));

    /** 1861: intensity of a phenomenon. */
    public static final LookupCodeTable<String> INTENSITY = new LookupCodeTable<>("1861",
            "Slight", "Moderate", "Heavy or strong");

    /** 2700: total cloud cover in oktas, 9 when the sky is obscured. */
    public static final LookupCodeTable<CloudCover> CLOUD_COVER = new LookupCodeTable<>("2700",
            CloudCover.oktas(0), CloudCover.oktas(1), CloudCover.oktas(2),
            CloudCover.oktas(3), CloudCover.oktas(4), CloudCover.oktas(5),
            CloudCover.oktas(6), CloudCover.oktas(7), CloudCover.oktas(8),
            CloudCover.OBSCURED);

    /** 3850: sea surface temperature measurement method, odd codes negative. */
    public static final LookupCodeTable<SstMeasurement> SST_MEASUREMENT = new LookupCodeTable<>("3850",
            new SstMeasurement("Intake", false), new SstMeasurement("Intake", true),
            new SstMeasurement("Bucket", false), new SstMeasurement("Bucket", true),
            new SstMeasurement("Hull contact sensor", false), new SstMeasurement("Hull contact sensor", true),
            new SstMeasurement("Other", false), new SstMeasurement("Other", true));

    /** 3855: wet-bulb temperature sign and measurement status. */
    public static final LookupCodeTable<WetBulbStatus> WET_BULB_STATUS = new LookupCodeTable<>("3855",
            new WetBulbStatus(Sign.POSITIVE, true),
            new WetBulbStatus(Sign.NEGATIVE, true),
            new WetBulbStatus(Sign.ICED, true),
            null,
            null,
            new WetBulbStatus(Sign.POSITIVE, false),
            new WetBulbStatus(Sign.NEGATIVE, false),
            new WetBulbStatus(Sign.ICED, false));

    /** 4019: duration of the precipitation reference period, in hours. */
    public static final LookupCodeTable<Integer> PRECIPITATION_PERIOD = new LookupCodeTable<>("4019",
            null, 6, 12, 18, 24, 1, 2, 3, 9, 15);

    /** 4451: ship's average speed, in knots and km/h. */
    public static final LookupCodeTable<ShipSpeed> SHIP_SPEED = new LookupCodeTable<>("4451",
            speed(0, 0, 0, 0),
            speed(1, 5, 1, 10),
            speed(6, 10, 11, 19),
            speed(11, 15, 20, 28),
            speed(16, 20, 29, 37),
            speed(21, 25, 38, 47),
            speed(26, 30, 48, 56),
            speed(31, 35, 57, 65),
            speed(36, 40, 66, 75),
            new ShipSpeed(
                    ValueRange.openEnded(40, Quantifier.IS_GREATER),
                    ValueRange.openEnded(75, Quantifier.IS_GREATER)));

    /** 5161: optical phenomena. */
    public static final LookupCodeTable<String> OPTICAL_PHENOMENA = new LookupCodeTable<>("5161",
            "Brocken spectre", "Rainbow", "Solar or lunar halo", "Parhelia or anthelia",
            "Sun pillar", "Corona", "Twilight glow", "Twilight glow on the mountains",
            "Mirage", "Zodiacal light");

    // -------------------------------------------------------------------------
    // Value ranges
    // -------------------------------------------------------------------------

    /** 1600: height above ground of the base of the lowest cloud, in metres. */
    public static final LookupCodeTable<ValueRange> LOWEST_CLOUD_BASE = new LookupCodeTable<>("1600",
            ValueRange.of(0, 50), ValueRange.of(50, 100), ValueRange.of(100, 200),
            ValueRange.of(200, 300), ValueRange.of(300, 600), ValueRange.of(600, 1000),
            ValueRange.of(1000, 1500), ValueRange.of(1500, 2000), ValueRange.of(2000, 2500),
            ValueRange.openEnded(2500, Quantifier.IS_GREATER_OR_EQUAL));

    /** 4300: visibility seawards, in metres. */
    public static final LookupCodeTable<ValueRange> SEA_VISIBILITY = new LookupCodeTable<>("4300",
            ValueRange.of(0, 50), ValueRange.of(50, 200), ValueRange.of(200, 500),
            ValueRange.of(500, 1000), ValueRange.of(1000, 2000), ValueRange.of(2000, 4000),
            ValueRange.of(4000, 10000), ValueRange.of(10000, 20000), ValueRange.of(20000, 50000),
            ValueRange.openEnded(50000, Quantifier.IS_GREATER));

    // -------------------------------------------------------------------------
    // Formula tables
    // -------------------------------------------------------------------------

    public static final CodeTable<WindDirection> WIND_DIRECTION = new WindDirectionTable();
    public static final CodeTable<CloudHeight> CLOUD_HEIGHT = new CloudHeightTable();
    public static final CodeTable<Visibility> VISIBILITY = new VisibilityTable();
    public static final CodeTable<Amount> PRECIPITATION_AMOUNT = new PrecipitationAmountTable(false);
    public static final CodeTable<Amount> PRECIPITATION_AMOUNT_24H = new PrecipitationAmountTable(true);
    public static final CodeTable<Amount> SNOW_DEPTH = new SnowDepthTable();
    public static final CodeTable<TimeBeforeObservation> TIME_BEFORE_OBSERVATION = new TimeBeforeObservationTable();

    // -------------------------------------------------------------------------
    // Decode-only
    // -------------------------------------------------------------------------

    private static final ValueRange[] PRECIPITATION_DURATIONS = {
        ValueRange.of(0, 1), ValueRange.of(1, 3), ValueRange.of(3, 6),
        ValueRange.openEnded(6, Quantifier.IS_GREATER)
    };

    private static final ValueRange[] PRECIPITATION_TIMES = {
        null,
        ValueRange.of(0, 1), ValueRange.of(1, 2), ValueRange.of(2, 3), ValueRange.of(3, 4),
        ValueRange.of(4, 5), ValueRange.of(5, 6), ValueRange.of(6, 12),
        ValueRange.openEnded(12, Quantifier.IS_GREATER)
    };

    /** 0833: duration of the precipitation reported by RRR, in hours. */
    public static final CodeTable<ValueRange> PRECIPITATION_CHARACTER = new DecodeOnlyCodeTable<>("0833", d -> {
        if (d == 9) {
            return ValueRange.UNKNOWN;
        }
        if (d < 0 || d > 7) {
            throw InvalidCodeException.invalidCode("0833", d);
        }
        return PRECIPITATION_DURATIONS[d % 4];
    });

    /** 1806: instrumentation for evaporation or crop for evapotranspiration. */
    public static final CodeTable<String> EVAPORATION_TYPE = new DecodeOnlyCodeTable<>("1806", i -> {
        if (i >= 0 && i <= 4) {
            return "evaporation";
        }
        if (i >= 5 && i <= 9) {
            return "evapotranspiration";
        }
        throw InvalidCodeException.invalidCode("1806", i);
    });

    /** 3552: time at which the precipitation reported by RRR began or ended, in hours. */
    public static final CodeTable<ValueRange> PRECIPITATION_TIME = new DecodeOnlyCodeTable<>("3552", r -> {
        if (r == 9) {
            return ValueRange.UNKNOWN;
        }
        if (r < 1 || r > 8) {
            throw InvalidCodeException.invalidCode("3552", r);
        }
        return PRECIPITATION_TIMES[r];
    });

    /** 3570: diameter of a solid deposit, in millimetres. */
    public static final CodeTable<Amount> DEPOSIT_DIAMETER = new DecodeOnlyCodeTable<>("3570", rr -> {
        if (rr >= 0 && rr <= 55) {
            return Amount.of(rr);
        }
        if (rr >= 56 && rr <= 90) {
            return Amount.of((rr - 50) * 10);
        }
        if (rr >= 91 && rr <= 96) {
            return Amount.of((rr - 90) / 10.0);
        }
        return switch (rr) {
            case 97 -> Amount.qualified(AmountQualifier.NON_MEASURABLE);
            case 98 -> Amount.bounded(400, Quantifier.IS_GREATER);
            case 99 -> Amount.qualified(AmountQualifier.MEASUREMENT_IMPOSSIBLE);
            default -> throw InvalidCodeException.invalidCode("3570", rr);
        };
    });

    /** 3870: depth of newly fallen snow, in millimetres. */
    public static final CodeTable<Amount> NEW_SNOW_DEPTH = new DecodeOnlyCodeTable<>("3870", ss -> {
        if (ss >= 0 && ss <= 55) {
            return Amount.of(ss * 10);
        }
        if (ss >= 56 && ss <= 90) {
            return Amount.of((ss - 50) * 100);
        }
        if (ss >= 91 && ss <= 96) {
            return Amount.of(ss - 90);
        }
        return switch (ss) {
            case 97 -> Amount.bounded(1, Quantifier.IS_LESS);
            case 98 -> Amount.bounded(4000, Quantifier.IS_GREATER);
            case 99 -> Amount.qualified(AmountQualifier.INACCURATE);
            default -> throw InvalidCodeException.invalidCode("3870", ss);
        };
    });

    private static IceBearing point(String point) {
        return new IceBearing(point, false, false);
    }

    private static ElevationAngle angle(int degrees) {
        return new ElevationAngle(degrees, null, true);
    }

    private static ShipSpeed speed(int knotsMin, int knotsMax, int kmhMin, int kmhMax) {
        return new ShipSpeed(ValueRange.of(knotsMin, knotsMax), ValueRange.of(kmhMin, kmhMax));
    }
}
