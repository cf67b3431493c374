package com.questrail.synop.internal.table;

import com.questrail.synop.model.Amount;
import com.questrail.synop.model.AmountQualifier;
import com.questrail.synop.model.CloudHeight;
import com.questrail.synop.model.Quantifier;
import com.questrail.synop.model.Region;
import com.questrail.synop.model.TimeBeforeObservation;
import com.questrail.synop.model.Visibility;
import com.questrail.synop.model.WindDirection;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CodeTablesTest
 * -----------------------------------------------------------------------------
 * Unit tests for the shared {@link CodeTables}.
 *
 * <p>Every invertible table must map each legal code back to itself, and the
 * reserved codes must be rejected rather than guessed at.</p>
 */
final class CodeTablesTest
{
    private static final List<CodeTable<?>> INVERTIBLE = List.of(
            CodeTables.WIND_DIRECTION,
            CodeTables.CLOUD_HEIGHT,
            CodeTables.VISIBILITY,
            CodeTables.PRECIPITATION_AMOUNT,
            CodeTables.PRECIPITATION_AMOUNT_24H,
            CodeTables.SNOW_DEPTH,
            CodeTables.TIME_BEFORE_OBSERVATION,
            CodeTables.REGION,
            CodeTables.PRECIPITATION_INDICATOR,
            CodeTables.WIND_INDICATOR,
            CodeTables.WEATHER_INDICATOR,
            CodeTables.ISOBARIC_SURFACE,
            CodeTables.CLOUD_GENUS,
            CodeTables.DIRECTION,
            CodeTables.ICE_BEARING,
            CodeTables.ELEVATION_ANGLE,
            CodeTables.ICE_ACCRETION_SOURCE,
            CodeTables.CLOUD_COVER,
            CodeTables.SST_MEASUREMENT,
            CodeTables.WET_BULB_STATUS,
            CodeTables.PRECIPITATION_PERIOD,
            CodeTables.SHIP_SPEED,
            CodeTables.LOWEST_CLOUD_BASE,
            CodeTables.SEA_VISIBILITY,
            CodeTables.PRESENT_WEATHER,
            CodeTables.VARIABLE_LOCATION_INTENSITY);

    @Test
    void everyLegalCodeEncodesBackToItself() throws Exception
    {
        for (CodeTable<?> table : INVERTIBLE) {
            int legal = assertInverse(table);
            assertTrue(legal > 0, "table " + table.id() + " has no legal code");
        }
    }

    private static <T> int assertInverse(CodeTable<T> table) throws InvalidCodeException {
        int legal = 0;
        for (int code = 0; code <= 9999; code++) {
            T value;
            try {
                value = table.decode(code);
            } catch (InvalidCodeException e) {
                continue;
            }
            legal++;
            assertEquals(code, table.encode(value), "table " + table.id() + " code " + code);
        }
        return legal;
    }

    @Test
    void visibilityCodeZeroIsBelowOneHundredMetres() throws Exception
    {
        Visibility visibility = CodeTables.VISIBILITY.decode(0);
        assertEquals(100, visibility.metres(), 1e-9);
        assertEquals(Quantifier.IS_LESS, visibility.quantifier());
        assertFalse(visibility.use90());
    }

    @Test
    void visibilityReservedCodesAreRejected()
    {
        for (int code = 51; code <= 55; code++) {
            int reserved = code;
            assertThrows(InvalidCodeException.class, () -> CodeTables.VISIBILITY.decode(reserved));
        }
        assertThrows(InvalidCodeException.class, () -> CodeTables.VISIBILITY.decode(100));
    }

    @Test
    void visibilityCoarseScaleSetsUse90() throws Exception
    {
        Visibility visibility = CodeTables.VISIBILITY.decode(94);
        assertTrue(visibility.use90());
        assertEquals(1000, visibility.metres(), 1e-9);

        assertEquals(94, CodeTables.VISIBILITY.encode(new Visibility(1500, null, true)));
        assertEquals(15, CodeTables.VISIBILITY.encode(new Visibility(1500, null, false)));
    }

    @Test
    void cloudHeightCoarseScaleKeepsTheRange() throws Exception
    {
        CloudHeight height = CodeTables.CLOUD_HEIGHT.decode(93);
        assertTrue(height.use90());
        assertEquals(200, height.min(), 1e-9);
        assertEquals(300, height.max(), 1e-9);
        assertNull(height.value());

        assertThrows(InvalidCodeException.class, () -> CodeTables.CLOUD_HEIGHT.decode(53));
    }

    @Test
    void windDirectionNorthIsNeverCalm() throws Exception
    {
        assertEquals(WindDirection.CALM, CodeTables.WIND_DIRECTION.decode(0));
        assertEquals(WindDirection.VARIABLE, CodeTables.WIND_DIRECTION.decode(99));
        assertEquals(36, CodeTables.WIND_DIRECTION.encode(WindDirection.degrees(0)));
        assertEquals(36, CodeTables.WIND_DIRECTION.encode(WindDirection.degrees(360)));
        assertThrows(InvalidCodeException.class, () -> CodeTables.WIND_DIRECTION.decode(37));
    }

    @Test
    void precipitationTraceAndTenths() throws Exception
    {
        Amount trace = CodeTables.PRECIPITATION_AMOUNT.decode(990);
        assertTrue(trace.is(AmountQualifier.TRACE));

        Amount small = CodeTables.PRECIPITATION_AMOUNT.decode(993);
        assertEquals(0.3, small.value(), 1e-9);

        assertEquals(990, CodeTables.PRECIPITATION_AMOUNT.encode(Amount.qualified(AmountQualifier.TRACE)));
        assertEquals(12, CodeTables.PRECIPITATION_AMOUNT.encode(Amount.of(12.2)));
        assertEquals(989, CodeTables.PRECIPITATION_AMOUNT.encode(Amount.of(1200)));

        assertEquals(123, CodeTables.PRECIPITATION_AMOUNT_24H.encode(Amount.of(12.3)));
        assertEquals(9999, CodeTables.PRECIPITATION_AMOUNT_24H.encode(Amount.qualified(AmountQualifier.TRACE)));
    }

    @Test
    void snowDepthSpecialCodes() throws Exception
    {
        assertEquals(Quantifier.IS_LESS, CodeTables.SNOW_DEPTH.decode(997).quantifier());
        assertTrue(CodeTables.SNOW_DEPTH.decode(998).is(AmountQualifier.NOT_CONTINUOUS));
        assertTrue(CodeTables.SNOW_DEPTH.decode(999).is(AmountQualifier.MEASUREMENT_IMPOSSIBLE));
        assertThrows(InvalidCodeException.class, () -> CodeTables.SNOW_DEPTH.decode(0));
    }

    @Test
    void timeBeforeObservationCoversMinutesAndHourWindows() throws Exception
    {
        assertEquals(TimeBeforeObservation.hours(1), CodeTables.TIME_BEFORE_OBSERVATION.decode(10));
        assertEquals(TimeBeforeObservation.hourWindow(6, 7), CodeTables.TIME_BEFORE_OBSERVATION.decode(61));
        assertThrows(InvalidCodeException.class, () -> CodeTables.TIME_BEFORE_OBSERVATION.decode(67));
        assertThrows(InvalidCodeException.class,
                () -> CodeTables.TIME_BEFORE_OBSERVATION.encode(TimeBeforeObservation.minutes(7)));
    }

    @Test
    void buoyRegionDigitZeroIsReserved() throws Exception
    {
        assertEquals(Region.ANTARCTIC, CodeTables.REGION.decode(7));
        assertThrows(InvalidCodeException.class, () -> CodeTables.REGION.decode(0));
        assertThrows(InvalidCodeException.class, () -> CodeTables.REGION.decode(8));
    }

    @Test
    void decodeOnlyTablesRefuseToEncode() throws Exception
    {
        assertFalse(CodeTables.DEPOSIT_DIAMETER.isEncodable());
        Amount diameter = CodeTables.DEPOSIT_DIAMETER.decode(60);
        assertEquals(100, diameter.value(), 1e-9);
        assertThrows(UnsupportedOperationException.class, () -> CodeTables.DEPOSIT_DIAMETER.encode(diameter));

        assertTrue(CodeTables.DEPOSIT_DIAMETER.decode(99).is(AmountQualifier.MEASUREMENT_IMPOSSIBLE));
        assertEquals("evapotranspiration", CodeTables.EVAPORATION_TYPE.decode(7));
        assertTrue(CodeTables.PRECIPITATION_TIME.decode(9).isUnknown());
        assertThrows(InvalidCodeException.class, () -> CodeTables.PRECIPITATION_TIME.decode(0));
    }

    @Test
    void simpleTableRejectsAnEmptyRange()
    {
        assertThrows(IllegalArgumentException.class, () -> new SimpleCodeTable("test", 5, 4));
    }
}
