package com.questrail.synop.internal.decode;

import com.questrail.synop.model.Amount;
import com.questrail.synop.model.AmountQualifier;
import com.questrail.synop.model.CloudLayer;
import com.questrail.synop.model.Geopotential;
import com.questrail.synop.model.GroundState;
import com.questrail.synop.model.LocalPrecipitation;
import com.questrail.synop.model.Observation;
import com.questrail.synop.model.Precipitation;
import com.questrail.synop.model.Radiation;
import com.questrail.synop.model.SeaLandIce;
import com.questrail.synop.model.SpecialPhenomena.DepositDiameter;
import com.questrail.synop.model.SpecialPhenomena.DepositType;
import com.questrail.synop.model.SpecialPhenomena.HighestGust;
import com.questrail.synop.model.SpecialPhenomena.VisibilityDirection;
import com.questrail.synop.model.Sunshine;
import com.questrail.synop.model.SwellWaves;
import com.questrail.synop.model.SynopField;
import com.questrail.synop.model.SynopReport;
import com.questrail.synop.model.TimeBeforeObservation;
import com.questrail.synop.model.Wind;
import com.questrail.synop.model.WindWaves;
import com.questrail.synop.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ReportDecoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link ReportDecoder}, group by group.
 *
 * <p>Telegrams here are built from a minimal land or ship prefix followed by
 * the groups under test.</p>
 */
final class ReportDecoderTest
{
    private static final String LAND = "AAXX 01004 88889 12782 61506 ";
    private static final String REGION_I = "AAXX 20064 67005 12570 50402 ";
    private static final String ANTARCTIC = "AAXX 20104 89646 46/// /2299 ";
    private static final String SHIP = "BBXX ZDLP 19004 99607 50455 41298 81307 ";

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final ReportDecoder decoder = new ReportDecoder(sink, Clock.systemUTC());

    private SynopReport decode(String telegram) {
        return decoder.decode(Arrays.asList(telegram.trim().split(" +")));
    }

    @Test
    void emptyGroupListIsFatal()
    {
        assertThrows(SynopDecodeException.class, () -> decoder.decode(List.of()));
    }

    // -------------------------------------------------------------------------
    // Section 1
    // -------------------------------------------------------------------------

    @Test
    void geopotentialRestoresTheOmittedDigit()
    {
        SynopReport report = decode(ANTARCTIC + "42010");

        Geopotential geopotential = report.get(SynopField.GEOPOTENTIAL).orElseThrow();
        assertEquals(925, geopotential.surface().value());
        assertEquals(1010, geopotential.height().value());
        assertFalse(report.has(SynopField.SEA_LEVEL_PRESSURE));
    }

    @Test
    void humidityReplacesDewpoint()
    {
        SynopReport report = decode(ANTARCTIC + "29079");

        assertEquals(79, report.get(SynopField.RELATIVE_HUMIDITY).orElseThrow().value());
        assertFalse(report.has(SynopField.DEWPOINT_TEMPERATURE));
    }

    @Test
    void temperatureWithSignButNoValueIsUnavailable()
    {
        SynopReport report = decode(LAND + "10/// 20///");

        Observation<Double> air = report.get(SynopField.AIR_TEMPERATURE).orElseThrow();
        assertFalse(air.available());
        assertEquals("0///", air.raw());
        assertFalse(report.get(SynopField.DEWPOINT_TEMPERATURE).orElseThrow().available());
        assertTrue(report.notImplemented().isEmpty());
        assertTrue(sink.getWarnings().isEmpty());
    }

    @Test
    void fallingTendencyIsNegative()
    {
        SynopReport report = decode(LAND + "57015");

        assertEquals(-1.5, report.get(SynopField.PRESSURE_TENDENCY).orElseThrow().change().value(), 1e-9);
    }

    @Test
    void pastWeatherPeriodFollowsTheObservationHour()
    {
        assertEquals(TimeBeforeObservation.hours(6),
                decode(LAND + "70102").get(SynopField.WEATHER).orElseThrow().timeBeforeObs());
        assertEquals(TimeBeforeObservation.hours(3),
                decode("AAXX 01034 88889 12782 61506 70102").get(SynopField.WEATHER).orElseThrow().timeBeforeObs());
    }

    // -------------------------------------------------------------------------
    // Section 2
    // -------------------------------------------------------------------------

    @Test
    void maritimeGroups()
    {
        SynopReport report = decode(SHIP + "22251 00268 10804 20604 310// 40802 61234 70021 80092");

        assertEquals("SW", report.get(SynopField.DISPLACEMENT).orElseThrow().direction().value().point());
        assertEquals(26.8, report.get(SynopField.SEA_SURFACE_TEMPERATURE).orElseThrow().temperature().value(), 1e-9);

        List<WindWaves> waves = report.get(SynopField.WIND_WAVES).orElseThrow();
        assertEquals(3, waves.size());
        assertTrue(waves.get(0).instrumental());
        assertEquals(8, waves.get(0).period().value());
        assertEquals(2.0, waves.get(0).height().value(), 1e-9);
        assertFalse(waves.get(1).instrumental());
        assertTrue(waves.get(2).accurate());
        assertEquals(2.1, waves.get(2).height().value(), 1e-9);

        List<SwellWaves> swells = report.get(SynopField.SWELL_WAVES).orElseThrow();
        assertEquals(1, swells.size());
        assertEquals(100, swells.get(0).direction().value().degrees());
        assertEquals(1.0, swells.get(0).height().value(), 1e-9);

        assertEquals(23, report.get(SynopField.ICE_ACCRETION).orElseThrow().thickness().value());
        assertEquals(9.2, report.get(SynopField.WET_BULB_TEMPERATURE).orElseThrow().temperature().value(), 1e-9);
    }

    @Test
    void negativeSeaTemperatureComesFromTheIndicator()
    {
        SynopReport report = decode(SHIP + "22200 01019 81001");

        assertEquals(-1.9, report.get(SynopField.SEA_SURFACE_TEMPERATURE).orElseThrow().temperature().value(), 1e-9);
        assertEquals(-0.1, report.get(SynopField.WET_BULB_TEMPERATURE).orElseThrow().temperature().value(), 1e-9);
    }

    @Test
    void confusedSeaHasNoPeriod()
    {
        WindWaves waves = decode(SHIP + "22200 29904").get(SynopField.WIND_WAVES).orElseThrow().get(0);

        assertTrue(waves.confused());
        assertFalse(waves.period().available());
        assertEquals(2.0, waves.height().value(), 1e-9);
    }

    @Test
    void swellDirectionGroupAloneIsKept()
    {
        List<SwellWaves> swells = decode(SHIP + "22200 3////").get(SynopField.SWELL_WAVES).orElseThrow();

        assertEquals(1, swells.size());
        assertFalse(swells.get(0).direction().available());
        assertFalse(swells.get(0).hasWaveGroup());
    }

    @Test
    void iceGroupOrPlainLanguage()
    {
        SeaLandIce coded = decode(SHIP + "ICE 21435").get(SynopField.SEA_LAND_ICE).orElseThrow();
        assertFalse(coded.isText());
        assertEquals(2, coded.concentration().value());
        assertEquals("SE", coded.bearing().value().point());

        SeaLandIce text = decode(SHIP + "22200 ICE icy conditions 333 10178").get(SynopField.SEA_LAND_ICE).orElseThrow();
        assertEquals("icy conditions", text.text());
    }

    // -------------------------------------------------------------------------
    // Section 3
    // -------------------------------------------------------------------------

    @Test
    void temperaturesAndGroundState()
    {
        SynopReport report = decode(LAND + "333 10178 21073 34101 41020");

        assertEquals(17.8, report.get(SynopField.MAXIMUM_TEMPERATURE).orElseThrow().value(), 1e-9);
        assertEquals(-7.3, report.get(SynopField.MINIMUM_TEMPERATURE).orElseThrow().value(), 1e-9);
        GroundState ground = report.get(SynopField.GROUND_STATE).orElseThrow();
        assertEquals(4, ground.state().value());
        assertEquals(-1, ground.temperature().value());
        assertEquals(20.0, report.get(SynopField.GROUND_STATE_SNOW).orElseThrow().depth().value().value(), 1e-9);
    }

    @Test
    void groundStateIsNotReportedBySea()
    {
        SynopReport report = decode(SHIP + "333 34101");

        assertFalse(report.has(SynopField.GROUND_STATE));
        assertEquals(List.of("34101"), report.notImplemented());
    }

    @Test
    void group0DependsOnTheRegion()
    {
        SynopReport regionI = decode(REGION_I + "333 02434");
        assertEquals(24, regionI.get(SynopField.GROUND_MINIMUM_TEMPERATURE).orElseThrow().value());
        LocalPrecipitation local = regionI.get(SynopField.LOCAL_PRECIPITATION).orElseThrow();
        assertEquals(3, local.character().value());
        assertEquals(4, local.time().value());

        assertEquals(-5, decode(REGION_I + "333 05534").get(SynopField.GROUND_MINIMUM_TEMPERATURE)
                .orElseThrow().value());

        Wind maxWind = decode(ANTARCTIC + "333 01268").get(SynopField.MAX_WIND).orElseThrow();
        assertEquals(120, maxWind.direction().value().degrees());
        assertEquals(68, maxWind.speed().value());
        assertEquals("KT", maxWind.speed().unit());

        SynopReport other = decode(LAND + "333 01234 10178");
        assertEquals(List.of("01234"), other.notImplemented());
        assertTrue(other.has(SynopField.MAXIMUM_TEMPERATURE));
    }

    @Test
    void dailyAndHourlySunshine()
    {
        Sunshine daily = decode(LAND + "333 55055").get(SynopField.SUNSHINE).orElseThrow().get(0);
        assertEquals(5.5, daily.amount().value(), 1e-9);
        assertEquals("h", daily.amount().unit());
        assertEquals(24, daily.duration().value());
        assertEquals("h", daily.duration().unit());

        Sunshine hourly = decode(LAND + "333 55305").get(SynopField.SUNSHINE).orElseThrow().get(0);
        assertEquals(0.5, hourly.amount().value(), 1e-9);
        assertEquals(1, hourly.duration().value());

        Sunshine unknown = decode(LAND + "333 55///").get(SynopField.SUNSHINE).orElseThrow().get(0);
        assertFalse(unknown.amount().available());
        assertNull(unknown.duration());
    }

    @Test
    void radiationFollowsSunshineWithIncreasingType()
    {
        SynopReport report = decode(LAND + "333 55055 00123 20456 10789 60051");

        Sunshine sunshine = report.get(SynopField.SUNSHINE).orElseThrow().get(0);
        List<Radiation> radiation = sunshine.radiation();
        assertEquals(2, radiation.size());
        assertEquals(0, radiation.get(0).type());
        assertEquals(123, radiation.get(0).amount().value());
        assertEquals(Radiation.DAILY_UNIT, radiation.get(0).amount().unit());
        assertEquals(2, radiation.get(1).type());

        assertEquals(List.of("10789"), report.notImplemented());
        assertTrue(report.has(SynopField.PRECIPITATION_S3));
    }

    @Test
    void hourlyRadiationUsesItsOwnUnit()
    {
        Sunshine sunshine = decode(LAND + "333 55302 40001 50010").get(SynopField.SUNSHINE).orElseThrow().get(0);

        assertEquals(2, sunshine.radiation().size());
        assertEquals(Radiation.HOURLY_UNIT, sunshine.radiation().get(1).amount().unit());
        assertEquals(5, sunshine.radiation().get(1).type());
    }

    @Test
    void group5FamilyRunsInOrder()
    {
        SynopReport report = decode(LAND + "333 50123 55055 55301 56123 57384 59012");

        assertEquals(1.2, report.get(SynopField.EVAPOTRANSPIRATION).orElseThrow().amount().value(), 1e-9);
        assertEquals("evaporation", report.get(SynopField.EVAPOTRANSPIRATION).orElseThrow().type().value());
        assertEquals(2, report.get(SynopField.SUNSHINE).orElseThrow().size());
        assertEquals("NE", report.get(SynopField.CLOUD_DRIFT_DIRECTION).orElseThrow().low().value().point());
        assertEquals("Ac", report.get(SynopField.CLOUD_ELEVATION).orElseThrow().genus().value());
        assertEquals(15, report.get(SynopField.CLOUD_ELEVATION).orElseThrow().elevation().value().degrees());
        assertEquals(-1.2, report.get(SynopField.PRESSURE_CHANGE).orElseThrow().value(), 1e-9);
        assertTrue(report.notImplemented().isEmpty());
    }

    @Test
    void group5FamilyEndsOnADecreasingLevel()
    {
        SynopReport report = decode(LAND + "333 56123 50123");

        assertTrue(report.has(SynopField.CLOUD_DRIFT_DIRECTION));
        assertFalse(report.has(SynopField.EVAPOTRANSPIRATION));
        assertEquals(List.of("50123"), report.notImplemented());
    }

    @Test
    void secondPrecipitationGroupGoesToTheDailySlot()
    {
        SynopReport both = decode(LAND + "333 60051 70123");
        Precipitation period = both.get(SynopField.PRECIPITATION_S3).orElseThrow();
        assertEquals(5.0, period.amount().value().value(), 1e-9);
        assertEquals(6, period.timeBeforeObs().value());
        Precipitation daily = both.get(SynopField.PRECIPITATION_24H).orElseThrow();
        assertEquals(12.3, daily.amount().value().value(), 1e-9);
        assertTrue(daily.isDailyTotal());

        SynopReport dailyOnly = decode(LAND + "333 79999");
        Precipitation trace = dailyOnly.get(SynopField.PRECIPITATION_S3).orElseThrow();
        assertTrue(trace.amount().value().is(AmountQualifier.TRACE));
        assertFalse(dailyOnly.has(SynopField.PRECIPITATION_24H));
    }

    @Test
    void cloudLayersRepeat()
    {
        List<CloudLayer> layers = decode(LAND + "333 81541 85630 88890").get(SynopField.CLOUD_LAYERS).orElseThrow();

        assertEquals(3, layers.size());
        assertEquals("Ns", layers.get(0).genus().value());
        assertEquals(1230.0, layers.get(0).height().value().value(), 1e-9);
        assertEquals(900.0, layers.get(1).height().value().value(), 1e-9);
        assertTrue(layers.get(2).height().value().use90());
    }

    // -------------------------------------------------------------------------
    // Special phenomena
    // -------------------------------------------------------------------------

    @Test
    void gustUsesThePastWeatherPeriodByDefault()
    {
        HighestGust gust = decode(LAND + "333 91120").get(SynopField.HIGHEST_GUSTS).orElseThrow().get(0);

        assertEquals(20, gust.speed().value());
        assertEquals("KT", gust.speed().unit());
        assertNull(gust.measurePeriodMinutes());
        assertEquals(Observation.of(TimeBeforeObservation.hours(6)), gust.timeBeforeObs());
    }

    @Test
    void periodGroupAndGustDirection()
    {
        SynopReport report = decode(LAND + "333 90710 91120 91527");

        List<HighestGust> gusts = report.get(SynopField.HIGHEST_GUSTS).orElseThrow();
        assertEquals(1, gusts.size());
        HighestGust gust = gusts.get(0);
        assertEquals(TimeBeforeObservation.hours(1), gust.timeBeforeObs().value());
        assertEquals(10, gust.timeBeforeObs().code());
        assertEquals(270, gust.direction().value().degrees());
        assertTrue(report.notImplemented().isEmpty());
    }

    @Test
    void eachPeriodGroupStartsANewGustSequence()
    {
        SynopReport report = decode(LAND + "333 90710 91120 90706 91115");

        List<HighestGust> gusts = report.get(SynopField.HIGHEST_GUSTS).orElseThrow();
        assertEquals(2, gusts.size());
        assertEquals(20, gusts.get(0).speed().value());
        assertEquals(TimeBeforeObservation.hours(1), gusts.get(0).timeBeforeObs().value());
        assertEquals(15, gusts.get(1).speed().value());
        assertEquals(TimeBeforeObservation.minutes(36), gusts.get(1).timeBeforeObs().value());
        assertTrue(report.notImplemented().isEmpty());
    }

    @Test
    void tenMinuteGustDoesNotUseThePeriod()
    {
        SynopReport report = decode(LAND + "333 90710 91027");

        HighestGust gust = report.get(SynopField.HIGHEST_GUSTS).orElseThrow().get(0);
        assertEquals(10, gust.measurePeriodMinutes());
        assertNull(gust.timeBeforeObs());
        assertEquals(List.of("90710"), report.notImplemented());
    }

    @Test
    void gustDirectionWithoutGustIsNotImplemented()
    {
        SynopReport report = decode(LAND + "333 91527");

        assertFalse(report.has(SynopField.HIGHEST_GUSTS));
        assertEquals(List.of("91527"), report.notImplemented());
    }

    @Test
    void specialPhenomenaMustIncrease()
    {
        SynopReport report = decode(LAND + "333 92411 91120 93115");

        assertTrue(report.has(SynopField.SEA_CONDITION));
        assertFalse(report.has(SynopField.HIGHEST_GUSTS));
        assertTrue(report.has(SynopField.SNOW_FALL));
        assertEquals(List.of("91120"), report.notImplemented());
    }

    @Test
    void snowFallAndDepositDiameters()
    {
        SynopReport report = decode(LAND + "333 93115 93360 93497");

        assertEquals(150.0, report.get(SynopField.SNOW_FALL).orElseThrow().amount().value().value(), 1e-9);
        List<DepositDiameter> diameters = report.get(SynopField.DEPOSIT_DIAMETERS).orElseThrow();
        assertEquals(DepositType.SOLID, diameters.get(0).type());
        assertEquals(Amount.of(100), diameters.get(0).diameter().value());
        assertEquals(DepositType.GLAZE, diameters.get(1).type());
        assertTrue(diameters.get(1).diameter().value().is(AmountQualifier.NON_MEASURABLE));
    }

    @Test
    void visibilityTowardsSeaAndByDirection()
    {
        List<VisibilityDirection> directions =
                decode(LAND + "333 98082 98350").get(SynopField.VISIBILITY_DIRECTIONS).orElseThrow();

        assertEquals("towardsSea", directions.get(0).direction().value());
        assertEquals(40000, directions.get(0).visibility().value().metres(), 1e-9);
        assertEquals("SE", directions.get(1).direction().value());
        assertEquals(3, directions.get(1).direction().code());
        assertEquals(5000, directions.get(1).visibility().value().metres(), 1e-9);
    }

    @Test
    void suddenChangesCarryTheirSign()
    {
        SynopReport report = decode(LAND + "333 99705 99810");

        assertEquals(-5, report.get(SynopField.SUDDEN_TEMPERATURE_CHANGE).orElseThrow().value());
        assertEquals(10, report.get(SynopField.SUDDEN_HUMIDITY_CHANGE).orElseThrow().value());
        assertEquals("Cel", report.get(SynopField.SUDDEN_TEMPERATURE_CHANGE).orElseThrow().unit());
    }

    @Test
    void duplicateSuddenChangeIsNotImplemented()
    {
        SynopReport report = decode(LAND + "333 99605 99705");

        assertEquals(5, report.get(SynopField.SUDDEN_TEMPERATURE_CHANGE).orElseThrow().value());
        assertEquals(List.of("99705"), report.notImplemented());
    }

    @Test
    void uninterpretedSpecialPhenomenaAreKept()
    {
        SynopReport report = decode("BBXX 51002 19001 99170 71577 46/// /0709 10267 333 91212 555 11102 22108 8//10 92344");

        assertEquals(List.of("91212"), report.notImplemented());
        assertEquals(List.of("11102", "22108", "8//10", "92344"), report.get(SynopField.SECTION_5).orElseThrow());
    }

    // -------------------------------------------------------------------------
    // Sections 4 and 5
    // -------------------------------------------------------------------------

    @Test
    void sections4And5AreVerbatim()
    {
        SynopReport report = decode(LAND + "333 10178 444 12345 67890 555 11102 8//10");

        assertEquals(List.of("12345", "67890"), report.get(SynopField.SECTION_4).orElseThrow());
        assertEquals(List.of("11102", "8//10"), report.get(SynopField.SECTION_5).orElseThrow());
        assertTrue(report.notImplemented().isEmpty());
    }
}
