package com.questrail.synop.codec.impl;

import com.questrail.synop.config.SynopCodecConfig;
import com.questrail.synop.internal.decode.SynopDecodeException;
import com.questrail.synop.model.Observation;
import com.questrail.synop.model.ObservationTime;
import com.questrail.synop.model.Region;
import com.questrail.synop.model.StationPosition;
import com.questrail.synop.model.StationType;
import com.questrail.synop.model.SynopField;
import com.questrail.synop.model.SynopReport;
import com.questrail.synop.model.Wind;
import com.questrail.synop.model.WindIndicator;
import com.questrail.synop.observability.RecordingObservabilitySink;
import com.questrail.synop.observability.SynopErrorEvent;
import com.questrail.synop.observability.SynopReportEvent;
import com.questrail.synop.observability.SynopWarningEvent;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultSynopDecoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultSynopDecoder}.
 *
 * <p>These tests cover the outer decode contract:</p>
 * <ul>
 *   <li>fatal failures for malformed mandatory groups</li>
 *   <li>recoverable warnings for invalid codes and unexpected groups</li>
 *   <li>partial reports for telegrams that end early</li>
 *   <li>the events reported to the observability sink</li>
 * </ul>
 */
final class DefaultSynopDecoderTest
{
    private static final Instant NOW = Instant.parse("2024-03-01T06:00:00Z");

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final DefaultSynopDecoder decoder = new DefaultSynopDecoder(
            SynopCodecConfig.builder().withObservabilitySink(sink).build(),
            Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void decodeLandStationSections0And1()
    {
        SynopReport report = decoder.decode("AAXX 01004 88889 12782 61506 10094 20047 30111 40197 53007 60001 70102 81541");

        Observation<StationType> type = report.get(SynopField.STATION_TYPE).orElseThrow();
        assertEquals(StationType.AAXX, type.value());
        assertEquals("AAXX", type.raw());

        ObservationTime time = report.get(SynopField.OBS_TIME).orElseThrow();
        assertEquals(1, time.day().value());
        assertEquals(0, time.hour().value());

        Observation<WindIndicator> indicator = report.get(SynopField.WIND_INDICATOR).orElseThrow();
        assertEquals(4, indicator.value().code());
        assertFalse(indicator.value().estimated());
        assertEquals("KT", indicator.unit());

        Observation<Double> temperature = report.get(SynopField.AIR_TEMPERATURE).orElseThrow();
        assertEquals(9.4, temperature.value(), 1e-9);
        assertEquals("Cel", temperature.unit());

        assertEquals("88889", report.get(SynopField.STATION_ID).orElseThrow().value());
        assertEquals(Region.III, report.get(SynopField.REGION).orElseThrow().value());
        assertEquals(1011.1, report.get(SynopField.STATION_PRESSURE).orElseThrow().value(), 1e-9);
        assertEquals(1019.7, report.get(SynopField.SEA_LEVEL_PRESSURE).orElseThrow().value(), 1e-9);
        assertEquals(4.7, report.get(SynopField.DEWPOINT_TEMPERATURE).orElseThrow().value(), 1e-9);
        assertTrue(report.notImplemented().isEmpty());
        assertFalse(report.isNil());
    }

    @Test
    void decodeReportsEventToSink()
    {
        String telegram = "AAXX 01004 88889 12782 61506 10094";
        SynopReport report = decoder.decode(telegram);

        List<SynopReportEvent> events = sink.getReports();
        assertEquals(1, events.size());
        SynopReportEvent event = events.get(0);
        assertEquals(SynopReportEvent.Direction.DECODED, event.direction());
        assertEquals(telegram, event.telegram());
        assertEquals(report.fields().size(), event.fieldCount());
        assertEquals(NOW, event.timestamp());
        assertFalse(sink.hasEventOfType(SynopWarningEvent.class));
    }

    @Test
    void extraWhitespaceBetweenGroupsIsIgnored()
    {
        SynopReport compact = decoder.decode("AAXX 01004 88889 12782 61506 10094");
        SynopReport spaced = decoder.decode("  AAXX  01004\n88889\t12782 61506   10094 ");

        assertEquals(compact, spaced);
    }

    @Test
    void nilReportKeepsOnlySection0()
    {
        SynopReport report = decoder.decode("BBXX ZDLP 19004 99607 50455 NIL");

        assertTrue(report.isNil());
        assertTrue(report.fields().stream().allMatch(field -> field.section() == 0));
        assertEquals(Region.SHIP, report.get(SynopField.REGION).orElseThrow().value());
        assertEquals("ZDLP", report.get(SynopField.CALLSIGN).orElseThrow().value());

        StationPosition position = report.get(SynopField.STATION_POSITION).orElseThrow();
        assertEquals(-60.7, position.latitude().value(), 1e-9);
        assertEquals(-45.5, position.longitude().value(), 1e-9);
        assertEquals(5, position.quadrant().value());
    }

    @Test
    void groupsAfterNilAreNotImplemented()
    {
        SynopReport report = decoder.decode("AAXX 01004 88889 NIL 12782");

        assertTrue(report.isNil());
        assertEquals(List.of("12782"), report.notImplemented());
    }

    @Test
    void buoyIdentifierGivesRegion()
    {
        SynopReport report = decoder.decode("BBXX 51002 19001 99170 71577 46/// /0709");

        Observation<Region> region = report.get(SynopField.REGION).orElseThrow();
        assertEquals(Region.V, region.value());
        assertEquals("0161", region.table());
        assertEquals("m/s", report.get(SynopField.WIND_INDICATOR).orElseThrow().unit());

        StationPosition position = report.get(SynopField.STATION_POSITION).orElseThrow();
        assertEquals(17.0, position.latitude().value(), 1e-9);
        assertEquals(-157.7, position.longitude().value(), 1e-9);
    }

    @Test
    void extendedWindSpeedConsumesTheFollowingGroup()
    {
        SynopReport report = decoder.decode("AAXX 01004 88889 12782 82799 00234 10094");

        Wind wind = report.get(SynopField.SURFACE_WIND).orElseThrow();
        assertEquals(234, wind.speed().value());
        assertEquals("KT", wind.speed().unit());
        assertEquals(9.4, report.get(SynopField.AIR_TEMPERATURE).orElseThrow().value(), 1e-9);
        assertTrue(report.notImplemented().isEmpty());
    }

    @Test
    void speed99WithoutFollowUpGroupIsKept()
    {
        SynopReport report = decoder.decode("AAXX 01004 88889 12782 82799 10094");

        Wind wind = report.get(SynopField.SURFACE_WIND).orElseThrow();
        assertEquals(99, wind.speed().value());
        assertEquals(270, wind.direction().value().degrees());
        assertEquals(9.4, report.get(SynopField.AIR_TEMPERATURE).orElseThrow().value(), 1e-9);
    }

    @Test
    void calmWindWithSpeedDropsTheSpeed()
    {
        SynopReport report = decoder.decode("AAXX 01004 88889 12782 80005");

        Wind wind = report.get(SynopField.SURFACE_WIND).orElseThrow();
        assertTrue(wind.direction().value().calm());
        assertNull(wind.speed());
        assertEquals("80005", sink.getWarnings().get(0).group());
    }

    @Test
    void invalidCodeOmitsTheComponentAndWarns()
    {
        SynopReport report = decoder.decode("AAXX 01004 88889 12752 61506");

        assertFalse(report.has(SynopField.VISIBILITY));
        assertTrue(report.has(SynopField.LOWEST_CLOUD_BASE));
        List<SynopWarningEvent> warnings = sink.getWarnings();
        assertEquals(1, warnings.size());
        assertEquals("12752", warnings.get(0).group());
        assertEquals(NOW, warnings.get(0).timestamp());
        assertNotNull(warnings.get(0).cause());
    }

    @Test
    void unavailableValuesArePresentButEmpty()
    {
        SynopReport report = decoder.decode("AAXX 20104 89646 46/// /2299 1////");

        Observation<?> visibility = report.get(SynopField.VISIBILITY).orElseThrow();
        assertFalse(visibility.available());
        assertEquals("//", visibility.raw());
        assertFalse(report.get(SynopField.CLOUD_COVER).orElseThrow().available());
        assertFalse(report.get(SynopField.AIR_TEMPERATURE).orElseThrow().available());
    }

    @Test
    void unrecognisedAndOutOfOrderGroupsAreNotImplemented()
    {
        SynopReport report = decoder.decode("AAXX 01004 88889 12782 61506 20047 10094 ABCDE 30111");

        assertEquals(List.of("10094", "ABCDE"), report.notImplemented());
        assertTrue(report.has(SynopField.STATION_PRESSURE));
        assertFalse(report.has(SynopField.AIR_TEMPERATURE));
        assertEquals(List.of("10094", "ABCDE"), sink.getReports().get(0).notImplemented());
    }

    @Test
    void sectionMarkerOutOfOrderIsNotImplemented()
    {
        SynopReport report = decoder.decode("AAXX 01004 88889 12782 61506 333 10178 22200");

        assertEquals(List.of("22200"), report.notImplemented());
        assertFalse(report.has(SynopField.DISPLACEMENT));
    }

    @Test
    void telegramEndingEarlyGivesPartialReport()
    {
        SynopReport report = decoder.decode("AAXX 01004");

        assertTrue(report.has(SynopField.STATION_TYPE));
        assertTrue(report.has(SynopField.OBS_TIME));
        assertTrue(report.has(SynopField.WIND_INDICATOR));
        assertFalse(report.has(SynopField.STATION_ID));
        assertFalse(sink.hasEventOfType(SynopErrorEvent.class));
    }

    @Test
    void unknownStationTypeIsFatal()
    {
        SynopDecodeException e = assertThrows(SynopDecodeException.class, () -> decoder.decode("ZZXX 01004 88889"));

        assertTrue(e.getMessage().contains("ZZXX"));
        List<SynopErrorEvent> errors = sink.getErrors();
        assertEquals(1, errors.size());
        assertSame(e, errors.get(0).cause());
        assertFalse(sink.hasEventOfType(SynopReportEvent.class));
    }

    @Test
    void malformedMandatoryGroupsAreFatal()
    {
        assertThrows(SynopDecodeException.class, () -> decoder.decode("AAXX 0100 88889"));
        assertThrows(SynopDecodeException.class, () -> decoder.decode("AAXX 32004 88889"));
        assertThrows(SynopDecodeException.class, () -> decoder.decode("AAXX 01002 88889"));
        assertThrows(SynopDecodeException.class, () -> decoder.decode("AAXX 01004 8888A"));
        assertThrows(SynopDecodeException.class, () -> decoder.decode("AAXX 01004 88889 1278"));
        assertThrows(SynopDecodeException.class, () -> decoder.decode("BBXX ZD-LP 19004"));
        assertThrows(SynopDecodeException.class, () -> decoder.decode("BBXX ZDLP 19004 98607"));
        assertEquals(7, sink.getErrors().size());
    }

    @Test
    void stationOutsideEveryRegionIsFatal()
    {
        assertThrows(SynopDecodeException.class, () -> decoder.decode("AAXX 01004 99999 12782"));
    }

    @Test
    void emptyTelegramIsFatal()
    {
        assertThrows(SynopDecodeException.class, () -> decoder.decode(""));
        assertThrows(SynopDecodeException.class, () -> decoder.decode("   "));
        assertThrows(SynopDecodeException.class, () -> decoder.decode(null));
    }

    @Test
    void decodedReportIsImmutable()
    {
        SynopReport report = decoder.decode("AAXX 01004 88889 12782 61506 10094");

        assertThrows(UnsupportedOperationException.class, () -> report.fields().clear());
        assertThrows(UnsupportedOperationException.class, () -> report.notImplemented().add("x"));
    }
}
