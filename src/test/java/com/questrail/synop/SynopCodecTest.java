package com.questrail.synop;

import com.questrail.synop.config.SynopCodecConfig;
import com.questrail.synop.model.Region;
import com.questrail.synop.model.SynopField;
import com.questrail.synop.model.SynopReport;
import com.questrail.synop.model.WindWaves;
import com.questrail.synop.observability.Slf4jSynopObservabilitySink;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SynopCodecTest
 * -----------------------------------------------------------------------------
 * End-to-end tests through the {@link SynopCodec} facade.
 *
 * <p>Telegrams that carry no lossy codes must come back unchanged after a
 * decode and encode.</p>
 */
final class SynopCodecTest
{
    private static final List<String> REFERENCE_TELEGRAMS = List.of(
            "AAXX 01004 88889 12782 61506 10094 20047 30111 40197 53007 60001 70102 81541 "
                    + "333 10178 21073 34101",
            "OOXX AAATN 18214 99759 50874 56057 12501 46/// /1219 11259 38338 49778 5//// 92100",
            "AAXX 20104 89646 46/// /2299 00113 29079 37708 42010 333 01268",
            "AAXX 20064 67005 12570 50402 60004 333 02434",
            "BBXX ZDLP 19004 99607 50455 41298 81307 10001 21004 49894 52012 70211 886// "
                    + "22200 04019 20000 300// 40000 5//// 81001 ICE icy conditions",
            "BBXX ZDLP 19004 99607 50455 NIL",
            "AAXX 01004 88889 12782 61506 10/// 20/// 3//// 333 1//// 2////",
            "AAXX 01004 88889 12782 61506 333 90710 91120 90706 91115 91527");

    private static final String BUOY =
            "BBXX 51002 19001 99170 71577 46/// /0709 10267 20232 30132 40135 92350 "
                    + "22251 00268 10804 20604 310// 40802 61234 70021 80092 "
                    + "333 91212 555 11102 22108 8//10 92344";

    private final SynopCodec codec = SynopCodec.create();

    @Test
    void referenceTelegramsSurviveARoundTrip()
    {
        for (String telegram : REFERENCE_TELEGRAMS) {
            assertEquals(telegram, codec.encode(codec.decode(telegram)), telegram);
        }
    }

    @Test
    void reEncodedReportDecodesToTheSameReport()
    {
        SynopReport report = codec.decode(REFERENCE_TELEGRAMS.get(0));

        assertEquals(report, codec.decode(codec.encode(report)));
    }

    @Test
    void buoyReportDecodesEverySection()
    {
        SynopReport report = codec.decode(BUOY);

        assertEquals(Region.V, report.get(SynopField.REGION).orElseThrow().value());
        assertEquals(26.8, report.get(SynopField.SEA_SURFACE_TEMPERATURE).orElseThrow().temperature().value(), 1e-9);
        assertEquals(9.2, report.get(SynopField.WET_BULB_TEMPERATURE).orElseThrow().temperature().value(), 1e-9);
        assertEquals(23, report.get(SynopField.EXACT_OBS_TIME).orElseThrow().hour().value());
        assertEquals(50, report.get(SynopField.EXACT_OBS_TIME).orElseThrow().minute().value());

        List<WindWaves> waves = report.get(SynopField.WIND_WAVES).orElseThrow();
        assertEquals(3, waves.size());
        assertEquals(2.1, waves.get(2).height().value(), 1e-9);

        assertEquals(List.of("91212"), report.notImplemented());
        assertEquals(List.of("11102", "22108", "8//10", "92344"), report.get(SynopField.SECTION_5).orElseThrow());
    }

    @Test
    void jsonRendering()
    {
        String json = codec.toJson(codec.decode("AAXX 01004 88889 12782 61506 10094 ABCDE"));

        assertTrue(json.startsWith("{\"station_type\":"));
        assertTrue(json.contains("\"air_temperature\":{\"value\":9.4,\"unit\":\"Cel\"}"));
        assertTrue(json.endsWith("\"_not_implemented\":[\"ABCDE\"]}"));
    }

    @Test
    void sharedCodecIsSafeAcrossThreads() throws Exception
    {
        SynopCodec shared = SynopCodec.create(SynopCodecConfig.builder()
                .withObservabilitySink(new Slf4jSynopObservabilitySink())
                .build());

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<String>> tasks = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String telegram = REFERENCE_TELEGRAMS.get(i % REFERENCE_TELEGRAMS.size());
                tasks.add(() -> shared.encode(shared.decode(telegram)));
            }
            List<Future<String>> results = executor.invokeAll(tasks);
            for (int i = 0; i < results.size(); i++) {
                assertEquals(REFERENCE_TELEGRAMS.get(i % REFERENCE_TELEGRAMS.size()), results.get(i).get());
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
