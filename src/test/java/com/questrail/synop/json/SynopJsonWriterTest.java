package com.questrail.synop.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.synop.SynopCodec;
import com.questrail.synop.model.SynopReport;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class SynopJsonWriterTest
{
    private final SynopCodec codec = SynopCodec.create();
    private final SynopJsonWriter writer = new SynopJsonWriter();

    @Test
    void tableObservationCarriesItsProvenance()
    {
        ObjectNode tree = writer.toTree(codec.decode("AAXX 01004 88889 12782 61506"));

        JsonNode indicator = tree.get("wind_indicator");
        assertEquals(4, indicator.get("code").asInt());
        assertFalse(indicator.has("estimated"));
        assertEquals("KT", indicator.get("unit").asText());
        assertEquals("1855", indicator.get("_table").asText());
        assertEquals(4, indicator.get("_code").asInt());

        JsonNode wind = tree.get("surface_wind");
        assertEquals(150, wind.get("direction").get("degrees").asInt());
        assertEquals(6, wind.get("speed").get("value").asInt());
    }

    @Test
    void unavailableObservationIsNull()
    {
        ObjectNode tree = writer.toTree(codec.decode("AAXX 20104 89646 46/// /2299 1////"));

        assertTrue(tree.get("air_temperature").isNull());
        assertTrue(tree.get("visibility").isNull());
        assertFalse(tree.has("_not_implemented"));
    }

    @Test
    void repeatedFieldsBecomeArrays()
    {
        SynopReport report = codec.decode("AAXX 01004 88889 12782 61506 333 81541 85630");

        JsonNode layers = writer.toTree(report).get("cloud_layers");
        assertTrue(layers.isArray());
        assertEquals(2, layers.size());
        assertEquals("Ns", layers.get(0).get("genus").get("value").asText());
    }

    @Test
    void nilAndNotImplementedGroupsAreMarked()
    {
        ObjectNode tree = writer.toTree(codec.decode("AAXX 01004 88889 NIL 12782"));

        assertTrue(tree.get("nil").asBoolean());
        assertEquals("12782", tree.get("_not_implemented").get(0).asText());
    }

    @Test
    void indentedOutputSpansLines()
    {
        String json = new SynopJsonWriter(true).write(codec.decode("AAXX 01004 88889"));

        assertTrue(json.contains("\n"));
        assertTrue(json.contains("\"station_id\""));
    }

    @Test
    void componentNamesAreSnakeCase()
    {
        assertEquals("measure_period_minutes", SynopJsonWriter.snakeCase("measurePeriodMinutes"));
        assertEquals("value", SynopJsonWriter.snakeCase("value"));
    }
}
