package com.questrail.synop.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class StandardUnitConverterTest
{
    private final UnitConverter units = StandardUnitConverter.INSTANCE;

    @Test
    void sameUnitIsReturnedUnchanged()
    {
        assertEquals(12.5, units.convert(12.5, "m", "m"), 0.0);
        assertEquals(12.5, units.convert(12.5, "unknown", "unknown"), 0.0);
    }

    @Test
    void temperatureGoesThroughKelvin()
    {
        assertEquals(0.0, units.convert(32, "degF", "Cel"), 1e-9);
        assertEquals(273.15, units.convert(0, "Cel", "K"), 1e-9);
        assertEquals(212.0, units.convert(373.15, "K", "degF"), 1e-9);
    }

    @Test
    void speedLengthAndPressureUsePrefixFactors()
    {
        assertEquals(1.0, units.convert(0.514444, "m/s", "KT"), 1e-9);
        assertEquals(36.0, units.convert(10, "m/s", "km/h"), 1e-9);
        assertEquals(150.0, units.convert(1.5, "m", "cm"), 1e-9);
        assertEquals(304.8, units.convert(1000, "ft", "m"), 1e-9);
        assertEquals(1013.2, units.convert(101.32, "kPa", "hPa"), 1e-9);
        assertEquals(2.0, units.convert(120, "min", "h"), 1e-9);
    }

    @Test
    void differentDimensionsAreRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> units.convert(1, "m", "hPa"));
        assertThrows(IllegalArgumentException.class, () -> units.convert(1, "Cel", "m"));
        assertThrows(IllegalArgumentException.class, () -> units.convert(1, "furlong", "m"));
    }
}
