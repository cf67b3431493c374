package com.questrail.synop.internal.field;

import com.questrail.synop.config.StandardUnitConverter;
import com.questrail.synop.config.UnitConverter;
import com.questrail.synop.internal.table.InvalidCodeException;
import com.questrail.synop.model.Amount;
import com.questrail.synop.model.Observation;
import com.questrail.synop.model.Visibility;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FieldCodecTest
 * -----------------------------------------------------------------------------
 * Unit tests for the component codecs in {@link Fields}.
 */
final class FieldCodecTest
{
    private static final UnitConverter UNITS = StandardUnitConverter.INSTANCE;

    @Test
    void slashesDecodeAsUnavailableWithoutTableLookup() throws Exception
    {
        Observation<Visibility> visibility = Fields.VISIBILITY.decode("//");
        assertFalse(visibility.available());
        assertNull(visibility.value());
        assertEquals("//", visibility.raw());
        assertNull(visibility.table());
    }

    @Test
    void unavailableAndMissingObservationsEncodeAsSlashes() throws Exception
    {
        assertEquals("////", Fields.TEMPERATURE.encode(null, UNITS));
        assertEquals("////", Fields.TEMPERATURE.encode(Observation.unavailable("////"), UNITS));
        assertEquals("///", Fields.PRECIPITATION_AMOUNT.encode(null, UNITS));
    }

    @Test
    void signWithoutDigitsIsUnavailableAndKeepsItsRawCode() throws Exception
    {
        Observation<Double> temperature = Fields.TEMPERATURE.decode("0///");

        assertFalse(temperature.available());
        assertNull(temperature.value());
        assertEquals("0///", Fields.TEMPERATURE.encode(temperature, UNITS));
        assertEquals("1///", Fields.TEMPERATURE.encode(Fields.TEMPERATURE.decode("1///"), UNITS));
    }

    @Test
    void wrongWidthIsInvalid()
    {
        assertThrows(InvalidCodeException.class, () -> Fields.TEMPERATURE.decode("012"));
        assertThrows(InvalidCodeException.class, () -> Fields.VISIBILITY.decode("1"));
    }

    @Test
    void signedTemperature() throws Exception
    {
        assertEquals(9.4, Fields.TEMPERATURE.decode("0094").value(), 1e-9);
        assertEquals(-7.3, Fields.TEMPERATURE.decode("1073").value(), 1e-9);
        assertEquals("Cel", Fields.TEMPERATURE.decode("0094").unit());
        assertFalse(Fields.TEMPERATURE.decode("/094").available());
        assertThrows(InvalidCodeException.class, () -> Fields.TEMPERATURE.decode("2094"));
    }

    @Test
    void missingTenthsDigitReadsAsZero() throws Exception
    {
        Observation<Double> temperature = Fields.TEMPERATURE.decode("012/");
        assertEquals(1.2, temperature.value(), 1e-9);
        assertEquals("0120", Fields.TEMPERATURE.encode(temperature, UNITS));
    }

    @Test
    void negativeZeroTemperatureKeepsItsSign() throws Exception
    {
        Observation<Double> temperature = Fields.TEMPERATURE.decode("1000");
        assertEquals("1000", Fields.TEMPERATURE.encode(temperature, UNITS));
        assertEquals("0000", Fields.TEMPERATURE.encode(Observation.of(0.0, "Cel"), UNITS));
    }

    @Test
    void temperatureIsConvertedToCelsiusBeforeEncoding() throws Exception
    {
        assertEquals("0100", Fields.TEMPERATURE.encode(Observation.of(50.0, "degF"), UNITS));
        assertEquals("1050", Fields.TEMPERATURE.encode(Observation.of(268.15, "K"), UNITS));
    }

    @Test
    void incompatibleUnitIsInvalid()
    {
        assertThrows(InvalidCodeException.class,
                () -> Fields.TEMPERATURE.encode(Observation.of(10.0, "hPa"), UNITS));
    }

    @Test
    void pressureOmitsTheThousandsDigit() throws Exception
    {
        assertEquals(1011.1, Fields.PRESSURE.decode("0111").value(), 1e-9);
        assertEquals(977.8, Fields.PRESSURE.decode("9778").value(), 1e-9);
        assertEquals("0111", Fields.PRESSURE.encode(Observation.of(1011.1, "hPa"), UNITS));
        assertEquals("9778", Fields.PRESSURE.encode(Observation.of(977.8, "hPa"), UNITS));
        assertEquals("0132", Fields.PRESSURE.encode(Observation.of(101320.0, "Pa"), UNITS));
    }

    @Test
    void tableFieldsKeepTheirCode() throws Exception
    {
        Observation<Visibility> visibility = Fields.VISIBILITY.decode("82");
        assertEquals(40000, visibility.value().metres(), 1e-9);
        assertEquals("4377", visibility.table());
        assertEquals(82, visibility.code());
        assertEquals("m", visibility.unit());
    }

    @Test
    void decodeOnlyFieldReEncodesFromItsCode() throws Exception
    {
        Observation<Amount> diameter = Fields.DEPOSIT_DIAMETER.decode("97");
        assertEquals("97", Fields.DEPOSIT_DIAMETER.encode(diameter, UNITS));
        assertThrows(InvalidCodeException.class,
                () -> Fields.DEPOSIT_DIAMETER.encode(Observation.of(Amount.of(5), "mm"), UNITS));
    }

    @Test
    void integerFieldEnforcesItsRange() throws Exception
    {
        assertEquals(79, Fields.RELATIVE_HUMIDITY.decode("079").value());
        assertThrows(InvalidCodeException.class, () -> Fields.RELATIVE_HUMIDITY.decode("101"));
        assertThrows(InvalidCodeException.class,
                () -> Fields.RELATIVE_HUMIDITY.encode(Observation.of(120, "%"), UNITS));
        assertThrows(InvalidCodeException.class, () -> Fields.EXACT_MINUTE.decode("6A"));
    }

    @Test
    void speedIsConvertedToTheAnnouncedUnit() throws Exception
    {
        FieldCodec<Integer> knots = Fields.speed("KT");
        assertEquals("10", knots.encode(Observation.of(5, "m/s"), UNITS));
        assertEquals("KT", knots.decode("12").unit());
    }

    @Test
    void scaledFieldWritesTheMagnitude() throws Exception
    {
        assertEquals(2.0, Fields.WAVE_HEIGHT.decode("04").value(), 1e-9);
        assertEquals("007", Fields.PRESSURE_CHANGE.encode(Observation.of(-0.7, "hPa"), UNITS));
        assertEquals("04", Fields.WAVE_HEIGHT.encode(Observation.of(2.0, "m"), UNITS));
    }
}
