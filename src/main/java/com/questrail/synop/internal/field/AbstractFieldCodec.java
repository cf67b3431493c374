package com.questrail.synop.internal.field;

import com.questrail.synop.config.UnitConverter;
import com.questrail.synop.internal.table.InvalidCodeException;
import com.questrail.synop.model.Observation;

/**
 * Applies the width and availability rules common to every
 * {@link FieldCodec}. Subclasses only see available raw codes and available
 * observations. An unavailable observation encodes back to its raw code when
 * that code has the field's width.
 */
abstract class AbstractFieldCodec<T> implements FieldCodec<T>
{
    private final int width;
    private final String unit;

    AbstractFieldCodec(int width, String unit) {
        if (width < 1) {
            throw new IllegalArgumentException("width must be positive");
        }
        this.width = width;
        this.unit = unit;
    }

    @Override
    public final int width() {
        return width;
    }

    @Override
    public final String unit() {
        return unit;
    }

    @Override
    public final Observation<T> decode(String raw) throws InvalidCodeException {
        if (raw == null || raw.length() != width) {
            throw new InvalidCodeException("Expected " + width + " characters but got '" + raw + "'");
        }
        if (Codes.isUnavailable(raw)) {
            return Observation.unavailable(raw);
        }
        return decodeAvailable(raw);
    }

    @Override
    public final String encode(Observation<T> observation, UnitConverter units) throws InvalidCodeException {
        if (observation == null) {
            return Codes.missing(width);
        }
        if (!observation.available()) {
            String raw = observation.raw();
            return raw != null && raw.length() == width ? raw : Codes.missing(width);
        }
        String encoded = encodeAvailable(observation, units);
        if (encoded.length() != width) {
            throw new InvalidCodeException(
                    "Encoded '" + encoded + "' does not fit in " + width + " characters");
        }
        return encoded;
    }

    protected abstract Observation<T> decodeAvailable(String raw) throws InvalidCodeException;

    protected abstract String encodeAvailable(Observation<T> observation, UnitConverter units)
            throws InvalidCodeException;

    /**
     * Returns the observation's numeric value expressed in this codec's unit.
     */
    protected final double inCanonicalUnit(Observation<? extends Number> observation, UnitConverter units)
            throws InvalidCodeException {
        double value = observation.value().doubleValue();
        String from = observation.unit();
        if (from == null || unit == null || from.equals(unit)) {
            return value;
        }
        try {
            return units.convert(value, from, unit);
        } catch (IllegalArgumentException e) {
            throw new InvalidCodeException(e.getMessage(), e);
        }
    }
}
