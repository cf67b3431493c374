package com.questrail.synop.internal.field;

import com.questrail.synop.config.UnitConverter;
import com.questrail.synop.internal.table.InvalidCodeException;
import com.questrail.synop.model.Observation;

/**
 * A plain non-negative integer with an optional unit and a legal range.
 */
public final class IntegerFieldCodec extends AbstractFieldCodec<Integer>
{
    private final int min;
    private final int max;

    public IntegerFieldCodec(int width, String unit, int min, int max) {
        super(width, unit);
        this.min = min;
        this.max = max;
    }

    public IntegerFieldCodec(int width, String unit) {
        this(width, unit, 0, (int) Math.pow(10, width) - 1);
    }

    public IntegerFieldCodec(int width) {
        this(width, null);
    }

    @Override
    protected Observation<Integer> decodeAvailable(String raw) throws InvalidCodeException {
        int value = Codes.parse(raw, "number");
        if (value < min || value > max) {
            throw new InvalidCodeException(value + " is outside the range " + min + ".." + max);
        }
        return Observation.of(raw, value, unit());
    }

    @Override
    protected String encodeAvailable(Observation<Integer> observation, UnitConverter units)
            throws InvalidCodeException {
        int value = (int) Math.round(inCanonicalUnit(observation, units));
        if (value < min || value > max) {
            throw new InvalidCodeException(value + " is outside the range " + min + ".." + max);
        }
        return Codes.pad(value, width());
    }
}
