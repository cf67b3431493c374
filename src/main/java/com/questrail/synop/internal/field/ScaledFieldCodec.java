package com.questrail.synop.internal.field;

import com.questrail.synop.config.UnitConverter;
import com.questrail.synop.internal.table.InvalidCodeException;
import com.questrail.synop.model.Observation;

/**
 * A non-negative decimal sent as an integer count of {@code 1/divisor} steps,
 * e.g. evaporation in tenths of a millimetre or wave height in half metres.
 * Only the magnitude is encoded; groups with a separate sign digit apply the
 * sign themselves.
 */
public final class ScaledFieldCodec extends AbstractFieldCodec<Double>
{
    private final double divisor;

    public ScaledFieldCodec(int width, String unit, double divisor) {
        super(width, unit);
        this.divisor = divisor;
    }

    @Override
    protected Observation<Double> decodeAvailable(String raw) throws InvalidCodeException {
        return Observation.of(raw, Codes.parse(raw, "number") / divisor, unit());
    }

    @Override
    protected String encodeAvailable(Observation<Double> observation, UnitConverter units)
            throws InvalidCodeException {
        long steps = Math.round(Math.abs(inCanonicalUnit(observation, units)) * divisor);
        if (steps > Integer.MAX_VALUE) {
            throw new InvalidCodeException(observation.value() + " is too large");
        }
        return Codes.pad((int) steps, width());
    }
}
