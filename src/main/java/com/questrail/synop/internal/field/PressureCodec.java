package com.questrail.synop.internal.field;

import com.questrail.synop.config.UnitConverter;
import com.questrail.synop.internal.table.InvalidCodeException;
import com.questrail.synop.model.Observation;

/**
 * The {@code PPPP} pressure in tenths of a hectopascal with the thousands digit
 * omitted: {@code 0111} is 1011.1 hPa and {@code 9778} is 977.8 hPa.
 */
public final class PressureCodec extends AbstractFieldCodec<Double>
{
    public static final String HECTOPASCAL = "hPa";

    public static final PressureCodec INSTANCE = new PressureCodec();

    private PressureCodec() {
        super(4, HECTOPASCAL);
    }

    @Override
    protected Observation<Double> decodeAvailable(String raw) throws InvalidCodeException {
        int tenths = Codes.parse(raw, "pressure");
        if (tenths <= 5000) {
            tenths += 10000;
        }
        return Observation.of(raw, tenths / 10.0, HECTOPASCAL);
    }

    @Override
    protected String encodeAvailable(Observation<Double> observation, UnitConverter units)
            throws InvalidCodeException {
        int tenths = (int) Math.round(inCanonicalUnit(observation, units) * 10);
        if (tenths >= 10000) {
            tenths -= 10000;
        }
        return Codes.pad(tenths, 4);
    }
}
