package com.questrail.synop.internal.field;

import com.questrail.synop.config.UnitConverter;
import com.questrail.synop.internal.table.InvalidCodeException;
import com.questrail.synop.model.Observation;

/**
 * SignedTemperatureCodec
 * -----------------------------------------------------------------------------
 * The {@code sTTT} temperature: a sign digit (0 positive, 1 negative) followed
 * by the temperature in tenths of a degree Celsius.
 *
 * <ul>
 *   <li>A missing sign makes the whole temperature unavailable.</li>
 *   <li>A valid sign with no digits ({@code 0///}) is unavailable too; the
 *       raw code is kept so the group encodes back unchanged.</li>
 *   <li>A missing tenths digit is read as 0, so {@code 012/} decodes as 1.2.</li>
 *   <li>Negative zero survives a round trip: {@code 1000} decodes as -0.0 and
 *       encodes back to {@code 1000}.</li>
 * </ul>
 */
public final class SignedTemperatureCodec extends AbstractFieldCodec<Double>
{
    public static final String CELSIUS = "Cel";

    public static final SignedTemperatureCodec INSTANCE = new SignedTemperatureCodec();

    private SignedTemperatureCodec() {
        super(4, CELSIUS);
    }

    @Override
    protected Observation<Double> decodeAvailable(String raw) throws InvalidCodeException {
        char sign = raw.charAt(0);
        if (sign == Codes.MISSING) {
            return Observation.unavailable(raw);
        }
        if (sign != '0' && sign != '1') {
            throw new InvalidCodeException("'" + sign + "' is not a valid temperature sign");
        }
        String digits = raw.substring(1);
        if (Codes.isUnavailable(digits)) {
            return Observation.unavailable(raw);
        }
        if (digits.charAt(2) == Codes.MISSING) {
            digits = digits.substring(0, 2) + "0";
        }
        double magnitude = Codes.parse(digits, "temperature") / 10.0;
        return Observation.of(raw, sign == '1' ? -magnitude : magnitude, CELSIUS);
    }

    @Override
    protected String encodeAvailable(Observation<Double> observation, UnitConverter units)
            throws InvalidCodeException {
        double celsius = inCanonicalUnit(observation, units);
        boolean negative = Math.copySign(1.0, celsius) < 0;
        return (negative ? "1" : "0") + Codes.pad((int) Math.round(Math.abs(celsius) * 10), 3);
    }
}
