package com.questrail.synop.internal.field;

import com.questrail.synop.config.UnitConverter;
import com.questrail.synop.internal.table.InvalidCodeException;
import com.questrail.synop.model.Observation;

/**
 * FieldCodec
 * -----------------------------------------------------------------------------
 * Decodes and encodes one fixed-width component of a SYNOP group.
 *
 * <h2>Availability</h2>
 * <ul>
 *   <li>A raw code made only of {@code /} decodes to an unavailable
 *       observation without consulting any table.</li>
 *   <li>A {@code null} or unavailable observation encodes as {@code /}
 *       repeated {@link #width()} times.</li>
 * </ul>
 *
 * <p>Codecs are stateless. Anything that depends on earlier groups, such as
 * the wind speed unit, is passed in by the section decoder.</p>
 *
 * @param <T> the decoded value type
 */
public interface FieldCodec<T>
{
    int width();

    /**
     * Canonical unit of encoded values, or {@code null} for unitless fields.
     */
    String unit();

    Observation<T> decode(String raw) throws InvalidCodeException;

    String encode(Observation<T> observation, UnitConverter units) throws InvalidCodeException;
}
