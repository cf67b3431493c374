package com.questrail.synop.internal.table;

/**
 * CodeTable
 * -----------------------------------------------------------------------------
 * A WMO code table: a pure mapping between a short numeric code and its
 * meaning.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Implementations are stateless and safe to share between threads.</li>
 *   <li>{@link #decode(int)} throws {@link InvalidCodeException} for a reserved
 *       or out-of-range code.</li>
 *   <li>For every invertible table, {@code encode(decode(c)) == c} for every
 *       legal code {@code c}.</li>
 *   <li>A decode-only table reports {@code false} from {@link #isEncodable()}
 *       and throws {@link UnsupportedOperationException} from
 *       {@link #encode(Object)}. Callers re-encode such values from the code
 *       kept on the decoded observation.</li>
 * </ul>
 *
 * @param <T> the decoded value type
 */
public interface CodeTable<T>
{
    /**
     * WMO identifier of this table, e.g. {@code "4377"}.
     */
    String id();

    T decode(int code) throws InvalidCodeException;

    int encode(T value) throws InvalidCodeException;

    default boolean isEncodable() {
        return true;
    }
}
