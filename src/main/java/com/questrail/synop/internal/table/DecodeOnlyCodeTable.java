package com.questrail.synop.internal.table;

import java.util.Objects;

/**
 * A table that can only be read. Several WMO tables fold distinct codes onto
 * the same meaning (0833 maps d and d+4 to one duration), so the code cannot
 * be recovered from the value. Encoding such a field relies on the code kept
 * on the decoded observation.
 *
 * @param <T> the decoded value type
 */
public final class DecodeOnlyCodeTable<T> implements CodeTable<T>
{
    @FunctionalInterface
    public interface Decoder<T> {
        T decode(int code) throws InvalidCodeException;
    }

    private final String id;
    private final Decoder<T> decoder;

    public DecodeOnlyCodeTable(String id, Decoder<T> decoder) {
        this.id = id;
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public T decode(int code) throws InvalidCodeException {
        return decoder.decode(code);
    }

    @Override
    public int encode(T value) {
        throw new UnsupportedOperationException("Code table " + id + " is decode-only");
    }

    @Override
    public boolean isEncodable() {
        return false;
    }
}
