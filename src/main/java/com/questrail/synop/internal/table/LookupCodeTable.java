package com.questrail.synop.internal.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A table backed by a positional list: the code is the index and a
 * {@code null} entry marks a reserved code.
 *
 * @param <T> the decoded value type
 */
public final class LookupCodeTable<T> implements CodeTable<T>
{
    private final String id;
    private final List<T> values;

    @SafeVarargs
    public LookupCodeTable(String id, T... values) {
        this.id = id;
        List<T> list = new ArrayList<>(values.length);
        Collections.addAll(list, values);
        this.values = Collections.unmodifiableList(list);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public T decode(int code) throws InvalidCodeException {
        if (code < 0 || code >= values.size() || values.get(code) == null) {
            throw InvalidCodeException.invalidCode(id, code);
        }
        return values.get(code);
    }

    @Override
    public int encode(T value) throws InvalidCodeException {
        int code = value == null ? -1 : values.indexOf(value);
        if (code < 0) {
            throw InvalidCodeException.unencodable(id, value);
        }
        return code;
    }

    /**
     * Number of codes covered by this table, reserved ones included.
     */
    public int size() {
        return values.size();
    }
}
