package com.questrail.synop.internal.table;

/**
 * A table whose codes are their own meaning within a legal range, such as
 * 4677 present weather. Decoding only validates the range.
 */
public final class SimpleCodeTable implements CodeTable<Integer>
{
    private final String id;
    private final int min;
    private final int max;

    public SimpleCodeTable(String id, int min, int max) {
        if (max < min) {
            throw new IllegalArgumentException("Empty range for table " + id);
        }
        this.id = id;
        this.min = min;
        this.max = max;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Integer decode(int code) throws InvalidCodeException {
        if (code < min || code > max) {
            throw InvalidCodeException.invalidCode(id, code);
        }
        return code;
    }

    @Override
    public int encode(Integer value) throws InvalidCodeException {
        if (value == null || value < min || value > max) {
            throw InvalidCodeException.unencodable(id, value);
        }
        return value;
    }

    public int min() {
        return min;
    }

    public int max() {
        return max;
    }
}
