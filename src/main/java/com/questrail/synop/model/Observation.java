package com.questrail.synop.model;

/**
 * Observation
 * -----------------------------------------------------------------------------
 * The universal representation of one decoded field of a SYNOP report.
 *
 * <p>An observation records the raw code it was decoded from, whether that code
 * carried data, the decoded value and its unit. When the value came out of a
 * WMO code table the table identifier and the integer code are kept as
 * provenance so the field can be re-encoded exactly.</p>
 *
 * <h2>Availability</h2>
 * <ul>
 *   <li>{@code available} is false when the raw code carries no value: every
 *       character is the unavailability marker {@code /}, or only a sign
 *       precedes the markers as in {@code 0///}.</li>
 *   <li>A value is present if and only if the observation is available.</li>
 *   <li>An observation built by a caller for encoding may have a {@code null}
 *       raw code.</li>
 * </ul>
 *
 * @param raw       the raw code, or {@code null} when not decoded from a telegram
 * @param available whether the raw code carried data
 * @param value     the decoded value; non-null exactly when available
 * @param unit      unit tag such as {@code hPa}, {@code Cel} or {@code KT}
 * @param table     identifier of the code table that produced the value
 * @param code      the integer code consumed from {@code table}
 */
public record Observation<T>(
    String raw,
    boolean available,
    T value,
    String unit,
    String table,
    Integer code
) {
    public Observation {
        if (available && value == null) {
            throw new IllegalArgumentException("An available observation requires a value");
        }
        if (!available && value != null) {
            throw new IllegalArgumentException("An unavailable observation must not carry a value");
        }
    }

    public static <T> Observation<T> unavailable(String raw) {
        return new Observation<>(raw, false, null, null, null, null);
    }

    public static <T> Observation<T> of(String raw, T value, String unit) {
        return new Observation<>(raw, true, value, unit, null, null);
    }

    /**
     * Creates an observation intended for encoding, with no raw code.
     */
    public static <T> Observation<T> of(T value, String unit) {
        return new Observation<>(null, true, value, unit, null, null);
    }

    public static <T> Observation<T> of(T value) {
        return new Observation<>(null, true, value, null, null, null);
    }

    public static <T> Observation<T> coded(String raw, T value, String unit, String table, int code) {
        return new Observation<>(raw, true, value, unit, table, code);
    }

    public Observation<T> withUnit(String unit) {
        return new Observation<>(raw, available, value, unit, table, code);
    }

    public Observation<T> withValue(T value) {
        return new Observation<>(raw, value != null, value, unit, table, code);
    }

    public boolean hasProvenance() {
        return table != null && code != null;
    }
}
