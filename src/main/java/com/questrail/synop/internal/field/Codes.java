package com.questrail.synop.internal.field;

import com.questrail.synop.internal.table.InvalidCodeException;

/**
 * Character-level helpers shared by the field codecs and section decoders.
 */
public final class Codes
{
    public static final char MISSING = '/';

    private Codes() {}

    /**
     * True when the raw code is non-empty and every character is {@code /}.
     */
    public static boolean isUnavailable(String raw) {
        if (raw == null || raw.isEmpty()) {
            return false;
        }
        for (int i = 0; i < raw.length(); i++) {
            if (raw.charAt(i) != MISSING) {
                return false;
            }
        }
        return true;
    }

    public static String missing(int width) {
        return String.valueOf(MISSING).repeat(width);
    }

    /**
     * Parses an all-digit code.
     *
     * @throws InvalidCodeException if any character is not a decimal digit
     */
    public static int parse(String raw, String what) throws InvalidCodeException {
        if (raw == null || raw.isEmpty() || !isDigits(raw)) {
            throw new InvalidCodeException("'" + raw + "' is not a valid " + what);
        }
        return Integer.parseInt(raw);
    }

    public static boolean isDigits(String raw) {
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return !raw.isEmpty();
    }

    /**
     * Zero-pads a non-negative code to exactly {@code width} characters.
     *
     * @throws InvalidCodeException if the code is negative or too wide
     */
    public static String pad(int code, int width) throws InvalidCodeException {
        String digits = Integer.toString(code);
        if (code < 0 || digits.length() > width) {
            throw new InvalidCodeException(code + " does not fit in " + width + " digits");
        }
        return "0".repeat(width - digits.length()) + digits;
    }

    /**
     * Digit at {@code index}, or -1 when the character is not a decimal digit.
     */
    public static int digit(String group, int index) {
        if (group == null || index >= group.length()) {
            return -1;
        }
        char c = group.charAt(index);
        return c >= '0' && c <= '9' ? c - '0' : -1;
    }
}
