package com.questrail.synop.internal.table;

/**
 * Indicates that a raw code, or a value offered for encoding, has no
 * meaning in the code table or field it was applied to.
 *
 * This typically reflects:
 * <ul>
 *   <li>A code outside the table's legal range</li>
 *   <li>A reserved or unused code (e.g. 51..55 in table 4377)</li>
 *   <li>A non-numeric character where a digit is required</li>
 *   <li>A value with no code that represents it</li>
 * </ul>
 *
 * The exception is checked: section decoders must either recover from it by
 * omitting the affected component, or translate it into a report-level error.
 */
public final class InvalidCodeException extends Exception
{
    public InvalidCodeException(String message) {
        super(message);
    }

    public InvalidCodeException(String message, Throwable cause) {
        super(message, cause);
    }

    public static InvalidCodeException invalidCode(String table, Object code) {
        return new InvalidCodeException(code + " is not a valid code for code table " + table);
    }

    public static InvalidCodeException unencodable(String table, Object value) {
        return new InvalidCodeException("Cannot encode " + value + " with code table " + table);
    }
}
