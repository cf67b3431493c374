package com.questrail.synop.internal.decode;

/**
 * Indicates that a SYNOP telegram could not be decoded into a report.
 *
 * This typically reflects:
 * <ul>
 *   <li>An unknown station type (MMMM)</li>
 *   <li>A malformed mandatory group in Section 0 or Section 1</li>
 *   <li>A station index outside every WMO region</li>
 * </ul>
 *
 * Invalid codes in optional groups are not fatal; they are reported as
 * warnings and the affected component is left out of the report.
 */
public final class SynopDecodeException extends RuntimeException
{
    public SynopDecodeException(String message) {
        super(message);
    }

    public SynopDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
