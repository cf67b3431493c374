package com.questrail.synop.internal.encode;

/**
 * Indicates that a {@link com.questrail.synop.model.SynopReport} could not be
 * encoded into a telegram.
 *
 * This typically reflects:
 * <ul>
 *   <li>A missing required field (station type, observation time, wind
 *       indicator, station id or callsign)</li>
 *   <li>A value that no code of its table represents</li>
 *   <li>A unit that cannot be converted to the field's unit</li>
 * </ul>
 */
public final class SynopEncodeException extends RuntimeException
{
    public SynopEncodeException(String message) {
        super(message);
    }

    public SynopEncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
