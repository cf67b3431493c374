package com.questrail.synop.codec;

import com.questrail.synop.model.SynopReport;

/**
 * SynopEncoder
 * -----------------------------------------------------------------------------
 * Text-level encoder producing one SYNOP telegram from a report.
 *
 * <p>For a report decoded from telegram T with no not-implemented groups,
 * {@code encode(report)} returns T with groups separated by single spaces.</p>
 */
public interface SynopEncoder
{
    /**
     * @throws com.questrail.synop.internal.encode.SynopEncodeException if a
     *         required field is missing or a value has no code
     */
    String encode(SynopReport report);
}
