package com.questrail.synop.codec;

import com.questrail.synop.model.SynopReport;

/**
 * SynopDecoder
 * -----------------------------------------------------------------------------
 * Text-level decoder for one SYNOP telegram.
 *
 * <p>The input is a single report, not a bulletin: it starts with MMMM and
 * holds whitespace-separated groups. Any trailing {@code =} terminator must
 * already be removed.</p>
 *
 * <p>The decoder is responsible for:</p>
 * <ul>
 *   <li>Recognising sections and their groups</li>
 *   <li>Turning codes into typed observations</li>
 *   <li>Keeping unrecognised groups verbatim</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for bulletin splitting,
 * quality control or unit conversion of decoded values.</p>
 */
public interface SynopDecoder
{
    /**
     * Decode one telegram.
     *
     * <p>Invalid codes in optional groups are reported as warnings to the
     * configured sink and leave the affected component out of the report. A
     * telegram that ends early yields a partial report.</p>
     *
     * @param telegram the report text
     * @return the decoded report
     * @throws com.questrail.synop.internal.decode.SynopDecodeException if the
     *         telegram is blank or a mandatory group is malformed
     */
    SynopReport decode(String telegram);
}
