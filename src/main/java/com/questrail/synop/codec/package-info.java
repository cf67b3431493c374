/**
 * SYNOP Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec boundary</strong> between SYNOP
 * telegram text (WMO FM-12 SYNOP, FM-13 SHIP and FM-14 SYNOP MOBIL) and the
 * typed {@link com.questrail.synop.model.SynopReport}.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   String telegram
 *        → SynopDecoder      (groups split, sections recognised)
 *            → SynopReport   (typed observations with code provenance)
 *                → SynopEncoder
 *                    → String telegram
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>Group-level rules live in {@code internal.decode} and
 *       {@code internal.encode}; code tables in {@code internal.table}.</li>
 *   <li>Decoding and encoding are pure functions of their input and the
 *       codec configuration; codec instances may be shared between
 *       threads.</li>
 * </ul>
 */
package com.questrail.synop.codec;
