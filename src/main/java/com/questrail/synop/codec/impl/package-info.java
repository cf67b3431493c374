/**
 * Default SYNOP codec implementations.
 *
 * <pre>
 *   String telegram
 *        → split on whitespace
 *        → ReportDecoder (Section 0, 1, 222, ICE, 333, 444, 555)
 *        → SynopReport
 *        → ReportEncoder
 *        → String telegram
 * </pre>
 *
 * <p>Both implementations report every completed call and every failure to
 * the configured {@link com.questrail.synop.observability.SynopObservabilitySink}.</p>
 */
package com.questrail.synop.codec.impl;
