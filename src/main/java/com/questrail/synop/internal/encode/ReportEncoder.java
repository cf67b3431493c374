package com.questrail.synop.internal.encode;

import com.questrail.synop.config.SynopCodecConfig;
import com.questrail.synop.model.SynopField;
import com.questrail.synop.model.SynopReport;

import java.util.List;
import java.util.Objects;

/**
 * ReportEncoder
 * =============================================================================
 * Turns a {@link SynopReport} back into a telegram, section by section, in
 * the fixed order of {@link SynopField#values()}.
 *
 * <h2>Outline</h2>
 * <ul>
 *   <li>Section 0 is always written. A {@code NIL} report ends right after
 *       it.</li>
 *   <li>iihVV and Nddff are always written; every other group only when the
 *       report has a value for it.</li>
 *   <li>Sections 4 and 5 are written back verbatim.</li>
 * </ul>
 *
 * <p>Instances hold no per-report state and may be shared between threads.</p>
 */
public final class ReportEncoder
{
    private final SynopCodecConfig config;

    public ReportEncoder(SynopCodecConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * @throws SynopEncodeException if a required field is missing or a value
     *         cannot be coded
     */
    public String encode(SynopReport report) {
        EncodeContext ctx = new EncodeContext(report, config);
        new Section0Encoder().encode(ctx);
        if (report.isNil()) {
            ctx.emit("NIL");
            return String.join(" ", ctx.groups());
        }
        new Section1Encoder().encode(ctx);
        new Section2Encoder().encode(ctx);
        new Section3Encoder().encode(ctx);
        report.get(SynopField.SECTION_4).ifPresent(groups -> emitVerbatim("444", groups, ctx));
        report.get(SynopField.SECTION_5).ifPresent(groups -> emitVerbatim("555", groups, ctx));
        return String.join(" ", ctx.groups());
    }

    private static void emitVerbatim(String marker, List<String> groups, EncodeContext ctx) {
        ctx.emit(marker);
        groups.forEach(ctx::emit);
    }
}
