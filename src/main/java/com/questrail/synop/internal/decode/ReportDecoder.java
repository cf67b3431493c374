package com.questrail.synop.internal.decode;

import com.questrail.synop.model.SynopField;
import com.questrail.synop.model.SynopReport;
import com.questrail.synop.observability.SynopObservabilitySink;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ReportDecoder
 * =============================================================================
 * Walks the groups of one telegram section by section and assembles the
 * {@link SynopReport}.
 *
 * <h2>Section order</h2>
 * <ul>
 *   <li>Section 0 and, unless the report is {@code NIL}, Section 1 are
 *       positional.</li>
 *   <li>The optional sections follow in increasing order: 222Dv, ICE, 333,
 *       444 and 555. A marker that arrives out of order is kept as not
 *       implemented.</li>
 *   <li>Sections 4 and 5 are national or regional; their groups are stored
 *       verbatim.</li>
 * </ul>
 *
 * <p>A telegram that ends early yields the report decoded so far. Instances
 * hold no per-telegram state and may be shared between threads.</p>
 */
public final class ReportDecoder
{
    private final SynopObservabilitySink sink;
    private final Clock clock;

    public ReportDecoder(SynopObservabilitySink sink, Clock clock) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @throws SynopDecodeException if a mandatory group is malformed
     */
    public SynopReport decode(List<String> groups) {
        if (groups.isEmpty()) {
            throw new SynopDecodeException("Empty telegram");
        }
        GroupCursor cursor = new GroupCursor(groups);
        DecodeContext ctx = new DecodeContext(sink, clock);

        new Section0Decoder().decode(cursor, ctx);
        if (!cursor.hasNext()) {
            return ctx.report().build();
        }
        if (Sections.NIL.equals(cursor.peek())) {
            cursor.next();
            ctx.report().nil(true);
            while (cursor.hasNext()) {
                ctx.notImplemented(cursor.next(), "Group after NIL");
            }
            return ctx.report().build();
        }

        new Section1Decoder().decode(cursor, ctx);
        decodeOptionalSections(cursor, ctx);
        return ctx.report().build();
    }

    private static void decodeOptionalSections(GroupCursor cursor, DecodeContext ctx) {
        Section2Decoder section2 = new Section2Decoder();
        int section = 1;
        boolean ice = false;
        while (cursor.hasNext()) {
            String group = cursor.next();
            if (Sections.isSection2(group) && section < 2) {
                section = 2;
                section2.decode(group, cursor, ctx);
            } else if (Sections.ICE.equals(group) && section <= 2 && !ice) {
                section = 2;
                ice = true;
                section2.decodeIce(cursor, ctx);
            } else if (Sections.SECTION_3.equals(group) && section < 3) {
                section = 3;
                new Section3Decoder().decode(cursor, ctx);
            } else if (Sections.SECTION_4.equals(group) && section < 4) {
                section = 4;
                List<String> verbatim = new ArrayList<>();
                while (cursor.hasNext() && !Sections.SECTION_5.equals(cursor.peek())) {
                    verbatim.add(cursor.next());
                }
                ctx.report().put(SynopField.SECTION_4, verbatim);
            } else if (Sections.SECTION_5.equals(group) && section < 5) {
                section = 5;
                List<String> verbatim = new ArrayList<>();
                while (cursor.hasNext()) {
                    verbatim.add(cursor.next());
                }
                ctx.report().put(SynopField.SECTION_5, verbatim);
            } else {
                ctx.notImplemented(group, "Unexpected group");
            }
        }
    }
}
