package com.questrail.synop.internal.decode;

import com.questrail.synop.internal.field.Codes;

/**
 * NumberedSectionDecoder
 * -----------------------------------------------------------------------------
 * Drives the groups of a section whose groups are identified by a leading
 * header digit that must increase through the section.
 *
 * <h2>Sequencing</h2>
 * <ul>
 *   <li>A section marker ends the section before any header dispatch.</li>
 *   <li>Each header may appear at most once. Headers that repeat by nature
 *       (cloud layers, special phenomena) consume their own followers inside
 *       {@link #decodeGroup}.</li>
 *   <li>A group whose header is not above the previous one, or that is not a
 *       five-character group with a numeric header, is kept verbatim in the
 *       report's not-implemented list.</li>
 * </ul>
 */
abstract class NumberedSectionDecoder
{
    private final int firstHeader;
    private final int lastHeader;

    NumberedSectionDecoder(int firstHeader, int lastHeader) {
        this.firstHeader = firstHeader;
        this.lastHeader = lastHeader;
    }

    final void decodeGroups(GroupCursor cursor, DecodeContext ctx) {
        int candidate = firstHeader;
        while (cursor.hasNext()) {
            String group = cursor.peek();
            if (Sections.isMarker(group)) {
                return;
            }
            cursor.next();
            int header = Codes.digit(group, 0);
            if (group.length() != 5 || header < 0) {
                ctx.notImplemented(group, "Unrecognised group");
                continue;
            }
            if (header < candidate || header > lastHeader) {
                ctx.notImplemented(group, "Group with header " + header + " is out of sequence");
                continue;
            }
            decodeGroup(header, group, cursor, ctx);
            candidate = header + 1;
        }
    }

    protected abstract void decodeGroup(int header, String group, GroupCursor cursor, DecodeContext ctx);
}
