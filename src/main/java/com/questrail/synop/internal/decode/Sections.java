package com.questrail.synop.internal.decode;

/**
 * Recognises the groups that open a section: {@code 222Dv}, {@code ICE},
 * {@code 333}, {@code 444} and {@code 555}.
 */
final class Sections
{
    static final String SECTION_3 = "333";
    static final String SECTION_4 = "444";
    static final String SECTION_5 = "555";
    static final String ICE = "ICE";
    static final String NIL = "NIL";

    private Sections() {}

    static boolean isSection2(String group) {
        return group.length() == 5 && group.startsWith("222");
    }

    static boolean isMarker(String group) {
        return isSection2(group)
            || SECTION_3.equals(group)
            || SECTION_4.equals(group)
            || SECTION_5.equals(group)
            || ICE.equals(group);
    }
}
