package com.questrail.synop.internal.decode;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Forward-only cursor over the whitespace-separated groups of a telegram.
 */
final class GroupCursor
{
    private final List<String> groups;
    private int index;

    GroupCursor(List<String> groups) {
        this.groups = List.copyOf(Objects.requireNonNull(groups, "groups"));
    }

    boolean hasNext() {
        return index < groups.size();
    }

    /**
     * The next group without consuming it, or {@code null} at the end.
     */
    String peek() {
        return hasNext() ? groups.get(index) : null;
    }

    String next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more groups after position " + index);
        }
        return groups.get(index++);
    }

    int position() {
        return index;
    }
}
