package de.mirkosertic.doctree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A slash separated, human readable path into the item tree, such as {@code /Books/Alice}.
 * <p>
 * The leading slash is optional, empty segments are dropped. The empty path denotes the root.
 */
public final class ItemPath {

    public static final ItemPath ROOT = new ItemPath(List.of());

    private final List<String> segments;

    private ItemPath(final List<String> segments) {
        this.segments = segments;
    }

    public static ItemPath parse(final String path) {
        if (path == null || path.isEmpty()) {
            return ROOT;
        }
        final List<String> segments = new ArrayList<>();
        for (final String segment : path.split("/")) {
            if (!segment.isEmpty()) {
                segments.add(segment);
            }
        }
        return segments.isEmpty() ? ROOT : new ItemPath(Collections.unmodifiableList(segments));
    }

    public static ItemPath of(final List<String> segments) {
        return segments.isEmpty() ? ROOT : new ItemPath(List.copyOf(segments));
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    /**
     * The last segment, or the empty string for the root.
     */
    public String name() {
        return segments.isEmpty() ? "" : segments.get(segments.size() - 1);
    }

    /**
     * The path without its last segment. The root has no parent and returns itself.
     */
    public ItemPath parent() {
        if (segments.size() <= 1) {
            return ROOT;
        }
        return new ItemPath(segments.subList(0, segments.size() - 1));
    }

    /**
     * Whether this path has a segment above its last one, i.e. whether it is not a top-level path.
     */
    public boolean hasParentSegment() {
        return segments.size() > 1;
    }

    /**
     * Whether this path consists of exactly one segment equal to {@code name}.
     */
    public boolean isSingleSegment(final String name) {
        return segments.size() == 1 && segments.get(0).equals(name);
    }

    public List<String> segments() {
        return segments;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ItemPath other && segments.equals(other.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return "/" + String.join("/", segments);
    }
}
