package com.transform.graphselect;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Package-first hierarchical name of a resource, e.g. {@code [X, staging, orders]}.
 */
public final class NamespacePath {
    private final List<String> segments;

    private NamespacePath(List<String> segments) {
        this.segments = segments;
    }

    /**
     * Creates a path from its segments.
     *
     * @param segments package name, optional hierarchical segments, simple name
     * @throws IllegalArgumentException if fewer than two segments are given or a segment is empty
     */
    public static NamespacePath of(List<String> segments) {
        if (segments == null || segments.size() < 2) {
            throw new IllegalArgumentException("Namespace path needs a package and a name, got " + segments);
        }
        List<String> copy = new ArrayList<>(segments.size());
        for (String segment : segments) {
            if (segment == null || segment.isEmpty()) {
                throw new IllegalArgumentException("Namespace path contains an empty segment: " + segments);
            }
            copy.add(segment);
        }
        return new NamespacePath(Collections.unmodifiableList(copy));
    }

    public static NamespacePath of(String... segments) {
        return of(Arrays.asList(segments));
    }

    public List<String> segments() {
        return segments;
    }

    public String packageName() {
        return segments.get(0);
    }

    public String simpleName() {
        return segments.get(segments.size() - 1);
    }

    /**
     * Segments with the leading package removed.
     */
    public List<String> withoutPackage() {
        return segments.subList(1, segments.size());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof NamespacePath)) return false;
        return segments.equals(((NamespacePath) obj).segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return String.join(".", segments);
    }
}
