package com.transform.graphselect;

import java.util.Locale;

/**
 * Kind of resource a graph node stands for.
 */
public enum ResourceKind {
    MODEL,
    SOURCE;

    /**
     * Resolves a manifest value such as {@code "model"} or {@code "source"}.
     *
     * @return the kind, or {@code null} if the value names no known kind
     */
    public static ResourceKind fromName(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (ResourceKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return kind;
            }
        }
        return null;
    }

    public String manifestName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
