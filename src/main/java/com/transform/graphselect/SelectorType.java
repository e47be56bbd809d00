package com.transform.graphselect;

/**
 * What the body of a selection spec is matched against.
 */
public enum SelectorType {
    FQN(null),
    TAG("tag:"),
    SOURCE("source:");

    private final String prefix;

    SelectorType(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Spec prefix that selects this type, or {@code null} for the fallback type.
     */
    public String prefix() {
        return prefix;
    }
}
