package com.transform.graphselect;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Catalog entry for one graph node: namespace path, tags and resource kind.
 */
public final class NodeMetadata {
    private final NamespacePath path;
    private final Set<String> tags;
    private final ResourceKind kind;

    public NodeMetadata(NamespacePath path, Set<String> tags, ResourceKind kind) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.path = path;
        this.tags = tags == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        this.kind = kind;
    }

    public static NodeMetadata model(NamespacePath path, Set<String> tags) {
        return new NodeMetadata(path, tags, ResourceKind.MODEL);
    }

    public static NodeMetadata source(NamespacePath path, Set<String> tags) {
        return new NodeMetadata(path, tags, ResourceKind.SOURCE);
    }

    public NamespacePath path() {
        return path;
    }

    public Set<String> tags() {
        return tags;
    }

    public ResourceKind kind() {
        return kind;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof NodeMetadata)) return false;
        NodeMetadata other = (NodeMetadata) obj;
        return path.equals(other.path) && tags.equals(other.tags) && kind == other.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, tags, kind);
    }

    @Override
    public String toString() {
        return kind.manifestName() + ":" + path + tags;
    }
}
