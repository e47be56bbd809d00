package com.transform.graphselect;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Map-backed catalog. Entries are fixed once built.
 */
public final class InMemoryResourceCatalog implements ResourceCatalog {
    private final Map<String, NodeMetadata> entries;

    public InMemoryResourceCatalog(Map<String, NodeMetadata> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public NodeMetadata metadataFor(String nodeId) {
        return entries.get(nodeId);
    }

    /**
     * Builder for InMemoryResourceCatalog.
     */
    public static class Builder {
        private final Map<String, NodeMetadata> entries = new LinkedHashMap<>();

        public Builder put(String nodeId, NodeMetadata metadata) {
            if (nodeId == null || metadata == null) {
                throw new IllegalArgumentException("nodeId and metadata cannot be null");
            }
            if (entries.putIfAbsent(nodeId, metadata) != null) {
                throw new IllegalArgumentException("Duplicate catalog entry for " + nodeId);
            }
            return this;
        }

        public InMemoryResourceCatalog build() {
            return new InMemoryResourceCatalog(entries);
        }
    }
}
