package com.transform.graphselect;

/**
 * Read-only lookup of node metadata by node identifier.
 */
public interface ResourceCatalog {

    /**
     * @return metadata for {@code nodeId}, or {@code null} if the catalog has no entry
     */
    NodeMetadata metadataFor(String nodeId);
}
