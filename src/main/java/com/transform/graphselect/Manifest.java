package com.transform.graphselect;

/**
 * A loaded project: its dependency graph and the catalog describing each node.
 */
public final class Manifest {
    private final DependencyGraph graph;
    private final ResourceCatalog catalog;

    public Manifest(DependencyGraph graph, ResourceCatalog catalog) {
        if (graph == null || catalog == null) {
            throw new IllegalArgumentException("graph and catalog cannot be null");
        }
        this.graph = graph;
        this.catalog = catalog;
    }

    public DependencyGraph graph() {
        return graph;
    }

    public ResourceCatalog catalog() {
        return catalog;
    }
}
