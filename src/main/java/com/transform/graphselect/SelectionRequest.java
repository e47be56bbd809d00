package com.transform.graphselect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Request object for a node selection against a manifest file.
 */
public final class SelectionRequest {
    static final String SELECT_ALL = "*";

    private final String manifestPath;
    private final List<String> includeSpecs;
    private final List<String> excludeSpecs;
    private final boolean listPackages;

    /**
     * Creates a new SelectionRequest with the given parameters.
     *
     * @param manifestPath Path of the YAML manifest describing the graph
     * @param includeSpecs Specs to select; everything is selected when null or empty
     * @param excludeSpecs Specs to remove from the selection, may be null
     * @param listPackages If true, report package names instead of selected nodes
     */
    public SelectionRequest(String manifestPath, List<String> includeSpecs, List<String> excludeSpecs, boolean listPackages) {
        if (manifestPath == null || manifestPath.trim().isEmpty()) {
            throw new IllegalArgumentException("manifestPath cannot be null or empty");
        }
        this.manifestPath = manifestPath.trim();
        this.includeSpecs = includeSpecs == null || includeSpecs.isEmpty()
            ? Collections.singletonList(SELECT_ALL)
            : Collections.unmodifiableList(new ArrayList<>(includeSpecs));
        this.excludeSpecs = excludeSpecs == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(excludeSpecs));
        this.listPackages = listPackages;
    }

    public String manifestPath() {
        return manifestPath;
    }

    public List<String> includeSpecs() {
        return includeSpecs;
    }

    public List<String> excludeSpecs() {
        return excludeSpecs;
    }

    public boolean listPackages() {
        return listPackages;
    }
}
