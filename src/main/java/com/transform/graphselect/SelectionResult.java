package com.transform.graphselect;

import java.util.Collections;
import java.util.List;

/**
 * Result object for a node selection.
 */
public final class SelectionResult {
    private final boolean success;
    private final String errorMessage;
    private final List<String> selectedNodes;
    private final List<String> packageNames;
    private final int totalNodes;
    private final long executionTimeMs;

    private SelectionResult(Builder builder) {
        this.success = builder.success;
        this.errorMessage = builder.errorMessage;
        this.selectedNodes = builder.selectedNodes == null ? Collections.emptyList() : builder.selectedNodes;
        this.packageNames = builder.packageNames == null ? Collections.emptyList() : builder.packageNames;
        this.totalNodes = builder.totalNodes;
        this.executionTimeMs = builder.executionTimeMs;
    }

    /**
     * Creates a successful result.
     */
    public static Builder success() {
        return new Builder().success(true);
    }

    /**
     * Creates a failed result with the given error message.
     */
    public static Builder failure(String errorMessage) {
        return new Builder().success(false).errorMessage(errorMessage);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * Selected node identifiers, sorted.
     */
    public List<String> getSelectedNodes() {
        return selectedNodes;
    }

    public List<String> getPackageNames() {
        return packageNames;
    }

    public int getTotalNodes() {
        return totalNodes;
    }

    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    /**
     * Builder for SelectionResult.
     */
    public static class Builder {
        private boolean success;
        private String errorMessage;
        private List<String> selectedNodes;
        private List<String> packageNames;
        private int totalNodes;
        private long executionTimeMs;

        public Builder success(boolean success) {
            this.success = success;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder selectedNodes(List<String> selectedNodes) {
            this.selectedNodes = selectedNodes;
            return this;
        }

        public Builder packageNames(List<String> packageNames) {
            this.packageNames = packageNames;
            return this;
        }

        public Builder totalNodes(int totalNodes) {
            this.totalNodes = totalNodes;
            return this;
        }

        public Builder executionTimeMs(long executionTimeMs) {
            this.executionTimeMs = executionTimeMs;
            return this;
        }

        public SelectionResult build() {
            return new SelectionResult(this);
        }
    }
}
