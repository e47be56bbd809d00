package com.transform.graphselect;

/**
 * Raised when the graph holds a node the resource catalog knows nothing about.
 */
public class MissingNodeMetadataException extends GraphSelectException {
    private final String nodeId;

    public MissingNodeMetadataException(String nodeId) {
        super("No catalog metadata for graph node '" + nodeId + "'");
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
