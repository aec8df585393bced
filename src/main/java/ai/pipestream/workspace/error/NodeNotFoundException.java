package ai.pipestream.workspace.error;

/**
 * Raised when a node id does not exist in the store.
 */
public class NodeNotFoundException extends WorkspaceAccessException {

    private final long nodeId;

    public NodeNotFoundException(long nodeId) {
        super(ErrorCategory.NOT_FOUND, "Node not found: " + nodeId);
        this.nodeId = nodeId;
    }

    public long nodeId() {
        return nodeId;
    }
}
