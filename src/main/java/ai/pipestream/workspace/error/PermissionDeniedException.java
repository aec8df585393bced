package ai.pipestream.workspace.error;

/**
 * Raised when the resolved permission level is below what an action requires.
 * <p>
 * The message never reveals whether the node exists, so a caller without Read access
 * cannot map the tree structure.
 */
public class PermissionDeniedException extends WorkspaceAccessException {

    private final long nodeId;
    private final String action;

    public PermissionDeniedException(long nodeId, String action) {
        super(ErrorCategory.PERMISSION_DENIED, "Permission denied: " + action + " on node " + nodeId);
        this.nodeId = nodeId;
        this.action = action;
    }

    public long nodeId() {
        return nodeId;
    }

    public String action() {
        return action;
    }
}
