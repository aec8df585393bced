package ai.pipestream.workspace.error;

/**
 * Raised when a move would make a node its own ancestor.
 */
public class CycleException extends WorkspaceAccessException {

    public CycleException(long nodeId, long newParentId) {
        super(ErrorCategory.VALIDATION,
                "Moving node " + nodeId + " under " + newParentId + " would create a cycle");
    }
}
