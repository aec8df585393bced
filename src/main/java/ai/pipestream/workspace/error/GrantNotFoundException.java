package ai.pipestream.workspace.error;

/**
 * Raised when revoking a share that was never granted.
 */
public class GrantNotFoundException extends WorkspaceAccessException {

    public GrantNotFoundException(long nodeId, String subjectId) {
        super(ErrorCategory.NOT_FOUND, "No grant on node " + nodeId + " for subject " + subjectId);
    }
}
