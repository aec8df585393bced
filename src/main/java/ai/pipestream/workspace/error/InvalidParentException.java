package ai.pipestream.workspace.error;

/**
 * Structural violation on create, move or restore: a workspace given a parent, a
 * non-workspace node without one, or a soft-deleted parent.
 */
public class InvalidParentException extends WorkspaceAccessException {

    public InvalidParentException(String message) {
        super(ErrorCategory.VALIDATION, message);
    }
}
