package ai.pipestream.workspace.error;

/**
 * Base type for every failure raised by the node identity and permission engine.
 * All subclasses are recoverable by the caller (retry, correct input, or deny-and-log).
 */
public abstract class WorkspaceAccessException extends RuntimeException {

    private final ErrorCategory category;

    protected WorkspaceAccessException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }
}
