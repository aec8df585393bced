package ai.pipestream.workspace.error;

/**
 * Raised on create when the referenced parent id does not exist.
 */
public class ParentNotFoundException extends WorkspaceAccessException {

    private final long parentId;

    public ParentNotFoundException(long parentId) {
        super(ErrorCategory.VALIDATION, "Parent node not found: " + parentId);
        this.parentId = parentId;
    }

    public long parentId() {
        return parentId;
    }
}
