package ai.pipestream.workspace.node;

/**
 * Kinds of node in a workspace tree. Permission inheritance is the same for all kinds;
 * only {@link #WORKSPACE} differs structurally, being the parentless root.
 */
public enum NodeType {
    WORKSPACE,
    CATEGORY,
    DOCUMENT,
    RESOURCE;

    public boolean isRoot() {
        return this == WORKSPACE;
    }
}
