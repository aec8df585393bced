package ai.pipestream.workspace.storage;

import ai.pipestream.workspace.access.NodeAction;

/**
 * Kind of object transfer a storage grant permits.
 */
public enum StorageOperation {
    READ(NodeAction.STORAGE_READ),
    WRITE(NodeAction.STORAGE_WRITE);

    private final NodeAction action;

    StorageOperation(NodeAction action) {
        this.action = action;
    }

    public NodeAction action() {
        return action;
    }
}
