package ai.pipestream.workspace.access;

import ai.pipestream.workspace.permission.PermissionLevel;

/**
 * Actions guarded by the access gateway, each with the minimum level it requires.
 */
public enum NodeAction {
    READ(PermissionLevel.READ),
    LIST_CHILDREN(PermissionLevel.READ),
    LIST_DELETED_CHILDREN(PermissionLevel.OWNER),
    CREATE_CHILD(PermissionLevel.EDIT),
    RENAME(PermissionLevel.EDIT),
    MOVE(PermissionLevel.EDIT),
    MOVE_INTO(PermissionLevel.EDIT),
    DELETE(PermissionLevel.OWNER),
    RESTORE(PermissionLevel.OWNER),
    SHARE(PermissionLevel.OWNER),
    REVOKE_SHARE(PermissionLevel.OWNER),
    LIST_GRANTS(PermissionLevel.OWNER),
    LIST_PERMISSIONS(PermissionLevel.OWNER),
    STORAGE_READ(PermissionLevel.READ),
    STORAGE_WRITE(PermissionLevel.EDIT);

    private final PermissionLevel requiredLevel;

    NodeAction(PermissionLevel requiredLevel) {
        this.requiredLevel = requiredLevel;
    }

    public PermissionLevel requiredLevel() {
        return requiredLevel;
    }
}
