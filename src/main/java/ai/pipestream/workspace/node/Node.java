package ai.pipestream.workspace.node;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a node in the workspace tree, detached from the stored row.
 *
 * @param id        snowflake id
 * @param type      node kind
 * @param parentId  parent id, {@code null} only for workspaces
 * @param ownerId   user who created the node
 * @param name      display name
 * @param createdAt creation time
 * @param updatedAt last structural or metadata change
 * @param deletedAt soft-delete time, {@code null} while live
 */
public record Node(long id,
                   NodeType type,
                   Long parentId,
                   String ownerId,
                   String name,
                   Instant createdAt,
                   Instant updatedAt,
                   Instant deletedAt) {

    public Node {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public boolean isRoot() {
        return parentId == null;
    }

    public boolean isOwnedBy(String userId) {
        return ownerId.equals(userId);
    }
}
