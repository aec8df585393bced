package ai.pipestream.workspace.entity;

import ai.pipestream.workspace.node.Node;
import ai.pipestream.workspace.node.NodeType;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.List;

/**
 * Persisted row of the node tree.
 * <p>
 * Ids are snowflakes assigned by the service, never by the database. Children are
 * looked up through the {@code parent_id} index.
 */
@Entity
@Table(name = "nodes", indexes = @Index(name = "idx_nodes_parent_id", columnList = "parent_id"))
public class NodeRecord extends PanacheEntityBase {

    @Id
    @Column(name = "id", nullable = false)
    public Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "node_type", nullable = false, length = 16)
    public NodeType type;

    @Column(name = "parent_id")
    public Long parentId;  // null only for workspaces

    @Column(name = "owner_id", nullable = false)
    public String ownerId;

    @Column(nullable = false)
    public String name;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    @Column(name = "deleted_at")
    public Instant deletedAt;

    public static List<NodeRecord> listChildren(long parentId) {
        return list("parentId = ?1 order by id", parentId);
    }

    public Node toNode() {
        return new Node(id, type, parentId, ownerId, name, createdAt, updatedAt, deletedAt);
    }
}
