package ai.pipestream.workspace.node;

import ai.pipestream.workspace.access.Authorization;
import ai.pipestream.workspace.access.NodeAction;
import ai.pipestream.workspace.entity.NodeRecord;
import ai.pipestream.workspace.error.CycleException;
import ai.pipestream.workspace.error.InvalidParentException;
import ai.pipestream.workspace.error.NodeNotFoundException;
import ai.pipestream.workspace.error.ParentNotFoundException;
import ai.pipestream.workspace.id.SnowflakeGenerator;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The node tree, persisted as {@link NodeRecord} rows keyed by snowflake id with an
 * index on parent id.
 * <p>
 * The store enforces structural integrity only: workspace roots have no parent, every
 * other node hangs off an existing live parent, and moves never introduce a cycle.
 * It makes no access decisions, but every mutation except opening a new workspace
 * demands the gateway's {@link Authorization} for the node it touches, so nothing can
 * change the tree without passing the gateway first. Each mutation runs in the
 * exclusive side of the {@link TreeLock} and in one transaction, so validation and
 * write are one step and no partial state is ever visible.
 */
@ApplicationScoped
public class NodeStore {

    private static final Logger LOG = Logger.getLogger(NodeStore.class);

    @Inject
    SnowflakeGenerator idGenerator;

    @Inject
    TreeLock treeLock;

    /**
     * Create a workspace root. Any verified user may open one; it touches no existing node.
     *
     * @param ownerId the owning user
     * @param name    display name
     * @return the new workspace
     */
    public Node createWorkspace(String ownerId, String name) {
        checkText(ownerId, "ownerId");
        checkText(name, "name");

        return treeLock.write(() -> {
            NodeRecord record = newRecord(NodeType.WORKSPACE, null, ownerId, name);
            record.persist();
            LOG.infof("Created workspace: id=%d, owner=%s", record.id, ownerId);
            return record.toNode();
        });
    }

    /**
     * Create a category, document or resource under the authorized parent. The
     * authorized user becomes the owner.
     *
     * @param parent authorization for {@link NodeAction#CREATE_CHILD} on the parent
     * @param type   node kind; never {@link NodeType#WORKSPACE}
     * @param name   display name
     * @return the new node
     * @throws InvalidParentException  if the type is a workspace or the parent is deleted
     * @throws ParentNotFoundException if the parent row no longer exists
     */
    public Node create(Authorization parent, NodeType type, String name) {
        Preconditions.checkNotNull(type, "type");
        checkText(name, "name");
        parent.require(NodeAction.CREATE_CHILD);

        return treeLock.write(() -> {
            long parentId = parent.nodeId();
            if (type.isRoot()) {
                throw new InvalidParentException("A workspace cannot have a parent");
            }
            NodeRecord parentRecord = NodeRecord.findById(parentId);
            if (parentRecord == null) {
                throw new ParentNotFoundException(parentId);
            }
            if (parentRecord.deletedAt != null) {
                throw new InvalidParentException("Parent node " + parentId + " is deleted");
            }

            String ownerId = parent.identity().userId();
            NodeRecord record = newRecord(type, parentId, ownerId, name);
            record.persist();
            LOG.infof("Created node: id=%d, type=%s, parent=%d, owner=%s", record.id, type, parentId, ownerId);
            return record.toNode();
        });
    }

    /**
     * Get a node by id, deleted or not.
     *
     * @throws NodeNotFoundException if absent
     */
    public Node get(long id) {
        return treeLock.read(() -> load(id).toNode());
    }

    public Optional<Node> find(long id) {
        return treeLock.read(() -> Optional.ofNullable(NodeRecord.<NodeRecord>findById(id)).map(NodeRecord::toNode));
    }

    /**
     * Re-parent a node.
     * <p>
     * Cycle detection walks up from the new parent while the tree is exclusively held, so
     * two concurrent moves that would form a cycle between them are serialized and the
     * second one fails.
     *
     * @param node        authorization for {@link NodeAction#MOVE} on the node
     * @param destination authorization for {@link NodeAction#MOVE_INTO} on the new parent,
     *                    issued to the same user
     * @throws NodeNotFoundException  if either row no longer exists
     * @throws CycleException         if the new parent is the node itself or one of its descendants
     * @throws InvalidParentException if the node is a workspace, the new parent is deleted,
     *                                or the new parent belongs to another workspace
     */
    public Node move(Authorization node, Authorization destination) {
        node.require(NodeAction.MOVE);
        destination.require(NodeAction.MOVE_INTO);
        Preconditions.checkArgument(node.identity().userId().equals(destination.identity().userId()),
                "both authorizations must belong to the same user");

        return treeLock.write(() -> {
            long id = node.nodeId();
            long newParentId = destination.nodeId();
            NodeRecord record = load(id);
            NodeRecord newParent = load(newParentId);

            if (record.type.isRoot()) {
                throw new InvalidParentException("A workspace cannot be moved");
            }
            if (id == newParentId || isAncestor(id, newParent)) {
                throw new CycleException(id, newParentId);
            }
            if (newParent.deletedAt != null) {
                throw new InvalidParentException("Parent node " + newParentId + " is deleted");
            }
            if (!rootOf(record).id.equals(rootOf(newParent).id)) {
                throw new InvalidParentException("Node " + id + " cannot be moved to another workspace");
            }
            if (record.parentId == newParentId) {
                return record.toNode();
            }

            long oldParentId = record.parentId;
            record.parentId = newParentId;
            record.updatedAt = now();
            LOG.infof("Moved node: id=%d, from=%d, to=%d", id, oldParentId, newParentId);
            return record.toNode();
        });
    }

    /**
     * Rename the authorized node.
     */
    public Node rename(Authorization node, String name) {
        checkText(name, "name");
        node.require(NodeAction.RENAME);
        return treeLock.write(() -> {
            NodeRecord record = load(node.nodeId());
            record.name = name;
            record.updatedAt = now();
            LOG.debugf("Renamed node: id=%d", record.id);
            return record.toNode();
        });
    }

    /**
     * Flag the authorized node as deleted. Children keep their parent link and stay
     * resolvable, so the subtree can be restored. Deleting an already deleted node is a no-op.
     */
    public Node softDelete(Authorization node) {
        node.require(NodeAction.DELETE);
        return treeLock.write(() -> {
            NodeRecord record = load(node.nodeId());
            if (record.deletedAt != null) {
                return record.toNode();
            }
            Instant now = now();
            record.deletedAt = now;
            record.updatedAt = now;
            LOG.infof("Soft-deleted node: id=%d", record.id);
            return record.toNode();
        });
    }

    /**
     * Clear the deleted flag of the authorized node.
     *
     * @throws InvalidParentException if the parent is itself still deleted
     */
    public Node restore(Authorization node) {
        node.require(NodeAction.RESTORE);
        return treeLock.write(() -> {
            NodeRecord record = load(node.nodeId());
            if (record.deletedAt == null) {
                return record.toNode();
            }
            if (record.parentId != null && load(record.parentId).deletedAt != null) {
                throw new InvalidParentException("Cannot restore node " + record.id + " under deleted parent " + record.parentId);
            }
            record.deletedAt = null;
            record.updatedAt = now();
            LOG.infof("Restored node: id=%d", record.id);
            return record.toNode();
        });
    }

    /**
     * Live children of a node, ordered by id (creation order).
     * <p>
     * The returned iterable is lazy and restartable: each iteration queries the current
     * children, so mutations between iterations are reflected.
     */
    public Iterable<Node> listChildren(long parentId) {
        return listChildren(parentId, false);
    }

    /**
     * Lazy children listing, optionally including soft-deleted ones for administrative views.
     */
    public Iterable<Node> listChildren(long parentId, boolean includeDeleted) {
        return () -> children(parentId, includeDeleted).iterator();
    }

    /**
     * Current children of a node, read once.
     */
    public List<Node> children(long parentId, boolean includeDeleted) {
        return treeLock.read(() -> NodeRecord.listChildren(parentId).stream()
                .filter(child -> includeDeleted || child.deletedAt == null)
                .map(NodeRecord::toNode)
                .collect(ImmutableList.toImmutableList()));
    }

    /**
     * Parent chain of a node, nearest parent first, ending at the workspace root.
     *
     * @throws NodeNotFoundException if the node does not exist
     */
    public List<Node> ancestors(long id) {
        return treeLock.read(() -> {
            List<Node> chain = new ArrayList<>();
            NodeRecord current = load(id);
            while (current.parentId != null) {
                current = load(current.parentId);
                chain.add(current.toNode());
            }
            return chain;
        });
    }

    public long count() {
        return treeLock.read(() -> NodeRecord.count());
    }

    private NodeRecord newRecord(NodeType type, Long parentId, String ownerId, String name) {
        Instant now = now();
        NodeRecord record = new NodeRecord();
        record.id = idGenerator.next();
        record.type = type;
        record.parentId = parentId;
        record.ownerId = ownerId;
        record.name = name;
        record.createdAt = now;
        record.updatedAt = now;
        return record;
    }

    private static NodeRecord load(long id) {
        NodeRecord record = NodeRecord.findById(id);
        if (record == null) {
            throw new NodeNotFoundException(id);
        }
        return record;
    }

    private static boolean isAncestor(long candidateAncestor, NodeRecord start) {
        NodeRecord current = start;
        while (current.parentId != null) {
            if (current.parentId == candidateAncestor) {
                return true;
            }
            current = load(current.parentId);
        }
        return false;
    }

    private static NodeRecord rootOf(NodeRecord node) {
        NodeRecord current = node;
        while (current.parentId != null) {
            current = load(current.parentId);
        }
        return current;
    }

    // the column keeps microseconds; truncating keeps snapshots equal to re-read rows
    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    private static void checkText(String value, String field) {
        Preconditions.checkArgument(value != null && !value.isBlank(), "%s cannot be null or blank", field);
    }
}
