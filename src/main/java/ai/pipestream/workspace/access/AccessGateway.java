package ai.pipestream.workspace.access;

import ai.pipestream.workspace.error.NodeNotFoundException;
import ai.pipestream.workspace.error.PermissionDeniedException;
import ai.pipestream.workspace.grant.Grant;
import ai.pipestream.workspace.grant.GrantStore;
import ai.pipestream.workspace.identity.Identity;
import ai.pipestream.workspace.node.Node;
import ai.pipestream.workspace.node.NodeStore;
import ai.pipestream.workspace.node.NodeType;
import ai.pipestream.workspace.node.TreeLock;
import ai.pipestream.workspace.permission.PermissionLevel;
import ai.pipestream.workspace.permission.PermissionResolver;
import ai.pipestream.workspace.storage.ScopedStorageGrant;
import ai.pipestream.workspace.storage.StorageGrantIssuer;
import ai.pipestream.workspace.storage.StorageOperation;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Single entry point for every read, mutation and storage authorization on the tree.
 * <p>
 * Each operation resolves the caller's effective level and performs the guarded action
 * inside one {@link TreeLock} section: shared for reads and storage grants, exclusive
 * for mutations. The decision and the action therefore observe the same ancestor chain
 * and grants, and a denied action never touches the stores.
 * <p>
 * A caller without sufficient access gets {@link PermissionDeniedException} whether the
 * node is missing, soft-deleted or merely not shared with them. The only
 * {@link NodeNotFoundException} the gateway raises is for a move destination, after the
 * caller has been authorized on the node being moved.
 */
@ApplicationScoped
public class AccessGateway {

    private static final Logger LOG = Logger.getLogger(AccessGateway.class);

    @Inject
    NodeStore nodeStore;

    @Inject
    GrantStore grantStore;

    @Inject
    PermissionResolver resolver;

    @Inject
    TreeLock treeLock;

    @Inject
    StorageGrantIssuer storageGrantIssuer;

    @Inject
    AccessMetrics metrics;

    /**
     * Check that an identity holds at least {@code required} on a node.
     *
     * @param identity the verified caller
     * @param nodeId   target node
     * @param required minimum level
     * @param action   what the caller intends to do, for auditing
     * @return the authorization, carrying the node snapshot the decision used
     * @throws PermissionDeniedException if the level is insufficient or the node is absent
     */
    public Authorization authorize(Identity identity, long nodeId, PermissionLevel required, NodeAction action) {
        return treeLock.read(() -> decide(identity, nodeId, required, action));
    }

    /**
     * Authorize and run a mutation as one unit, holding the tree exclusively.
     * The operation receives the authorization and is never invoked on denial.
     */
    public <T> T guarded(Identity identity, long nodeId, PermissionLevel required, NodeAction action,
                         Function<Authorization, T> operation) {
        return treeLock.write(() -> operation.apply(decide(identity, nodeId, required, action)));
    }

    /**
     * Authorize and run a non-mutating action against one consistent view of the tree.
     */
    public <T> T checked(Identity identity, long nodeId, PermissionLevel required, NodeAction action,
                         Function<Authorization, T> operation) {
        return treeLock.read(() -> operation.apply(decide(identity, nodeId, required, action)));
    }

    /**
     * Create a new workspace owned by the caller. Any authenticated identity may do so.
     */
    public Node createWorkspace(Identity identity, String name) {
        Objects.requireNonNull(identity, "identity");
        Node workspace = nodeStore.createWorkspace(identity.userId(), name);
        LOG.infof("User %s created workspace %d", identity.userId(), workspace.id());
        return workspace;
    }

    /**
     * Create a category, document or resource owned by the caller under a parent the
     * caller can edit.
     */
    public Node createChild(Identity identity, long parentId, NodeType type, String name) {
        return guarded(identity, parentId, NodeAction.CREATE_CHILD.requiredLevel(), NodeAction.CREATE_CHILD,
                auth -> nodeStore.create(auth, type, name));
    }

    public Node read(Identity identity, long nodeId) {
        return authorize(identity, nodeId, NodeAction.READ.requiredLevel(), NodeAction.READ).node();
    }

    public Node rename(Identity identity, long nodeId, String name) {
        return guarded(identity, nodeId, NodeAction.RENAME.requiredLevel(), NodeAction.RENAME,
                auth -> nodeStore.rename(auth, name));
    }

    /**
     * Move a node under a new parent. Requires Edit on the node and on the destination;
     * both checks and the cycle validation see the same tree state.
     * <p>
     * Once the caller is authorized on the node being moved, a destination id that does
     * not exist is reported as {@link NodeNotFoundException}; an existing destination the
     * caller cannot edit is still a {@link PermissionDeniedException}.
     */
    public Node move(Identity identity, long nodeId, long newParentId) {
        return treeLock.write(() -> {
            Authorization source = decide(identity, nodeId, NodeAction.MOVE.requiredLevel(), NodeAction.MOVE);
            if (nodeStore.find(newParentId).isEmpty()) {
                LOG.warnf("Move of node=%d by user=%s targets missing node=%d", nodeId, identity.userId(), newParentId);
                throw new NodeNotFoundException(newParentId);
            }
            Authorization destination = decide(identity, newParentId, NodeAction.MOVE_INTO.requiredLevel(),
                    NodeAction.MOVE_INTO);
            return nodeStore.move(source, destination);
        });
    }

    public Node softDelete(Identity identity, long nodeId) {
        return guarded(identity, nodeId, NodeAction.DELETE.requiredLevel(), NodeAction.DELETE,
                auth -> nodeStore.softDelete(auth));
    }

    public Node restore(Identity identity, long nodeId) {
        return guarded(identity, nodeId, NodeAction.RESTORE.requiredLevel(), NodeAction.RESTORE,
                auth -> nodeStore.restore(auth));
    }

    /**
     * Share a node with another user. Only owners/admins may share.
     */
    public Grant share(Identity identity, long nodeId, String subjectId, PermissionLevel level) {
        return guarded(identity, nodeId, NodeAction.SHARE.requiredLevel(), NodeAction.SHARE,
                auth -> grantStore.put(auth, subjectId, level));
    }

    public Grant revokeShare(Identity identity, long nodeId, String subjectId) {
        return guarded(identity, nodeId, NodeAction.REVOKE_SHARE.requiredLevel(), NodeAction.REVOKE_SHARE,
                auth -> grantStore.revoke(auth, subjectId));
    }

    /**
     * Grants placed directly on a node.
     */
    public List<Grant> listGrants(Identity identity, long nodeId) {
        return checked(identity, nodeId, NodeAction.LIST_GRANTS.requiredLevel(), NodeAction.LIST_GRANTS,
                auth -> grantStore.listForNode(nodeId));
    }

    /**
     * Live children of a node the caller can read. The result is lazy: every iteration
     * re-checks access and re-reads the store in one shared section, so a caller whose
     * access was revoked gets {@link PermissionDeniedException} instead of new children.
     */
    public Iterable<Node> listChildren(Identity identity, long parentId) {
        return children(identity, parentId, NodeAction.LIST_CHILDREN, false);
    }

    /**
     * Administrative listing including soft-deleted children. Owner/Admin only. Lazy in
     * the same way as {@link #listChildren(Identity, long)}.
     */
    public Iterable<Node> listAllChildren(Identity identity, long parentId) {
        return children(identity, parentId, NodeAction.LIST_DELETED_CHILDREN, true);
    }

    /**
     * Authorize an object transfer for a node and mint a scoped, short-lived storage
     * reference. Reading needs Read; writing needs Edit.
     */
    public ScopedStorageGrant authorizeStorageAccess(Identity identity, long nodeId, StorageOperation operation) {
        NodeAction action = operation.action();
        return checked(identity, nodeId, action.requiredLevel(), action,
                auth -> storageGrantIssuer.issue(auth, operation));
    }

    /**
     * Effective level of every user with access to a node, for audit and sharing UIs.
     * Owner/Admin only.
     */
    public Map<String, PermissionLevel> listEffectivePermissions(Identity identity, long nodeId) {
        return checked(identity, nodeId, NodeAction.LIST_PERMISSIONS.requiredLevel(), NodeAction.LIST_PERMISSIONS,
                auth -> resolver.effectivePermissions(nodeId));
    }

    private Iterable<Node> children(Identity identity, long parentId, NodeAction action, boolean includeDeleted) {
        authorize(identity, parentId, action.requiredLevel(), action);
        return () -> checked(identity, parentId, action.requiredLevel(), action,
                auth -> nodeStore.children(parentId, includeDeleted)).iterator();
    }

    private Authorization decide(Identity identity, long nodeId, PermissionLevel required, NodeAction action) {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(required, "required");
        Objects.requireNonNull(action, "action");

        Timer.Sample sample = metrics.startResolveTimer();
        try {
            Optional<Node> target = nodeStore.find(nodeId);
            if (target.isEmpty()) {
                throw deny(identity, nodeId, action, "node absent");
            }
            Node node = target.get();

            List<Node> ancestors = nodeStore.ancestors(nodeId);
            boolean hidden = node.isDeleted() || ancestors.stream().anyMatch(Node::isDeleted);
            PermissionLevel needed = hidden ? PermissionLevel.OWNER : required;

            PermissionLevel effective = resolver.resolve(identity, nodeId);

            if (!effective.atLeast(needed)) {
                throw deny(identity, nodeId, action, "effective=" + effective + ", required=" + needed);
            }

            long workspaceId = ancestors.isEmpty() ? node.id() : ancestors.get(ancestors.size() - 1).id();
            metrics.recordAllowed(action);
            LOG.debugf("Allowed %s on node=%d for user=%s (effective=%s)", action, nodeId, identity.userId(), effective);
            return new Authorization(identity, node, workspaceId, effective, action);
        } finally {
            metrics.stopResolveTimer(sample);
        }
    }

    private PermissionDeniedException deny(Identity identity, long nodeId, NodeAction action, String reason) {
        metrics.recordDenied(action);
        LOG.warnf("Denied %s on node=%d for user=%s: %s", action, nodeId, identity.userId(), reason);
        return new PermissionDeniedException(nodeId, action.name());
    }
}
