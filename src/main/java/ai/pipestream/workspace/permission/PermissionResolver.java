package ai.pipestream.workspace.permission;

import ai.pipestream.workspace.error.NodeNotFoundException;
import ai.pipestream.workspace.grant.Grant;
import ai.pipestream.workspace.grant.GrantStore;
import ai.pipestream.workspace.identity.Identity;
import ai.pipestream.workspace.node.Node;
import ai.pipestream.workspace.node.NodeStore;
import ai.pipestream.workspace.node.TreeLock;
import com.google.common.collect.ImmutableMap;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes the effective permission level an identity holds on a node.
 * <p>
 * Rules, uniform across node types:
 * <ol>
 *   <li>Owning the node yields {@link PermissionLevel#OWNER} and ends the walk.</li>
 *   <li>Otherwise the result is the maximum explicit grant for the identity on the node
 *       and every ancestor up to the workspace root.</li>
 *   <li>No grant anywhere on the chain yields {@link PermissionLevel#NONE}.</li>
 * </ol>
 * Only grants flow downward. Owning an ancestor confers nothing on descendants owned by
 * someone else, and a grant on a document never widens access to its parent.
 * Soft-deleted nodes resolve like live ones so owners can still find and restore them.
 * The walk is bounded by tree depth; the store guarantees the chain is acyclic.
 */
@ApplicationScoped
public class PermissionResolver {

    private static final Logger LOG = Logger.getLogger(PermissionResolver.class);

    @Inject
    NodeStore nodeStore;

    @Inject
    GrantStore grantStore;

    @Inject
    TreeLock treeLock;

    /**
     * Resolve the effective level of an identity on a node.
     *
     * @throws NodeNotFoundException if the node does not exist
     */
    public PermissionLevel resolve(Identity identity, long nodeId) {
        return treeLock.read(() -> {
            Node current = nodeStore.get(nodeId);
            if (current.isOwnedBy(identity.userId())) {
                return PermissionLevel.OWNER;
            }

            PermissionLevel effective = grantStore.levelFor(nodeId, identity.userId());
            while (current.parentId() != null && effective != PermissionLevel.OWNER) {
                current = nodeStore.get(current.parentId());
                effective = PermissionLevel.max(effective, grantStore.levelFor(current.id(), identity.userId()));
            }

            LOG.debugf("Resolved %s for user=%s on node=%d", effective, identity.userId(), nodeId);
            return effective;
        });
    }

    /**
     * Effective level of the node's owner and of every user granted access anywhere on
     * the node's chain. Users absent from the map resolve to {@link PermissionLevel#NONE}.
     *
     * @throws NodeNotFoundException if the node does not exist
     */
    public Map<String, PermissionLevel> effectivePermissions(long nodeId) {
        return treeLock.read(() -> {
            Map<String, PermissionLevel> levels = new LinkedHashMap<>();
            Node current = nodeStore.get(nodeId);
            levels.put(current.ownerId(), PermissionLevel.OWNER);
            while (true) {
                for (Grant grant : grantStore.listForNode(current.id())) {
                    levels.merge(grant.subjectId(), grant.level(), PermissionLevel::max);
                }
                if (current.parentId() == null) {
                    break;
                }
                current = nodeStore.get(current.parentId());
            }
            return ImmutableMap.copyOf(levels);
        });
    }
}
