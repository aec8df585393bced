package ai.pipestream.workspace.access;

import ai.pipestream.workspace.error.PermissionDeniedException;
import ai.pipestream.workspace.identity.Identity;
import ai.pipestream.workspace.node.Node;
import ai.pipestream.workspace.permission.PermissionLevel;

/**
 * Proof that the gateway authorized an identity for an action on a node.
 * <p>
 * Only {@link AccessGateway} can create one, so any API that demands an
 * {@code Authorization} is reachable only through a successful check. The node store,
 * grant store and storage issuer all take one for every mutation. The node snapshot is
 * the one the decision was made against; callers reuse it instead of fetching the node
 * again.
 */
public final class Authorization {

    private final Identity identity;
    private final Node node;
    private final long workspaceId;
    private final PermissionLevel effectiveLevel;
    private final NodeAction action;

    Authorization(Identity identity, Node node, long workspaceId, PermissionLevel effectiveLevel, NodeAction action) {
        this.identity = identity;
        this.node = node;
        this.workspaceId = workspaceId;
        this.effectiveLevel = effectiveLevel;
        this.action = action;
    }

    public Identity identity() {
        return identity;
    }

    public Node node() {
        return node;
    }

    public long nodeId() {
        return node.id();
    }

    /**
     * Id of the workspace root the node belongs to.
     */
    public long workspaceId() {
        return workspaceId;
    }

    public PermissionLevel effectiveLevel() {
        return effectiveLevel;
    }

    public NodeAction action() {
        return action;
    }

    public boolean permits(PermissionLevel required) {
        return effectiveLevel.atLeast(required);
    }

    /**
     * Fail unless the level this authorization was granted covers {@code required}.
     *
     * @return this authorization
     * @throws PermissionDeniedException if the effective level is too low
     */
    public Authorization require(NodeAction required) {
        if (!permits(required.requiredLevel())) {
            throw new PermissionDeniedException(nodeId(), required.name());
        }
        return this;
    }

    @Override
    public String toString() {
        return "Authorization{user=" + identity.userId() + ", node=" + node.id() + ", level=" + effectiveLevel
                + ", action=" + action + "}";
    }
}
