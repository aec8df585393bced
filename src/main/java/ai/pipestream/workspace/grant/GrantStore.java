package ai.pipestream.workspace.grant;

import ai.pipestream.workspace.access.Authorization;
import ai.pipestream.workspace.access.NodeAction;
import ai.pipestream.workspace.entity.GrantRecord;
import ai.pipestream.workspace.error.GrantNotFoundException;
import ai.pipestream.workspace.id.SnowflakeGenerator;
import ai.pipestream.workspace.node.TreeLock;
import ai.pipestream.workspace.permission.PermissionLevel;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Grant table, persisted as {@link GrantRecord} rows indexed by {@code (node_id, subject_id)}.
 * Writes demand the gateway's {@link Authorization} and share the tree's consistency
 * boundary, so a resolution never observes a half-applied share.
 */
@ApplicationScoped
public class GrantStore {

    private static final Logger LOG = Logger.getLogger(GrantStore.class);

    @Inject
    SnowflakeGenerator idGenerator;

    @Inject
    TreeLock treeLock;

    /**
     * Create or replace the grant for a subject on the authorized node. The authorized
     * user is recorded as the grantor.
     *
     * @param node authorization for {@link NodeAction#SHARE} on the node
     * @return the stored grant; an existing grant keeps its id
     */
    public Grant put(Authorization node, String subjectId, PermissionLevel level) {
        Preconditions.checkArgument(subjectId != null && !subjectId.isBlank(), "subjectId cannot be null or blank");
        Preconditions.checkArgument(level != null && level != PermissionLevel.NONE,
                "grant level must be READ or higher; revoke to remove access");
        node.require(NodeAction.SHARE);

        return treeLock.write(() -> {
            long nodeId = node.nodeId();
            String grantedBy = node.identity().userId();
            GrantRecord record = GrantRecord.findByNodeAndSubject(nodeId, subjectId).orElse(null);
            if (record == null) {
                record = new GrantRecord();
                record.id = idGenerator.next();
                record.nodeId = nodeId;
                record.subjectId = subjectId;
                record.level = level;
                record.grantedBy = grantedBy;
                record.grantedAt = now();
                record.persist();
            } else {
                record.level = level;
                record.grantedBy = grantedBy;
                record.grantedAt = now();
            }
            LOG.infof("Granted %s on node %d to %s (by %s)", level, nodeId, subjectId, grantedBy);
            return record.toGrant();
        });
    }

    /**
     * Remove the grant for a subject on the authorized node.
     *
     * @param node authorization for {@link NodeAction#REVOKE_SHARE} on the node
     * @throws GrantNotFoundException if no such grant exists
     */
    public Grant revoke(Authorization node, String subjectId) {
        node.require(NodeAction.REVOKE_SHARE);
        return treeLock.write(() -> {
            long nodeId = node.nodeId();
            GrantRecord record = GrantRecord.findByNodeAndSubject(nodeId, subjectId)
                    .orElseThrow(() -> new GrantNotFoundException(nodeId, subjectId));
            Grant removed = record.toGrant();
            record.delete();
            LOG.infof("Revoked grant on node %d from %s", nodeId, subjectId);
            return removed;
        });
    }

    public Optional<Grant> find(long nodeId, String subjectId) {
        return treeLock.read(() -> GrantRecord.findByNodeAndSubject(nodeId, subjectId).map(GrantRecord::toGrant));
    }

    /**
     * Level explicitly granted to a subject on exactly this node, {@link PermissionLevel#NONE} if none.
     */
    public PermissionLevel levelFor(long nodeId, String subjectId) {
        return find(nodeId, subjectId).map(Grant::level).orElse(PermissionLevel.NONE);
    }

    /**
     * All grants placed directly on a node, oldest first.
     */
    public List<Grant> listForNode(long nodeId) {
        return treeLock.read(() -> GrantRecord.listForNode(nodeId).stream()
                .map(GrantRecord::toGrant)
                .collect(ImmutableList.toImmutableList()));
    }

    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }
}
