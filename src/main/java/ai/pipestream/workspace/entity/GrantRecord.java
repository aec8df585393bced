package ai.pipestream.workspace.entity;

import ai.pipestream.workspace.grant.Grant;
import ai.pipestream.workspace.permission.PermissionLevel;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persisted explicit share. At most one row exists per {@code (node_id, subject_id)};
 * the unique index doubles as the lookup path for resolution.
 */
@Entity
@Table(name = "grants", indexes = @Index(name = "idx_grants_node_subject", columnList = "node_id, subject_id", unique = true))
public class GrantRecord extends PanacheEntityBase {

    @Id
    @Column(name = "id", nullable = false)
    public Long id;

    @Column(name = "node_id", nullable = false)
    public Long nodeId;

    @Column(name = "subject_id", nullable = false)
    public String subjectId;

    @Enumerated(EnumType.STRING)
    @Column(name = "permission_level", nullable = false, length = 16)
    public PermissionLevel level;

    @Column(name = "granted_by", nullable = false)
    public String grantedBy;

    @Column(name = "granted_at", nullable = false)
    public Instant grantedAt;

    public static Optional<GrantRecord> findByNodeAndSubject(long nodeId, String subjectId) {
        return GrantRecord.<GrantRecord>find("nodeId = ?1 and subjectId = ?2", nodeId, subjectId).firstResultOptional();
    }

    public static List<GrantRecord> listForNode(long nodeId) {
        return list("nodeId = ?1 order by id", nodeId);
    }

    public Grant toGrant() {
        return new Grant(id, nodeId, subjectId, level, grantedBy, grantedAt);
    }
}
