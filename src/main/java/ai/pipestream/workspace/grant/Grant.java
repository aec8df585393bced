package ai.pipestream.workspace.grant;

import ai.pipestream.workspace.permission.PermissionLevel;

import java.time.Instant;

/**
 * Explicit share of one node to one user. Inheritance to descendants is computed at
 * resolution time and never stored.
 *
 * @param id        snowflake id of the grant record
 * @param nodeId    shared node
 * @param subjectId user receiving access
 * @param level     granted level, never {@link PermissionLevel#NONE}
 * @param grantedBy user who issued the share
 * @param grantedAt when the share was issued or last changed
 */
public record Grant(long id, long nodeId, String subjectId, PermissionLevel level, String grantedBy, Instant grantedAt) {
}
