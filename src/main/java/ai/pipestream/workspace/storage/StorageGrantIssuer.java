package ai.pipestream.workspace.storage;

import ai.pipestream.workspace.access.AccessMetrics;
import ai.pipestream.workspace.access.Authorization;
import ai.pipestream.workspace.error.PermissionDeniedException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import software.amazon.awssdk.awscore.presigner.PresignedRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PutObjectPresignRequest;

import java.time.Duration;

/**
 * Mints scoped, short-lived storage references for node attachments.
 * <p>
 * Issuing requires an {@link Authorization}, which only the access gateway can create,
 * so a reference is never signed without a prior successful permission check.
 */
@ApplicationScoped
public class StorageGrantIssuer {

    private static final Logger LOG = Logger.getLogger(StorageGrantIssuer.class);

    @Inject
    S3Presigner presigner;

    @Inject
    S3Config s3Config;

    @Inject
    AccessMetrics metrics;

    /**
     * Sign a single-object request for the authorized node.
     *
     * @param authorization the gateway's decision for this node
     * @param operation     transfer direction
     * @return the scoped grant
     * @throws PermissionDeniedException if the authorization does not cover the operation
     */
    public ScopedStorageGrant issue(Authorization authorization, StorageOperation operation) {
        authorization.require(operation.action());

        String objectKey = objectKey(authorization.workspaceId(), authorization.nodeId());
        Duration ttl = s3Config.grantTtl();

        PresignedRequest presigned = switch (operation) {
            case READ -> presigner.presignGetObject(GetObjectPresignRequest.builder()
                    .signatureDuration(ttl)
                    .getObjectRequest(GetObjectRequest.builder()
                            .bucket(s3Config.bucket())
                            .key(objectKey)
                            .build())
                    .build());
            case WRITE -> presigner.presignPutObject(PutObjectPresignRequest.builder()
                    .signatureDuration(ttl)
                    .putObjectRequest(PutObjectRequest.builder()
                            .bucket(s3Config.bucket())
                            .key(objectKey)
                            .build())
                    .build());
        };

        metrics.recordStorageGrant(operation.name());
        LOG.infof("Issued %s storage grant for node=%d to user=%s: s3://%s/%s (expires %s)",
                operation, authorization.nodeId(), authorization.identity().userId(),
                s3Config.bucket(), objectKey, presigned.expiration());

        return new ScopedStorageGrant(
                authorization.nodeId(),
                authorization.identity().userId(),
                s3Config.bucket(),
                objectKey,
                operation,
                presigned.url(),
                presigned.expiration());
    }

    /**
     * Object key for a node's attachment: {@code {keyPrefix}/{workspaceId}/{nodeId}}.
     * The key only depends on ids; renames and moves never leave the workspace, so it is stable.
     */
    public String objectKey(long workspaceId, long nodeId) {
        String prefix = s3Config.keyPrefix();
        if (prefix == null || prefix.isBlank()) {
            return workspaceId + "/" + nodeId;
        }
        return prefix + "/" + workspaceId + "/" + nodeId;
    }
}
