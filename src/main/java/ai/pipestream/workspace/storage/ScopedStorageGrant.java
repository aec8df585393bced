package ai.pipestream.workspace.storage;

import java.net.URL;
import java.time.Instant;

/**
 * Short-lived reference to exactly one object, handed to the storage client that
 * performs the transfer.
 *
 * @param nodeId    node the object is attached to
 * @param subjectId user the grant was issued to
 * @param bucket    bucket holding the object
 * @param objectKey key of the object
 * @param operation permitted transfer direction
 * @param url       pre-signed URL scoped to this object and operation
 * @param expiresAt instant after which the URL is rejected by storage
 */
public record ScopedStorageGrant(long nodeId,
                                 String subjectId,
                                 String bucket,
                                 String objectKey,
                                 StorageOperation operation,
                                 URL url,
                                 Instant expiresAt) {
}
