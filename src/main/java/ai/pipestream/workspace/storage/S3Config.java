package ai.pipestream.workspace.storage;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * S3 configuration for scoped storage grants.
 *
 * The service never hands these credentials out; it only signs short-lived,
 * single-object requests with them.
 */
@ConfigMapping(prefix = "workspace.s3")
public interface S3Config {

    String endpoint();

    String region();

    String accessKey();

    String secretKey();

    String bucket();

    /**
     * Whether to use path-style access (required for most MinIO setups).
     */
    @WithDefault("true")
    boolean pathStyleAccess();

    /**
     * Object key prefix for node attachments.
     */
    @WithDefault("nodes")
    String keyPrefix();

    /**
     * Validity of a pre-signed storage reference.
     */
    @WithDefault("PT5M")
    Duration grantTtl();
}
