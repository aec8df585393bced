package ai.pipestream.workspace.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Configuration for identifier issuance.
 * All keys are namespaced under {@code workspace.snowflake.*}.
 */
@ConfigMapping(prefix = "workspace.snowflake")
public interface SnowflakeConfiguration {

    /**
     * Generator id embedded in every identifier. Must be unique across all running
     * instances sharing the id space, in the range 0..1023.
     * Default: 0.
     */
    @WithDefault("0")
    int generatorId();

    /**
     * Epoch that the 41-bit timestamp counts from, as an ISO-8601 instant.
     * Default: 2024-01-01T00:00:00Z.
     */
    @WithDefault("2024-01-01T00:00:00Z")
    String epoch();

    /**
     * Backward clock movement that is absorbed by waiting instead of failing.
     * Default: 5ms.
     */
    @WithDefault("PT0.005S")
    Duration clockSkewTolerance();
}
