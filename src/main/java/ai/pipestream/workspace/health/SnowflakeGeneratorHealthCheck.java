package ai.pipestream.workspace.health;

import ai.pipestream.workspace.id.SnowflakeGenerator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness check for identifier issuance.
 * Reports DOWN while the generator refuses to mint ids because of clock skew, so the
 * instance is taken out of rotation instead of failing every create.
 */
@Readiness
@ApplicationScoped
public class SnowflakeGeneratorHealthCheck implements HealthCheck {

    @Inject
    SnowflakeGenerator generator;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("snowflake-generator")
                .withData("generatorId", generator.getGeneratorId())
                .withData("lastTimestampMillis", generator.getLastTimestampMillis());

        if (generator.isHalted()) {
            return builder
                    .withData("error", "clock moved backwards; id issuance halted")
                    .down()
                    .build();
        }
        return builder.up().build();
    }
}
