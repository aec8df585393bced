package ai.pipestream.workspace.id;

import ai.pipestream.workspace.config.SnowflakeConfiguration;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.time.Instant;

@ApplicationScoped
public class SnowflakeGeneratorProducer {

    private static final Logger LOG = Logger.getLogger(SnowflakeGeneratorProducer.class);

    /**
     * Produces the process-wide generator. The generator id is fixed for the lifetime of
     * the process; keeping it unique per running instance is an operational precondition.
     */
    @Produces
    @Singleton
    public SnowflakeGenerator snowflakeGenerator(SnowflakeConfiguration config) {
        Instant epoch = Instant.parse(config.epoch());
        SnowflakeGenerator generator = new SnowflakeGenerator(
                config.generatorId(),
                epoch.toEpochMilli(),
                config.clockSkewTolerance().toMillis());
        LOG.infof("SnowflakeGenerator initialized: generatorId=%d, epoch=%s, clockSkewTolerance=%s",
                config.generatorId(), epoch, config.clockSkewTolerance());
        return generator;
    }
}
