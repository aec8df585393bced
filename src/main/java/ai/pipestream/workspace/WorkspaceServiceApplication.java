package ai.pipestream.workspace;

import ai.pipestream.workspace.id.SnowflakeGenerator;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;

/**
 * Entry point of the node identity and permission engine.
 * <p>
 * Each running instance must be started with its own generator id
 * ({@code workspace.snowflake.generator-id}); the id is logged on startup so
 * duplicates across a deployment are easy to spot.
 */
@QuarkusMain
@ApplicationScoped
public class WorkspaceServiceApplication implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(WorkspaceServiceApplication.class);

    @Inject
    SnowflakeGenerator idGenerator;

    public static void main(String... args) {
        Quarkus.run(WorkspaceServiceApplication.class, args);
    }

    @Override
    public int run(String... args) throws Exception {
        LOG.infof("Workspace access engine started: generatorId=%d, epoch=%s",
                idGenerator.getGeneratorId(), Instant.ofEpochMilli(idGenerator.getEpochMillis()));
        Quarkus.waitForExit();
        return 0;
    }
}
