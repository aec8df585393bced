package ai.pipestream.workspace.access;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Metrics for authorization decisions and storage grants.
 * Exposes counters and timers via Micrometer.
 */
@ApplicationScoped
public class AccessMetrics {

    @Inject
    MeterRegistry registry;

    private Timer resolveLatency;

    @PostConstruct
    void init() {
        resolveLatency = Timer.builder("access_resolve_latency")
                .description("Latency of permission resolution for a single decision")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordAllowed(NodeAction action) {
        decisions(action, "allowed").increment();
    }

    public void recordDenied(NodeAction action) {
        decisions(action, "denied").increment();
    }

    public void recordStorageGrant(String operation) {
        Counter.builder("storage_grants_issued_total")
                .description("Total number of pre-signed storage references issued")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public double decisionCount(NodeAction action, String outcome) {
        return decisions(action, outcome).count();
    }

    public Timer.Sample startResolveTimer() {
        return Timer.start(registry);
    }

    public void stopResolveTimer(Timer.Sample sample) {
        sample.stop(resolveLatency);
    }

    private Counter decisions(NodeAction action, String outcome) {
        return Counter.builder("access_decisions_total")
                .description("Authorization decisions by action and outcome")
                .tag("action", action.name())
                .tag("outcome", outcome)
                .register(registry);
    }
}
