package bouncer.adapter.out.telemetry;

import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import bouncer.config.TelemetryConfig;
import bouncer.core.port.out.DecisionMetrics;

/**
 * Records access decisions using Micrometer.
 *
 * <p>All methods are no-ops when telemetry is disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code bouncer.decisions.total} - Decision count by outcome</li>
 *   <li>{@code bouncer.decisions.latency} - Time spent deciding, by outcome</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerDecisionMetrics implements DecisionMetrics {

    static final String DECISIONS_TOTAL = "bouncer.decisions.total";
    static final String DECISIONS_LATENCY = "bouncer.decisions.latency";

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerDecisionMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordDecision(Outcome outcome, long latencyNs) {
        if (!enabled) {
            return;
        }

        Counter.builder(DECISIONS_TOTAL)
                .description("Total number of access decisions")
                .tag("outcome", outcome.tag())
                .register(registry)
                .increment();

        Timer.builder(DECISIONS_LATENCY)
                .description("Time spent evaluating access decisions")
                .tag("outcome", outcome.tag())
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(registry)
                .record(latencyNs, TimeUnit.NANOSECONDS);
    }
}
