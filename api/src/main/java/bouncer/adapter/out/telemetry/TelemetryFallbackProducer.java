package bouncer.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Default;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.quarkus.arc.DefaultBean;

/**
 * Provides a fallback meter registry when the Micrometer extension does not.
 */
@ApplicationScoped
public class TelemetryFallbackProducer {

    @Produces
    @Singleton
    @DefaultBean
    @Default
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
