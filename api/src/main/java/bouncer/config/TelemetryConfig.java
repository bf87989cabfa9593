package bouncer.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for decision metrics.
 *
 * <p>Disabled by default.
 */
@ConfigMapping(prefix = "bouncer.telemetry")
public interface TelemetryConfig {

    @WithDefault("false")
    boolean enabled();
}
