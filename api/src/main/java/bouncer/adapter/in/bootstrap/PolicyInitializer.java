package bouncer.adapter.in.bootstrap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import bouncer.config.EnforcerConfig;
import bouncer.core.port.in.PolicyManagement;

/**
 * Loads the policy from storage on application startup.
 */
@ApplicationScoped
public class PolicyInitializer {

    private static final Logger LOG = Logger.getLogger(PolicyInitializer.class);

    private final PolicyManagement policies;
    private final EnforcerConfig config;

    @Inject
    public PolicyInitializer(PolicyManagement policies, EnforcerConfig config) {
        this.policies = policies;
        this.config = config;
    }

    void onStart(@Observes StartupEvent event) {
        if (!config.loadOnStartup()) {
            LOG.info("Policy load on startup disabled");
            return;
        }
        LOG.info("Loading policy from storage...");
        policies.loadPolicy()
                .subscribe()
                .with(
                        count -> LOG.infof("Policy loaded: %d rule(s)", count),
                        e -> LOG.errorf(e, "Failed to load policy"));
    }
}
