package bouncer.adapter.in.bootstrap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import bouncer.config.EnforcerConfig;
import bouncer.core.model.definition.MatchingOptions;
import bouncer.core.port.out.PolicyRepository;
import bouncer.core.service.compiler.ModelCompiler;
import bouncer.core.service.enforcer.Enforcer;
import bouncer.core.service.function.FunctionRegistry;

/**
 * Builds the application's single {@link Enforcer} from configuration.
 *
 * <p>The enforcer is an explicit bean; consumers get it by injection.
 */
@ApplicationScoped
public class EnforcerProducer {

    private static final Logger LOG = Logger.getLogger(EnforcerProducer.class);

    private final EnforcerConfig config;
    private final PolicyRepository repository;

    @Inject
    public EnforcerProducer(EnforcerConfig config, PolicyRepository repository) {
        this.config = config;
        this.repository = repository;
    }

    @Produces
    @Singleton
    public Enforcer enforcer() {
        final var options = new MatchingOptions(config.caseSensitive(), config.patternMode());
        final var compiler = new ModelCompiler(options, FunctionRegistry.empty());
        LOG.infof(
                "Creating enforcer from model %s (case-sensitive=%s, pattern-mode=%s, auto-save=%s)",
                config.modelPath(),
                options.caseSensitive(),
                options.patternMode(),
                config.autoSave());
        return new Enforcer(
                compiler, ModelSource.read(config.modelPath()), repository, config.autoSave(), config.storageTimeout());
    }
}
