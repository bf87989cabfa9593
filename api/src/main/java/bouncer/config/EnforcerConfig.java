package bouncer.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import bouncer.core.model.definition.PatternMode;

/**
 * Configuration for the decision engine.
 *
 * <p>Example configuration:
 * <pre>{@code
 * bouncer.enforcer.model-path=rbac_model.conf
 * bouncer.enforcer.auto-save=true
 * bouncer.enforcer.case-sensitive=false
 * bouncer.enforcer.pattern-mode=WILDCARD
 * }</pre>
 */
@ConfigMapping(prefix = "bouncer.enforcer")
public interface EnforcerConfig {

    /**
     * Location of the model text. Classpath resources are tried first, then the file system.
     */
    @WithName("model-path")
    @WithDefault("model.conf")
    String modelPath();

    /**
     * Write every successful mutation through to the policy repository.
     */
    @WithName("auto-save")
    @WithDefault("false")
    boolean autoSave();

    /**
     * How long a mutation waits for an auto-save write before failing.
     */
    @WithName("storage-timeout")
    @WithDefault("PT30S")
    Duration storageTimeout();

    @WithName("case-sensitive")
    @WithDefault("true")
    boolean caseSensitive();

    /**
     * FULL enables glob and regex patterns; WILDCARD allows only leading or trailing '*'.
     */
    @WithName("pattern-mode")
    @WithDefault("FULL")
    PatternMode patternMode();

    /**
     * Load the policy from the repository when the application starts.
     */
    @WithName("load-on-startup")
    @WithDefault("true")
    boolean loadOnStartup();
}
