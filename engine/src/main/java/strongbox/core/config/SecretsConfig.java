package strongbox.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for the secret engine.
 *
 * <p>Example configuration:
 * <pre>{@code
 * strongbox.secrets.model-uuid=7a3c0e36-4a4f-4b8b-9a52-0c4f1e2d5b6a
 * strongbox.secrets.prune.enabled=true
 * strongbox.secrets.rotate-retry-delay=PT5M
 * }</pre>
 *
 * <p>{@code strongbox.secrets.storage.provider} is read by the store provider loader
 * and {@code strongbox.secrets.prune.interval} by the prune job's schedule.
 */
@ConfigMapping(prefix = "strongbox.secrets")
public interface SecretsConfig {

    /**
     * UUID of the model whose secrets this process manages.
     *
     * <p>When absent a random UUID is used, which only makes sense in development.
     */
    @WithName("model-uuid")
    Optional<String> modelUuid();

    Prune prune();

    /**
     * How long to wait before re-running a rotation whose secret was not
     * updated by the owner.
     */
    @WithName("rotate-retry-delay")
    @WithDefault("PT5M")
    Duration rotateRetryDelay();

    interface Prune {

        /**
         * Whether obsolete user secret revisions are pruned in the background.
         */
        @WithDefault("true")
        boolean enabled();
    }
}
