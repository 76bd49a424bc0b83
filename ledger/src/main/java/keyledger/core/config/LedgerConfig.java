package keyledger.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for the key ledger.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code keyledger.service.default-rate-limit} - Daily limit for services registered without one</li>
 *   <li>{@code keyledger.storage.provider} - Storage provider name (optional, highest priority wins)</li>
 *   <li>{@code keyledger.metrics.enabled} - Whether operation metrics are recorded</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>
 * keyledger.service.default-rate-limit=1000
 * keyledger.storage.provider=memory
 * </pre>
 */
@ConfigMapping(prefix = "keyledger")
public interface LedgerConfig {

    ServiceDefaults service();

    Storage storage();

    Metrics metrics();

    interface ServiceDefaults {

        /**
         * Requests per day applied when a service is registered without a default.
         */
        @WithDefault("1000")
        long defaultRateLimit();
    }

    interface Storage {

        /**
         * Name of the storage provider to use. When empty, the available
         * provider with the highest priority is selected.
         */
        Optional<String> provider();
    }

    interface Metrics {

        @WithDefault("true")
        boolean enabled();
    }
}
