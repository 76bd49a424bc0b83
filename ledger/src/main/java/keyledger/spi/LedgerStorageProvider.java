package keyledger.spi;

import keyledger.core.config.LedgerConfig;
import keyledger.core.port.out.LedgerStore;

/**
 * Service Provider Interface for ledger storage implementations.
 *
 * <p>A storage backend must honour the {@link LedgerStore} contract: lookups by
 * identity key, uniqueness of service authorities and key identities, and
 * all-or-nothing transactions. Implementations are discovered via
 * java.util.ServiceLoader at startup.
 *
 * <h2>How to Create a Custom Provider</h2>
 * <ol>
 *   <li>Implement this interface</li>
 *   <li>Create META-INF/services/keyledger.spi.LedgerStorageProvider</li>
 *   <li>Add your fully qualified class name to the file</li>
 *   <li>Configure: keyledger.storage.provider=your-provider-name</li>
 * </ol>
 */
public interface LedgerStorageProvider {

    /**
     * Unique name identifying this provider.
     *
     * <p>Used in configuration: keyledger.storage.provider={name}
     *
     * @return The provider name
     */
    String name();

    /**
     * Human-readable description of this provider.
     *
     * @return Description for logging and diagnostics
     */
    default String description() {
        return name() + " ledger storage provider";
    }

    /**
     * Priority for auto-selection when no explicit provider is configured.
     *
     * <p>Higher values = higher priority. The built-in memory provider uses 0.
     *
     * @return The provider priority
     */
    default int priority() {
        return 0;
    }

    /**
     * Check if this provider is available (dependencies present, etc.)
     *
     * @return true if the provider can be used
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Create the store implementation.
     *
     * <p>Called once at startup. The returned instance should be thread-safe.
     *
     * @param config ledger configuration
     * @return Store implementation
     * @throws StorageProviderException if initialization fails
     */
    LedgerStore createStore(LedgerConfig config);
}
