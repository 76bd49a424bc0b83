package keyledger.adapter.out.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import keyledger.core.config.LedgerConfig;
import keyledger.core.port.out.LedgerStore;
import keyledger.spi.LedgerStorageProvider;
import keyledger.spi.StorageProviderException;

/**
 * Discovers and loads ledger storage providers via ServiceLoader.
 *
 * <p>Provider selection:
 * <ol>
 *   <li>If keyledger.storage.provider is set, use that provider</li>
 *   <li>Otherwise, select the highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class LedgerStoreProviderLoader {

    private static final Logger LOG = Logger.getLogger(LedgerStoreProviderLoader.class);

    private final LedgerConfig config;
    private final Supplier<List<LedgerStorageProvider>> discovery;

    private LedgerStorageProvider storageProvider;

    @Inject
    public LedgerStoreProviderLoader(LedgerConfig config) {
        this(config, LedgerStoreProviderLoader::discover);
    }

    LedgerStoreProviderLoader(LedgerConfig config, Supplier<List<LedgerStorageProvider>> discovery) {
        this.config = config;
        this.discovery = discovery;
    }

    @Produces
    @ApplicationScoped
    public LedgerStore ledgerStore() {
        LedgerStorageProvider provider = getStorageProvider();
        LOG.infof("Creating ledger store from provider: %s (%s)", provider.name(), provider.description());
        return provider.createStore(config);
    }

    LedgerStorageProvider getStorageProvider() {
        if (storageProvider != null) {
            return storageProvider;
        }

        List<LedgerStorageProvider> providers = discovery.get();
        if (providers.isEmpty()) {
            throw new StorageProviderException(
                    "No ledger storage providers found. Ensure a provider JAR is on the classpath.");
        }

        LOG.infof(
                "Found %d ledger storage provider(s): %s",
                providers.size(),
                providers.stream().map(LedgerStorageProvider::name).toList());

        storageProvider = selectProvider(providers, config.storage().provider().orElse(null));
        return storageProvider;
    }

    private LedgerStorageProvider selectProvider(List<LedgerStorageProvider> providers, String configured) {
        if (configured != null && !configured.isBlank()) {
            return providers.stream()
                    .filter(p -> p.name().equals(configured))
                    .findFirst()
                    .orElseThrow(() -> new StorageProviderException("Configured storage provider not found: "
                            + configured + ". Available: "
                            + providers.stream().map(LedgerStorageProvider::name).toList()));
        }

        return providers.stream()
                .filter(LedgerStorageProvider::isAvailable)
                .max(Comparator.comparingInt(LedgerStorageProvider::priority))
                .orElseThrow(() -> new StorageProviderException("No available storage providers"));
    }

    private static List<LedgerStorageProvider> discover() {
        List<LedgerStorageProvider> providers = new ArrayList<>();
        ServiceLoader.load(LedgerStorageProvider.class).forEach(providers::add);
        return providers;
    }
}
