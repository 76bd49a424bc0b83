package keyledger.adapter.out.storage.memory;

import keyledger.core.config.LedgerConfig;
import keyledger.core.port.out.LedgerStore;
import keyledger.spi.LedgerStorageProvider;

/**
 * In-memory storage provider for services and keys.
 *
 * <p>Data is NOT persisted across application restarts.
 */
public class InMemoryLedgerStorageProvider implements LedgerStorageProvider {

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "In-memory ledger storage (non-persistent)";
    }

    @Override
    public int priority() {
        return 0; // Lowest priority, used as fallback
    }

    @Override
    public LedgerStore createStore(LedgerConfig config) {
        return new InMemoryLedgerStore();
    }
}
