package keyledger.adapter.out.storage.memory;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import io.smallrye.mutiny.Uni;

import keyledger.core.model.Principal;
import keyledger.core.model.error.LedgerError;
import keyledger.core.model.error.LedgerException;
import keyledger.core.model.key.ApiKey;
import keyledger.core.model.key.KeyId;
import keyledger.core.model.service.Service;
import keyledger.core.port.out.LedgerStore;
import keyledger.core.port.out.LedgerTransaction;

/**
 * In-memory implementation of LedgerStore.
 *
 * <p>Data is NOT persisted across restarts. This implementation is suitable for:
 * <ul>
 *   <li>Development and testing</li>
 *   <li>Single-instance deployments where persistence is handled externally</li>
 * </ul>
 *
 * <p>This class is instantiated by {@link InMemoryLedgerStorageProvider}.
 *
 * <p>Thread-safety: transactions run one at a time under a single lock, and
 * their writes are applied to both maps only after the work returns.
 */
public class InMemoryLedgerStore implements LedgerStore {

    private final ConcurrentHashMap<Principal, Service> services = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<KeyId, ApiKey> keys = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();

    @Override
    public Uni<Optional<Service>> findService(Principal authority) {
        return Uni.createFrom().item(() -> Optional.ofNullable(services.get(authority)));
    }

    @Override
    public Uni<Optional<ApiKey>> findKey(KeyId keyId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(keys.get(keyId)));
    }

    @Override
    public Uni<List<ApiKey>> findKeys(Principal authority) {
        return Uni.createFrom().item(() -> keys.values().stream()
                .filter(key -> key.service().equals(authority))
                .sorted(Comparator.comparingLong(ApiKey::sequence))
                .toList());
    }

    @Override
    public <T> Uni<T> inTransaction(Function<LedgerTransaction, T> work) {
        return Uni.createFrom().item(() -> {
            synchronized (writeLock) {
                var tx = new BufferedTransaction();
                T result = work.apply(tx);
                tx.commit();
                return result;
            }
        });
    }

    /**
     * Returns the number of stored services.
     *
     * <p>Useful for monitoring and testing.
     */
    public int serviceCount() {
        return services.size();
    }

    /**
     * Returns the number of stored keys.
     *
     * <p>Useful for monitoring and testing.
     */
    public int keyCount() {
        return keys.size();
    }

    /**
     * Clears all records.
     *
     * <p>Primarily for testing purposes.
     */
    public void clear() {
        synchronized (writeLock) {
            services.clear();
            keys.clear();
        }
    }

    /**
     * Stages writes until {@link #commit()}; dropped unapplied if the work throws.
     */
    private final class BufferedTransaction implements LedgerTransaction {

        private final Map<Principal, Service> pendingServices = new HashMap<>();
        private final Map<KeyId, ApiKey> pendingKeys = new HashMap<>();

        @Override
        public Optional<Service> service(Principal authority) {
            var pending = pendingServices.get(authority);
            return pending != null ? Optional.of(pending) : Optional.ofNullable(services.get(authority));
        }

        @Override
        public Optional<ApiKey> key(KeyId keyId) {
            var pending = pendingKeys.get(keyId);
            return pending != null ? Optional.of(pending) : Optional.ofNullable(keys.get(keyId));
        }

        @Override
        public void insertService(Service service) {
            if (service(service.authority()).isPresent()) {
                throw new LedgerException(LedgerError.SERVICE_ALREADY_EXISTS, service.authority().id());
            }
            pendingServices.put(service.authority(), service);
        }

        @Override
        public void insertKey(ApiKey key) {
            if (key(key.id()).isPresent()) {
                throw new LedgerException(LedgerError.KEY_ALREADY_EXISTS, key.id().toString());
            }
            pendingKeys.put(key.id(), key);
        }

        @Override
        public void updateService(Service service) {
            if (service(service.authority()).isEmpty()) {
                throw new IllegalStateException("Cannot update unknown service: " + service.authority());
            }
            pendingServices.put(service.authority(), service);
        }

        @Override
        public void updateKey(ApiKey key) {
            if (key(key.id()).isEmpty()) {
                throw new IllegalStateException("Cannot update unknown key: " + key.id());
            }
            pendingKeys.put(key.id(), key);
        }

        void commit() {
            services.putAll(pendingServices);
            keys.putAll(pendingKeys);
        }
    }
}
