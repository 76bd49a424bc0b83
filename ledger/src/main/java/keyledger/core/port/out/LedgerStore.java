package keyledger.core.port.out;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import io.smallrye.mutiny.Uni;

import keyledger.core.model.Principal;
import keyledger.core.model.key.ApiKey;
import keyledger.core.model.key.KeyId;
import keyledger.core.model.service.Service;

/**
 * Port interface for the durable record store holding services and keys.
 *
 * <p>Implementations provide lookup by identity key, uniqueness of service
 * authorities and key identities, and atomic multi-record writes. Each ledger
 * operation runs as one {@link #inTransaction(Function) transaction}.
 */
public interface LedgerStore {

    /**
     * Find a service by its authority.
     *
     * @param authority the service's authority
     * @return Uni with Optional containing the service if found
     */
    Uni<Optional<Service>> findService(Principal authority);

    /**
     * Find a key by its identity.
     *
     * @param keyId the key identity
     * @return Uni with Optional containing the key if found
     */
    Uni<Optional<ApiKey>> findKey(KeyId keyId);

    /**
     * Retrieve all keys issued by a service, ordered by sequence.
     *
     * @param authority the service's authority
     * @return Uni with the service's keys (empty if none)
     */
    Uni<List<ApiKey>> findKeys(Principal authority);

    /**
     * Run {@code work} as one atomic, serialized unit.
     *
     * <p>Writes made through the transaction become visible together when
     * {@code work} returns normally. If {@code work} throws, every write is
     * discarded and the returned Uni fails with the thrown exception.
     *
     * @param work the read-modify-write step
     * @param <T> result type
     * @return Uni with the result of {@code work}
     */
    <T> Uni<T> inTransaction(Function<LedgerTransaction, T> work);
}
