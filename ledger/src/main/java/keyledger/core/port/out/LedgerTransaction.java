package keyledger.core.port.out;

import java.util.Optional;

import keyledger.core.model.Principal;
import keyledger.core.model.key.ApiKey;
import keyledger.core.model.key.KeyId;
import keyledger.core.model.service.Service;

/**
 * View of the store inside one {@link LedgerStore#inTransaction transaction}.
 *
 * <p>Reads observe the transaction's own pending writes.
 */
public interface LedgerTransaction {

    Optional<Service> service(Principal authority);

    Optional<ApiKey> key(KeyId keyId);

    /**
     * Stage a new service.
     *
     * @throws keyledger.core.model.error.LedgerException with {@code SERVICE_ALREADY_EXISTS}
     *     if the authority already owns a service
     */
    void insertService(Service service);

    /**
     * Stage a new key.
     *
     * @throws keyledger.core.model.error.LedgerException with {@code KEY_ALREADY_EXISTS}
     *     if the identity is taken
     */
    void insertKey(ApiKey key);

    /**
     * Stage an update to an existing service.
     */
    void updateService(Service service);

    /**
     * Stage an update to an existing key.
     */
    void updateKey(ApiKey key);
}
