package keyledger.core.port.in;

import java.util.OptionalLong;

import io.smallrye.mutiny.Uni;

import keyledger.core.model.Principal;
import keyledger.core.model.service.Service;

/**
 * Port for registering services that issue API keys.
 *
 * <p>Rejections fail the returned Uni with a
 * {@link keyledger.core.model.error.LedgerException}.
 */
public interface ServiceManagement {

    /**
     * Registers a new service controlled by {@code authority}.
     *
     * @param authority        verified identity of the caller, who becomes the service authority
     * @param name             display name (at most 32 bytes)
     * @param defaultRateLimit requests per day for keys without their own limit;
     *                         empty to use the configured default
     * @return Uni with the created service
     */
    Uni<Service> create(Principal authority, String name, OptionalLong defaultRateLimit);

    /**
     * Looks up the service controlled by {@code authority}.
     *
     * @param authority the service authority
     * @return Uni with the service, failing with {@code SERVICE_NOT_FOUND} if absent
     */
    Uni<Service> get(Principal authority);
}
