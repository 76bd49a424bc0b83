package keyledger.core.service;

import java.util.OptionalLong;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import keyledger.core.config.LedgerConfig;
import keyledger.core.model.Principal;
import keyledger.core.model.error.LedgerError;
import keyledger.core.model.error.LedgerException;
import keyledger.core.model.service.Service;
import keyledger.core.port.in.ServiceManagement;
import keyledger.core.port.out.LedgerMetrics;
import keyledger.core.port.out.LedgerStore;

/**
 * Registers services and answers service lookups.
 */
@ApplicationScoped
public class ServiceRegistryService implements ServiceManagement {

    private static final Logger LOG = Logger.getLogger(ServiceRegistryService.class);

    private final LedgerStore store;
    private final LedgerConfig config;
    private final OperationObserver observer;

    @Inject
    public ServiceRegistryService(LedgerStore store, LedgerConfig config, LedgerMetrics metrics) {
        this.store = store;
        this.config = config;
        this.observer = new OperationObserver(metrics, LOG);
    }

    @Override
    public Uni<Service> create(Principal authority, String name, OptionalLong defaultRateLimit) {
        long rateLimit = defaultRateLimit.orElseGet(() -> config.service().defaultRateLimit());

        return observer.observe("create_service", store.inTransaction(tx -> {
            var service = Service.create(authority, name, rateLimit);
            tx.insertService(service);
            return service;
        }))
                .invoke(service -> LOG.infov(
                        "Service ''{0}'' initialized by {1} (default rate limit {2}/day)",
                        service.name(), service.authority(), service.defaultRateLimit()));
    }

    @Override
    public Uni<Service> get(Principal authority) {
        return observer.observe("get_service", store.findService(authority)
                .map(found -> found.orElseThrow(
                        () -> new LedgerException(LedgerError.SERVICE_NOT_FOUND, authority.id()))));
    }
}
