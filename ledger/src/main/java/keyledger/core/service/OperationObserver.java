package keyledger.core.service;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import keyledger.core.model.error.LedgerException;
import keyledger.core.port.out.LedgerMetrics;

/**
 * Records the outcome of each ledger operation to metrics and the debug log.
 */
final class OperationObserver {

    static final String SUCCESS = "success";

    private final LedgerMetrics metrics;
    private final Logger log;

    OperationObserver(LedgerMetrics metrics, Logger log) {
        this.metrics = metrics;
        this.log = log;
    }

    <T> Uni<T> observe(String operation, Uni<T> result) {
        return result.onItem()
                .invoke(ignored -> metrics.recordOperation(operation, SUCCESS))
                .onFailure(LedgerException.class)
                .invoke(failure -> {
                    var error = ((LedgerException) failure).error();
                    log.debugv("{0} rejected: {1}", operation, failure.getMessage());
                    metrics.recordOperation(operation, error.tag());
                });
    }
}
