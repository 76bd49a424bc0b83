package keyledger.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import keyledger.core.config.LedgerConfig;
import keyledger.core.port.out.LedgerMetrics;

/**
 * Records ledger operation outcomes using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code keyledger.operations.total} - Operation count by operation and outcome</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerLedgerMetrics implements LedgerMetrics {

    static final String OPERATIONS_TOTAL = "keyledger.operations.total";

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerLedgerMetrics(MeterRegistry registry, LedgerConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.metrics().enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordOperation(String operation, String outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder(OPERATIONS_TOTAL)
                .description("Number of ledger operations by outcome")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
