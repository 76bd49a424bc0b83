package keyledger.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Default;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.quarkus.arc.DefaultBean;

/**
 * Supplies a meter registry for the ledger metrics when the host application does not.
 *
 * <p>A registry contributed by the Micrometer extension (or any other bean)
 * replaces this one.
 */
@ApplicationScoped
public class MeterRegistryFallbackProducer {

    /**
     * @return an in-memory registry holding the ledger's counters
     */
    @Produces
    @Singleton
    @DefaultBean
    @Default
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
