package keyledger.core.port.out;

/**
 * Port interface for recording ledger metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface LedgerMetrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record a completed operation.
     *
     * @param operation the operation name (e.g., "record_request")
     * @param outcome   "success" or the rejection tag
     */
    void recordOperation(String operation, String outcome);
}
