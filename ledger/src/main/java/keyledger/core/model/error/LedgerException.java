package keyledger.core.model.error;

/**
 * Thrown when a ledger operation is rejected by a business rule.
 *
 * <p>The operation that raised it has made no change to any record.
 */
public class LedgerException extends RuntimeException {

    private final LedgerError error;

    public LedgerException(LedgerError error) {
        super(error.message());
        this.error = error;
    }

    public LedgerException(LedgerError error, String detail) {
        super(error.message() + ": " + detail);
        this.error = error;
    }

    public LedgerError error() {
        return error;
    }
}
