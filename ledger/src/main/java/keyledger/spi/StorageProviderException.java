package keyledger.spi;

/**
 * Exception thrown when no usable ledger storage provider can be selected.
 */
public class StorageProviderException extends RuntimeException {

    public StorageProviderException(String message) {
        super(message);
    }

    public StorageProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
