package keyledger.core.model;

/**
 * Identity of a principal acting on the ledger.
 *
 * <p>The host verifies that the caller controls this identity before any ledger
 * operation runs; the ledger itself only compares identities.
 *
 * @param id opaque identity string (e.g., a public key)
 */
public record Principal(String id) {

    public Principal {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Principal ID cannot be null or blank");
        }
    }

    public static Principal of(String id) {
        return new Principal(id);
    }

    @Override
    public String toString() {
        return id;
    }
}
