package keyledger.core.model;

import java.nio.charset.StandardCharsets;
import java.util.List;

import keyledger.core.model.error.LedgerError;
import keyledger.core.model.error.LedgerException;

/**
 * Size limits shared by service and key records.
 *
 * <p>Lengths are counted in UTF-8 bytes.
 */
public final class LedgerLimits {

    /** Maximum length of a service or key name. */
    public static final int MAX_NAME_LENGTH = 32;

    /** Maximum number of scopes on one key. */
    public static final int MAX_SCOPES = 8;

    /** Maximum length of a single scope. */
    public static final int MAX_SCOPE_LENGTH = 16;

    private LedgerLimits() {}

    /**
     * Rejects names longer than {@link #MAX_NAME_LENGTH} bytes.
     *
     * @throws LedgerException with {@link LedgerError#NAME_TOO_LONG}
     */
    public static void requireValidName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Name cannot be null");
        }
        if (byteLength(name) > MAX_NAME_LENGTH) {
            throw new LedgerException(LedgerError.NAME_TOO_LONG, name);
        }
    }

    /**
     * Rejects scope lists with too many entries or an over-long entry.
     *
     * <p>The count is checked before any entry length.
     *
     * @throws LedgerException with {@link LedgerError#TOO_MANY_SCOPES} or {@link LedgerError#SCOPE_TOO_LONG}
     */
    public static void requireValidScopes(List<String> scopes) {
        if (scopes == null) {
            throw new IllegalArgumentException("Scopes cannot be null");
        }
        if (scopes.size() > MAX_SCOPES) {
            throw new LedgerException(LedgerError.TOO_MANY_SCOPES, scopes.size() + " > " + MAX_SCOPES);
        }
        for (String scope : scopes) {
            if (scope == null) {
                throw new IllegalArgumentException("Scope cannot be null");
            }
            if (byteLength(scope) > MAX_SCOPE_LENGTH) {
                throw new LedgerException(LedgerError.SCOPE_TOO_LONG, scope);
            }
        }
    }

    /**
     * Rejects negative rate limits; limits live in the unsigned 64-bit domain.
     */
    public static void requireNonNegativeLimit(long limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("Rate limit cannot be negative: " + limit);
        }
    }

    private static int byteLength(String value) {
        return value.getBytes(StandardCharsets.UTF_8).length;
    }
}
