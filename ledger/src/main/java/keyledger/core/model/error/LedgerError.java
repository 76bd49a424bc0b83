package keyledger.core.model.error;

import java.util.Locale;

/**
 * Rejection reasons for ledger operations.
 *
 * <p>Every rejection is terminal for the attempted call and leaves all records
 * untouched. A caller may retry only after correcting the condition.
 */
public enum LedgerError {
    NAME_TOO_LONG(Category.INPUT, "Name exceeds maximum length"),
    TOO_MANY_SCOPES(Category.INPUT, "Too many scopes specified"),
    SCOPE_TOO_LONG(Category.INPUT, "Scope name exceeds maximum length"),
    EXPIRATION_IN_PAST(Category.INPUT, "Expiration date must be in the future"),

    KEY_INACTIVE(Category.STATE, "API key is not active"),
    KEY_EXPIRED(Category.STATE, "API key has expired"),
    KEY_ALREADY_REVOKED(Category.STATE, "API key is already revoked"),
    KEY_ALREADY_ACTIVE(Category.STATE, "API key is already active"),
    RATE_LIMIT_EXCEEDED(Category.STATE, "Rate limit exceeded"),

    UNAUTHORIZED(Category.AUTHORIZATION, "Unauthorized"),
    INSUFFICIENT_PERMISSIONS(Category.AUTHORIZATION, "Insufficient permissions for this scope"),
    SERVICE_MISMATCH(Category.AUTHORIZATION, "Service mismatch"),

    SERVICE_NOT_FOUND(Category.LOOKUP, "Service not found"),
    KEY_NOT_FOUND(Category.LOOKUP, "API key not found"),
    SERVICE_ALREADY_EXISTS(Category.LOOKUP, "Service already exists for this authority"),
    KEY_ALREADY_EXISTS(Category.LOOKUP, "API key already exists");

    /**
     * Broad grouping of rejection reasons.
     */
    public enum Category {
        INPUT,
        STATE,
        AUTHORIZATION,
        LOOKUP
    }

    private final Category category;
    private final String message;

    LedgerError(Category category, String message) {
        this.category = category;
        this.message = message;
    }

    public Category category() {
        return category;
    }

    public String message() {
        return message;
    }

    /**
     * Lower-case tag for metrics and logs (e.g., {@code rate_limit_exceeded}).
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
