package keyledger.core.model.service;

import keyledger.core.model.LedgerLimits;
import keyledger.core.model.Principal;

/**
 * A service that issues API keys and holds their default policy and aggregate counts.
 *
 * <p>Records are immutable; every transition returns a new instance.
 *
 * @param authority        principal controlling the service; also its identity
 * @param name             display name
 * @param defaultRateLimit requests per day for keys created without their own limit
 * @param totalKeys        keys ever created; the next key's sequence number
 * @param activeKeys       keys currently active, never more than {@code totalKeys}
 */
public record Service(Principal authority, String name, long defaultRateLimit, long totalKeys, long activeKeys) {

    public Service {
        if (authority == null) {
            throw new IllegalArgumentException("Service authority cannot be null");
        }
        if (name == null) {
            throw new IllegalArgumentException("Service name cannot be null");
        }
        LedgerLimits.requireNonNegativeLimit(defaultRateLimit);
        if (totalKeys < 0 || activeKeys < 0 || activeKeys > totalKeys) {
            throw new IllegalStateException(
                    "Invalid key counters: active=" + activeKeys + ", total=" + totalKeys);
        }
    }

    /**
     * Creates a new service with zeroed counters.
     *
     * @throws keyledger.core.model.error.LedgerException if the name is too long
     */
    public static Service create(Principal authority, String name, long defaultRateLimit) {
        LedgerLimits.requireValidName(name);
        return new Service(authority, name, defaultRateLimit, 0, 0);
    }

    /**
     * Sequence number the next created key receives.
     */
    public long nextSequence() {
        return totalKeys;
    }

    public boolean isAuthority(Principal principal) {
        return authority.equals(principal);
    }

    /**
     * Counts a newly created key, which starts active.
     */
    public Service withKeyIssued() {
        return new Service(
                authority, name, defaultRateLimit, Math.addExact(totalKeys, 1), Math.addExact(activeKeys, 1));
    }

    /**
     * Counts a revoked key. Never drops below zero.
     */
    public Service withKeyDeactivated() {
        return new Service(authority, name, defaultRateLimit, totalKeys, Math.max(0, activeKeys - 1));
    }

    /**
     * Counts a reactivated key.
     */
    public Service withKeyReactivated() {
        return new Service(authority, name, defaultRateLimit, totalKeys, Math.addExact(activeKeys, 1));
    }
}
