package keyledger.core.model.key;

import java.util.List;

import keyledger.core.model.LedgerLimits;
import keyledger.core.model.Principal;
import keyledger.core.model.usage.DailyUsage;

/**
 * Permission and usage metadata of one issued API key.
 *
 * <p>No secret material is held here; the ledger tracks what a key may do and
 * how much it has been used.
 *
 * @param id         identity (service, owner, sequence)
 * @param name       display name
 * @param scopes     ordered scopes; {@code "*"} matches any requested scope
 * @param rateLimit  exclusive daily ceiling on {@code requestsToday}
 * @param usage      usage counters
 * @param createdAt  creation time in epoch seconds
 * @param expiration when the key stops being usable
 * @param state      active or revoked
 */
public record ApiKey(
        KeyId id,
        String name,
        List<String> scopes,
        long rateLimit,
        DailyUsage usage,
        long createdAt,
        Expiration expiration,
        KeyState state) {

    /** Scope that matches any requested scope. */
    public static final String WILDCARD_SCOPE = "*";

    public ApiKey {
        if (id == null) {
            throw new IllegalArgumentException("API key ID cannot be null");
        }
        if (name == null) {
            throw new IllegalArgumentException("API key name cannot be null");
        }
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
        LedgerLimits.requireNonNegativeLimit(rateLimit);
        if (usage == null) {
            usage = DailyUsage.none();
        }
        if (expiration == null) {
            expiration = Expiration.never();
        }
        if (state == null) {
            state = KeyState.ACTIVE;
        }
    }

    public Principal service() {
        return id.service();
    }

    public Principal owner() {
        return id.owner();
    }

    public long sequence() {
        return id.sequence();
    }

    public long requestsToday() {
        return usage.requestsToday();
    }

    public long totalRequests() {
        return usage.totalRequests();
    }

    public long lastRequestDay() {
        return usage.lastRequestDay();
    }

    public boolean isActive() {
        return state == KeyState.ACTIVE;
    }

    public boolean isExpiredAt(long nowEpochSeconds) {
        return expiration.isExpiredAt(nowEpochSeconds);
    }

    /**
     * Checks whether this key grants {@code requiredScope}.
     *
     * <p>Matching is exact: the scope itself or the literal {@code "*"}.
     */
    public boolean grants(String requiredScope) {
        return scopes.contains(WILDCARD_SCOPE) || scopes.contains(requiredScope);
    }

    public ApiKey withUsage(DailyUsage newUsage) {
        return new ApiKey(id, name, scopes, rateLimit, newUsage, createdAt, expiration, state);
    }

    public ApiKey withState(KeyState newState) {
        return new ApiKey(id, name, scopes, rateLimit, usage, createdAt, expiration, newState);
    }

    public ApiKey withRateLimit(long newRateLimit) {
        return new ApiKey(id, name, scopes, newRateLimit, usage, createdAt, expiration, state);
    }

    public ApiKey withScopes(List<String> newScopes) {
        return new ApiKey(id, name, newScopes, rateLimit, usage, createdAt, expiration, state);
    }

    public ApiKey withExpiration(Expiration newExpiration) {
        return new ApiKey(id, name, scopes, rateLimit, usage, createdAt, newExpiration, state);
    }

    public static Builder builder(KeyId id) {
        return new Builder(id);
    }

    public static class Builder {
        private final KeyId id;
        private String name = "";
        private List<String> scopes = List.of();
        private long rateLimit;
        private DailyUsage usage = DailyUsage.none();
        private long createdAt;
        private Expiration expiration = Expiration.never();
        private KeyState state = KeyState.ACTIVE;

        private Builder(KeyId id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder scopes(List<String> scopes) {
            this.scopes = scopes;
            return this;
        }

        public Builder rateLimit(long rateLimit) {
            this.rateLimit = rateLimit;
            return this;
        }

        public Builder usage(DailyUsage usage) {
            this.usage = usage;
            return this;
        }

        public Builder createdAt(long createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder expiration(Expiration expiration) {
            this.expiration = expiration;
            return this;
        }

        public Builder state(KeyState state) {
            this.state = state;
            return this;
        }

        public ApiKey build() {
            return new ApiKey(id, name, scopes, rateLimit, usage, createdAt, expiration, state);
        }
    }
}
