package keyledger.core.model.key;

import java.util.List;
import java.util.OptionalLong;

/**
 * Parameters for issuing a new API key.
 *
 * @param name       display name
 * @param scopes     scopes to grant
 * @param rateLimit  daily ceiling; empty to inherit the service default
 * @param expiration requested expiration
 */
public record NewKey(String name, List<String> scopes, OptionalLong rateLimit, Expiration expiration) {

    public NewKey {
        if (scopes == null) {
            scopes = List.of();
        }
        if (rateLimit == null) {
            rateLimit = OptionalLong.empty();
        }
        if (expiration == null) {
            expiration = Expiration.never();
        }
    }

    /**
     * A key inheriting the service's default limit and never expiring.
     */
    public static NewKey of(String name, List<String> scopes) {
        return new NewKey(name, scopes, OptionalLong.empty(), Expiration.never());
    }

    public NewKey withRateLimit(long limit) {
        return new NewKey(name, scopes, OptionalLong.of(limit), expiration);
    }

    public NewKey expiringAt(long epochSeconds) {
        return new NewKey(name, scopes, rateLimit, Expiration.at(epochSeconds));
    }
}
