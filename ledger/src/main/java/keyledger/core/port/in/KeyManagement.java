package keyledger.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import keyledger.core.model.Principal;
import keyledger.core.model.key.ApiKey;
import keyledger.core.model.key.KeyId;
import keyledger.core.model.key.NewKey;
import keyledger.core.model.usage.UsageDecision;

/**
 * Port for issuing, using and revoking API keys.
 *
 * <p>Every operation on an existing key names the service it is performed
 * under and the verified identity of the caller. Before anything else the
 * service and key are loaded, the key must belong to that service
 * ({@code SERVICE_MISMATCH}) and the caller must hold the operation's role
 * ({@code UNAUTHORIZED}).
 *
 * <p>Rejections fail the returned Uni with a
 * {@link keyledger.core.model.error.LedgerException} and change nothing.
 */
public interface KeyManagement {

    /**
     * Issues a new key to {@code owner} under the service of {@code service}.
     *
     * <p>The key receives the service's current key count as its sequence and
     * starts active; the service's total and active counts grow by one.
     *
     * @param service authority of the issuing service
     * @param owner   verified identity of the caller, who owns the new key
     * @param request name, scopes, optional rate limit and expiration
     * @return Uni with the created key
     */
    Uni<ApiKey> create(Principal service, Principal owner, NewKey request);

    /**
     * Counts one request against the key's daily limit. Role: service authority.
     *
     * @return Uni with the admitted decision; fails with {@code KEY_INACTIVE},
     *     {@code KEY_EXPIRED} or {@code RATE_LIMIT_EXCEEDED}
     */
    Uni<UsageDecision> recordRequest(Principal service, KeyId keyId, Principal caller);

    /**
     * Checks that the key is usable and grants {@code requiredScope}. No role required.
     *
     * @return Uni completing with the key; fails with {@code KEY_INACTIVE},
     *     {@code KEY_EXPIRED} or {@code INSUFFICIENT_PERMISSIONS}
     */
    Uni<ApiKey> validateScope(Principal service, KeyId keyId, String requiredScope);

    /**
     * Deactivates an active key. Role: key owner or service authority.
     */
    Uni<ApiKey> revoke(Principal service, KeyId keyId, Principal caller);

    /**
     * Reactivates a revoked, unexpired key. Role: key owner or service authority.
     */
    Uni<ApiKey> reactivate(Principal service, KeyId keyId, Principal caller);

    /**
     * Replaces the key's daily limit without touching today's count. Role: service authority.
     */
    Uni<ApiKey> updateRateLimit(Principal service, KeyId keyId, Principal caller, long newLimit);

    /**
     * Replaces the key's scopes. Role: service authority.
     */
    Uni<ApiKey> updateScopes(Principal service, KeyId keyId, Principal caller, List<String> newScopes);

    /**
     * Sets a new expiration, which must be in the future. Role: service authority.
     */
    Uni<ApiKey> extendExpiration(Principal service, KeyId keyId, Principal caller, long newExpiresAt);

    /**
     * Gets a key by identity.
     *
     * @return Uni with the key, failing with {@code KEY_NOT_FOUND} if absent
     */
    Uni<ApiKey> get(KeyId keyId);

    /**
     * Lists a service's keys by sequence.
     *
     * @return Uni with the keys, failing with {@code SERVICE_NOT_FOUND} if the service is absent
     */
    Uni<List<ApiKey>> list(Principal service);
}
