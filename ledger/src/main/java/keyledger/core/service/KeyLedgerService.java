package keyledger.core.service;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import keyledger.core.model.LedgerLimits;
import keyledger.core.model.Principal;
import keyledger.core.model.auth.Role;
import keyledger.core.model.error.LedgerError;
import keyledger.core.model.error.LedgerException;
import keyledger.core.model.key.ApiKey;
import keyledger.core.model.key.Expiration;
import keyledger.core.model.key.KeyId;
import keyledger.core.model.key.KeyState;
import keyledger.core.model.key.NewKey;
import keyledger.core.model.service.Service;
import keyledger.core.model.usage.UsageDecision;
import keyledger.core.port.in.KeyManagement;
import keyledger.core.port.out.ClockSource;
import keyledger.core.port.out.LedgerMetrics;
import keyledger.core.port.out.LedgerStore;
import keyledger.core.port.out.LedgerTransaction;

/**
 * Issues API keys and enforces their lifecycle, scopes and daily limits.
 *
 * <p>Each operation runs as a single store transaction. All preconditions are
 * checked before anything is staged, and the store discards staged writes
 * when an operation throws, so a rejected call leaves both the key and its
 * service untouched.
 */
@ApplicationScoped
public class KeyLedgerService implements KeyManagement {

    private static final Logger LOG = Logger.getLogger(KeyLedgerService.class);

    private final LedgerStore store;
    private final ClockSource clock;
    private final OperationObserver observer;

    @Inject
    public KeyLedgerService(LedgerStore store, ClockSource clock, LedgerMetrics metrics) {
        this.store = store;
        this.clock = clock;
        this.observer = new OperationObserver(metrics, LOG);
    }

    @Override
    public Uni<ApiKey> create(Principal service, Principal owner, NewKey request) {
        return observer.observe("create_key", store.inTransaction(tx -> {
            var issuer = requireService(tx, service);

            LedgerLimits.requireValidName(request.name());
            LedgerLimits.requireValidScopes(request.scopes());

            long now = clock.nowEpochSeconds();
            requireFuture(request.expiration(), now);

            var key = ApiKey.builder(new KeyId(issuer.authority(), owner, issuer.nextSequence()))
                    .name(request.name())
                    .scopes(request.scopes())
                    .rateLimit(request.rateLimit().orElse(issuer.defaultRateLimit()))
                    .createdAt(now)
                    .expiration(request.expiration())
                    .state(KeyState.ACTIVE)
                    .build();

            tx.insertKey(key);
            tx.updateService(issuer.withKeyIssued());
            return key;
        }))
                .invoke(key -> LOG.infov("API key ''{0}'' created for {1} ({2})", key.name(), key.owner(), key.id()));
    }

    @Override
    public Uni<UsageDecision> recordRequest(Principal service, KeyId keyId, Principal caller) {
        return observer.observe("record_request", store.inTransaction(tx -> {
            var target = load(tx, service, keyId, caller, Role.AUTHORITY);
            var key = target.key();
            long now = clock.nowEpochSeconds();

            requireUsable(key, now);

            var decision = key.usage().admit(key.rateLimit(), now);
            if (!decision.admitted()) {
                throw new LedgerException(
                        LedgerError.RATE_LIMIT_EXCEEDED, key.requestsToday() + "/" + key.rateLimit() + " today");
            }

            tx.updateKey(key.withUsage(decision.usage()));
            return decision;
        }))
                .invoke(decision -> LOG.debugv(
                        "Request recorded for {0}. Today: {1}/{2}",
                        keyId, decision.usage().requestsToday(), decision.rateLimit()));
    }

    @Override
    public Uni<ApiKey> validateScope(Principal service, KeyId keyId, String requiredScope) {
        return observer.observe("validate_scope", store.inTransaction(tx -> {
            var key = load(tx, service, keyId).key();

            requireUsable(key, clock.nowEpochSeconds());
            if (!key.grants(requiredScope)) {
                throw new LedgerException(LedgerError.INSUFFICIENT_PERMISSIONS, requiredScope);
            }
            return key;
        }))
                .invoke(key -> LOG.debugv("Scope ''{0}'' validated for key ''{1}''", requiredScope, key.name()));
    }

    @Override
    public Uni<ApiKey> revoke(Principal service, KeyId keyId, Principal caller) {
        return observer.observe("revoke_key", store.inTransaction(tx -> {
            var target = load(tx, service, keyId, caller, Role.OWNER_OR_AUTHORITY);
            var key = target.key();

            if (!key.isActive()) {
                throw new LedgerException(LedgerError.KEY_ALREADY_REVOKED, keyId.toString());
            }

            var revoked = key.withState(KeyState.INACTIVE);
            tx.updateKey(revoked);
            tx.updateService(target.service().withKeyDeactivated());
            return revoked;
        }))
                .invoke(key -> LOG.infov("API key ''{0}'' has been revoked by {1}", key.name(), caller));
    }

    @Override
    public Uni<ApiKey> reactivate(Principal service, KeyId keyId, Principal caller) {
        return observer.observe("reactivate_key", store.inTransaction(tx -> {
            var target = load(tx, service, keyId, caller, Role.OWNER_OR_AUTHORITY);
            var key = target.key();

            if (key.isActive()) {
                throw new LedgerException(LedgerError.KEY_ALREADY_ACTIVE, keyId.toString());
            }
            if (key.isExpiredAt(clock.nowEpochSeconds())) {
                throw new LedgerException(LedgerError.KEY_EXPIRED, keyId.toString());
            }

            var reactivated = key.withState(KeyState.ACTIVE);
            tx.updateKey(reactivated);
            tx.updateService(target.service().withKeyReactivated());
            return reactivated;
        }))
                .invoke(key -> LOG.infov("API key ''{0}'' has been reactivated by {1}", key.name(), caller));
    }

    @Override
    public Uni<ApiKey> updateRateLimit(Principal service, KeyId keyId, Principal caller, long newLimit) {
        return observer.observe("update_rate_limit", store.inTransaction(tx -> {
            LedgerLimits.requireNonNegativeLimit(newLimit);
            var key = load(tx, service, keyId, caller, Role.AUTHORITY).key();

            // requestsToday is kept even when it already exceeds the new limit
            var updated = key.withRateLimit(newLimit);
            tx.updateKey(updated);
            return updated;
        }))
                .invoke(key -> LOG.infov("Rate limit set to {0}/day for key ''{1}''", key.rateLimit(), key.name()));
    }

    @Override
    public Uni<ApiKey> updateScopes(Principal service, KeyId keyId, Principal caller, List<String> newScopes) {
        return observer.observe("update_scopes", store.inTransaction(tx -> {
            var key = load(tx, service, keyId, caller, Role.AUTHORITY).key();

            LedgerLimits.requireValidScopes(newScopes);

            var updated = key.withScopes(newScopes);
            tx.updateKey(updated);
            return updated;
        }))
                .invoke(key -> LOG.infov("Scopes updated for key ''{0}'': {1}", key.name(), key.scopes()));
    }

    @Override
    public Uni<ApiKey> extendExpiration(Principal service, KeyId keyId, Principal caller, long newExpiresAt) {
        return observer.observe("extend_expiration", store.inTransaction(tx -> {
            var key = load(tx, service, keyId, caller, Role.AUTHORITY).key();

            var expiration = Expiration.at(newExpiresAt);
            requireFuture(expiration, clock.nowEpochSeconds());

            var updated = key.withExpiration(expiration);
            tx.updateKey(updated);
            return updated;
        }))
                .invoke(key -> LOG.infov("Expiration set to {0} for key ''{1}''", newExpiresAt, key.name()));
    }

    @Override
    public Uni<ApiKey> get(KeyId keyId) {
        return observer.observe("get_key", store.findKey(keyId)
                .map(found -> found.orElseThrow(
                        () -> new LedgerException(LedgerError.KEY_NOT_FOUND, keyId.toString()))));
    }

    @Override
    public Uni<List<ApiKey>> list(Principal service) {
        return observer.observe("list_keys", store.findService(service).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().failure(new LedgerException(LedgerError.SERVICE_NOT_FOUND, service.id()));
            }
            return store.findKeys(service);
        }));
    }

    /**
     * A key together with the service it was loaded under.
     */
    private record Target(Service service, ApiKey key) {}

    private Target load(LedgerTransaction tx, Principal service, KeyId keyId, Principal caller, Role role) {
        var target = load(tx, service, keyId);
        if (!role.permits(target.service(), target.key(), caller)) {
            throw new LedgerException(LedgerError.UNAUTHORIZED, caller + " is not " + role);
        }
        return target;
    }

    private Target load(LedgerTransaction tx, Principal service, KeyId keyId) {
        var owner = requireService(tx, service);
        var key = tx.key(keyId)
                .orElseThrow(() -> new LedgerException(LedgerError.KEY_NOT_FOUND, keyId.toString()));
        if (!key.service().equals(owner.authority())) {
            throw new LedgerException(LedgerError.SERVICE_MISMATCH, keyId + " is not issued by " + service);
        }
        return new Target(owner, key);
    }

    private static Service requireService(LedgerTransaction tx, Principal service) {
        return tx.service(service)
                .orElseThrow(() -> new LedgerException(LedgerError.SERVICE_NOT_FOUND, service.id()));
    }

    private static void requireUsable(ApiKey key, long now) {
        if (!key.isActive()) {
            throw new LedgerException(LedgerError.KEY_INACTIVE, key.id().toString());
        }
        if (key.isExpiredAt(now)) {
            throw new LedgerException(LedgerError.KEY_EXPIRED, key.id().toString());
        }
    }

    private static void requireFuture(Expiration expiration, long now) {
        if (!expiration.isAfter(now)) {
            throw new LedgerException(LedgerError.EXPIRATION_IN_PAST, expiration.toString());
        }
    }
}
