package keyledger.core.model.auth;

import keyledger.core.model.Principal;
import keyledger.core.model.key.ApiKey;
import keyledger.core.model.service.Service;

/**
 * Identity a caller must prove to run an operation.
 *
 * <p>A capability check over the identities involved, not a hierarchy.
 */
public enum Role {

    /** The caller is the service's authority. */
    AUTHORITY {
        @Override
        public boolean permits(Service service, ApiKey key, Principal caller) {
            return service.isAuthority(caller);
        }
    },

    /** The caller owns the key or is the service's authority. */
    OWNER_OR_AUTHORITY {
        @Override
        public boolean permits(Service service, ApiKey key, Principal caller) {
            return key.owner().equals(caller) || service.isAuthority(caller);
        }
    };

    /**
     * Whether {@code caller} holds this role for {@code key} under {@code service}.
     *
     * @param service the owning service
     * @param key     the key being acted on
     * @param caller  the verified identity of the caller
     * @return true if permitted
     */
    public abstract boolean permits(Service service, ApiKey key, Principal caller);
}
