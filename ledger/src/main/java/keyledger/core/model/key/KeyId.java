package keyledger.core.model.key;

import keyledger.core.model.Principal;

/**
 * Unique identity of an API key record.
 *
 * @param service  authority of the owning service
 * @param owner    principal the key was issued to
 * @param sequence the service's key count when the key was created
 */
public record KeyId(Principal service, Principal owner, long sequence) {

    public KeyId {
        if (service == null) {
            throw new IllegalArgumentException("Service cannot be null");
        }
        if (owner == null) {
            throw new IllegalArgumentException("Owner cannot be null");
        }
        if (sequence < 0) {
            throw new IllegalArgumentException("Sequence cannot be negative: " + sequence);
        }
    }

    @Override
    public String toString() {
        return service + "/" + owner + "/" + sequence;
    }
}
