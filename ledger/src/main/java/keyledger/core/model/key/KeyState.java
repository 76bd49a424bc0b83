package keyledger.core.model.key;

/**
 * Lifecycle state of an API key.
 *
 * <pre>
 * ACTIVE ⇄ INACTIVE
 * </pre>
 *
 * <ul>
 *   <li>{@link #ACTIVE} - Usage can be recorded and scopes validated</li>
 *   <li>{@link #INACTIVE} - Revoked; may be reactivated while unexpired</li>
 * </ul>
 */
public enum KeyState {
    ACTIVE,
    INACTIVE
}
