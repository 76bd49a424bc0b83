package keyledger.core.model.key;

import java.util.OptionalLong;

/**
 * Expiration of an API key: either never, or at a fixed epoch second.
 */
public sealed interface Expiration {

    record Never() implements Expiration {}

    record At(long epochSeconds) implements Expiration {}

    static Expiration never() {
        return new Never();
    }

    static Expiration at(long epochSeconds) {
        return new At(epochSeconds);
    }

    /**
     * A key expires at the first second equal to or after its expiration.
     *
     * @param nowEpochSeconds the current time
     * @return true if the key can no longer be used at {@code nowEpochSeconds}
     */
    default boolean isExpiredAt(long nowEpochSeconds) {
        return this instanceof At at && nowEpochSeconds >= at.epochSeconds();
    }

    /**
     * Whether this expiration lies strictly after {@code nowEpochSeconds}.
     * {@link Never} always does.
     */
    default boolean isAfter(long nowEpochSeconds) {
        return !(this instanceof At at) || at.epochSeconds() > nowEpochSeconds;
    }

    /**
     * The expiration instant in epoch seconds, empty for {@link Never}.
     */
    default OptionalLong expiresAt() {
        return this instanceof At at ? OptionalLong.of(at.epochSeconds()) : OptionalLong.empty();
    }
}
