package keyledger.core.model.key;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import keyledger.core.model.Principal;
import keyledger.core.model.usage.DailyUsage;

@DisplayName("ApiKey")
class ApiKeyTest {

    private static final KeyId KEY_ID = new KeyId(Principal.of("service"), Principal.of("alice"), 0);

    private static ApiKey keyWithScopes(String... scopes) {
        return ApiKey.builder(KEY_ID).name("key").scopes(List.of(scopes)).rateLimit(10).build();
    }

    @Nested
    @DisplayName("Scopes")
    class ScopeTests {

        @Test
        @DisplayName("should grant a scope listed verbatim")
        void shouldGrantListedScope() {
            assertTrue(keyWithScopes("read").grants("read"));
        }

        @Test
        @DisplayName("should grant any scope through the wildcard")
        void shouldGrantThroughWildcard() {
            var key = keyWithScopes("read", "*");

            assertTrue(key.grants("write"));
            assertTrue(key.grants("read"));
        }

        @Test
        @DisplayName("should not grant unlisted scopes")
        void shouldNotGrantUnlistedScope() {
            assertFalse(keyWithScopes("read").grants("write"));
            assertFalse(keyWithScopes().grants("read"));
        }

        @Test
        @DisplayName("should match exactly, without glob or prefix semantics")
        void shouldMatchExactly() {
            assertFalse(keyWithScopes("read*").grants("read:all"));
            assertFalse(keyWithScopes("read").grants("READ"));
            assertFalse(keyWithScopes("read").grants("*"));
        }

        @Test
        @DisplayName("should keep a defensive copy of scopes")
        void shouldCopyScopes() {
            var scopes = new ArrayList<>(List.of("read"));
            var key = ApiKey.builder(KEY_ID).name("key").scopes(scopes).build();

            scopes.add("write");

            assertEquals(List.of("read"), key.scopes());
        }
    }

    @Nested
    @DisplayName("Expiration")
    class ExpirationTests {

        @Test
        @DisplayName("should never expire without an expiration")
        void shouldNeverExpire() {
            var key = keyWithScopes();

            assertFalse(key.isExpiredAt(Long.MAX_VALUE));
            assertEquals(OptionalLong.empty(), key.expiration().expiresAt());
        }

        @Test
        @DisplayName("should expire at the expiration second")
        void shouldExpireAtBoundary() {
            var key = keyWithScopes().withExpiration(Expiration.at(1000));

            assertFalse(key.isExpiredAt(999));
            assertTrue(key.isExpiredAt(1000));
            assertTrue(key.isExpiredAt(1001));
        }

        @Test
        @DisplayName("should expose the instant of a timed expiration")
        void shouldExposeExpirationInstant() {
            var expiration = Expiration.at(1000);

            assertEquals(OptionalLong.of(1000), expiration.expiresAt());
            assertEquals(1000, ((Expiration.At) expiration).epochSeconds());
        }

        @Test
        @DisplayName("should only be after a time strictly earlier than it")
        void shouldCompareStrictly() {
            assertTrue(Expiration.at(1000).isAfter(999));
            assertFalse(Expiration.at(1000).isAfter(1000));
            assertTrue(Expiration.never().isAfter(Long.MAX_VALUE));
        }
    }

    @Nested
    @DisplayName("Transitions")
    class TransitionTests {

        @Test
        @DisplayName("should default to an active key with empty usage")
        void shouldApplyDefaults() {
            var key = new ApiKey(KEY_ID, "key", null, 5, null, 0, null, null);

            assertTrue(key.isActive());
            assertEquals(DailyUsage.none(), key.usage());
            assertEquals(List.of(), key.scopes());
            assertEquals(Expiration.never(), key.expiration());
        }

        @Test
        @DisplayName("should leave the original untouched when changing state")
        void shouldBeImmutable() {
            var key = keyWithScopes("read");

            var revoked = key.withState(KeyState.INACTIVE);

            assertTrue(key.isActive());
            assertFalse(revoked.isActive());
            assertEquals(key.id(), revoked.id());
            assertEquals(key.scopes(), revoked.scopes());
        }

        @Test
        @DisplayName("should expose identity parts")
        void shouldExposeIdentity() {
            var key = keyWithScopes();

            assertEquals(Principal.of("service"), key.service());
            assertEquals(Principal.of("alice"), key.owner());
            assertEquals(0, key.sequence());
        }

        @Test
        @DisplayName("should reject a negative rate limit")
        void shouldRejectNegativeRateLimit() {
            assertThrows(IllegalArgumentException.class, () -> keyWithScopes().withRateLimit(-1));
        }

        @Test
        @DisplayName("should reject a negative sequence")
        void shouldRejectNegativeSequence() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> new KeyId(Principal.of("service"), Principal.of("alice"), -1));
        }
    }
}
