package keyledger.core.model;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import keyledger.core.model.error.LedgerError;
import keyledger.core.model.error.LedgerException;

@DisplayName("LedgerLimits")
class LedgerLimitsTest {

    @Nested
    @DisplayName("Names")
    class NameTests {

        @Test
        @DisplayName("should accept names up to 32 bytes")
        void shouldAcceptNamesUpToLimit() {
            assertDoesNotThrow(() -> LedgerLimits.requireValidName(""));
            assertDoesNotThrow(() -> LedgerLimits.requireValidName("a".repeat(32)));
        }

        @Test
        @DisplayName("should reject names over 32 bytes")
        void shouldRejectLongNames() {
            var e = assertThrows(LedgerException.class, () -> LedgerLimits.requireValidName("a".repeat(33)));

            assertEquals(LedgerError.NAME_TOO_LONG, e.error());
        }

        @Test
        @DisplayName("should count multi-byte characters by their UTF-8 size")
        void shouldCountUtf8Bytes() {
            // 11 three-byte characters = 33 bytes
            var e = assertThrows(LedgerException.class, () -> LedgerLimits.requireValidName("鍵".repeat(11)));

            assertEquals(LedgerError.NAME_TOO_LONG, e.error());
            assertDoesNotThrow(() -> LedgerLimits.requireValidName("鍵".repeat(10)));
        }
    }

    @Nested
    @DisplayName("Scopes")
    class ScopeTests {

        @Test
        @DisplayName("should accept up to 8 scopes of up to 16 bytes")
        void shouldAcceptScopesWithinLimits() {
            assertDoesNotThrow(() -> LedgerLimits.requireValidScopes(List.of()));
            assertDoesNotThrow(() -> LedgerLimits.requireValidScopes(Collections.nCopies(8, "s".repeat(16))));
        }

        @Test
        @DisplayName("should reject a ninth scope")
        void shouldRejectTooManyScopes() {
            var e = assertThrows(
                    LedgerException.class, () -> LedgerLimits.requireValidScopes(Collections.nCopies(9, "r")));

            assertEquals(LedgerError.TOO_MANY_SCOPES, e.error());
        }

        @Test
        @DisplayName("should reject a scope over 16 bytes")
        void shouldRejectLongScope() {
            var e = assertThrows(
                    LedgerException.class,
                    () -> LedgerLimits.requireValidScopes(List.of("read", "x".repeat(17))));

            assertEquals(LedgerError.SCOPE_TOO_LONG, e.error());
        }

        @Test
        @DisplayName("should check the scope count before scope lengths")
        void shouldCheckCountFirst() {
            var scopes = Collections.nCopies(9, "x".repeat(17));

            var e = assertThrows(LedgerException.class, () -> LedgerLimits.requireValidScopes(scopes));

            assertEquals(LedgerError.TOO_MANY_SCOPES, e.error());
        }
    }

    @Test
    @DisplayName("should reject negative rate limits as programming errors")
    void shouldRejectNegativeLimits() {
        assertThrows(IllegalArgumentException.class, () -> LedgerLimits.requireNonNegativeLimit(-1));
        assertDoesNotThrow(() -> LedgerLimits.requireNonNegativeLimit(0));
        assertDoesNotThrow(() -> LedgerLimits.requireNonNegativeLimit(Long.MAX_VALUE));
    }
}
