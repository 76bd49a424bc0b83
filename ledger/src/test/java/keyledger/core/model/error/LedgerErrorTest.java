package keyledger.core.model.error;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LedgerError")
class LedgerErrorTest {

    @Test
    @DisplayName("should group codes by the layer that raises them")
    void shouldCategorize() {
        assertEquals(LedgerError.Category.INPUT, LedgerError.TOO_MANY_SCOPES.category());
        assertEquals(LedgerError.Category.STATE, LedgerError.RATE_LIMIT_EXCEEDED.category());
        assertEquals(LedgerError.Category.AUTHORIZATION, LedgerError.SERVICE_MISMATCH.category());
        assertEquals(LedgerError.Category.LOOKUP, LedgerError.KEY_NOT_FOUND.category());
    }

    @Test
    @DisplayName("should expose a lower-case tag for metrics")
    void shouldTag() {
        assertEquals("key_already_revoked", LedgerError.KEY_ALREADY_REVOKED.tag());
    }

    @Test
    @DisplayName("should carry the code and a detailed message")
    void shouldBuildException() {
        var e = new LedgerException(LedgerError.KEY_EXPIRED, "svc/alice/0");

        assertSame(LedgerError.KEY_EXPIRED, e.error());
        assertEquals("API key has expired: svc/alice/0", e.getMessage());
        assertEquals("API key has expired", new LedgerException(LedgerError.KEY_EXPIRED).getMessage());
    }
}
