package keyledger.core.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Optional;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LedgerConfig")
class LedgerConfigTest {

    private static LedgerConfig load(Map<String, String> properties) {
        return new SmallRyeConfigBuilder()
                .withMapping(LedgerConfig.class)
                .withSources(new PropertiesConfigSource(properties, "test", 100))
                .build()
                .getConfigMapping(LedgerConfig.class);
    }

    @Test
    @DisplayName("should apply defaults when nothing is set")
    void shouldApplyDefaults() {
        var config = load(Map.of());

        assertEquals(1000, config.service().defaultRateLimit());
        assertEquals(Optional.empty(), config.storage().provider());
        assertTrue(config.metrics().enabled());
    }

    @Test
    @DisplayName("should read overridden properties")
    void shouldReadOverrides() {
        var config = load(Map.of(
                "keyledger.service.default-rate-limit", "25",
                "keyledger.storage.provider", "memory",
                "keyledger.metrics.enabled", "false"));

        assertEquals(25, config.service().defaultRateLimit());
        assertEquals(Optional.of("memory"), config.storage().provider());
        assertFalse(config.metrics().enabled());
    }
}
