package keyledger.adapter.out.clock;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;

import keyledger.core.port.out.ClockSource;

/**
 * Clock source backed by the system UTC clock.
 */
@ApplicationScoped
public class SystemClockSource implements ClockSource {

    private final Clock clock;

    public SystemClockSource() {
        this(Clock.systemUTC());
    }

    SystemClockSource(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long nowEpochSeconds() {
        return clock.instant().getEpochSecond();
    }
}
