package keyledger.core.port.out;

/**
 * Port interface for the wall clock.
 */
public interface ClockSource {

    /**
     * Current time as whole seconds since the Unix epoch.
     *
     * <p>Any value, including zero and negative values, is valid.
     *
     * @return the current epoch second
     */
    long nowEpochSeconds();
}
