package keyledger.core.model.usage;

/**
 * Fixed UTC-day buckets used as the rate-limit reset boundary.
 */
public final class DayBucket {

    public static final long SECONDS_PER_DAY = 86_400L;

    private DayBucket() {}

    /**
     * Day number of a timestamp: {@code floor(epochSeconds / 86400)}.
     *
     * <p>Rounds toward negative infinity, so times before the epoch fall into
     * negative days rather than day zero.
     *
     * @param epochSeconds seconds since the Unix epoch, any value
     * @return the day number
     */
    public static long dayOf(long epochSeconds) {
        return Math.floorDiv(epochSeconds, SECONDS_PER_DAY);
    }
}
