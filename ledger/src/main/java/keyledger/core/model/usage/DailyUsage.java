package keyledger.core.model.usage;

/**
 * Usage counters of one API key.
 *
 * <p>{@link #admit(long, long)} is the whole daily rate-limit algorithm: a pure
 * transition from the current counters, the key's limit and the current time
 * to a decision carrying the next counters.
 *
 * @param requestsToday  requests counted in {@code lastRequestDay}
 * @param totalRequests  lifetime request count, saturating at {@link Long#MAX_VALUE}
 * @param lastRequestDay day number of the last counted request (0 before the first)
 */
public record DailyUsage(long requestsToday, long totalRequests, long lastRequestDay) {

    private static final DailyUsage NONE = new DailyUsage(0, 0, 0);

    public DailyUsage {
        if (requestsToday < 0) {
            throw new IllegalArgumentException("requestsToday cannot be negative: " + requestsToday);
        }
        if (totalRequests < 0) {
            throw new IllegalArgumentException("totalRequests cannot be negative: " + totalRequests);
        }
    }

    /**
     * Counters of a freshly created key.
     */
    public static DailyUsage none() {
        return NONE;
    }

    /**
     * Applies day rollover, then admits one request if {@code requestsToday < rateLimit}.
     *
     * <p>Rollover is lazy: a later day resets {@code requestsToday} once, however
     * many days were skipped. An earlier day (clock moved backwards) never
     * rolls back {@code lastRequestDay}. A rejected decision carries these
     * counters unchanged, rollover included.
     *
     * @param rateLimit       exclusive daily ceiling
     * @param nowEpochSeconds current time, any value
     * @return the decision
     */
    public UsageDecision admit(long rateLimit, long nowEpochSeconds) {
        long currentDay = DayBucket.dayOf(nowEpochSeconds);

        long today = requestsToday;
        long day = lastRequestDay;
        if (currentDay > lastRequestDay) {
            today = 0;
            day = currentDay;
        }

        if (today >= rateLimit) {
            return UsageDecision.rejected(this, rateLimit, currentDay);
        }

        var next = new DailyUsage(today + 1, saturatingIncrement(totalRequests), day);
        return UsageDecision.admitted(next, rateLimit, currentDay);
    }

    private static long saturatingIncrement(long value) {
        return value == Long.MAX_VALUE ? Long.MAX_VALUE : value + 1;
    }
}
