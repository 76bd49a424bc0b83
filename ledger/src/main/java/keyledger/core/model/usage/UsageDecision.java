package keyledger.core.model.usage;

/**
 * Result of admitting one request against a key's daily limit.
 *
 * @param admitted   whether the request was counted
 * @param usage      counters to store (unchanged input counters when rejected)
 * @param rateLimit  the ceiling the decision was made against
 * @param currentDay day number the decision was made in
 */
public record UsageDecision(boolean admitted, DailyUsage usage, long rateLimit, long currentDay) {

    public static UsageDecision admitted(DailyUsage usage, long rateLimit, long currentDay) {
        return new UsageDecision(true, usage, rateLimit, currentDay);
    }

    public static UsageDecision rejected(DailyUsage usage, long rateLimit, long currentDay) {
        return new UsageDecision(false, usage, rateLimit, currentDay);
    }

    /**
     * Requests still admissible today after this decision.
     *
     * @return remaining allowance, 0 when rejected
     */
    public long remaining() {
        if (!admitted) {
            return 0;
        }
        return Math.max(0, rateLimit - usage.requestsToday());
    }

    /**
     * Epoch second at which the current day bucket ends, clamped to {@link Long#MAX_VALUE}.
     */
    public long resetsAtEpochSeconds() {
        if (currentDay >= Long.MAX_VALUE / DayBucket.SECONDS_PER_DAY) {
            return Long.MAX_VALUE;
        }
        return (currentDay + 1) * DayBucket.SECONDS_PER_DAY;
    }
}
