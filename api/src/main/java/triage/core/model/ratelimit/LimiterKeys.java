package triage.core.model.ratelimit;

/**
 * Store keys for one subject and operation at a given instant.
 *
 * <p>Window keys embed the window index so a new minute or hour starts a fresh counter. All
 * three keys share the hash tag {@code {subjectId:operation}}, so they land in one Redis Cluster
 * slot and can be touched by a single script.
 *
 * @param bucket token bucket key
 * @param minuteWindow minute window counter key
 * @param hourWindow hour window counter key
 */
public record LimiterKeys(String bucket, String minuteWindow, String hourWindow) {

    /**
     * Build the keys for a subject and operation.
     *
     * @param prefix key prefix, for example {@code triage:ratelimit:}
     * @param subjectId opaque subject identifier
     * @param operation operation wire value
     * @param nowMillis current time in epoch milliseconds
     * @return the keys
     */
    public static LimiterKeys of(String prefix, String subjectId, String operation, long nowMillis) {
        final var epochMinute = nowMillis / 60_000L;
        final var epochHour = nowMillis / 3_600_000L;
        final var scope = prefix + "{" + subjectId + ":" + operation + "}";
        return new LimiterKeys(scope + ":tb", scope + ":minute:" + epochMinute, scope + ":hour:" + epochHour);
    }
}
