package com.pocketping.common.infra;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Backoff delay computation.
 */
public final class Backoff {

    private Backoff() {
    }

    /**
     * Backoff policy configuration.
     *
     * @param initialMs   delay before the first retry in milliseconds
     * @param maxMs       maximum delay in milliseconds
     * @param factor      multiplicative factor per attempt; {@code 1.0} with
     *                    {@code linear} makes the delay grow by {@code initialMs}
     * @param jitter      jitter ratio (0..1)
     * @param linear      grow by adding {@code initialMs} each attempt instead of
     *                    multiplying
     * @param maxAttempts attempts allowed before giving up
     */
    public record Policy(long initialMs, long maxMs, double factor, double jitter, boolean linear, int maxAttempts) {

        /** Discord gateway reconnects: 5s, 10s, 15s, 20s, 25s. */
        public static final Policy GATEWAY_RECONNECT = new Policy(5_000, 60_000, 1.0, 0.0, true, 5);

        /** Linear policy with a custom step (for testing). */
        public static Policy linear(long stepMs, int maxAttempts) {
            return new Policy(stepMs, Long.MAX_VALUE, 1.0, 0.0, true, maxAttempts);
        }

        public boolean exhausted(int attempt) {
            return attempt > maxAttempts;
        }
    }

    /**
     * Compute the backoff delay for a given attempt.
     *
     * @param policy  backoff policy
     * @param attempt 1-based attempt number
     * @return delay in milliseconds (capped at {@code policy.maxMs})
     */
    public static long compute(Policy policy, int attempt) {
        int n = Math.max(attempt, 1);
        double base = policy.linear()
                ? (double) policy.initialMs() * n
                : policy.initialMs() * Math.pow(policy.factor(), n - 1);
        double jitter = base * policy.jitter() * ThreadLocalRandom.current().nextDouble();
        return Math.min(policy.maxMs(), Math.round(base + jitter));
    }
}
