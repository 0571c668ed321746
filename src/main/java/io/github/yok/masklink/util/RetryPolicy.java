package io.github.yok.masklink.util;

import com.google.common.base.Preconditions;
import io.github.yok.masklink.config.PipelineConfig;
import java.time.Duration;
import java.util.concurrent.Callable;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Explicit bounded retry policy applied by callers around an I/O operation.
 *
 * <p>
 * The delay before attempt {@code n + 1} is {@link #delayAfter(int) delayAfter(n)}:
 * </p>
 * <ul>
 * <li>fixed: always {@code initialDelay}</li>
 * <li>exponential: {@code initialDelay * 2^(n-1)}, capped at {@code maxDelay}</li>
 * </ul>
 *
 * <p>
 * Waits are not cancellable; an interrupt ends the retry loop, restores the interrupt flag and
 * rethrows the last failure.
 * </p>
 */
@Slf4j
@Getter
public final class RetryPolicy {

    /**
     * Blocking wait used between attempts (replaceable in tests).
     */
    @FunctionalInterface
    public interface Sleeper {

        /**
         * Blocks for the given duration.
         *
         * @param duration time to wait
         * @throws InterruptedException if interrupted while waiting
         */
        void sleep(Duration duration) throws InterruptedException;
    }

    /**
     * Sleeper backed by {@link Thread#sleep(long)}.
     */
    public static final Sleeper THREAD_SLEEPER = d -> Thread.sleep(d.toMillis());

    private final int maxAttempts;
    private final PipelineConfig.Backoff backoff;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final Sleeper sleeper;

    private RetryPolicy(int maxAttempts, PipelineConfig.Backoff backoff, Duration initialDelay,
            Duration maxDelay, Sleeper sleeper) {
        Preconditions.checkArgument(maxAttempts >= 1, "maxAttempts must be >= 1: %s",
                maxAttempts);
        Preconditions.checkNotNull(initialDelay, "initialDelay must not be null");
        Preconditions.checkNotNull(maxDelay, "maxDelay must not be null");
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.sleeper = sleeper;
    }

    /**
     * Creates a fixed-delay policy.
     *
     * @param maxAttempts maximum number of attempts (including the first)
     * @param delay delay between attempts
     * @return policy
     */
    public static RetryPolicy fixed(int maxAttempts, Duration delay) {
        return new RetryPolicy(maxAttempts, PipelineConfig.Backoff.FIXED, delay, delay,
                THREAD_SLEEPER);
    }

    /**
     * Creates an exponential-backoff policy.
     *
     * @param maxAttempts maximum number of attempts (including the first)
     * @param initialDelay first delay
     * @param maxDelay delay cap
     * @return policy
     */
    public static RetryPolicy exponential(int maxAttempts, Duration initialDelay,
            Duration maxDelay) {
        return new RetryPolicy(maxAttempts, PipelineConfig.Backoff.EXPONENTIAL, initialDelay,
                maxDelay, THREAD_SLEEPER);
    }

    /**
     * Creates a policy from configured settings.
     *
     * @param settings retry settings
     * @return policy
     */
    public static RetryPolicy from(PipelineConfig.RetrySettings settings) {
        return new RetryPolicy(settings.getMaxAttempts(), settings.getBackoff(),
                settings.getInitialDelay(), settings.getMaxDelay(), THREAD_SLEEPER);
    }

    /**
     * Returns a copy of this policy that waits with the given sleeper.
     *
     * @param replacement sleeper
     * @return policy
     */
    public RetryPolicy withSleeper(Sleeper replacement) {
        return new RetryPolicy(maxAttempts, backoff, initialDelay, maxDelay, replacement);
    }

    /**
     * Returns the delay to wait after the given failed attempt.
     *
     * @param attempt 1-based number of the attempt that just failed
     * @return delay before the next attempt
     */
    public Duration delayAfter(int attempt) {
        if (backoff == PipelineConfig.Backoff.FIXED) {
            return initialDelay;
        }
        Duration delay = initialDelay;
        for (int i = 1; i < attempt; i++) {
            delay = delay.multipliedBy(2);
            if (delay.compareTo(maxDelay) >= 0) {
                return maxDelay;
            }
        }
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    /**
     * Runs the operation, retrying on any exception until it succeeds or the attempts are
     * exhausted.
     *
     * @param <T> result type
     * @param description short description used in log messages
     * @param operation operation to run
     * @return the operation's result
     * @throws Exception the last failure once all attempts are exhausted
     */
    public <T> T execute(String description, Callable<T> operation) throws Exception {
        int attempt = 1;
        while (true) {
            try {
                return operation.call();
            } catch (Exception e) {
                if (attempt >= maxAttempts) {
                    log.error("{} failed after {} attempt(s): {}", description, attempt,
                            e.getMessage());
                    throw e;
                }
                Duration delay = delayAfter(attempt);
                log.warn("{} failed (attempt {}/{}), retrying in {} ms: {}", description, attempt,
                        maxAttempts, delay.toMillis(), e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(ie);
                    throw e;
                }
                attempt++;
            }
        }
    }
}
