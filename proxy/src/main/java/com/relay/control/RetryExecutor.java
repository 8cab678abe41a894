package com.relay.control;

import com.relay.exception.RetryCancelledException;
import com.relay.exception.RetryExhaustedException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;

@Slf4j
public class RetryExecutor {

    private static final double JITTER_FRACTION = 0.05;

    private final Sleeper sleeper;

    public RetryExecutor() {
        this(duration -> Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000));
    }

    RetryExecutor(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    public void run(Deadline deadline, RetryPolicy policy, CheckedRunnable fn) throws Exception {
        call(deadline, policy, () -> {
            fn.run();
            return null;
        });
    }

    public <T> T call(Deadline deadline, RetryPolicy policy, Callable<T> fn) throws Exception {
        int maxAttempts = Math.max(1, policy.getMaxAttempts());
        Exception lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return fn.call();
            } catch (Exception e) {
                lastFailure = e;

                if (e instanceof RetryCancelledException || !policy.isRetryable(e)) {
                    throw e;
                }

                if (deadline.isExpired()) {
                    throw new RetryCancelledException("Retry cancelled: deadline exceeded", e);
                }

                if (attempt == maxAttempts) {
                    break;
                }

                Duration delay = computeDelay(attempt, policy, ThreadLocalRandom.current());
                log.warn("Attempt {}/{} failed: {} - retrying in {}ms",
                        attempt, maxAttempts, e.getMessage(), delay.toMillis());
                await(deadline, delay);
            }
        }

        throw new RetryExhaustedException(maxAttempts, lastFailure);
    }

    private void await(Deadline deadline, Duration delay) {
        if (deadline.isExpired() || !deadline.allows(delay)) {
            throw new RetryCancelledException("Retry cancelled: deadline exceeded");
        }

        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetryCancelledException("Retry cancelled: interrupted", e);
        }
    }

    static Duration computeDelay(int attempt, RetryPolicy policy, Random random) {
        double delay = policy.getInitialDelay().toNanos() * Math.pow(policy.getMultiplier(), attempt - 1);

        double max = policy.getMaxDelay().toNanos();
        if (delay > max) {
            delay = max;
        }

        if (policy.isJitter()) {
            double factor = (random.nextDouble() * 2 - 1) * JITTER_FRACTION;
            delay += delay * factor;
        }

        return Duration.ofNanos((long) delay);
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}
