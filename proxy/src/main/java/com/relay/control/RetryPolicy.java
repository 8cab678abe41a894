package com.relay.control;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Set;
import java.util.function.Predicate;

@Value
@Builder(toBuilder = true)
public class RetryPolicy {

    public static final Set<Integer> RETRYABLE_HTTP_STATUSES = Set.of(408, 429, 500, 502, 503, 504);

    @Builder.Default
    int maxAttempts = 3;
    @Builder.Default
    Duration initialDelay = Duration.ofMillis(100);
    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(10);
    @Builder.Default
    double multiplier = 2.0;
    @Builder.Default
    boolean jitter = true;
    Predicate<Throwable> retryable;

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    public boolean isRetryable(Throwable failure) {
        if (failure == null) {
            return false;
        }
        return retryable == null || retryable.test(failure);
    }

    @SafeVarargs
    public static Predicate<Throwable> retryOn(Class<? extends Throwable>... types) {
        return failure -> {
            for (Throwable t = failure; t != null; t = t.getCause()) {
                for (Class<? extends Throwable> type : types) {
                    if (type.isInstance(t)) {
                        return true;
                    }
                }
                if (t.getCause() == t) {
                    break;
                }
            }
            return false;
        };
    }

    public static boolean isRetryableHttpStatus(int statusCode) {
        return RETRYABLE_HTTP_STATUSES.contains(statusCode);
    }
}
