package com.relay.control;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

public final class Deadline {

    private static final Deadline NONE = new Deadline(null, Clock.systemUTC());

    private final Instant expiresAt;
    private final Clock clock;

    private Deadline(Instant expiresAt, Clock clock) {
        this.expiresAt = expiresAt;
        this.clock = clock;
    }

    public static Deadline after(Duration timeout) {
        return after(timeout, Clock.systemUTC());
    }

    public static Deadline after(Duration timeout, Clock clock) {
        return new Deadline(clock.instant().plus(timeout), clock);
    }

    public static Deadline none() {
        return NONE;
    }

    public boolean isExpired() {
        return expiresAt != null && !clock.instant().isBefore(expiresAt);
    }

    public boolean allows(Duration wait) {
        if (expiresAt == null) {
            return true;
        }
        return !clock.instant().plus(wait).isAfter(expiresAt);
    }

    public Duration cap(Duration timeout) {
        if (expiresAt == null) {
            return timeout;
        }
        Duration remaining = Duration.between(clock.instant(), expiresAt);
        if (remaining.isNegative()) {
            return Duration.ZERO;
        }
        return remaining.compareTo(timeout) < 0 ? remaining : timeout;
    }

    @Override
    public String toString() {
        return expiresAt == null ? "Deadline{none}" : "Deadline{" + expiresAt + "}";
    }
}
