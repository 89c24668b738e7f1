package com.qubi.netmap.core.runtime;

import java.time.Duration;

public record TransportSettings(
        int reconnectAttempts,      // reintentos seguidos antes de rendirse
        Duration baseBackoff,
        Duration maxBackoff,
        Duration pullInterval
) {
    public static final TransportSettings DEFAULTS = new TransportSettings(
            5, Duration.ofSeconds(1), Duration.ofSeconds(30), Duration.ofSeconds(30));

    public TransportSettings {
        if (reconnectAttempts < 0) throw new IllegalArgumentException("reconnectAttempts < 0");
        if (pullInterval.isZero() || pullInterval.isNegative()) {
            throw new IllegalArgumentException("pullInterval must be positive");
        }
    }

    /** Delay before retry number {@code attempt} (1-based): base * 2^(attempt-1), capped. */
    public long backoffMillis(int attempt) {
        long base = Math.max(1L, baseBackoff.toMillis());
        int shift = Math.min(Math.max(0, attempt - 1), 30);
        long delay = base << shift;
        if (delay <= 0 || delay > maxBackoff.toMillis()) delay = maxBackoff.toMillis();
        return delay;
    }
}
