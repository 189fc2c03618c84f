package agentmesh.coordinator.util;

import java.time.Duration;
import java.util.Objects;

/**
 * {@code base * 2^exponent}, capped. Shared by task retries and probe backoff.
 */
public final class ExponentialBackoff {

    private final Duration base;
    private final Duration cap;

    public ExponentialBackoff(Duration base, Duration cap) {
        this.base = Objects.requireNonNull(base, "base");
        this.cap = Objects.requireNonNull(cap, "cap");
        if (base.isNegative() || cap.isNegative()) {
            throw new IllegalArgumentException("backoff durations must not be negative");
        }
    }

    public Duration delay(int exponent) {
        if (exponent < 0) {
            throw new IllegalArgumentException("exponent must not be negative");
        }
        long baseMs = base.toMillis();
        long capMs = cap.toMillis();
        // beyond 2^62 the multiplication overflows; the cap applies long before
        if (exponent >= 62 || baseMs > (capMs >> Math.min(exponent, 62))) {
            return cap;
        }
        return Duration.ofMillis(Math.min(capMs, baseMs << exponent));
    }

    public Duration base() {
        return base;
    }

    public Duration cap() {
        return cap;
    }

    @Override
    public String toString() {
        return "ExponentialBackoff{base=" + base + ", cap=" + cap + "}";
    }
}
