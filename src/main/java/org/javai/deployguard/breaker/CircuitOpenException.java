package org.javai.deployguard.breaker;

import java.time.Duration;
import java.util.Objects;

/**
 * Thrown instead of running an operation when its circuit breaker refuses the call.
 * The operation was not attempted; the dependency is being given time to recover.
 */
public class CircuitOpenException extends Exception {

    /**
     * Why the call was refused.
     */
    public enum Reason {
        OPEN("open"),
        HALF_OPEN_LIMIT_REACHED("half_open_limit");

        private final String code;

        Reason(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }

    private final String breakerName;
    private final Reason reason;
    private final Duration remainingCooldown;

    public CircuitOpenException(String breakerName, Reason reason, Duration remainingCooldown) {
        super(messageFor(breakerName, reason, remainingCooldown));
        this.breakerName = Objects.requireNonNull(breakerName, "breakerName must not be null");
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.remainingCooldown = Objects.requireNonNull(remainingCooldown, "remainingCooldown must not be null");
    }

    public String breakerName() {
        return breakerName;
    }

    public Reason reason() {
        return reason;
    }

    /**
     * @return time until the breaker admits probe calls; zero when half-open
     */
    public Duration remainingCooldown() {
        return remainingCooldown;
    }

    private static String messageFor(String name, Reason reason, Duration remaining) {
        return switch (reason) {
            case OPEN -> "Circuit breaker '" + name + "' is OPEN; dependency unavailable for another "
                    + remaining.toMillis() + "ms";
            case HALF_OPEN_LIMIT_REACHED -> "Circuit breaker '" + name + "' is HALF_OPEN and at probe capacity";
        };
    }
}
