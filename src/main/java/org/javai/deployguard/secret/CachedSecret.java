package org.javai.deployguard.secret;

import java.time.Instant;
import java.util.Objects;

/**
 * A secret value and the instant after which it must be fetched again.
 */
record CachedSecret(String value, Instant expiresAt) {

    CachedSecret {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(expiresAt, "expiresAt must not be null");
    }

    boolean isFreshAt(Instant now) {
        return now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "CachedSecret[value=****, expiresAt=" + expiresAt + "]";
    }
}
