package org.javai.deployguard.secret;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.deployguard.Failure;
import org.javai.deployguard.FailureCode;
import org.javai.deployguard.FailureType;
import org.javai.deployguard.Outcome;
import org.javai.deployguard.boundary.RetryClassifier;
import org.javai.deployguard.retry.RetryResult;
import org.javai.deployguard.retry.Retrier;
import org.javai.deployguard.toggle.Feature;
import org.javai.deployguard.toggle.FeatureToggles;

/**
 * Serves secrets from a remote store, caching each value for a fixed time to live.
 *
 * <p>Lookup order:</p>
 * <ol>
 *   <li>{@link Feature#USE_REMOTE_SECRET_STORE} off: the local source only.</li>
 *   <li>A cached value that has not expired.</li>
 *   <li>The remote store, through the retrier. Every store error counts as transient.</li>
 *   <li>The local source, when the store still fails or has no such secret.</li>
 * </ol>
 *
 * <p>Expired entries are evicted when they are next read. Two threads missing the same name at
 * once may both fetch it; the later value wins. Secret values are never logged.</p>
 */
public final class SecretCache {

    private static final Logger LOG = LogManager.getLogger(SecretCache.class);

    static final FailureCode NOT_FOUND = FailureCode.of("secret", "not_found");
    static final FailureCode LOCAL_SOURCE_ERROR = FailureCode.of("secret", "local_source_error");
    static final FailureCode REMOTE_STORE_DISABLED = FailureCode.of("secret", "remote_store_disabled");
    private static final String FETCH_OPERATION = "SecretStore.fetch";
    private static final String STORE_OPERATION = "SecretStore.store";
    private static final RetryClassifier WRITE_RETRYABLE = error -> !(error instanceof UnsupportedOperationException);
    private static final String LOOKUP_OPERATION = "SecretCache.get";

    private final SecretStoreClient store;
    private final Duration ttl;
    private final LocalSecretSource localSource;
    private final FeatureToggles toggles;
    private final Retrier retrier;
    private final Clock clock;

    private final Map<String, CachedSecret> cache = new ConcurrentHashMap<>();
    private final LongAdder hits = new LongAdder();
    private final LongAdder remoteFetches = new LongAdder();
    private final LongAdder localReads = new LongAdder();

    public SecretCache(
            SecretStoreClient store,
            Duration ttl,
            LocalSecretSource localSource,
            FeatureToggles toggles,
            Retrier retrier,
            Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
        this.localSource = Objects.requireNonNull(localSource, "localSource must not be null");
        this.toggles = Objects.requireNonNull(toggles, "toggles must not be null");
        this.retrier = Objects.requireNonNull(retrier, "retrier must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative");
        }
    }

    /**
     * Returns the secret, or a failure: {@code secret:not_found} when neither the store nor the
     * local source has it, {@code secret:local_source_error} when the local source throws, or
     * a cancellation when the calling thread was interrupted during a fetch.
     */
    public Outcome<String> get(String name) {
        Objects.requireNonNull(name, "name must not be null");

        if (!toggles.isEnabled(Feature.USE_REMOTE_SECRET_STORE)) {
            return readLocal(name);
        }

        CachedSecret cached = cache.get(name);
        if (cached != null) {
            if (cached.isFreshAt(clock.instant())) {
                hits.increment();
                LOG.debug("Secret '{}' served from cache", name);
                return Outcome.ok(cached.value());
            }
            cache.remove(name, cached);
            LOG.debug("Cached secret '{}' expired at {}", name, cached.expiresAt());
        }

        RetryResult<Optional<String>> result = retrier.execute(
                FETCH_OPERATION,
                () -> Optional.ofNullable(store.fetch(name)),
                RetryClassifier.always());

        if (result.isOk()) {
            Optional<String> fetched = result.outcome().getOrThrow();
            if (fetched.isPresent()) {
                Instant expiresAt = clock.instant().plus(ttl);
                cache.put(name, new CachedSecret(fetched.get(), expiresAt));
                remoteFetches.increment();
                LOG.info("Fetched secret '{}' from the secret store; cached until {}", name, expiresAt);
                return Outcome.ok(fetched.get());
            }
            LOG.warn("Secret '{}' not present in the secret store; trying the local source", name);
            return readLocal(name);
        }

        Failure failure = result.failure();
        if (failure.type() == FailureType.CANCELLED) {
            return Outcome.fail(failure);
        }
        LOG.warn("Secret store fetch of '{}' failed after {} attempt(s): {}; falling back to the local source",
                name, result.attemptCount(), failure.message());
        return readLocal(name);
    }

    /**
     * Writes a secret to the remote store through the retrier and drops any cached value for it,
     * so the next {@link #get} reads the new value.
     *
     * @return ok, {@code secret:remote_store_disabled} without contacting the store when
     *         {@link Feature#USE_REMOTE_SECRET_STORE} is off, or the store's failure
     */
    public Outcome<Void> put(String name, String value) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");

        if (!toggles.isEnabled(Feature.USE_REMOTE_SECRET_STORE)) {
            LOG.error("Cannot write secret '{}': the remote secret store is disabled ({}=false)",
                    name, Feature.USE_REMOTE_SECRET_STORE.key());
            return Outcome.fail(Failure.permanentFailure(
                    REMOTE_STORE_DISABLED,
                    "Cannot write secret '" + name + "' while the remote secret store is disabled",
                    STORE_OPERATION,
                    null));
        }

        RetryResult<Void> result = retrier.execute(STORE_OPERATION, () -> {
            store.store(name, value);
            return null;
        }, WRITE_RETRYABLE);

        if (result.isFail()) {
            LOG.error("Failed to write secret '{}' to the secret store after {} attempt(s): {}",
                    name, result.attemptCount(), result.failure().message());
            return Outcome.fail(result.failure());
        }
        invalidate(name);
        LOG.info("Secret '{}' updated in the secret store", name);
        return Outcome.ok();
    }

    /**
     * Drops the cached value and fetches the secret again.
     */
    public Outcome<String> refresh(String name) {
        invalidate(name);
        return get(name);
    }

    /**
     * @return true if a cached value was dropped
     */
    public boolean invalidate(String name) {
        return cache.remove(name) != null;
    }

    public void clear() {
        int size = cache.size();
        cache.clear();
        LOG.info("Cleared {} cached secret(s)", size);
    }

    public SecretCacheStats stats() {
        Instant now = clock.instant();
        int total = 0;
        int expired = 0;
        for (CachedSecret secret : cache.values()) {
            total++;
            if (!secret.isFreshAt(now)) {
                expired++;
            }
        }
        return new SecretCacheStats(
                total,
                expired,
                hits.sum(),
                remoteFetches.sum(),
                localReads.sum(),
                ttl,
                toggles.isEnabled(Feature.USE_REMOTE_SECRET_STORE));
    }

    private Outcome<String> readLocal(String name) {
        Optional<String> value;
        try {
            value = localSource.lookup(name);
        } catch (Exception e) {
            LOG.error("Local secret source failed for '{}'", name, e);
            return Outcome.fail(Failure.permanentFailure(
                    LOCAL_SOURCE_ERROR,
                    "Local secret source failed for '" + name + "': " + e.getMessage(),
                    LOOKUP_OPERATION,
                    e));
        }
        if (value.isPresent()) {
            localReads.increment();
            LOG.debug("Secret '{}' read from the local source", name);
            return Outcome.ok(value.get());
        }
        LOG.error("Secret '{}' not found in any source", name);
        return Outcome.fail(Failure.permanentFailure(
                NOT_FOUND,
                "Secret '" + name + "' not found",
                LOOKUP_OPERATION,
                null));
    }
}
