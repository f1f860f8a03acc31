package org.javai.deployguard.secret;

import java.time.Duration;

/**
 * Counters for a {@link SecretCache}. Entry counts are taken at the moment of the call;
 * the rest are totals since the cache was created.
 *
 * @param cachedEntries entries currently held, fresh or not
 * @param expiredEntries held entries past their expiry, awaiting lazy eviction
 * @param hits reads answered from the cache
 * @param remoteFetches successful fetches from the remote store
 * @param localReads reads answered by the local source
 * @param ttl how long a fetched value stays fresh
 * @param remoteStoreEnabled whether the remote store is switched on right now
 */
public record SecretCacheStats(
        int cachedEntries,
        int expiredEntries,
        long hits,
        long remoteFetches,
        long localReads,
        Duration ttl,
        boolean remoteStoreEnabled
) {
    public int freshEntries() {
        return cachedEntries - expiredEntries;
    }
}
