package org.javai.deployguard.transaction;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of a transaction for monitoring.
 *
 * @param completedAt null while the transaction is active
 * @param rollbackErrors messages of cleanups that failed during rollback
 */
public record TransactionSnapshot(
        String name,
        TransactionStatus status,
        boolean dryRun,
        boolean rollbackEnabled,
        Instant startedAt,
        Instant completedAt,
        Duration elapsed,
        List<String> resources,
        List<String> rollbackErrors
) {
    public TransactionSnapshot {
        resources = List.copyOf(resources);
        rollbackErrors = List.copyOf(rollbackErrors);
    }

    public int resourceCount() {
        return resources.size();
    }
}
