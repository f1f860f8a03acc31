package org.javai.deployguard.transaction;

import java.util.List;
import java.util.Objects;

/**
 * What a rollback did.
 *
 * @param transactionName the transaction that was rolled back
 * @param reason why the rollback happened, may be null
 * @param cleanedUp resources whose cleanup completed, in the order they were cleaned up
 * @param failures resources whose cleanup threw, in the order they were attempted
 * @param skipped true when no cleanup ran at all (already finished, or rollback disabled)
 */
public record RollbackSummary(
        String transactionName,
        String reason,
        List<TrackedResource> cleanedUp,
        List<CleanupFailure> failures,
        boolean skipped
) {

    public RollbackSummary {
        Objects.requireNonNull(transactionName, "transactionName must not be null");
        cleanedUp = List.copyOf(cleanedUp);
        failures = List.copyOf(failures);
    }

    static RollbackSummary skipped(String transactionName, String reason) {
        return new RollbackSummary(transactionName, reason, List.of(), List.of(), true);
    }

    /**
     * True when every cleanup that ran succeeded.
     */
    public boolean isClean() {
        return failures.isEmpty();
    }

    /**
     * True when some resource could not be removed and must be cleaned up by hand.
     */
    public boolean requiresManualIntervention() {
        return !failures.isEmpty();
    }
}
