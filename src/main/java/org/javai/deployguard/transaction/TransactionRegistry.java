package org.javai.deployguard.transaction;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Knows which deployment transactions are still running, for health checks and operators.
 *
 * <p>A transaction built with {@link DeploymentTransaction.Builder#registry} joins the registry
 * when it is built and leaves it as soon as it commits or rolls back. Transactions are held by
 * identity, so two concurrent deployments with the same name are both listed.</p>
 */
public final class TransactionRegistry {

    private final Set<DeploymentTransaction> active = ConcurrentHashMap.newKeySet();

    void register(DeploymentTransaction transaction) {
        active.add(Objects.requireNonNull(transaction, "transaction must not be null"));
    }

    void unregister(DeploymentTransaction transaction) {
        active.remove(transaction);
    }

    /**
     * @return a snapshot of each active transaction, oldest first
     */
    public List<TransactionSnapshot> activeTransactions() {
        return active.stream()
                .map(DeploymentTransaction::snapshot)
                .sorted(Comparator.comparing(TransactionSnapshot::startedAt)
                        .thenComparing(TransactionSnapshot::name))
                .toList();
    }

    public int size() {
        return active.size();
    }
}
