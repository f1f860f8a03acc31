package org.javai.deployguard.transaction;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tracks the resources a deployment creates so that a failed deployment can remove them again.
 *
 * <p>Register each resource with {@link #track} right after its creation is confirmed. On success
 * call {@link #commit()}; on failure {@link #rollback(String)} runs the cleanups in strict reverse
 * order of tracking. A cleanup that throws is recorded and the remaining cleanups still run.</p>
 *
 * <p>The transaction is {@link AutoCloseable}: closing one that is still active rolls it back,
 * so a try-with-resources block always ends committed or rolled back.</p>
 *
 * <pre>{@code
 * try (DeploymentTransaction tx = DeploymentTransaction.open("deploy-analytics")) {
 *     Workspace ws = api.createWorkspace(request);
 *     tx.track("workspace", ws.name(), ws.id(), () -> api.deleteWorkspace(ws.id()));
 *     RoleBinding rb = api.bindRole(ws, role);
 *     tx.track("role-binding", rb.name(), rb.id(), () -> api.unbindRole(rb.id()));
 *     tx.commit();
 * }
 * }</pre>
 *
 * <p>One transaction belongs to one deployment and is driven from one thread. Only
 * {@link #snapshot()} may be called from other threads, for monitoring.</p>
 */
public final class DeploymentTransaction implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(DeploymentTransaction.class);

    private final String name;
    private final boolean dryRun;
    private final boolean rollbackEnabled;
    private final Clock clock;
    private final TransactionRegistry registry;
    private final Instant startedAt;
    private final List<TrackedResource> resources = new CopyOnWriteArrayList<>();
    private final List<CleanupFailure> rollbackErrors = new CopyOnWriteArrayList<>();
    private volatile TransactionStatus status = TransactionStatus.ACTIVE;
    private volatile Instant completedAt;

    private DeploymentTransaction(Builder builder) {
        this.name = builder.name;
        this.dryRun = builder.dryRun;
        this.rollbackEnabled = builder.rollbackEnabled;
        this.clock = builder.clock;
        this.registry = builder.registry;
        this.startedAt = clock.instant();
        LOG.info("Started transaction '{}'{}", name, dryRun ? " [DRY RUN]" : "");
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Opens a transaction with rollback enabled and dry run off.
     */
    public static DeploymentTransaction open(String name) {
        return builder(name).build();
    }

    /**
     * Runs {@code body} inside a new transaction. Commits when the body returns; rolls back and
     * rethrows when it throws. Cleanup failures are attached to the rethrown exception as suppressed.
     */
    public static <T> T run(String name, TransactionBody<T> body) throws Exception {
        return builder(name).run(body);
    }

    public String name() {
        return name;
    }

    public TransactionStatus status() {
        return status;
    }

    public boolean isActive() {
        return status == TransactionStatus.ACTIVE;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public boolean isRollbackEnabled() {
        return rollbackEnabled;
    }

    /**
     * @return the tracked resources in tracking order
     */
    public List<TrackedResource> resources() {
        return List.copyOf(resources);
    }

    public List<CleanupFailure> rollbackErrors() {
        return List.copyOf(rollbackErrors);
    }

    public void track(String label, String resourceId, CleanupAction cleanup) {
        track(TrackedResource.UNTYPED, label, resourceId, cleanup);
    }

    /**
     * Registers a created resource. Ignored, with an error log, when {@code cleanup} is null
     * or the transaction has already finished.
     */
    public void track(String resourceType, String label, String resourceId, CleanupAction cleanup) {
        if (cleanup == null) {
            LOG.error("Transaction '{}': refusing to track {} '{}' ({}) without a cleanup action",
                    name, resourceType, label, resourceId);
            return;
        }
        if (status.isFinished()) {
            LOG.error("Transaction '{}' is {}; ignoring {} '{}' ({})",
                    name, status, resourceType, label, resourceId);
            return;
        }
        TrackedResource resource = new TrackedResource(resourceType, label, resourceId, cleanup, clock.instant());
        resources.add(resource);
        LOG.debug("Transaction '{}' tracking {} [{} total]", name, resource, resources.size());
    }

    /**
     * Marks the deployment as successful. Tracked resources are kept. Calling it again does nothing.
     */
    public void commit() {
        if (status == TransactionStatus.COMMITTED) {
            return;
        }
        if (status.isFinished()) {
            LOG.warn("Transaction '{}' is {}; commit ignored", name, status);
            return;
        }
        finish(TransactionStatus.COMMITTED);
        LOG.info("Committed transaction '{}' with {} resource(s) in {}ms",
                name, resources.size(), elapsed().toMillis());
    }

    public RollbackSummary rollback() {
        return rollback(null);
    }

    /**
     * Removes every tracked resource, most recent first.
     *
     * @param reason why the deployment is being undone, may be null
     * @return what was cleaned up and what failed; a skipped summary if nothing ran
     */
    public RollbackSummary rollback(String reason) {
        if (status == TransactionStatus.COMMITTED) {
            LOG.warn("Transaction '{}' already committed; rollback ignored", name);
            return RollbackSummary.skipped(name, reason);
        }
        if (status.isFinished()) {
            LOG.warn("Transaction '{}' is already {}; rollback ignored", name, status);
            return RollbackSummary.skipped(name, reason);
        }

        if (!rollbackEnabled) {
            finish(TransactionStatus.ROLLBACK_DISABLED);
            LOG.warn("Rollback disabled for transaction '{}'{}; {} resource(s) left in place: {}",
                    name, reasonSuffix(reason), resources.size(), describe(resources));
            return RollbackSummary.skipped(name, reason);
        }

        LOG.warn("Rolling back transaction '{}'{}: {} resource(s)", name, reasonSuffix(reason), resources.size());

        List<TrackedResource> cleanedUp = new ArrayList<>();
        boolean aborted = true;
        try {
            for (int i = resources.size() - 1; i >= 0; i--) {
                TrackedResource resource = resources.get(i);
                if (dryRun) {
                    LOG.info("[DRY RUN] Would clean up {}", resource);
                    cleanedUp.add(resource);
                    continue;
                }
                try {
                    resource.cleanup().cleanup();
                    cleanedUp.add(resource);
                    LOG.info("Cleaned up {}", resource);
                } catch (Exception e) {
                    rollbackErrors.add(new CleanupFailure(resource, e));
                    LOG.error("Failed to clean up {} in transaction '{}'", resource, name, e);
                }
            }
            aborted = false;
        } finally {
            // Finished either way, so a later close() or rollback() never repeats cleanups
            finish(TransactionStatus.ROLLED_BACK);
            if (aborted) {
                LOG.error("Rollback of transaction '{}' aborted after {} of {} cleanup(s); manual cleanup required",
                        name, cleanedUp.size(), resources.size());
            }
        }

        RollbackSummary summary = new RollbackSummary(name, reason, cleanedUp, rollbackErrors, false);
        if (summary.requiresManualIntervention()) {
            LOG.error("Rollback of transaction '{}' incomplete: {} cleaned up, {} failed. Manual cleanup required for: {}",
                    name, cleanedUp.size(), rollbackErrors.size(),
                    rollbackErrors.stream().map(f -> f.resource().toString()).collect(Collectors.joining(", ")));
        } else {
            LOG.info("Rolled back transaction '{}': {} resource(s) cleaned up", name, cleanedUp.size());
        }
        return summary;
    }

    /**
     * Rolls back if the transaction is still active; otherwise does nothing.
     */
    @Override
    public void close() {
        if (isActive()) {
            rollback("closed without commit");
        }
    }

    public TransactionSnapshot snapshot() {
        return new TransactionSnapshot(
                name,
                status,
                dryRun,
                rollbackEnabled,
                startedAt,
                completedAt,
                elapsed(),
                resources.stream().map(TrackedResource::toString).collect(Collectors.toList()),
                rollbackErrors.stream()
                        .map(f -> f.resource() + ": " + f.message())
                        .collect(Collectors.toList()));
    }

    private void finish(TransactionStatus finalStatus) {
        completedAt = clock.instant();
        status = finalStatus;
        if (registry != null) {
            registry.unregister(this);
        }
    }

    private Duration elapsed() {
        Instant end = completedAt != null ? completedAt : clock.instant();
        return Duration.between(startedAt, end);
    }

    private static String reasonSuffix(String reason) {
        return reason == null ? "" : " (" + reason + ")";
    }

    private static String describe(List<TrackedResource> resources) {
        return resources.stream().map(TrackedResource::toString).collect(Collectors.joining(", ", "[", "]"));
    }

    /**
     * Work that runs inside a transaction.
     */
    @FunctionalInterface
    public interface TransactionBody<T> {
        T execute(DeploymentTransaction transaction) throws Exception;
    }

    public static final class Builder {
        private final String name;
        private boolean dryRun;
        private boolean rollbackEnabled = true;
        private Clock clock = Clock.systemUTC();
        private TransactionRegistry registry;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
        }

        /**
         * Log cleanups instead of running them.
         */
        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder rollbackEnabled(boolean rollbackEnabled) {
            this.rollbackEnabled = rollbackEnabled;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * Lists the transaction in {@code registry} while it is active.
         */
        public Builder registry(TransactionRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry must not be null");
            return this;
        }

        public DeploymentTransaction build() {
            DeploymentTransaction transaction = new DeploymentTransaction(this);
            if (registry != null) {
                registry.register(transaction);
            }
            return transaction;
        }

        /**
         * Builds a transaction and runs {@code body} inside it.
         *
         * @see DeploymentTransaction#run(String, TransactionBody)
         */
        public <T> T run(TransactionBody<T> body) throws Exception {
            Objects.requireNonNull(body, "body must not be null");
            DeploymentTransaction transaction = build();
            T result;
            try {
                result = body.execute(transaction);
            } catch (Exception e) {
                RollbackSummary summary = transaction.rollback(e.getClass().getSimpleName() + ": " + e.getMessage());
                for (CleanupFailure failure : summary.failures()) {
                    e.addSuppressed(failure.exception());
                }
                throw e;
            } catch (Error e) {
                transaction.rollback(e.getClass().getSimpleName());
                throw e;
            }
            transaction.commit();
            return result;
        }
    }
}
