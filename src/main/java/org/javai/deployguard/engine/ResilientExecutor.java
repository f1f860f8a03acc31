package org.javai.deployguard.engine;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import org.javai.deployguard.boundary.RetryClassifier;
import org.javai.deployguard.boundary.ThrowingSupplier;
import org.javai.deployguard.breaker.CircuitBreakerRegistry;
import org.javai.deployguard.config.ConfigResolver;
import org.javai.deployguard.config.ResilienceSettings;
import org.javai.deployguard.ops.OpReporter;
import org.javai.deployguard.ops.health.HealthReport;
import org.javai.deployguard.ops.log4j.Log4jOpReporter;
import org.javai.deployguard.retry.Retrier;
import org.javai.deployguard.retry.RetryPolicy;
import org.javai.deployguard.retry.RetryResult;
import org.javai.deployguard.secret.EnvironmentSecretSource;
import org.javai.deployguard.secret.LocalSecretSource;
import org.javai.deployguard.secret.SecretCache;
import org.javai.deployguard.secret.SecretStoreClient;
import org.javai.deployguard.toggle.Feature;
import org.javai.deployguard.toggle.FeatureToggles;
import org.javai.deployguard.transaction.DeploymentTransaction;
import org.javai.deployguard.transaction.TransactionRegistry;

/**
 * The single entry point a deployment orchestrator calls into.
 *
 * <p>Each {@link #call} runs the operation through the circuit breaker of its dependency, inside
 * the retrier. Both layers can be switched off with {@link Feature#USE_CIRCUIT_BREAKER} and
 * {@link Feature#USE_RETRY}; the toggles are read on every call, including the secret store
 * fetches of {@link #secrets()}.</p>
 *
 * <p>Transactions opened here are listed in {@link #transactions()} until they finish, and
 * show up in {@link #healthReport()}.</p>
 *
 * <pre>{@code
 * ResilientExecutor executor = ResilientExecutor.fromEnvironment();
 *
 * try (DeploymentTransaction tx = executor.openTransaction("deploy-analytics")) {
 *     Workspace ws = executor.call("workspace-api", "WorkspaceApi.create",
 *             () -> api.createWorkspace(request), RetryClassifier.anyOf(IOException.class))
 *         .getOrRethrow();
 *     tx.track("workspace", ws.name(), ws.id(), () -> api.deleteWorkspace(ws.id()));
 *     tx.commit();
 * }
 * }</pre>
 */
public final class ResilientExecutor {

    static final String RETRY_POLICY_ID = "deployment";

    private final ResilienceSettings settings;
    private final FeatureToggles toggles;
    private final CircuitBreakerRegistry breakers;
    private final TransactionRegistry transactions;
    private final Retrier retrier;
    private final Clock clock;
    private final SecretCache secrets;

    private ResilientExecutor(Builder builder) {
        this.settings = builder.settings;
        this.toggles = builder.toggles;
        this.clock = builder.clock;
        this.breakers = builder.breakers != null
                ? builder.breakers
                : new CircuitBreakerRegistry(settings.circuitBreaker(), clock, builder.reporter.asCircuitBreakerListener());
        this.transactions = builder.transactions;
        this.retrier = Retrier.builder()
                .policy(RetryPolicy.exponentialBackoff(RETRY_POLICY_ID, settings.retry())
                        .onlyWhen(() -> toggles.isEnabled(Feature.USE_RETRY)))
                .reporter(builder.reporter)
                .sleeper(builder.sleeper)
                .build();
        this.secrets = builder.secretStore == null ? null : new SecretCache(
                builder.secretStore,
                settings.secretCacheTtl(),
                builder.localSecrets,
                toggles,
                retrier,
                clock);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * An executor configured from system properties and environment variables, logging through Log4j.
     */
    public static ResilientExecutor fromEnvironment() {
        return builder()
                .settings(ResilienceSettings.load(ConfigResolver.system()))
                .toggles(FeatureToggles.fromEnvironment())
                .reporter(new Log4jOpReporter())
                .build();
    }

    /**
     * Runs {@code operation} against {@code dependency}.
     *
     * @param dependency names the circuit breaker; one breaker per dependency
     * @param operationName used in failures and reports
     * @param operation the work, run once per attempt
     * @param isRetryable decides which exceptions are worth another attempt
     * @return the final outcome with every attempt made
     */
    public <T> RetryResult<T> call(
            String dependency,
            String operationName,
            ThrowingSupplier<T, ? extends Exception> operation,
            RetryClassifier isRetryable
    ) {
        Objects.requireNonNull(dependency, "dependency must not be null");
        Objects.requireNonNull(operation, "operation must not be null");

        ThrowingSupplier<T, ? extends Exception> work = toggles.isEnabled(Feature.USE_CIRCUIT_BREAKER)
                ? breakers.get(dependency).guard(operation)
                : operation;
        return retrier.execute(operationName, work, isRetryable);
    }

    /**
     * Opens a transaction whose rollback follows {@link Feature#USE_ROLLBACK}.
     */
    public DeploymentTransaction openTransaction(String name) {
        return transaction(name).build();
    }

    /**
     * A transaction builder preset from the toggles, for callers that also want dry run.
     */
    public DeploymentTransaction.Builder transaction(String name) {
        return DeploymentTransaction.builder(name)
                .rollbackEnabled(toggles.isEnabled(Feature.USE_ROLLBACK))
                .clock(clock)
                .registry(transactions);
    }

    public HealthReport healthReport() {
        return HealthReport.of(
                clock.instant(),
                breakers.snapshots(),
                secrets == null ? null : secrets.stats(),
                transactions.activeTransactions(),
                toggles.status());
    }

    public CircuitBreakerRegistry breakers() {
        return breakers;
    }

    /**
     * @return the secret cache, present when a secret store was configured
     */
    public Optional<SecretCache> secrets() {
        return Optional.ofNullable(secrets);
    }

    /**
     * @return the transactions opened by this executor that are still active
     */
    public TransactionRegistry transactions() {
        return transactions;
    }

    public FeatureToggles toggles() {
        return toggles;
    }

    public ResilienceSettings settings() {
        return settings;
    }

    public static final class Builder {
        private ResilienceSettings settings = ResilienceSettings.defaults();
        private FeatureToggles toggles = FeatureToggles.defaults();
        private OpReporter reporter = OpReporter.noOp();
        private Clock clock = Clock.systemUTC();
        private Retrier.Sleeper sleeper = Thread::sleep;
        private CircuitBreakerRegistry breakers;
        private SecretStoreClient secretStore;
        private LocalSecretSource localSecrets = new EnvironmentSecretSource();
        private TransactionRegistry transactions = new TransactionRegistry();

        private Builder() {}

        public Builder settings(ResilienceSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings must not be null");
            return this;
        }

        public Builder toggles(FeatureToggles toggles) {
            this.toggles = Objects.requireNonNull(toggles, "toggles must not be null");
            return this;
        }

        /**
         * Receives retry events, failures and breaker transitions.
         */
        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Builder sleeper(Retrier.Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        /**
         * Shares an existing registry. By default one is created from the settings, reporting
         * transitions to the reporter.
         */
        public Builder breakers(CircuitBreakerRegistry breakers) {
            this.breakers = Objects.requireNonNull(breakers, "breakers must not be null");
            return this;
        }

        public Builder secretStore(SecretStoreClient secretStore) {
            this.secretStore = Objects.requireNonNull(secretStore, "secretStore must not be null");
            return this;
        }

        /**
         * Fallback for secrets; defaults to system properties and environment variables.
         */
        public Builder localSecrets(LocalSecretSource localSecrets) {
            this.localSecrets = Objects.requireNonNull(localSecrets, "localSecrets must not be null");
            return this;
        }

        /**
         * Shares a transaction registry, for example with a monitoring endpoint.
         */
        public Builder transactions(TransactionRegistry transactions) {
            this.transactions = Objects.requireNonNull(transactions, "transactions must not be null");
            return this;
        }

        public ResilientExecutor build() {
            return new ResilientExecutor(this);
        }
    }
}
