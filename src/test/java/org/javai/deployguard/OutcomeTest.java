package org.javai.deployguard;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.*;

class OutcomeTest {

    @Test
    void ok_getOrThrow_returnsValue() {
        Outcome<String> outcome = Outcome.ok("hello");

        assertThat(outcome.isOk()).isTrue();
        assertThat(outcome.isFail()).isFalse();
        assertThat(outcome.getOrThrow()).isEqualTo("hello");
        assertThat(Outcome.failureOf(outcome)).isNull();
    }

    @Test
    void ok_withoutValue_holdsNull() {
        Outcome<Void> outcome = Outcome.ok();

        assertThat(outcome.isOk()).isTrue();
        assertThat(((Outcome.Ok<Void>) outcome).value()).isNull();
    }

    @Test
    void fail_getOrThrow_wrapsOriginalExceptionAsCause() {
        IOException cause = new IOException("connection reset");
        Failure failure = transientFailure(cause);
        Outcome<String> outcome = Outcome.fail(failure);

        assertThatThrownBy(outcome::getOrThrow)
                .isInstanceOf(OutcomeFailedException.class)
                .hasMessageContaining("transient:IOException")
                .hasCause(cause)
                .satisfies(e -> assertThat(((OutcomeFailedException) e).failure()).isSameAs(failure));
    }

    @Test
    void fail_getOrRethrow_throwsOriginalException() {
        IOException cause = new IOException("connection reset");
        Outcome<String> outcome = Outcome.fail(transientFailure(cause));

        assertThatThrownBy(outcome::getOrRethrow).isSameAs(cause);
    }

    @Test
    void fail_getOrRethrow_withoutException_throwsOutcomeFailedException() {
        Failure failure = Failure.permanentFailure(FailureCode.of("secret", "not_found"),
                "Secret 'db-password' not found", "SecretCache.get", null);

        assertThatThrownBy(() -> Outcome.fail(failure).getOrRethrow())
                .isInstanceOf(OutcomeFailedException.class)
                .hasMessageContaining("secret:not_found");
    }

    @Test
    void failure_negativeRetryAfter_isRejected() {
        assertThatThrownBy(() -> Failure.transientFailure(FailureCode.of("transient", "X"), "x", "op",
                null, java.time.Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void failure_onlyTransientIsRetryable() {
        assertThat(transientFailure(new IOException("x")).isRetryable()).isTrue();
        assertThat(Failure.cancelled("stopped", "op", null).isRetryable()).isFalse();
        assertThat(Failure.cancelled("stopped", "op", null).code().toString()).isEqualTo("execution:cancelled");
    }

    private static Failure transientFailure(Exception cause) {
        return Failure.transientFailure(FailureCode.of("transient", cause.getClass().getSimpleName()),
                String.valueOf(cause.getMessage()), "WorkspaceApi.create", cause);
    }
}
