package io.failforge;

import java.util.Objects;

/**
 * Result of evaluating one expectation: passed, or failed with the error to
 * report.
 */
public final class ExpectationResult {

    private static final ExpectationResult PASSED = new ExpectationResult(null);

    private final ExpectationFailedError failure;

    private ExpectationResult(ExpectationFailedError failure) {
        this.failure = failure;
    }

    public static ExpectationResult passed() {
        return PASSED;
    }

    public static ExpectationResult failed(ExpectationFailedError failure) {
        return new ExpectationResult(Objects.requireNonNull(failure, "failure"));
    }

    public static ExpectationResult failed(String message) {
        return failed(new ExpectationFailedError(message));
    }

    public boolean isPassed() {
        return failure == null;
    }

    /**
     * The failure, or {@code null} for a passed result.
     */
    public ExpectationFailedError failure() {
        return failure;
    }
}
