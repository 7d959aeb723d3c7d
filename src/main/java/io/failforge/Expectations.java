package io.failforge;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Entry points for matcher code, bound to {@link AggregationContext#global()}.
 *
 * <p>Outside an aggregation block every failure is thrown immediately. Inside
 * one, failures are collected and the calling code keeps running.
 */
public final class Expectations {

    private Expectations() {
    }

    public static void notifyFailure(ExpectationFailedError failure) {
        AggregationContext.global().notifyFailure(failure);
    }

    /**
     * Evaluate a condition without reporting anything.
     */
    public static ExpectationResult evaluate(boolean condition, Supplier<String> message) {
        Objects.requireNonNull(message, "message");
        if (condition) {
            return ExpectationResult.passed();
        }
        return ExpectationResult.failed(message.get());
    }

    public static void verify(ExpectationResult result) {
        AggregationContext.global().verify(result);
    }

    public static void expect(boolean condition, Supplier<String> message) {
        verify(evaluate(condition, message));
    }

    public static void fail(String message) {
        notifyFailure(new ExpectationFailedError(message));
    }
}
