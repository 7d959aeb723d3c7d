package io.failforge;

import java.time.Duration;

/**
 * Observability callbacks for aggregation block lifecycle events.
 * Callbacks run on the thread executing the block.
 */
public interface AggregationHook {

    default void onEnter(BlockInfo info) {
    }

    /**
     * Called when an error other than a notified expectation failure escaped the
     * body and aborted it.
     */
    default void onAbort(BlockInfo info, Throwable error) {
    }

    default void onComplete(BlockInfo info, AggregationOutcome outcome, Duration duration) {
    }
}
