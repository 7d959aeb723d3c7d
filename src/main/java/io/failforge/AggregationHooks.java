package io.failforge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

final class AggregationHooks {

    private static final Logger LOG = LoggerFactory.getLogger(AggregationHooks.class);

    static final AggregationHook NOOP = new AggregationHook() {
    };

    private AggregationHooks() {
    }

    static AggregationHook compose(final AggregationHook left, final AggregationHook right) {
        return new AggregationHook() {
            @Override
            public void onEnter(BlockInfo info) {
                safeEnter(left, info);
                safeEnter(right, info);
            }

            @Override
            public void onAbort(BlockInfo info, Throwable error) {
                safeAbort(left, info, error);
                safeAbort(right, info, error);
            }

            @Override
            public void onComplete(BlockInfo info, AggregationOutcome outcome, Duration duration) {
                safeComplete(left, info, outcome, duration);
                safeComplete(right, info, outcome, duration);
            }
        };
    }

    static void safeEnter(AggregationHook hook, BlockInfo info) {
        try {
            hook.onEnter(info);
        } catch (Throwable e) {
            LOG.warn("Aggregation hook onEnter failed for {}", info, e);
        }
    }

    static void safeAbort(AggregationHook hook, BlockInfo info, Throwable error) {
        try {
            hook.onAbort(info, error);
        } catch (Throwable e) {
            LOG.warn("Aggregation hook onAbort failed for {}", info, e);
        }
    }

    static void safeComplete(AggregationHook hook, BlockInfo info, AggregationOutcome outcome, Duration duration) {
        try {
            hook.onComplete(info, outcome, duration);
        } catch (Throwable e) {
            LOG.warn("Aggregation hook onComplete failed for {}", info, e);
        }
    }
}
