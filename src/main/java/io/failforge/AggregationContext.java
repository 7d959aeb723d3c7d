package io.failforge;

import io.failforge.internal.Backtraces;
import io.failforge.internal.FailureCollector;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Chain of active failure collectors, scoped to the thread lineage that opened them.
 *
 * <p>Entering a block installs its collector on the calling thread. Threads
 * started inside the block body inherit the chain, so failures they report go
 * to that block. Threads outside that lineage see only their own blocks: with
 * none open, a reported failure is thrown right away.
 *
 * <p>Pooled threads created before the block do not inherit the chain; submit
 * work to them through {@link #wrap(Runnable)} or {@link #wrap(Callable)}.
 *
 * <p>{@link #global()} is the process-wide instance used by {@link Expectations}
 * and by {@link FailureAggregator#open()}. {@link #create()} returns a separate
 * instance whose blocks are invisible to every other context.
 */
public final class AggregationContext {

    private static final AggregationContext GLOBAL = new AggregationContext();

    private final InheritableThreadLocal<Chain> local;

    private AggregationContext() {
        this.local = new InheritableThreadLocal<Chain>();
    }

    public static AggregationContext global() {
        return GLOBAL;
    }

    public static AggregationContext create() {
        return new AggregationContext();
    }

    /**
     * Whether the calling thread reports into an open block of this context.
     */
    public boolean isAggregating() {
        return openCollector(local.get()) != null;
    }

    /**
     * Number of blocks on the calling thread's chain.
     */
    public int depth() {
        Chain chain = local.get();
        return chain == null ? 0 : chain.depth;
    }

    /**
     * Report an expectation failure.
     *
     * <p>With a block open on the calling thread's chain the failure is collected
     * and this method returns normally. Otherwise the failure is thrown right
     * away. Either way a missing backtrace is captured from the calling site first.
     */
    public void notifyFailure(ExpectationFailedError failure) {
        Objects.requireNonNull(failure, "failure");
        failure.setBacktraceIfAbsent(Backtraces.capture());
        for (Chain chain = local.get(); chain != null; chain = chain.parent) {
            if (chain.collector.accept(failure)) {
                return;
            }
        }
        throw failure;
    }

    /**
     * Route a failed result to {@link #notifyFailure}; passed results are ignored.
     */
    public void verify(ExpectationResult result) {
        Objects.requireNonNull(result, "result");
        if (!result.isPassed()) {
            notifyFailure(result.failure());
        }
    }

    /**
     * Bind a task to the calling thread's chain so it reports into the same
     * blocks when run on another thread.
     */
    public Runnable wrap(final Runnable runnable) {
        Objects.requireNonNull(runnable, "runnable");
        final Chain captured = local.get();
        return new Runnable() {
            @Override
            public void run() {
                Chain previous = install(captured);
                try {
                    runnable.run();
                } finally {
                    install(previous);
                }
            }
        };
    }

    public <T> Callable<T> wrap(final Callable<T> callable) {
        Objects.requireNonNull(callable, "callable");
        final Chain captured = local.get();
        return new Callable<T>() {
            @Override
            public T call() throws Exception {
                Chain previous = install(captured);
                try {
                    return callable.call();
                } finally {
                    install(previous);
                }
            }
        };
    }

    Entry enter(long blockId, boolean reportToOuter) {
        Chain previous = local.get();
        FailureCollector.Slot slot = null;
        if (reportToOuter) {
            FailureCollector outer = openCollector(previous);
            if (outer != null) {
                slot = outer.reserve();
            }
        }
        FailureCollector collector = new FailureCollector(blockId);
        Chain chain = new Chain(collector, previous);
        local.set(chain);
        return new Entry(collector, slot, previous, chain.depth);
    }

    void exit(Entry entry) {
        Chain current = local.get();
        FailureCollector collector = entry.collector();
        collector.close();
        install(entry.previous);
        if (current == null || current.collector != collector) {
            throw new IllegalStateException("collector of block-" + collector.ownerId() + " is not active");
        }
    }

    private Chain install(Chain chain) {
        Chain previous = local.get();
        if (chain == null) {
            local.remove();
        } else {
            local.set(chain);
        }
        return previous;
    }

    private static FailureCollector openCollector(Chain chain) {
        for (Chain current = chain; current != null; current = current.parent) {
            if (!current.collector.isClosed()) {
                return current.collector;
            }
        }
        return null;
    }

    private static final class Chain {
        private final FailureCollector collector;
        private final Chain parent;
        private final int depth;

        private Chain(FailureCollector collector, Chain parent) {
            this.collector = collector;
            this.parent = parent;
            this.depth = parent == null ? 1 : parent.depth + 1;
        }
    }

    static final class Entry {
        private final FailureCollector collector;
        private final FailureCollector.Slot outerSlot;
        private final Chain previous;
        private final int depth;

        private Entry(FailureCollector collector, FailureCollector.Slot outerSlot, Chain previous, int depth) {
            this.collector = collector;
            this.outerSlot = outerSlot;
            this.previous = previous;
            this.depth = depth;
        }

        FailureCollector collector() {
            return collector;
        }

        FailureCollector.Slot outerSlot() {
            return outerSlot;
        }

        int depth() {
            return depth;
        }
    }
}
