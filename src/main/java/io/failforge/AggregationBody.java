package io.failforge;

/**
 * Code executed inside an aggregation block.
 */
@FunctionalInterface
public interface AggregationBody {

    void run() throws Throwable;
}
