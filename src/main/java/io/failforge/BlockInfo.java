package io.failforge;

import java.time.Instant;

/**
 * Immutable metadata for one aggregation block invocation.
 */
public final class BlockInfo {

    private final long blockId;
    private final String label;
    private final int depth;
    private final Instant startedAt;

    public BlockInfo(long blockId, String label, int depth, Instant startedAt) {
        this.blockId = blockId;
        this.label = label;
        this.depth = depth;
        this.startedAt = startedAt;
    }

    public long blockId() {
        return blockId;
    }

    /**
     * Block label, or {@code null} when the block is unnamed.
     */
    public String label() {
        return label;
    }

    /**
     * Nesting depth, {@code 1} for an outermost block.
     */
    public int depth() {
        return depth;
    }

    public Instant startedAt() {
        return startedAt;
    }

    @Override
    public String toString() {
        return label == null ? "block-" + blockId : "block-" + blockId + " \"" + label + "\"";
    }
}
