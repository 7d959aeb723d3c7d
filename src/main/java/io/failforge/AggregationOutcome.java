package io.failforge;

import io.failforge.internal.Throwables;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one aggregation block.
 *
 * <p>{@link #error()} is what the block raises: {@code null} when nothing went
 * wrong, the original object when exactly one problem was collected, or an
 * {@link AggregateFailureError} for two or more.
 */
public final class AggregationOutcome {

    private final String label;
    private final Map<String, Object> metadata;
    private final List<Throwable> failures;
    private final List<Throwable> otherErrors;
    private final Throwable error;

    public AggregationOutcome(
        String label,
        Map<String, ?> metadata,
        List<? extends Throwable> failures,
        List<? extends Throwable> otherErrors
    ) {
        this.label = label;
        this.metadata = metadata == null
            ? Collections.<String, Object>emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<String, Object>(metadata));
        this.failures = Collections.unmodifiableList(new ArrayList<Throwable>(failures));
        this.otherErrors = Collections.unmodifiableList(new ArrayList<Throwable>(otherErrors));
        this.error = resolveError();
    }

    public String label() {
        return label;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public List<Throwable> failures() {
        return failures;
    }

    public List<Throwable> otherErrors() {
        return otherErrors;
    }

    public int total() {
        return failures.size() + otherErrors.size();
    }

    public boolean hasProblems() {
        return error != null;
    }

    public Throwable error() {
        return error;
    }

    /**
     * Raise {@link #error()} unchanged if there is one.
     */
    public void rethrowIfFailed() {
        if (error != null) {
            throw Throwables.rethrow(error);
        }
    }

    private Throwable resolveError() {
        int total = total();
        if (total == 0) {
            return null;
        }
        if (total == 1) {
            return failures.isEmpty() ? otherErrors.get(0) : failures.get(0);
        }
        return new AggregateFailureError(failures, otherErrors, label, metadata);
    }

    @Override
    public String toString() {
        return "AggregationOutcome{label=" + label
            + ", failures=" + failures.size()
            + ", otherErrors=" + otherErrors.size() + "}";
    }
}
