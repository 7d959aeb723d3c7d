package io.failforge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Represents two or more problems collected by one aggregation block.
 *
 * <p>{@link #failures()} holds expectation failures and the results of nested
 * aggregation blocks, {@link #otherErrors()} holds any other error that escaped
 * the block body. The message is rendered by {@link AggregateReport} on first
 * access and cached.
 */
public class AggregateFailureError extends AssertionError {

    private final List<Throwable> failures;
    private final List<Throwable> otherErrors;
    private final String aggregationBlockLabel;
    private final Map<String, Object> aggregationMetadata;

    private volatile String renderedMessage;

    public AggregateFailureError(
        List<? extends Throwable> failures,
        List<? extends Throwable> otherErrors,
        String aggregationBlockLabel,
        Map<String, ?> aggregationMetadata
    ) {
        super();
        Objects.requireNonNull(failures, "failures");
        Objects.requireNonNull(otherErrors, "otherErrors");
        if (failures.size() + otherErrors.size() < 2) {
            throw new IllegalArgumentException("an aggregate needs at least two problems, got "
                + (failures.size() + otherErrors.size()));
        }
        this.failures = Collections.unmodifiableList(new ArrayList<Throwable>(failures));
        this.otherErrors = Collections.unmodifiableList(new ArrayList<Throwable>(otherErrors));
        this.aggregationBlockLabel = aggregationBlockLabel;
        this.aggregationMetadata = aggregationMetadata == null
            ? Collections.<String, Object>emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<String, Object>(aggregationMetadata));
        for (Throwable failure : this.failures) {
            addSuppressed(failure);
        }
        for (Throwable error : this.otherErrors) {
            addSuppressed(error);
        }
    }

    public List<Throwable> failures() {
        return failures;
    }

    public List<Throwable> otherErrors() {
        return otherErrors;
    }

    /**
     * Failures followed by other errors. A new list is built on every call.
     */
    public List<Throwable> allExceptions() {
        List<Throwable> all = new ArrayList<Throwable>(failures.size() + otherErrors.size());
        all.addAll(failures);
        all.addAll(otherErrors);
        return Collections.unmodifiableList(all);
    }

    public String aggregationBlockLabel() {
        return aggregationBlockLabel;
    }

    public Map<String, Object> aggregationMetadata() {
        return aggregationMetadata;
    }

    @Override
    public String getMessage() {
        String message = renderedMessage;
        if (message == null) {
            synchronized (this) {
                message = renderedMessage;
                if (message == null) {
                    message = AggregateReport.render(this);
                    renderedMessage = message;
                }
            }
        }
        return message;
    }
}
