package io.failforge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable capture of one failed expectation.
 */
public final class FailureRecord {

    private final String message;
    private final List<String> backtrace;

    public FailureRecord(String message, List<String> backtrace) {
        this.message = message == null ? "" : message;
        this.backtrace = Collections.unmodifiableList(new ArrayList<String>(Objects.requireNonNull(backtrace, "backtrace")));
    }

    public String message() {
        return message;
    }

    /**
     * Location strings in call order, innermost first.
     */
    public List<String> backtrace() {
        return backtrace;
    }

    @Override
    public String toString() {
        return "FailureRecord{message=" + message + ", backtrace=" + backtrace.size() + " frames}";
    }
}
