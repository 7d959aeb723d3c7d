package io.failforge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Raised when an expectation is not met.
 *
 * <p>The backtrace is an opaque list of location strings. It can be supplied at
 * construction or assigned later, but only once: an existing backtrace is never
 * replaced.
 */
public class ExpectationFailedError extends AssertionError {

    private volatile List<String> backtrace;

    public ExpectationFailedError(String message) {
        super(message);
    }

    public ExpectationFailedError(String message, List<String> backtrace) {
        super(message);
        if (backtrace != null) {
            this.backtrace = copyOf(backtrace);
        }
    }

    public boolean hasBacktrace() {
        return backtrace != null;
    }

    /**
     * Returns the backtrace, or an empty list when none was assigned yet.
     */
    public List<String> backtrace() {
        List<String> current = backtrace;
        return current == null ? Collections.<String>emptyList() : current;
    }

    /**
     * Assign the backtrace unless one is already present.
     *
     * @return {@code true} if the given backtrace was installed
     */
    public synchronized boolean setBacktraceIfAbsent(List<String> candidate) {
        Objects.requireNonNull(candidate, "candidate");
        if (backtrace != null) {
            return false;
        }
        backtrace = copyOf(candidate);
        return true;
    }

    public FailureRecord record() {
        return new FailureRecord(getMessage(), backtrace());
    }

    private static List<String> copyOf(List<String> lines) {
        return Collections.unmodifiableList(new ArrayList<String>(lines));
    }
}
