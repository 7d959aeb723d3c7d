package io.failforge.internal;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Captures the caller's stack as location strings, dropping the leading
 * frames that belong to the aggregation machinery itself.
 */
public final class Backtraces {

    private static final Set<String> ENGINE_CLASSES = new HashSet<String>(Arrays.asList(
        "java.lang.Thread",
        "io.failforge.internal.Backtraces",
        "io.failforge.internal.FailureCollector",
        "io.failforge.AggregationContext",
        "io.failforge.Expectations",
        "io.failforge.ExpectationResult"
    ));

    private Backtraces() {
    }

    public static List<String> capture() {
        return format(Thread.currentThread().getStackTrace());
    }

    /**
     * Location strings of a throwable's own stack trace, unfiltered.
     */
    public static List<String> of(Throwable throwable) {
        StackTraceElement[] frames = throwable.getStackTrace();
        List<String> lines = new ArrayList<String>(frames.length);
        for (StackTraceElement frame : frames) {
            lines.add(frame.toString());
        }
        return Collections.unmodifiableList(lines);
    }

    static List<String> format(StackTraceElement[] frames) {
        int start = 0;
        while (start < frames.length && isEngineFrame(frames[start])) {
            start++;
        }
        if (start == frames.length) {
            start = 0;
        }
        List<String> lines = new ArrayList<String>(frames.length - start);
        for (int i = start; i < frames.length; i++) {
            lines.add(frames[i].toString());
        }
        return Collections.unmodifiableList(lines);
    }

    private static boolean isEngineFrame(StackTraceElement frame) {
        String className = frame.getClassName();
        int nested = className.indexOf('$');
        if (nested > 0) {
            className = className.substring(0, nested);
        }
        return ENGINE_CLASSES.contains(className);
    }
}
