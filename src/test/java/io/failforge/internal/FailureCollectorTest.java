package io.failforge.internal;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FailureCollectorTest {

    @Test
    void reservedSlotsKeepTheirPosition() {
        FailureCollector collector = new FailureCollector(1L);
        RuntimeException first = new RuntimeException("first");
        RuntimeException nested = new RuntimeException("nested");
        RuntimeException last = new RuntimeException("last");

        collector.addFailure(first);
        FailureCollector.Slot slot = collector.reserve();
        collector.reserve();
        collector.addFailure(last);
        assertTrue(slot.fill(nested));

        assertEquals(Arrays.<Throwable>asList(first, nested, last), collector.failures());
        assertEquals(3, collector.size());
        assertThrows(IllegalStateException.class, () -> slot.fill(new RuntimeException("again")));
        assertFalse(collector.contains(new RuntimeException("stranger")));
    }

    @Test
    void sameObjectIsCollectedOnce() {
        FailureCollector collector = new FailureCollector(2L);
        RuntimeException boom = new RuntimeException("boom");

        assertTrue(collector.addFailure(boom));
        assertFalse(collector.addFailure(boom));
        assertFalse(collector.addOtherError(boom));
        assertTrue(collector.contains(boom));
        assertEquals(1, collector.size());
        assertTrue(collector.otherErrors().isEmpty());
    }

    @Test
    void acceptTreatsRepeatedFailuresAsTaken() {
        FailureCollector collector = new FailureCollector(4L);
        RuntimeException boom = new RuntimeException("boom");

        assertTrue(collector.accept(boom));
        assertTrue(collector.accept(boom));
        assertEquals(Collections.<Throwable>singletonList(boom), collector.failures());
    }

    @Test
    void closedCollectorRefusesAdditions() {
        FailureCollector collector = new FailureCollector(3L);
        FailureCollector.Slot slot = collector.reserve();
        collector.close();

        assertTrue(collector.isClosed());
        assertFalse(collector.addFailure(new RuntimeException("late")));
        assertFalse(collector.addOtherError(new RuntimeException("late")));
        assertFalse(slot.fill(new RuntimeException("late")));
        assertNull(collector.reserve());
        assertFalse(collector.accept(new RuntimeException("late")));
        assertEquals(0, collector.size());
    }

    @Test
    void backtraceDropsLeadingEngineFrames() {
        StackTraceElement[] frames = new StackTraceElement[] {
            new StackTraceElement("java.lang.Thread", "getStackTrace", "Thread.java", 1),
            new StackTraceElement("io.failforge.internal.Backtraces", "capture", "Backtraces.java", 2),
            new StackTraceElement("io.failforge.AggregationContext", "notifyFailure", "AggregationContext.java", 3),
            new StackTraceElement("com.example.UserSpec", "checksPayload", "UserSpec.java", 42),
            new StackTraceElement("io.failforge.AggregationContext$Entry", "x", "AggregationContext.java", 4)
        };

        List<String> lines = Backtraces.format(frames);

        assertEquals(2, lines.size());
        assertEquals("com.example.UserSpec.checksPayload(UserSpec.java:42)", lines.get(0));
    }

    @Test
    void backtraceKeepsEverythingWhenOnlyEngineFramesExist() {
        StackTraceElement[] frames = new StackTraceElement[] {
            new StackTraceElement("io.failforge.Expectations", "fail", "Expectations.java", 9)
        };

        assertEquals(Collections.singletonList("io.failforge.Expectations.fail(Expectations.java:9)"),
            Backtraces.format(frames));
        assertTrue(Backtraces.of(new RuntimeException()).get(0).contains("FailureCollectorTest"));
    }
}
