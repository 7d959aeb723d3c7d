package io.failforge;

import java.util.List;

/**
 * Renders an {@link AggregateFailureError} into the text returned by its
 * {@link AggregateFailureError#getMessage()}.
 *
 * <p>Layout:
 * <pre>
 * Got 2 failures and 1 other error from failure aggregation block "label":
 *
 *   1) first message
 *      second line of first message
 *
 *   2) ...
 * </pre>
 * Entry numbers are padded to the width of the largest one so every message
 * starts in the same column.
 */
public final class AggregateReport {

    private static final String INDEX_INDENT = "  ";

    private AggregateReport() {
    }

    public static String render(AggregateFailureError error) {
        List<Throwable> entries = error.allExceptions();
        StringBuilder sb = new StringBuilder(256);
        sb.append(summary(error.failures().size(), error.otherErrors().size(), error.aggregationBlockLabel()));
        sb.append(":\n\n");

        int labelWidth = indexLabel(entries.size()).length();
        for (int i = 0; i < entries.size(); i++) {
            if (i > 0) {
                sb.append("\n\n");
            }
            appendEntry(sb, i + 1, labelWidth, entryMessage(entries.get(i)));
        }
        return sb.toString();
    }

    /**
     * Header without the trailing colon, e.g. {@code Got 3 failures from failure aggregation block}.
     */
    public static String summary(int failures, int otherErrors, String label) {
        StringBuilder sb = new StringBuilder(96);
        sb.append("Got ").append(pluralize(failures, "failure"));
        if (otherErrors > 0) {
            sb.append(" and ").append(pluralize(otherErrors, "other error"));
        }
        sb.append(" from failure aggregation block");
        if (label != null) {
            sb.append(" \"").append(label).append('"');
        }
        return sb.toString();
    }

    static String entryMessage(Throwable entry) {
        if (entry instanceof ExpectationFailedError || entry instanceof AggregateFailureError) {
            return nullToEmpty(entry.getMessage());
        }
        String message = entry.getMessage();
        if (message == null) {
            return entry.getClass().getName();
        }
        return entry.getClass().getName() + ": " + message;
    }

    private static void appendEntry(StringBuilder sb, int index, int labelWidth, String message) {
        String label = indexLabel(index);
        sb.append(label);
        appendSpaces(sb, labelWidth - label.length());

        String[] lines = message.strip().split("\n", -1);
        sb.append(lines[0]);
        for (int i = 1; i < lines.length; i++) {
            sb.append('\n');
            if (!lines[i].isBlank()) {
                appendSpaces(sb, labelWidth);
            }
            sb.append(lines[i]);
        }
    }

    private static String indexLabel(int index) {
        return INDEX_INDENT + index + ") ";
    }

    private static String pluralize(int count, String noun) {
        return count + " " + noun + (count == 1 ? "" : "s");
    }

    private static void appendSpaces(StringBuilder sb, int count) {
        for (int i = 0; i < count; i++) {
            sb.append(' ');
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
