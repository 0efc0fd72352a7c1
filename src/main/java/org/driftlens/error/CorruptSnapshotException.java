package org.driftlens.error;

import java.util.List;
import java.util.Objects;

/**
 * Persisted snapshot data that cannot be turned back into a report.
 */
public final class CorruptSnapshotException extends RuntimeException {
    private final List<String> problems;

    public CorruptSnapshotException(final String problem) {
        this(List.of(Objects.requireNonNull(problem, "problem")), null);
    }

    public CorruptSnapshotException(final String problem, final Throwable cause) {
        this(List.of(Objects.requireNonNull(problem, "problem")), cause);
    }

    public CorruptSnapshotException(final List<String> problems) {
        this(problems, null);
    }

    private CorruptSnapshotException(final List<String> problems, final Throwable cause) {
        super(formatMessage(problems), cause);
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }

    private static String formatMessage(final List<String> problems) {
        final List<String> normalized = List.copyOf(Objects.requireNonNull(problems, "problems"));
        if (normalized.isEmpty()) {
            return "corrupt snapshot";
        }
        if (normalized.size() == 1) {
            return "corrupt snapshot: " + normalized.get(0);
        }
        final StringBuilder sb = new StringBuilder();
        sb.append("corrupt snapshot (").append(normalized.size()).append(" issue(s))");
        for (final String problem : normalized) {
            sb.append('\n').append("- ").append(problem);
        }
        return sb.toString();
    }
}
