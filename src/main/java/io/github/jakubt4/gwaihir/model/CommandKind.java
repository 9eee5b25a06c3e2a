package io.github.jakubt4.gwaihir.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of mission command kinds. Each kind is executed by exactly one phase executor.
 */
public enum CommandKind {
    ASCEND("ASCEND", "TAKEOFF"),
    HOLD("HOLD", "HOVER"),
    CIRCULAR_PATH("CIRCULAR_PATH", "CIRCLE"),
    DESCEND_AND_LAND("DESCEND_AND_LAND", "LAND");

    private final List<String> labels;

    CommandKind(final String... labels) {
        this.labels = List.of(labels);
    }

    /**
     * Resolves a configuration label such as {@code "TAKEOFF"} or {@code "circle"}.
     *
     * @return the matching kind, or empty when the label names no supported kind
     */
    public static Optional<CommandKind> fromLabel(final String label) {
        if (label == null) {
            return Optional.empty();
        }
        final var normalized = label.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(kind -> kind.labels.contains(normalized))
                .findFirst();
    }
}
