package io.github.jakubt4.gwaihir.model;

import java.util.List;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One element of a mission's command sequence.
 *
 * @param id                      unique id, the only ordering of the sequence
 * @param kind                    command kind, {@code null} when the configured label is unknown
 * @param description             free-form operator text
 * @param parameters              kind-specific parameters as loaded from configuration
 * @param expectedDurationSeconds informational only, never enforced
 * @param safetyChecks            ids of the checks run before and while the command executes
 */
public record CommandSpec(int id, CommandKind kind, String description, Map<String, Object> parameters,
                          int expectedDurationSeconds, List<String> safetyChecks) {

    public CommandSpec {
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        safetyChecks = safetyChecks == null ? List.of() : List.copyOf(safetyChecks);
    }
}
