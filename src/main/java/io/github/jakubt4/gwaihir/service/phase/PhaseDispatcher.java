package io.github.jakubt4.gwaihir.service.phase;

import io.github.jakubt4.gwaihir.model.CommandSpec;
import io.github.jakubt4.gwaihir.service.config.UnsupportedCommandKindException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Binds commands to the executor of their kind.
 */
@Component
@RequiredArgsConstructor
public class PhaseDispatcher {

    private final AscendExecutor ascendExecutor;
    private final HoldExecutor holdExecutor;
    private final CircularPathExecutor circularPathExecutor;
    private final DescendAndLandExecutor descendAndLandExecutor;

    public static PhaseDispatcher standard() {
        return new PhaseDispatcher(new AscendExecutor(), new HoldExecutor(), new CircularPathExecutor(),
                new DescendAndLandExecutor());
    }

    /**
     * Validates the command's parameters and pairs them with the matching executor.
     *
     * @throws UnsupportedCommandKindException if the command has no kind
     * @throws io.github.jakubt4.gwaihir.service.config.ConfigInvalidException if the parameters
     *         do not fit the kind
     */
    public PlannedPhase<?> plan(final CommandSpec command) {
        if (command.kind() == null) {
            throw new UnsupportedCommandKindException(command.id(), "null");
        }
        return switch (command.kind()) {
            case ASCEND -> PlannedPhase.of(command, ascendExecutor);
            case HOLD -> PlannedPhase.of(command, holdExecutor);
            case CIRCULAR_PATH -> PlannedPhase.of(command, circularPathExecutor);
            case DESCEND_AND_LAND -> PlannedPhase.of(command, descendAndLandExecutor);
        };
    }
}
