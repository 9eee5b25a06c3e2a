package io.github.jakubt4.gwaihir.service.phase;

import io.github.jakubt4.gwaihir.model.CommandSpec;

/**
 * A command bound to its executor with parameters already validated.
 */
public record PlannedPhase<P>(CommandSpec command, PhaseExecutor<P> executor, P parameters) {

    static <P> PlannedPhase<P> of(final CommandSpec command, final PhaseExecutor<P> executor) {
        return new PlannedPhase<>(command, executor, executor.parseParameters(command.parameters()));
    }

    public PhaseResult run(final PhaseContext context) {
        return executor.execute(parameters, context);
    }
}
