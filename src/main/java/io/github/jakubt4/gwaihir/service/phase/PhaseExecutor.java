package io.github.jakubt4.gwaihir.service.phase;

import java.util.Map;

/**
 * Numeric integration of one command kind as a fixed-timestep loop.
 *
 * @param <P> typed parameters of the command kind
 */
public interface PhaseExecutor<P> {

    /**
     * Validates and converts a command's raw parameters. Called before the mission starts.
     *
     * @throws io.github.jakubt4.gwaihir.service.config.ConfigInvalidException if a parameter
     *         is missing, of the wrong type or out of range
     */
    P parseParameters(Map<String, Object> raw);

    /**
     * Runs the phase tick by tick. Returns as soon as a tick reports a safety violation,
     * without producing further ticks.
     */
    PhaseResult execute(P parameters, PhaseContext context);
}
