package org.treesim.runtime;

/**
 * Signals that one simulation attempt cannot be accepted (too few or too many sampled tips,
 * extinction before the target, or a runaway population).
 * <p>
 * Internal: {@link ForestGenerator} catches it and restarts the attempt from scratch.
 */
public class SimulationExhaustedException extends TreeSimulationException {

    public SimulationExhaustedException(String message) {
        super(message);
    }
}
