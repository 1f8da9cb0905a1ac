package org.treesim.runtime;

/**
 * Base class of all errors raised by the simulation core.
 */
public class TreeSimulationException extends RuntimeException {

    public TreeSimulationException(String message) {
        super(message);
    }

    public TreeSimulationException(String message, Throwable cause) {
        super(message, cause);
    }
}
