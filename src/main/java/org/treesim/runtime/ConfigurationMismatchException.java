package org.treesim.runtime;

/**
 * Thrown when the skyline switch times and the model list disagree in length,
 * or when the switch times are not strictly increasing.
 * Raised before any simulation starts.
 */
public class ConfigurationMismatchException extends TreeSimulationException {

    public ConfigurationMismatchException(String message) {
        super(message);
    }
}
