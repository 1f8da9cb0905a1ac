package org.treesim.runtime;

/**
 * Thrown when the configured process can never produce an acceptable forest
 * (no interval can sample, the horizon is zero, births are impossible while more tips than
 * one tree can yield are requested), or when the configured attempt limit is exhausted.
 */
public class DegenerateProcessException extends TreeSimulationException {

    public DegenerateProcessException(String message) {
        super(message);
    }
}
