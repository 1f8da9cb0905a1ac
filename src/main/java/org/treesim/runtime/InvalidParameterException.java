package org.treesim.runtime;

/**
 * Thrown when a rate model or a simulation parameter is constructed with an out-of-domain value,
 * e.g. a negative rate or a probability outside [0, 1].
 * <p>
 * Fatal: surfaced immediately, never retried.
 */
public class InvalidParameterException extends TreeSimulationException {

    public InvalidParameterException(String message) {
        super(message);
    }

    /**
     * Fails unless {@code value} is finite and non-negative.
     *
     * @param name  parameter name used in the message.
     * @param value the value to check.
     * @return the value, for chaining in constructors.
     */
    public static double requireRate(String name, double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw new InvalidParameterException(name + " must be a finite non-negative number, got " + value);
        }
        return value;
    }

    /**
     * Fails unless {@code value} lies in [0, 1].
     *
     * @param name  parameter name used in the message.
     * @param value the value to check.
     * @return the value, for chaining in constructors.
     */
    public static double requireProbability(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new InvalidParameterException(name + " must be a probability in [0, 1], got " + value);
        }
        return value;
    }
}
