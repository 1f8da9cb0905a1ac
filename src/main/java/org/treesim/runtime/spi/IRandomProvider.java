package org.treesim.runtime.spi;

/**
 * Source of randomness for the simulation.
 * <p>
 * A single provider is threaded through one simulation attempt. Attempts obtain independent
 * streams through {@link #deriveFor(String, long)}, so that retries never share state and a fixed
 * seed reproduces the same forest.
 */
public interface IRandomProvider {

    /**
     * @return a uniformly distributed value in [0, 1).
     */
    double nextDouble();

    /**
     * @param bound exclusive upper bound, must be positive.
     * @return a uniformly distributed value in [0, bound).
     */
    int nextInt(int bound);

    /**
     * Draws a waiting time from the exponential distribution with the given rate.
     *
     * @param rate the event rate; zero (or less) means the event never fires.
     * @return the waiting time, or {@link Double#POSITIVE_INFINITY} for a zero rate.
     */
    double nextExponential(double rate);

    /**
     * @param mean the Poisson mean; zero (or less) yields 0 without consuming randomness.
     * @return a Poisson distributed count.
     */
    int nextPoisson(double mean);

    /**
     * Bernoulli draw. Probabilities of 0 and 1 are resolved without consuming randomness.
     *
     * @param probability success probability in [0, 1].
     * @return {@code true} with the given probability.
     */
    boolean nextBoolean(double probability);

    /**
     * Creates an independent, deterministic child stream.
     *
     * @param context a label for the consumer of the stream (e.g. "attempt").
     * @param salt    a discriminator within that context (e.g. the attempt number).
     * @return a new provider whose sequence depends only on this provider's seed, context and salt.
     */
    IRandomProvider deriveFor(String context, long salt);

    /**
     * @return the serialized generator state.
     */
    byte[] saveState();

    /**
     * Restores a state previously obtained from {@link #saveState()}.
     *
     * @param state the serialized generator state.
     */
    void loadState(byte[] state);
}
