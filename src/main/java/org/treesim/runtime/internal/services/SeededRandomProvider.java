package org.treesim.runtime.internal.services;

import java.nio.charset.StandardCharsets;

import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.core.RandomProviderDefaultState;
import org.apache.commons.rng.sampling.distribution.AhrensDieterExponentialSampler;
import org.apache.commons.rng.sampling.distribution.PoissonSampler;
import org.apache.commons.rng.sampling.distribution.SharedStateContinuousSampler;
import org.apache.commons.rng.sampling.distribution.SharedStateDiscreteSampler;
import org.apache.commons.rng.simple.RandomSource;
import org.treesim.runtime.spi.IRandomProvider;

import it.unimi.dsi.fastutil.doubles.Double2ObjectOpenHashMap;

/**
 * {@link IRandomProvider} backed by an Apache Commons RNG XoShiRo256++ generator.
 * <p>
 * Derived streams are seeded from a hash of the parent seed, the context label and the salt,
 * so the whole tree of streams is a pure function of the root seed.
 * <p>
 * Samplers hold no state of their own, so they are built once and reused: exponential draws scale a
 * unit-mean sample, and Poisson samplers are cached per mean.
 */
public class SeededRandomProvider implements IRandomProvider {

    private static final RandomSource ALGORITHM = RandomSource.XO_SHI_RO_256_PP;

    private final long seed;
    private final RestorableUniformRandomProvider rng;
    private final SharedStateContinuousSampler unitExponential;
    private final Double2ObjectOpenHashMap<SharedStateDiscreteSampler> poissonSamplers = new Double2ObjectOpenHashMap<>();

    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.rng = (RestorableUniformRandomProvider) ALGORITHM.create(seed);
        this.unitExponential = AhrensDieterExponentialSampler.of(rng, 1.0);
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public double nextDouble() {
        return rng.nextDouble();
    }

    @Override
    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    @Override
    public double nextExponential(double rate) {
        if (!(rate > 0.0)) {
            return Double.POSITIVE_INFINITY;
        }
        return unitExponential.sample() / rate;
    }

    @Override
    public int nextPoisson(double mean) {
        if (!(mean > 0.0)) {
            return 0;
        }
        SharedStateDiscreteSampler sampler = poissonSamplers.get(mean);
        if (sampler == null) {
            sampler = PoissonSampler.of(rng, mean);
            poissonSamplers.put(mean, sampler);
        }
        return sampler.sample();
    }

    int cachedPoissonSamplers() {
        return poissonSamplers.size();
    }

    @Override
    public boolean nextBoolean(double probability) {
        if (probability <= 0.0) {
            return false;
        }
        if (probability >= 1.0) {
            return true;
        }
        return rng.nextDouble() < probability;
    }

    @Override
    public IRandomProvider deriveFor(String context, long salt) {
        long h = mix(seed);
        for (byte b : context.getBytes(StandardCharsets.UTF_8)) {
            h = mix(h ^ b);
        }
        return new SeededRandomProvider(mix(h ^ salt));
    }

    @Override
    public byte[] saveState() {
        return ((RandomProviderDefaultState) rng.saveState()).getState();
    }

    @Override
    public void loadState(byte[] state) {
        rng.restoreState(new RandomProviderDefaultState(state));
    }

    // SplitMix64 finalizer
    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return z ^ (z >>> 31);
    }
}
