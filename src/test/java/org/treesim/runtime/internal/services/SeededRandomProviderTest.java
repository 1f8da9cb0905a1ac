package org.treesim.runtime.internal.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.treesim.runtime.spi.IRandomProvider;

@Tag("unit")
class SeededRandomProviderTest {

    @Test
    void sameSeedSameSequence() {
        SeededRandomProvider a = new SeededRandomProvider(123L);
        SeededRandomProvider b = new SeededRandomProvider(123L);

        for (int i = 0; i < 100; i++) {
            assertThat(a.nextDouble()).isEqualTo(b.nextDouble());
            assertThat(a.nextExponential(2.0)).isEqualTo(b.nextExponential(2.0));
        }
        assertThat(a.getSeed()).isEqualTo(123L);
    }

    @Test
    void derivedStreamsAreDeterministicAndIndependent() {
        SeededRandomProvider root = new SeededRandomProvider(5L);

        IRandomProvider first = root.deriveFor("attempt", 1);
        IRandomProvider again = new SeededRandomProvider(5L).deriveFor("attempt", 1);
        IRandomProvider second = root.deriveFor("attempt", 2);
        IRandomProvider other = root.deriveFor("other", 1);

        double value = first.nextDouble();
        assertThat(again.nextDouble()).isEqualTo(value);
        assertThat(second.nextDouble()).isNotEqualTo(value);
        assertThat(other.nextDouble()).isNotEqualTo(value);
    }

    @Test
    void derivingDoesNotAdvanceTheParent() {
        SeededRandomProvider a = new SeededRandomProvider(8L);
        SeededRandomProvider b = new SeededRandomProvider(8L);

        a.deriveFor("attempt", 3);

        assertThat(a.nextDouble()).isEqualTo(b.nextDouble());
    }

    @Test
    void stateRoundTrip() {
        SeededRandomProvider provider = new SeededRandomProvider(77L);
        provider.nextDouble();
        byte[] state = provider.saveState();
        double expected = provider.nextDouble();

        provider.nextDouble();
        provider.loadState(state);

        assertThat(provider.nextDouble()).isEqualTo(expected);
    }

    @Test
    void degenerateDrawsConsumeNothing() {
        SeededRandomProvider a = new SeededRandomProvider(9L);
        SeededRandomProvider b = new SeededRandomProvider(9L);

        assertThat(a.nextExponential(0.0)).isInfinite();
        assertThat(a.nextPoisson(0.0)).isZero();
        assertThat(a.nextBoolean(0.0)).isFalse();
        assertThat(a.nextBoolean(1.0)).isTrue();

        assertThat(a.nextDouble()).isEqualTo(b.nextDouble());
    }

    @Test
    void exponentialMeanMatchesRate() {
        SeededRandomProvider provider = new SeededRandomProvider(2L);
        double sum = 0.0;
        int draws = 50_000;
        for (int i = 0; i < draws; i++) {
            sum += provider.nextExponential(4.0);
        }

        assertThat(sum / draws).isCloseTo(0.25, within(0.01));
    }

    @Test
    void bernoulliFrequency() {
        SeededRandomProvider provider = new SeededRandomProvider(4L);
        int hits = 0;
        int draws = 50_000;
        for (int i = 0; i < draws; i++) {
            if (provider.nextBoolean(0.3)) {
                hits++;
            }
        }

        assertThat((double) hits / draws).isCloseTo(0.3, within(0.01));
    }

    @Test
    void poissonSamplerIsBuiltOncePerMean() {
        SeededRandomProvider provider = new SeededRandomProvider(6L);

        for (int i = 0; i < 1_000; i++) {
            provider.nextPoisson(0.5);
            provider.nextPoisson(60.0);
        }

        assertThat(provider.cachedPoissonSamplers()).isEqualTo(2);
    }

    @Test
    void largeMeanPoissonMatchesMeanAndRestoresState() {
        SeededRandomProvider provider = new SeededRandomProvider(12L);
        long sum = 0;
        int draws = 20_000;
        for (int i = 0; i < draws; i++) {
            sum += provider.nextPoisson(60.0);
        }
        assertThat((double) sum / draws).isCloseTo(60.0, within(0.5));

        byte[] state = provider.saveState();
        int expected = provider.nextPoisson(60.0);
        provider.nextPoisson(60.0);
        provider.loadState(state);

        assertThat(provider.nextPoisson(60.0)).isEqualTo(expected);
    }
}
