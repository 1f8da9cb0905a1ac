package org.treesim.runtime.model;

import java.util.Arrays;

import org.treesim.runtime.InvalidParameterException;
import org.treesim.runtime.spi.IRandomProvider;

/**
 * Distribution of the number of recipients of one transmission event (always at least one).
 * <p>
 * Three shapes are supported:
 * <ul>
 *   <li>{@link #single()}: exactly one recipient (one-to-one transmission).</li>
 *   <li>{@link #withMean(double)}: {@code 1 + Poisson(r - 1)} recipients, mean r.</li>
 *   <li>{@link #ofWeights(double...)}: {@code weights[k]} is the relative weight of k + 1 recipients.</li>
 * </ul>
 */
public final class RecipientDistribution {

    private static final RecipientDistribution SINGLE = new RecipientDistribution(1.0, null);

    private final double mean;
    /** Cumulative weights, or {@code null} for the Poisson shape. */
    private final double[] cumulative;

    private RecipientDistribution(double mean, double[] cumulative) {
        this.mean = mean;
        this.cumulative = cumulative;
    }

    public static RecipientDistribution single() {
        return SINGLE;
    }

    /**
     * @param averageRecipients mean number of recipients r ≥ 1.
     * @return the shifted Poisson distribution with mean r, or {@link #single()} for r = 1.
     * @throws InvalidParameterException if r is below one or not finite.
     */
    public static RecipientDistribution withMean(double averageRecipients) {
        if (!Double.isFinite(averageRecipients) || averageRecipients < 1.0) {
            throw new InvalidParameterException(
                    "average number of recipients must be a finite number >= 1, got " + averageRecipients);
        }
        if (averageRecipients == 1.0) {
            return SINGLE;
        }
        return new RecipientDistribution(averageRecipients, null);
    }

    /**
     * @param weights relative weights of 1, 2, 3, ... recipients.
     * @return the explicit distribution.
     * @throws InvalidParameterException if a weight is negative or not finite, or all are zero.
     */
    public static RecipientDistribution ofWeights(double... weights) {
        if (weights == null || weights.length == 0) {
            throw new InvalidParameterException("recipient weights must not be empty");
        }
        double[] cumulative = new double[weights.length];
        double total = 0.0;
        double weightedSum = 0.0;
        for (int k = 0; k < weights.length; k++) {
            InvalidParameterException.requireRate("recipient weight #" + (k + 1), weights[k]);
            total += weights[k];
            weightedSum += weights[k] * (k + 1);
            cumulative[k] = total;
        }
        if (total <= 0.0) {
            throw new InvalidParameterException("at least one recipient weight must be positive");
        }
        if (weights.length == 1) {
            return SINGLE;
        }
        return new RecipientDistribution(weightedSum / total, cumulative);
    }

    /**
     * Draws a recipient count. The one-recipient shape consumes no randomness.
     *
     * @param random the attempt's random stream.
     * @return a count ≥ 1.
     */
    public int sample(IRandomProvider random) {
        if (this == SINGLE) {
            return 1;
        }
        if (cumulative == null) {
            return 1 + random.nextPoisson(mean - 1.0);
        }
        double u = random.nextDouble() * cumulative[cumulative.length - 1];
        for (int k = 0; k < cumulative.length; k++) {
            if (u < cumulative[k]) {
                return k + 1;
            }
        }
        return cumulative.length;
    }

    public double mean() {
        return mean;
    }

    /**
     * @return {@code true} if more than one recipient is possible.
     */
    public boolean isMultiple() {
        return this != SINGLE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RecipientDistribution other)) {
            return false;
        }
        return Double.compare(mean, other.mean) == 0 && Arrays.equals(cumulative, other.cumulative);
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(mean) + Arrays.hashCode(cumulative);
    }

    @Override
    public String toString() {
        if (this == SINGLE) {
            return "single";
        }
        return cumulative == null ? "1+Poisson(" + (mean - 1.0) + ")" : "weights" + Arrays.toString(cumulative);
    }
}
