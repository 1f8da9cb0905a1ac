package org.treesim.runtime.model;

import static org.treesim.runtime.InvalidParameterException.requireProbability;
import static org.treesim.runtime.InvalidParameterException.requireRate;

import java.util.Objects;

/**
 * Plain birth-death-sampling rates of one skyline interval.
 *
 * @param birthRate           transmission rate λ ≥ 0.
 * @param removalRate         removal rate ψ ≥ 0.
 * @param samplingProbability probability p ∈ [0, 1] that a removal is sampled.
 * @param recipients          number of recipients per transmission.
 */
public record BirthDeathModel(double birthRate, double removalRate, double samplingProbability,
                              RecipientDistribution recipients) implements RateModel {

    public BirthDeathModel {
        requireRate("birth rate (lambda)", birthRate);
        requireRate("removal rate (psi)", removalRate);
        requireProbability("sampling probability (p)", samplingProbability);
        Objects.requireNonNull(recipients, "recipients");
    }

    /**
     * Creates a model with one-to-one transmissions.
     */
    public BirthDeathModel(double birthRate, double removalRate, double samplingProbability) {
        this(birthRate, removalRate, samplingProbability, RecipientDistribution.single());
    }

    @Override
    public String toString() {
        return "BD(lambda=" + birthRate + ", psi=" + removalRate + ", p=" + samplingProbability
                + (recipients.isMultiple() ? ", r=" + recipients.mean() : "") + ")";
    }
}
