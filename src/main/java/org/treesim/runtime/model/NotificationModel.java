package org.treesim.runtime.model;

import static org.treesim.runtime.InvalidParameterException.requireProbability;
import static org.treesim.runtime.InvalidParameterException.requireRate;

import java.util.Objects;

/**
 * Adds contact notification to a plain model.
 * <p>
 * Under this model a sampling event notifies contacts with probability υ. Notified lineages are
 * removed at rate φ instead of ψ, are always sampled when removed and never notify in turn.
 * Everything else is delegated to the base model, so υ = 0 behaves exactly like the base.
 *
 * @param base                    the wrapped rates.
 * @param notificationProbability υ ∈ [0, 1].
 * @param notifiedRemovalRate     φ ≥ 0.
 */
public record NotificationModel(BirthDeathModel base, double notificationProbability,
                                double notifiedRemovalRate) implements RateModel {

    public NotificationModel {
        Objects.requireNonNull(base, "base");
        requireProbability("notification probability (upsilon)", notificationProbability);
        requireRate("notified removal rate (phi)", notifiedRemovalRate);
    }

    @Override
    public double birthRate() {
        return base.birthRate();
    }

    @Override
    public double removalRate() {
        return base.removalRate();
    }

    @Override
    public double samplingProbability() {
        return base.samplingProbability();
    }

    @Override
    public RecipientDistribution recipients() {
        return base.recipients();
    }

    @Override
    public String toString() {
        return "PN(" + base + ", upsilon=" + notificationProbability + ", phi=" + notifiedRemovalRate + ")";
    }
}
