package org.treesim.runtime.model;

/**
 * Per-interval event rates of the birth-death-sampling process.
 * <p>
 * Two implementations exist: {@link BirthDeathModel} (plain rates) and {@link NotificationModel},
 * which composes a plain model with the contact-notification parameters. The engine only talks to
 * this interface.
 */
public interface RateModel {

    /**
     * @return transmission (birth) rate λ per lineage.
     */
    double birthRate();

    /**
     * @return removal rate ψ per ordinary lineage.
     */
    double removalRate();

    /**
     * @return probability p that a removal is observed (sampled).
     */
    double samplingProbability();

    /**
     * @return distribution of the number of recipients per transmission.
     */
    RecipientDistribution recipients();

    /**
     * @return probability υ that a sampling event notifies contacts; 0 for plain models.
     */
    default double notificationProbability() {
        return 0.0;
    }

    /**
     * @return removal rate φ of notified lineages. Plain models keep ψ.
     */
    default double notifiedRemovalRate() {
        return removalRate();
    }

    /**
     * @return {@code true} if a sampling event under this model may notify contacts.
     */
    default boolean canNotify() {
        return notificationProbability() > 0.0;
    }
}
