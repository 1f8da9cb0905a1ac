package org.treesim.runtime;

import java.util.ArrayList;
import java.util.List;

import org.treesim.runtime.model.RateModel;
import org.treesim.runtime.model.SkylineSchedule;

/**
 * Validated inputs of one forest generation.
 * <p>
 * Use {@link #builder()}; {@link Builder#build()} rejects out-of-domain scalars with
 * {@link InvalidParameterException} and inconsistent skyline lists with
 * {@link ConfigurationMismatchException}.
 */
public final class SimulationParameters {

    private final SkylineSchedule schedule;
    private final int minTips;
    private final int maxTips;
    private final double horizon;
    private final int maxNotifiedContacts;

    private SimulationParameters(Builder builder) {
        if (builder.minTips < 1) {
            throw new InvalidParameterException("min tips must be positive, got " + builder.minTips);
        }
        if (builder.maxTips < builder.minTips) {
            throw new InvalidParameterException("max tips (" + builder.maxTips
                    + ") must not be less than min tips (" + builder.minTips + ")");
        }
        if (Double.isNaN(builder.horizon) || builder.horizon < 0.0) {
            throw new InvalidParameterException("total time T must be non-negative, got " + builder.horizon);
        }
        if (builder.maxNotifiedContacts < 0) {
            throw new InvalidParameterException("max notified contacts must be non-negative, got "
                    + builder.maxNotifiedContacts);
        }
        this.schedule = SkylineSchedule.of(builder.models, builder.skylineTimes);
        this.minTips = builder.minTips;
        this.maxTips = builder.maxTips;
        this.horizon = builder.horizon;
        this.maxNotifiedContacts = builder.maxNotifiedContacts;
    }

    public static Builder builder() {
        return new Builder();
    }

    public SkylineSchedule schedule() {
        return schedule;
    }

    public int minTips() {
        return minTips;
    }

    public int maxTips() {
        return maxTips;
    }

    /**
     * @return the total time T, {@link Double#POSITIVE_INFINITY} for single-tree mode.
     */
    public double horizon() {
        return horizon;
    }

    public boolean isForestMode() {
        return horizon < Double.POSITIVE_INFINITY;
    }

    public int maxNotifiedContacts() {
        return maxNotifiedContacts;
    }

    public static final class Builder {
        private final List<RateModel> models = new ArrayList<>();
        private final List<Double> skylineTimes = new ArrayList<>();
        private int minTips = 1;
        private int maxTips = 1;
        private double horizon = Double.POSITIVE_INFINITY;
        private int maxNotifiedContacts = 1;

        private Builder() {
        }

        /**
         * Appends an interval.
         *
         * @param model      rates of the interval.
         * @param switchTime end time of the interval.
         */
        public Builder interval(RateModel model, double switchTime) {
            models.add(model);
            skylineTimes.add(switchTime);
            return this;
        }

        public Builder models(List<? extends RateModel> value) {
            models.clear();
            models.addAll(value);
            return this;
        }

        public Builder skylineTimes(List<Double> value) {
            skylineTimes.clear();
            skylineTimes.addAll(value);
            return this;
        }

        public Builder tips(int min, int max) {
            this.minTips = min;
            this.maxTips = max;
            return this;
        }

        public Builder horizon(double totalTime) {
            this.horizon = totalTime;
            return this;
        }

        public Builder maxNotifiedContacts(int value) {
            this.maxNotifiedContacts = value;
            return this;
        }

        public SimulationParameters build() {
            return new SimulationParameters(this);
        }
    }
}
