package org.treesim.runtime.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.treesim.runtime.ConfigurationMismatchException;

/**
 * Piecewise-constant sequence of rate models over simulated time.
 * <p>
 * Built from parallel lists of models and switch times. Model {@code i} governs
 * {@code [t(i-1), t(i))} with {@code t(-1) = 0}. The last model governs all time after the
 * previous switch; its own switch time only records the nominal end of the schedule, so the final
 * rates keep applying past it. Interval lookup depends on time only, never on the lineage.
 */
public final class SkylineSchedule {

    private final List<RateModel> models;
    private final double[] switchTimes;

    private SkylineSchedule(List<RateModel> models, double[] switchTimes) {
        this.models = models;
        this.switchTimes = switchTimes;
    }

    /**
     * @param models      one model per interval, in time order.
     * @param switchTimes the end time of each interval, strictly increasing and positive.
     *                    Only the last one may be infinite.
     * @return the schedule.
     * @throws ConfigurationMismatchException if the lists are empty or differ in length,
     *                                        or the times are not strictly increasing.
     */
    public static SkylineSchedule of(List<? extends RateModel> models, List<Double> switchTimes) {
        if (models == null || switchTimes == null || models.isEmpty()) {
            throw new ConfigurationMismatchException("at least one model and one switch time are required");
        }
        if (models.size() != switchTimes.size()) {
            throw new ConfigurationMismatchException("got " + models.size() + " models but "
                    + switchTimes.size() + " switch times; the lists must have equal length");
        }
        double[] times = new double[switchTimes.size()];
        double previous = 0.0;
        for (int i = 0; i < times.length; i++) {
            Double boxed = switchTimes.get(i);
            double t = boxed == null ? Double.NaN : boxed;
            boolean last = i == times.length - 1;
            if (Double.isNaN(t) || (!last && Double.isInfinite(t))) {
                throw new ConfigurationMismatchException("switch time #" + (i + 1) + " must be finite, got " + t);
            }
            if (t <= previous) {
                throw new ConfigurationMismatchException("switch times must be strictly increasing and positive, got "
                        + switchTimes);
            }
            times[i] = t;
            previous = t;
        }
        List<RateModel> copy = new ArrayList<>(models.size());
        for (RateModel model : models) {
            if (model == null) {
                throw new ConfigurationMismatchException("models must not contain null entries");
            }
            copy.add(model);
        }
        return new SkylineSchedule(Collections.unmodifiableList(copy), times);
    }

    /**
     * @return a single-interval schedule that applies {@code model} forever.
     */
    public static SkylineSchedule constant(RateModel model) {
        return of(List.of(model), List.of(Double.POSITIVE_INFINITY));
    }

    public int size() {
        return models.size();
    }

    public List<RateModel> models() {
        return models;
    }

    public double[] switchTimes() {
        return switchTimes.clone();
    }

    public RateModel modelAt(int intervalIndex) {
        return models.get(intervalIndex);
    }

    public RateModel modelAt(double time) {
        return models.get(intervalIndexAt(time));
    }

    /**
     * Binary search over the effective boundaries. A time equal to a boundary belongs to the
     * interval that starts there.
     *
     * @param time absolute simulated time ≥ 0.
     * @return index of the interval containing {@code time}.
     */
    public int intervalIndexAt(double time) {
        int lo = 0;
        int hi = switchTimes.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (switchTimes[mid] <= time) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /**
     * @return start time of the given interval.
     */
    public double intervalStart(int intervalIndex) {
        return intervalIndex == 0 ? 0.0 : switchTimes[intervalIndex - 1];
    }

    /**
     * @return end time of the given interval, {@link Double#POSITIVE_INFINITY} for the last one.
     */
    public double intervalEnd(int intervalIndex) {
        return intervalIndex < switchTimes.length - 1 ? switchTimes[intervalIndex] : Double.POSITIVE_INFINITY;
    }

    /**
     * @return the first boundary strictly after {@code time}, or +∞ in the final interval.
     */
    public double nextSwitch(double time) {
        return intervalEnd(intervalIndexAt(time));
    }

    @Override
    public String toString() {
        return "Skyline" + models + " until " + Arrays.toString(switchTimes);
    }
}
