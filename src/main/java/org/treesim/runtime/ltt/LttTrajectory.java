package org.treesim.runtime.ltt;

import java.util.ArrayList;
import java.util.List;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Lineages-through-time step function: after {@code time(i)} (inclusive) and until the next
 * point, {@code count(i)} lineages are alive. Times are strictly increasing.
 */
public final class LttTrajectory {

    /**
     * One step of the trajectory.
     *
     * @param time     the time the count changed.
     * @param lineages number of lineages from that time on.
     */
    public record Point(double time, int lineages) {
    }

    private final DoubleArrayList times;
    private final IntArrayList counts;

    LttTrajectory(DoubleArrayList times, IntArrayList counts) {
        this.times = times;
        this.counts = counts;
    }

    public static LttTrajectory empty() {
        return new LttTrajectory(new DoubleArrayList(), new IntArrayList());
    }

    public int size() {
        return times.size();
    }

    public boolean isEmpty() {
        return times.isEmpty();
    }

    public double time(int index) {
        return times.getDouble(index);
    }

    public int count(int index) {
        return counts.getInt(index);
    }

    /**
     * @param time any time.
     * @return number of lineages alive at {@code time}; 0 before the first point.
     */
    public int countAt(double time) {
        int lo = 0;
        int hi = times.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (times.getDouble(mid) <= time) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo == 0 ? 0 : counts.getInt(lo - 1);
    }

    /**
     * @return the largest number of simultaneously alive lineages.
     */
    public int max() {
        int max = 0;
        for (int i = 0; i < counts.size(); i++) {
            max = Math.max(max, counts.getInt(i));
        }
        return max;
    }

    public List<Point> points() {
        List<Point> points = new ArrayList<>(times.size());
        for (int i = 0; i < times.size(); i++) {
            points.add(new Point(times.getDouble(i), counts.getInt(i)));
        }
        return points;
    }

    @Override
    public String toString() {
        return "LttTrajectory" + points();
    }
}
