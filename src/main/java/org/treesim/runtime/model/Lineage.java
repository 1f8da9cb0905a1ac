package org.treesim.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One edge of a simulated tree: a continuous segment of an individual's history, from the event
 * that created it to the event that ended it.
 * <p>
 * A lineage owns its children. The parent and the notifier are non-owning back-references used for
 * traversal. End time and terminal state are fixed exactly once by {@link #terminate}.
 * <p>
 * Instances are mutated only by the simulating thread while the tree is built.
 */
public final class Lineage {

    private final int id;
    private final Lineage parent;
    private final Lineage notifier;
    private final double startTime;
    private final int birthInterval;
    private final boolean notified;
    private final List<Lineage> children = new ArrayList<>(2);

    private int intervalIndex;
    private LineageState state;
    private double endTime = Double.NaN;

    private Lineage(int id, Lineage parent, Lineage notifier, double startTime, int intervalIndex,
                    LineageState initialState) {
        if (!initialState.isAlive()) {
            throw new IllegalArgumentException("a lineage must start alive, got " + initialState);
        }
        this.id = id;
        this.parent = parent;
        this.notifier = notifier;
        this.startTime = startTime;
        this.birthInterval = intervalIndex;
        this.intervalIndex = intervalIndex;
        this.notified = initialState == LineageState.NOTIFIED_ALIVE;
        this.state = initialState;
    }

    /**
     * Creates the root lineage of a new tree.
     *
     * @param id            identifier, unique within the tree.
     * @param startTime     the time the tree starts.
     * @param intervalIndex skyline interval governing {@code startTime}.
     * @return an {@link LineageState#ALIVE} root.
     */
    public static Lineage root(int id, double startTime, int intervalIndex) {
        return new Lineage(id, null, null, startTime, intervalIndex, LineageState.ALIVE);
    }

    /**
     * Creates a child lineage owned by this one.
     *
     * @param childId       identifier, unique within the tree.
     * @param time          creation time, not before this lineage's start.
     * @param interval      skyline interval governing {@code time}.
     * @param initialState  {@link LineageState#ALIVE} or {@link LineageState#NOTIFIED_ALIVE}.
     * @param childNotifier the sampled lineage whose notification the child stems from, or {@code null}.
     * @return the new child.
     */
    public Lineage spawnChild(int childId, double time, int interval, LineageState initialState,
                              Lineage childNotifier) {
        if (time < startTime) {
            throw new IllegalArgumentException("child at " + time + " before parent start " + startTime);
        }
        if (!Double.isNaN(endTime) && time != endTime) {
            throw new IllegalStateException("lineage " + id + " ended at " + endTime
                    + " and cannot branch at " + time);
        }
        Lineage child = new Lineage(childId, this, childNotifier, time, interval, initialState);
        children.add(child);
        return child;
    }

    /**
     * Fixes the outcome of this lineage.
     *
     * @param outcome a terminal state.
     * @param time    the end time, not before the start time.
     * @throws IllegalStateException    if the lineage already terminated.
     * @throws IllegalArgumentException if {@code outcome} is not terminal or {@code time} precedes the start.
     */
    public void terminate(LineageState outcome, double time) {
        if (state.isTerminal()) {
            throw new IllegalStateException("lineage " + id + " already terminated as " + state);
        }
        if (!outcome.isTerminal()) {
            throw new IllegalArgumentException("not a terminal state: " + outcome);
        }
        if (!(time >= startTime)) {
            throw new IllegalArgumentException("end time " + time + " before start time " + startTime);
        }
        this.state = outcome;
        this.endTime = time;
    }

    /**
     * Moves an alive lineage into the given skyline interval.
     */
    public void enterInterval(int index) {
        if (state.isTerminal()) {
            throw new IllegalStateException("lineage " + id + " is terminated");
        }
        this.intervalIndex = index;
    }

    public int getId() {
        return id;
    }

    public Lineage getParent() {
        return parent;
    }

    /**
     * @return the sampled lineage whose notification created this one, or {@code null}.
     */
    public Lineage getNotifier() {
        return notifier;
    }

    public double getStartTime() {
        return startTime;
    }

    /**
     * @return end time, {@code NaN} while alive.
     */
    public double getEndTime() {
        return endTime;
    }

    /**
     * @return elapsed time since birth at {@code now} (or until termination, if earlier).
     */
    public double elapsed(double now) {
        double until = Double.isNaN(endTime) ? now : Math.min(now, endTime);
        return until - startTime;
    }

    /**
     * @return end time minus start time.
     * @throws IllegalStateException while the lineage is alive.
     */
    public double branchLength() {
        if (Double.isNaN(endTime)) {
            throw new IllegalStateException("lineage " + id + " is still alive");
        }
        return endTime - startTime;
    }

    public int getBirthInterval() {
        return birthInterval;
    }

    public int getIntervalIndex() {
        return intervalIndex;
    }

    public LineageState getState() {
        return state;
    }

    /**
     * @return {@code true} if the lineage was created in {@link LineageState#NOTIFIED_ALIVE}.
     */
    public boolean isNotified() {
        return notified;
    }

    public List<Lineage> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int childCount() {
        return children.size();
    }

    public boolean isTip() {
        return children.isEmpty();
    }

    @Override
    public String toString() {
        return "Lineage{" + id + ", " + state + ", [" + startTime + ", " + endTime + "]}";
    }
}
