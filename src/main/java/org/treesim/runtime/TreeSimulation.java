package org.treesim.runtime;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Set;

import org.treesim.runtime.model.Lineage;
import org.treesim.runtime.model.LineageState;
import org.treesim.runtime.model.RateModel;
import org.treesim.runtime.model.SkylineSchedule;
import org.treesim.runtime.model.Tree;
import org.treesim.runtime.observability.NullGenerationListener;
import org.treesim.runtime.spi.IGenerationListener;
import org.treesim.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Continuous-time event engine that grows one tree under a {@link SkylineSchedule}.
 * <p>
 * Every alive lineage races two exponential clocks, birth at rate λ and removal at rate ψ
 * (φ for notified lineages), and the earlier one is scheduled. Scheduled events are processed in
 * global time order. When the earliest event lies at or past the next skyline boundary, the clock
 * stops at the boundary, every alive lineage enters the new interval and all races restart under
 * the new rates. Events past the time horizon are never applied: the survivors are pruned at the
 * horizon instead.
 * <ul>
 *   <li><b>Birth:</b> the edge ends as {@link LineageState#TRANSMITTED}; the individual continues in
 *   a first child and each recipient starts in a further child.</li>
 *   <li><b>Removal:</b> sampled with probability p, otherwise removed unobserved. Under a
 *   notification model a sampling notifies with probability υ, creating
 *   {@code maxNotifiedContacts} notified children.</li>
 *   <li><b>Notified removal:</b> always sampled, never notifies.</li>
 * </ul>
 * <p>
 * An instance is confined to the thread running one attempt. It may simulate several trees in a
 * row; each {@link #run} call starts from an empty state and shares only the random stream.
 */
public class TreeSimulation {

    private static final Logger LOG = LoggerFactory.getLogger(TreeSimulation.class);

    private enum EventKind { BIRTH, REMOVAL }

    private record ScheduledEvent(double time, EventKind kind, Lineage lineage) {
    }

    private static final Comparator<ScheduledEvent> EVENT_ORDER = Comparator
            .comparingDouble(ScheduledEvent::time)
            .thenComparingInt(e -> e.lineage().getId());

    private final SkylineSchedule schedule;
    private final int maxNotifiedContacts;
    private final IRandomProvider random;
    private final IGenerationListener listener;
    private final int maxAliveLineages;

    private final PriorityQueue<ScheduledEvent> queue = new PriorityQueue<>(EVENT_ORDER);
    private final Set<Lineage> alive = new LinkedHashSet<>();
    private int nextId;
    private int interval;
    private int sampled;

    /**
     * @param schedule            rate models over time.
     * @param maxNotifiedContacts contacts notified per notifying sampling event.
     * @param random              the attempt's random stream.
     */
    public TreeSimulation(SkylineSchedule schedule, int maxNotifiedContacts, IRandomProvider random) {
        this(schedule, maxNotifiedContacts, random, NullGenerationListener.INSTANCE, Integer.MAX_VALUE);
    }

    /**
     * @param schedule            rate models over time.
     * @param maxNotifiedContacts contacts notified per notifying sampling event.
     * @param random              the attempt's random stream.
     * @param listener            receives interval switches.
     * @param maxAliveLineages    alive population above which the run is abandoned.
     */
    public TreeSimulation(SkylineSchedule schedule, int maxNotifiedContacts, IRandomProvider random,
                          IGenerationListener listener, int maxAliveLineages) {
        if (maxNotifiedContacts < 0) {
            throw new InvalidParameterException("max notified contacts must be non-negative, got " + maxNotifiedContacts);
        }
        this.schedule = schedule;
        this.maxNotifiedContacts = maxNotifiedContacts;
        this.random = random;
        this.listener = listener;
        this.maxAliveLineages = maxAliveLineages;
    }

    /**
     * Simulates one tree starting with a single lineage at time 0.
     *
     * @param horizon     time at which all survivors are pruned; may be infinite.
     * @param sampleLimit stop as soon as this many tips are sampled ({@link Integer#MAX_VALUE} for no limit).
     * @return the completed tree; its end time is the time the run stopped.
     * @throws SimulationExhaustedException if the alive population exceeds the configured cap, or no
     *                                      further event can ever happen before an infinite horizon.
     */
    public Tree run(double horizon, int sampleLimit) {
        queue.clear();
        alive.clear();
        nextId = 0;
        sampled = 0;
        interval = schedule.intervalIndexAt(0.0);

        double now = 0.0;
        Lineage root = Lineage.root(nextId++, now, interval);
        activate(root, now);

        while (!alive.isEmpty()) {
            double boundary = schedule.intervalEnd(interval);
            ScheduledEvent next = queue.peek();
            double nextTime = next == null ? Double.POSITIVE_INFINITY : next.time();

            if (nextTime >= horizon && horizon <= boundary) {
                if (Double.isInfinite(horizon)) {
                    throw new SimulationExhaustedException(alive.size()
                            + " lineages can no longer change state: all rates are zero");
                }
                now = horizon;
                pruneAll(now);
                break;
            }
            if (nextTime >= boundary) {
                now = boundary;
                enterInterval(interval + 1, now);
                continue;
            }

            queue.poll();
            now = nextTime;
            if (next.kind() == EventKind.BIRTH) {
                transmit(next.lineage(), now);
            } else {
                remove(next.lineage(), now);
            }

            if (sampled >= sampleLimit) {
                pruneAll(now);
                break;
            }
            if (alive.size() > maxAliveLineages) {
                throw new SimulationExhaustedException("alive population exceeded " + maxAliveLineages
                        + " lineages at t=" + now);
            }
        }
        return new Tree(root, now);
    }

    /**
     * @return the removal rate that applies to {@code lineage} under {@code model}.
     */
    static double removalRate(Lineage lineage, RateModel model) {
        return lineage.isNotified() ? model.notifiedRemovalRate() : model.removalRate();
    }

    private void activate(Lineage lineage, double now) {
        alive.add(lineage);
        scheduleNext(lineage, now);
    }

    private void scheduleNext(Lineage lineage, double now) {
        RateModel model = schedule.modelAt(interval);
        double birthWait = random.nextExponential(model.birthRate());
        double removalWait = random.nextExponential(removalRate(lineage, model));
        if (Double.isInfinite(birthWait) && Double.isInfinite(removalWait)) {
            return;
        }
        EventKind kind = birthWait < removalWait ? EventKind.BIRTH : EventKind.REMOVAL;
        queue.add(new ScheduledEvent(now + Math.min(birthWait, removalWait), kind, lineage));
    }

    private void enterInterval(int index, double now) {
        interval = index;
        queue.clear();
        for (Lineage lineage : alive) {
            lineage.enterInterval(index);
            scheduleNext(lineage, now);
        }
        LOG.trace("Entered interval {} at t={} with {} alive lineages", index, now, alive.size());
        listener.onIntervalEntered(index, now, alive.size());
    }

    private void transmit(Lineage donor, double now) {
        alive.remove(donor);
        donor.terminate(LineageState.TRANSMITTED, now);
        LineageState continuing = donor.isNotified() ? LineageState.NOTIFIED_ALIVE : LineageState.ALIVE;
        activate(donor.spawnChild(nextId++, now, interval, continuing, donor.getNotifier()), now);
        int recipients = schedule.modelAt(interval).recipients().sample(random);
        for (int i = 0; i < recipients; i++) {
            activate(donor.spawnChild(nextId++, now, interval, LineageState.ALIVE, null), now);
        }
    }

    private void remove(Lineage lineage, double now) {
        alive.remove(lineage);
        if (lineage.isNotified()) {
            lineage.terminate(LineageState.SAMPLED, now);
            sampled++;
            return;
        }
        RateModel model = schedule.modelAt(interval);
        if (!random.nextBoolean(model.samplingProbability())) {
            lineage.terminate(LineageState.REMOVED_UNSAMPLED, now);
            return;
        }
        lineage.terminate(LineageState.SAMPLED, now);
        sampled++;
        if (model.canNotify() && maxNotifiedContacts > 0 && random.nextBoolean(model.notificationProbability())) {
            for (int i = 0; i < maxNotifiedContacts; i++) {
                activate(lineage.spawnChild(nextId++, now, interval, LineageState.NOTIFIED_ALIVE, lineage), now);
            }
        }
    }

    private void pruneAll(double now) {
        List<Lineage> survivors = new ArrayList<>(alive);
        for (Lineage lineage : survivors) {
            lineage.terminate(LineageState.PRUNED_AT_TIME_LIMIT, now);
        }
        alive.clear();
        queue.clear();
    }
}
