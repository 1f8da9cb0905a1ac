package org.treesim.runtime;

import java.util.List;

import org.treesim.runtime.ltt.LttCalculator;
import org.treesim.runtime.model.Forest;
import org.treesim.runtime.model.RateModel;
import org.treesim.runtime.model.SkylineSchedule;
import org.treesim.runtime.model.Tree;
import org.treesim.runtime.observability.NullGenerationListener;
import org.treesim.runtime.spi.IGenerationListener;
import org.treesim.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Builds a forest that satisfies the tip bounds by repeated, independent simulation attempts.
 * <ul>
 *   <li><b>Infinite T:</b> each attempt draws a target n uniformly from [minTips, maxTips] and grows
 *   a single tree until n tips are sampled. A tree that dies out earlier is rejected.</li>
 *   <li><b>Finite T:</b> each attempt adds trees, all started at time 0 and pruned at T, until the
 *   forest holds at least minTips sampled tips. A forest that ends above maxTips is discarded as a
 *   whole.</li>
 * </ul>
 * Every attempt runs on its own random stream derived from the generator's provider, so no state
 * crosses attempts and a fixed seed reproduces the accepted forest. Rejections are invisible to the
 * caller apart from listener callbacks.
 * <p>
 * Options (all optional):
 * <ul>
 *   <li><b>max-attempts:</b> attempts before giving up with {@link DegenerateProcessException};
 *   0 (default) retries forever.</li>
 *   <li><b>max-alive-lineages:</b> alive population at which an attempt is abandoned.</li>
 * </ul>
 */
public class ForestGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(ForestGenerator.class);

    static final int DEFAULT_MAX_ALIVE_LINEAGES = 1_000_000;

    private final IRandomProvider randomProvider;
    private final IGenerationListener listener;
    private final long maxAttempts;
    private final int maxAliveLineages;

    /**
     * Creates a generator with unbounded retries and no progress reporting.
     *
     * @param randomProvider the source of randomness.
     */
    public ForestGenerator(IRandomProvider randomProvider) {
        this(randomProvider, NullGenerationListener.INSTANCE, 0L, DEFAULT_MAX_ALIVE_LINEAGES);
    }

    /**
     * Creates a generator from the {@code simulation} configuration block.
     *
     * @param randomProvider the source of randomness.
     * @param listener       receives progress events.
     * @param options        configuration; 'max-attempts' and 'max-alive-lineages' are optional.
     */
    public ForestGenerator(IRandomProvider randomProvider, IGenerationListener listener, Config options) {
        this(randomProvider, listener,
                options.hasPath("max-attempts") ? options.getLong("max-attempts") : 0L,
                options.hasPath("max-alive-lineages") ? options.getInt("max-alive-lineages") : DEFAULT_MAX_ALIVE_LINEAGES);
    }

    public ForestGenerator(IRandomProvider randomProvider, IGenerationListener listener,
                           long maxAttempts, int maxAliveLineages) {
        if (maxAttempts < 0) {
            throw new InvalidParameterException("max attempts must be non-negative, got " + maxAttempts);
        }
        if (maxAliveLineages < 1) {
            throw new InvalidParameterException("max alive lineages must be positive, got " + maxAliveLineages);
        }
        this.randomProvider = randomProvider;
        this.listener = listener;
        this.maxAttempts = maxAttempts;
        this.maxAliveLineages = maxAliveLineages;
    }

    /**
     * Generates a forest from parallel lists of models and switch times.
     *
     * @param models              one rate model per skyline interval.
     * @param minTips             minimal total number of sampled tips.
     * @param maxTips             maximal total number of sampled tips.
     * @param totalTime           T, or {@link Double#POSITIVE_INFINITY} for a single tree.
     * @param skylineTimes        end time of each interval.
     * @param maxNotifiedContacts contacts notified per notifying sampling event.
     * @return the accepted forest, its totals and the LTT of the accepted attempt.
     */
    public GenerationResult generate(List<? extends RateModel> models, int minTips, int maxTips, double totalTime,
                                     List<Double> skylineTimes, int maxNotifiedContacts) {
        return generate(SimulationParameters.builder()
                .models(models)
                .skylineTimes(skylineTimes)
                .tips(minTips, maxTips)
                .horizon(totalTime)
                .maxNotifiedContacts(maxNotifiedContacts)
                .build());
    }

    /**
     * @param parameters validated inputs.
     * @return the accepted forest, its totals and the LTT of the accepted attempt.
     * @throws DegenerateProcessException if the process cannot reach the bounds, or the attempt limit is hit.
     */
    public GenerationResult generate(SimulationParameters parameters) {
        checkReachable(parameters);

        long attempt = 0;
        while (true) {
            attempt++;
            if (maxAttempts > 0 && attempt > maxAttempts) {
                throw new DegenerateProcessException("no acceptable forest after " + maxAttempts
                        + " attempts; the rates are unlikely to produce between " + parameters.minTips()
                        + " and " + parameters.maxTips() + " sampled tips");
            }
            listener.onAttemptStarted(attempt);
            IRandomProvider attemptRandom = randomProvider.deriveFor("attempt", attempt);
            TreeSimulation simulation = new TreeSimulation(parameters.schedule(), parameters.maxNotifiedContacts(),
                    attemptRandom, listener, maxAliveLineages);
            try {
                Forest forest = parameters.isForestMode()
                        ? growForest(simulation, parameters, attempt)
                        : growTree(simulation, parameters, attempt, attemptRandom);
                ForestSummary summary = forest.summary();
                LOG.debug("Attempt {} accepted: {}", attempt, summary);
                listener.onForestAccepted(attempt, summary);
                return new GenerationResult(forest, summary, LttCalculator.simulated(forest));
            } catch (SimulationExhaustedException e) {
                listener.onAttemptRejected(attempt, e.getMessage());
            }
        }
    }

    private Forest growTree(TreeSimulation simulation, SimulationParameters parameters, long attempt,
                            IRandomProvider attemptRandom) {
        int target = parameters.minTips() == parameters.maxTips()
                ? parameters.minTips()
                : parameters.minTips() + attemptRandom.nextInt(parameters.maxTips() - parameters.minTips() + 1);
        Tree tree = simulation.run(Double.POSITIVE_INFINITY, target);
        listener.onTreeSimulated(attempt, tree);
        if (tree.sampledTips() < target) {
            throw new SimulationExhaustedException("tree died out with " + tree.sampledTips()
                    + " sampled tips, target was " + target);
        }
        Forest forest = new Forest();
        forest.append(tree);
        forest.close(tree.getEndTime());
        return forest;
    }

    private Forest growForest(TreeSimulation simulation, SimulationParameters parameters, long attempt) {
        Forest forest = new Forest();
        while (forest.totalTips() < parameters.minTips()) {
            Tree tree = simulation.run(parameters.horizon(), Integer.MAX_VALUE);
            listener.onTreeSimulated(attempt, tree);
            forest.append(tree);
            if (forest.totalTips() > parameters.maxTips()) {
                throw new SimulationExhaustedException("forest reached " + forest.totalTips()
                        + " sampled tips, more than the maximum of " + parameters.maxTips());
            }
        }
        forest.close(parameters.horizon());
        return forest;
    }

    /**
     * Fails fast on processes that can never be accepted.
     */
    static void checkReachable(SimulationParameters parameters) {
        SkylineSchedule schedule = parameters.schedule();
        double horizon = parameters.horizon();
        if (horizon == 0.0) {
            throw new DegenerateProcessException("total time T is zero: no event can happen");
        }
        boolean canSample = false;
        boolean canBirth = false;
        boolean canNotify = false;
        // contacts only count once a later (or the same) interval can remove them
        boolean canSampleContacts = false;
        for (int i = 0; i < schedule.size() && schedule.intervalStart(i) < horizon; i++) {
            RateModel model = schedule.modelAt(i);
            canSample |= model.removalRate() > 0.0 && model.samplingProbability() > 0.0;
            canBirth |= model.birthRate() > 0.0;
            canNotify |= model.canNotify() && parameters.maxNotifiedContacts() > 0;
            canSampleContacts |= canNotify && model.notifiedRemovalRate() > 0.0;
        }
        if (!canSample) {
            throw new DegenerateProcessException("no skyline interval before T=" + horizon
                    + " has both a positive removal rate and a positive sampling probability");
        }
        if (!canBirth && !parameters.isForestMode()) {
            int reachable = 1 + (canSampleContacts ? parameters.maxNotifiedContacts() : 0);
            if (parameters.minTips() > reachable) {
                throw new DegenerateProcessException("without transmissions a single tree yields at most "
                        + reachable + " sampled tips, but " + parameters.minTips() + " are required");
            }
        }
    }
}
