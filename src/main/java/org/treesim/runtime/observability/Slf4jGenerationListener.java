package org.treesim.runtime.observability;

import org.treesim.runtime.ForestSummary;
import org.treesim.runtime.model.Tree;
import org.treesim.runtime.spi.IGenerationListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of {@link IGenerationListener} that reports progress via SLF4J.
 * <p>
 * Per-tree and per-attempt details go to DEBUG (shown with {@code --verbose}); rejections are
 * summarized at INFO every {@code rejectionReportInterval} attempts so long retry phases stay visible.
 */
public final class Slf4jGenerationListener implements IGenerationListener {
    private static final Logger log = LoggerFactory.getLogger(Slf4jGenerationListener.class);

    private final long rejectionReportInterval;
    private long rejected;

    public Slf4jGenerationListener() {
        this(1000);
    }

    public Slf4jGenerationListener(long rejectionReportInterval) {
        this.rejectionReportInterval = Math.max(1, rejectionReportInterval);
    }

    @Override
    public void onAttemptStarted(long attempt) {
        log.debug("Starting simulation attempt {}", attempt);
    }

    @Override
    public void onIntervalEntered(int intervalIndex, double time, int aliveLineages) {
        log.trace("Skyline interval {} entered at t={} with {} alive lineages", intervalIndex + 1, time, aliveLineages);
    }

    @Override
    public void onTreeSimulated(long attempt, Tree tree) {
        log.debug("Simulated a tree with {} sampled tips, {} unsampled removals and {} lineages alive at t={}",
                tree.sampledTips(), tree.unsampledRemovals(), tree.prunedLineages(), tree.getEndTime());
    }

    @Override
    public void onAttemptRejected(long attempt, String reason) {
        rejected++;
        log.debug("Attempt {} rejected: {}", attempt, reason);
        if (rejected % rejectionReportInterval == 0) {
            log.info("{} simulation attempts rejected so far, still retrying", rejected);
        }
    }

    @Override
    public void onForestAccepted(long attempt, ForestSummary summary) {
        log.info("Accepted forest after {} attempt(s): {} sampled tips, {} unsampled removals, {} hidden trees, T={}",
                attempt, summary.totalTips(), summary.unsampledCount(), summary.hiddenTrees(), summary.realizedTime());
    }
}
