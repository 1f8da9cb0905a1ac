package org.treesim.runtime.observability;

import org.treesim.runtime.ForestSummary;
import org.treesim.runtime.model.Tree;
import org.treesim.runtime.spi.IGenerationListener;

/**
 * No-op implementation of {@link IGenerationListener}.
 */
public final class NullGenerationListener implements IGenerationListener {
    public static final NullGenerationListener INSTANCE = new NullGenerationListener();

    private NullGenerationListener() {}

    @Override
    public void onAttemptStarted(long attempt) {}

    @Override
    public void onIntervalEntered(int intervalIndex, double time, int aliveLineages) {}

    @Override
    public void onTreeSimulated(long attempt, Tree tree) {}

    @Override
    public void onAttemptRejected(long attempt, String reason) {}

    @Override
    public void onForestAccepted(long attempt, ForestSummary summary) {}
}
