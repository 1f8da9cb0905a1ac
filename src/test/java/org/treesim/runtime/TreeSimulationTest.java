package org.treesim.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.treesim.cli.output.NewickWriter;
import org.treesim.runtime.internal.services.SeededRandomProvider;
import org.treesim.runtime.model.BirthDeathModel;
import org.treesim.runtime.model.Lineage;
import org.treesim.runtime.model.LineageState;
import org.treesim.runtime.model.NotificationModel;
import org.treesim.runtime.model.ObservedTree;
import org.treesim.runtime.model.SkylineSchedule;
import org.treesim.runtime.model.Tree;
import org.treesim.runtime.model.TreeNode;
import org.treesim.runtime.spi.IGenerationListener;

/**
 * Unit tests for the {@link TreeSimulation} event engine.
 * Scripted waiting times pin down exact event sequences; seeded runs check structural properties.
 */
@Tag("unit")
class TreeSimulationTest {

    private static final BirthDeathModel FULLY_SAMPLED = new BirthDeathModel(1.0, 1.0, 1.0);

    @Test
    void birthSplitsIntoDonorAndRecipient() {
        // root: birth 1.0 vs removal 5.0; donor: birth 10 vs removal 2; recipient: birth 10 vs removal 1
        ScriptedRandomProvider random = new ScriptedRandomProvider().waits(1.0, 5.0, 10.0, 2.0, 10.0, 1.0);
        TreeSimulation simulation = new TreeSimulation(SkylineSchedule.constant(FULLY_SAMPLED), 1, random);

        Tree tree = simulation.run(Double.POSITIVE_INFINITY, Integer.MAX_VALUE);

        Lineage root = tree.getRoot();
        assertThat(root.getState()).isEqualTo(LineageState.TRANSMITTED);
        assertThat(root.getEndTime()).isEqualTo(1.0);
        assertThat(root.getChildren()).hasSize(2);
        assertThat(root.getChildren().get(0).getEndTime()).isEqualTo(3.0);
        assertThat(root.getChildren().get(1).getEndTime()).isEqualTo(2.0);
        assertThat(tree.sampledTips()).isEqualTo(2);
        assertThat(tree.getEndTime()).isEqualTo(3.0);
        assertThat(random.remainingWaits()).isZero();

        ObservedTree observed = tree.observed().orElseThrow();
        assertThat(NewickWriter.toNewick(observed)).isEqualTo("(t1:2.0,t2:1.0)n1:1.0;");
    }

    @Test
    void notifyingSamplingSpawnsExactlyTheCapOfNotifiedContacts() {
        NotificationModel model = new NotificationModel(new BirthDeathModel(0.0, 1.0, 1.0), 1.0, 2.0);
        // root removal at 1.0, then the two notified contacts are removed after 0.5 and 0.75
        ScriptedRandomProvider random = new ScriptedRandomProvider().waits(1.0, 0.5, 0.75);
        TreeSimulation simulation = new TreeSimulation(SkylineSchedule.constant(model), 2, random);

        Tree tree = simulation.run(Double.POSITIVE_INFINITY, Integer.MAX_VALUE);

        Lineage root = tree.getRoot();
        assertThat(root.getState()).isEqualTo(LineageState.SAMPLED);
        assertThat(root.getChildren()).hasSize(2)
                .allSatisfy(child -> {
                    assertThat(child.isNotified()).isTrue();
                    assertThat(child.getNotifier()).isSameAs(root);
                    assertThat(child.getState()).isEqualTo(LineageState.SAMPLED);
                    assertThat(child.isTip()).isTrue();
                });
        assertThat(tree.sampledTips()).isEqualTo(3);
        assertThat(tree.notifiedLineages()).isEqualTo(2);

        ObservedTree observed = tree.observed().orElseThrow();
        assertThat(NewickWriter.toNewick(observed)).isEqualTo("(t1:0.5,t2:0.75,t3:0.0)n1:1.0;");
    }

    @Test
    void unsampledRemovalUsesBernoulliOnSamplingProbability() {
        BirthDeathModel model = new BirthDeathModel(0.0, 1.0, 0.5);
        ScriptedRandomProvider random = new ScriptedRandomProvider().waits(2.0).uniforms(0.9);
        TreeSimulation simulation = new TreeSimulation(SkylineSchedule.constant(model), 1, random);

        Tree tree = simulation.run(Double.POSITIVE_INFINITY, Integer.MAX_VALUE);

        assertThat(tree.getRoot().getState()).isEqualTo(LineageState.REMOVED_UNSAMPLED);
        assertThat(tree.unsampledRemovals()).isEqualTo(1);
        assertThat(tree.observed()).isEmpty();
    }

    @Test
    void survivorsArePrunedAtTheHorizon() {
        ScriptedRandomProvider random = new ScriptedRandomProvider().waits(5.0, 6.0);
        TreeSimulation simulation = new TreeSimulation(SkylineSchedule.constant(FULLY_SAMPLED), 1, random);

        Tree tree = simulation.run(2.0, Integer.MAX_VALUE);

        assertThat(tree.getRoot().getState()).isEqualTo(LineageState.PRUNED_AT_TIME_LIMIT);
        assertThat(tree.getRoot().getEndTime()).isEqualTo(2.0);
        assertThat(tree.prunedLineages()).isEqualTo(1);
        assertThat(tree.getEndTime()).isEqualTo(2.0);
    }

    @Test
    void racesRestartAtSkylineBoundary() {
        SkylineSchedule schedule = SkylineSchedule.of(
                List.of(new BirthDeathModel(0.0, 0.0, 0.0), new BirthDeathModel(0.0, 1.0, 1.0)),
                List.of(1.0, 10.0));
        ScriptedRandomProvider random = new ScriptedRandomProvider().waits(0.5);
        IGenerationListener listener = mock(IGenerationListener.class);
        TreeSimulation simulation = new TreeSimulation(schedule, 1, random, listener, 100);

        Tree tree = simulation.run(Double.POSITIVE_INFINITY, Integer.MAX_VALUE);

        assertThat(tree.getRoot().getEndTime()).isEqualTo(1.5);
        assertThat(tree.getRoot().getIntervalIndex()).isEqualTo(1);
        assertThat(tree.getRoot().getBirthInterval()).isZero();
        verify(listener).onIntervalEntered(1, 1.0, 1);
    }

    @Test
    void stopsAtTheSampleLimitAndPrunesTheRest() {
        BirthDeathModel model = new BirthDeathModel(2.0, 1.0, 1.0);
        TreeSimulation simulation = new TreeSimulation(SkylineSchedule.constant(model), 1, new SeededRandomProvider(11L));

        for (int i = 0; i < 20; i++) {
            Tree tree = simulation.run(Double.POSITIVE_INFINITY, 5);
            assertThat(tree.sampledTips()).isLessThanOrEqualTo(5);
            if (tree.sampledTips() == 5) {
                assertThat(tree.lineages())
                        .filteredOn(l -> l.getState() == LineageState.PRUNED_AT_TIME_LIMIT)
                        .allSatisfy(l -> assertThat(l.getEndTime()).isEqualTo(tree.getEndTime()));
            }
        }
    }

    @Test
    void zeroRatesWithInfiniteHorizonAreExhausted() {
        TreeSimulation simulation = new TreeSimulation(
                SkylineSchedule.constant(new BirthDeathModel(0.0, 0.0, 0.5)), 1, new SeededRandomProvider(1L));

        assertThatThrownBy(() -> simulation.run(Double.POSITIVE_INFINITY, 1))
                .isInstanceOf(SimulationExhaustedException.class)
                .hasMessageContaining("rates are zero");
    }

    @Test
    void aliveCapAbandonsRun() {
        TreeSimulation simulation = new TreeSimulation(
                SkylineSchedule.constant(new BirthDeathModel(5.0, 0.0, 0.5)), 1, new SeededRandomProvider(3L),
                mock(IGenerationListener.class), 50);

        assertThatThrownBy(() -> simulation.run(Double.POSITIVE_INFINITY, 10))
                .isInstanceOf(SimulationExhaustedException.class)
                .hasMessageContaining("exceeded 50");
    }

    @Test
    void noBirthsBeforeFirstSwitchWhenFirstIntervalHasZeroBirthRate() {
        SkylineSchedule schedule = SkylineSchedule.of(
                List.of(new BirthDeathModel(0.0, 0.0, 0.0), new BirthDeathModel(2.0, 1.0, 0.5)),
                List.of(1.0, Double.POSITIVE_INFINITY));
        TreeSimulation simulation = new TreeSimulation(schedule, 1, new SeededRandomProvider(5L));

        for (int i = 0; i < 50; i++) {
            Tree tree = simulation.run(3.0, Integer.MAX_VALUE);
            assertThat(tree.lineages())
                    .filteredOn(l -> l != tree.getRoot())
                    .allSatisfy(l -> assertThat(l.getStartTime()).isGreaterThanOrEqualTo(1.0));
        }
    }

    @Test
    void notifiedLineagesNeverNotifyAndAreAlwaysSampled() {
        NotificationModel model = new NotificationModel(new BirthDeathModel(1.5, 1.0, 0.8), 0.6, 3.0);
        TreeSimulation simulation = new TreeSimulation(SkylineSchedule.constant(model), 2, new SeededRandomProvider(21L));

        for (int i = 0; i < 30; i++) {
            Tree tree = simulation.run(4.0, Integer.MAX_VALUE);
            for (Lineage lineage : tree.lineages()) {
                long notifiedByThis = lineage.getChildren().stream()
                        .filter(child -> child.getNotifier() == lineage)
                        .count();
                if (lineage.isNotified()) {
                    assertThat(notifiedByThis).isZero();
                    assertThat(lineage.getState()).isNotEqualTo(LineageState.REMOVED_UNSAMPLED);
                } else if (notifiedByThis > 0) {
                    assertThat(lineage.getState()).isEqualTo(LineageState.SAMPLED);
                    assertThat(notifiedByThis).isEqualTo(2);
                }
            }
        }
    }

    @Test
    void observedBranchLengthsAddUpToTipTimes() {
        BirthDeathModel model = new BirthDeathModel(2.0, 1.0, 0.6);
        TreeSimulation simulation = new TreeSimulation(SkylineSchedule.constant(model), 1, new SeededRandomProvider(8L));

        for (int i = 0; i < 20; i++) {
            Tree tree = simulation.run(4.0, Integer.MAX_VALUE);
            tree.observed().ifPresent(observed -> assertPathSums(observed, observed.getRoot(), null, 0.0));
        }
    }

    @Test
    void sameSeedReproducesTheSameTree() {
        BirthDeathModel model = new BirthDeathModel(2.0, 1.0, 0.5);
        Tree first = new TreeSimulation(SkylineSchedule.constant(model), 1, new SeededRandomProvider(99L))
                .run(5.0, Integer.MAX_VALUE);
        Tree second = new TreeSimulation(SkylineSchedule.constant(model), 1, new SeededRandomProvider(99L))
                .run(5.0, Integer.MAX_VALUE);

        assertThat(second.size()).isEqualTo(first.size());
        assertThat(second.lineages()).extracting(Lineage::getEndTime)
                .containsExactlyElementsOf(first.lineages().stream().map(Lineage::getEndTime).toList());
    }

    @Test
    void zeroNotificationProbabilityRunsExactlyLikeTheBaseModel() {
        BirthDeathModel base = new BirthDeathModel(1.2, 0.6, 0.5);
        NotificationModel silent = new NotificationModel(base, 0.0, 3.0);

        for (long seed = 0; seed < 10; seed++) {
            Tree plain = new TreeSimulation(SkylineSchedule.constant(base), 2, new SeededRandomProvider(seed))
                    .run(5.0, Integer.MAX_VALUE);
            Tree withNotification = new TreeSimulation(SkylineSchedule.constant(silent), 2,
                    new SeededRandomProvider(seed))
                    .run(5.0, Integer.MAX_VALUE);

            assertThat(withNotification.size()).isEqualTo(plain.size());
            assertThat(withNotification.lineages()).extracting(Lineage::getEndTime)
                    .containsExactlyElementsOf(plain.lineages().stream().map(Lineage::getEndTime).toList());
            assertThat(withNotification.lineages()).extracting(Lineage::getState)
                    .containsExactlyElementsOf(plain.lineages().stream().map(Lineage::getState).toList());
            assertThat(withNotification.notifiedLineages()).isZero();
            assertThat(withNotification.lineages()).noneMatch(Lineage::isNotified);
        }
    }

    @Test
    void removalRateDependsOnNotification() {
        NotificationModel model = new NotificationModel(new BirthDeathModel(1.0, 0.5, 0.5), 0.5, 4.0);
        Lineage root = Lineage.root(0, 0.0, 0);
        Lineage notified = root.spawnChild(1, 0.0, 0, LineageState.NOTIFIED_ALIVE, root);

        assertThat(TreeSimulation.removalRate(root, model)).isEqualTo(0.5);
        assertThat(TreeSimulation.removalRate(notified, model)).isEqualTo(4.0);
    }

    @Test
    void rejectsNegativeNotificationCap() {
        assertThatThrownBy(() -> new TreeSimulation(SkylineSchedule.constant(FULLY_SAMPLED), -1,
                new ScriptedRandomProvider()))
                .isInstanceOf(InvalidParameterException.class);
    }

    private static void assertPathSums(ObservedTree tree, TreeNode node, TreeNode parent, double sumAbove) {
        double sum = sumAbove + tree.branchLength(node, parent);
        assertThat(sum).isCloseTo(node.time() - tree.getStartTime(), offset(1e-9));
        for (TreeNode child : node.children()) {
            assertPathSums(tree, child, node, sum);
        }
    }
}
