package org.treesim.runtime.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.treesim.runtime.ForestSummary;

@Tag("unit")
class ForestTest {

    @Test
    void routesTreesWithoutSamplesToHidden() {
        Forest forest = new Forest();
        forest.append(SampleTrees.twoSampledTips());
        forest.append(SampleTrees.unobserved());

        assertThat(forest.size()).isEqualTo(1);
        assertThat(forest.hiddenTrees()).hasSize(1);
        assertThat(forest.allTrees()).hasSize(2);
        assertThat(forest.totalTips()).isEqualTo(2);
        assertThat(forest.unsampledCount()).isEqualTo(2);
    }

    @Test
    void closeSealsTheForest() {
        Forest forest = new Forest();
        forest.append(SampleTrees.twoSampledTips());
        assertThat(forest.isClosed()).isFalse();
        assertThat(forest.realizedTime()).isNaN();

        forest.close(5.0);

        assertThat(forest.isClosed()).isTrue();
        assertThat(forest.summary()).isEqualTo(new ForestSummary(2, 1, 5.0, 0));
        assertThatThrownBy(() -> forest.append(SampleTrees.unobserved())).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> forest.close(6.0)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void treeListsAreReadOnly() {
        Forest forest = new Forest();

        assertThatThrownBy(() -> forest.trees().add(SampleTrees.twoSampledTips()))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
