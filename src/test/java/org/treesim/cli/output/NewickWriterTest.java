package org.treesim.cli.output;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.treesim.runtime.model.Forest;
import org.treesim.runtime.model.Lineage;
import org.treesim.runtime.model.LineageState;
import org.treesim.runtime.model.SampleTrees;
import org.treesim.runtime.model.Tree;

@Tag("unit")
class NewickWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void formatsReconstructedTree() {
        String newick = NewickWriter.toNewick(SampleTrees.twoSampledTips().observed().orElseThrow());

        assertThat(newick).isEqualTo("(t1:2.0,t2:3.0)n1:1.0;");
    }

    @Test
    void singleTipTree() {
        Lineage root = Lineage.root(0, 0.0, 0);
        root.terminate(LineageState.SAMPLED, 0.25);

        String newick = NewickWriter.toNewick(new Tree(root, 0.25).observed().orElseThrow());

        assertThat(newick).isEqualTo("t1:0.25;");
    }

    @Test
    void writesOneLinePerObservedTreeWithForestWideNumbering() throws Exception {
        Forest forest = new Forest();
        forest.append(SampleTrees.twoSampledTips());
        forest.append(SampleTrees.unobserved());
        forest.append(SampleTrees.twoSampledTips());
        forest.close(5.0);
        Path file = tempDir.resolve("forest.nwk");

        NewickWriter.write(forest, file);

        assertThat(Files.readAllLines(file)).containsExactly(
                "(t1:2.0,t2:3.0)n1:1.0;",
                "(t3:2.0,t4:3.0)n2:1.0;");
    }

    @Test
    void emptyForestWritesEmptyFile() throws Exception {
        Forest forest = new Forest();
        forest.append(SampleTrees.unobserved());
        forest.close(2.0);
        Path file = tempDir.resolve("empty.nwk");

        NewickWriter.write(forest, file);

        assertThat(Files.size(file)).isZero();
    }

    @Test
    void smallLengthsAreNotInScientificNotation() {
        Lineage root = Lineage.root(0, 0.0, 0);
        root.terminate(LineageState.SAMPLED, 1e-7);

        String newick = NewickWriter.toNewick(new Tree(root, 1e-7).observed().orElseThrow());

        assertThat(newick).doesNotContain("E").startsWith("t1:0.0000001").endsWith(";");
    }
}
