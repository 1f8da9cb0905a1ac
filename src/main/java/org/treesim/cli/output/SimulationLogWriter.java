package org.treesim.cli.output;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.treesim.runtime.ForestSummary;
import org.treesim.runtime.model.RateModel;

/**
 * Writes the parameter log: a CSV header and one row describing the model and the accepted forest.
 * <p>
 * Columns: {@code la,psi,p,tips,T,hidden_trees,unsampled}, followed by {@code upsilon,phi} for
 * notification models and {@code r} when transmissions may have several recipients.
 */
public final class SimulationLogWriter {

    private SimulationLogWriter() {
    }

    /**
     * @param model   the model whose parameters are logged (the last skyline interval's).
     * @param summary totals of the accepted forest.
     * @return header and value lines.
     */
    public static List<String> format(RateModel model, ForestSummary summary) {
        List<String> header = new ArrayList<>(List.of("la", "psi", "p", "tips", "T", "hidden_trees", "unsampled"));
        List<String> values = new ArrayList<>(List.of(
                Double.toString(model.birthRate()),
                Double.toString(model.removalRate()),
                Double.toString(model.samplingProbability()),
                Integer.toString(summary.totalTips()),
                Double.toString(summary.realizedTime()),
                Integer.toString(summary.hiddenTrees()),
                Integer.toString(summary.unsampledCount())));
        if (model.canNotify()) {
            header.add("upsilon");
            header.add("phi");
            values.add(Double.toString(model.notificationProbability()));
            values.add(Double.toString(model.notifiedRemovalRate()));
        }
        if (model.recipients().isMultiple()) {
            header.add("r");
            values.add(Double.toString(model.recipients().mean()));
        }
        return List.of(String.join(",", header), String.join(",", values));
    }

    /**
     * @throws IOException if the file cannot be written.
     */
    public static void write(RateModel model, ForestSummary summary, Path file) throws IOException {
        Files.write(file, format(model, summary), StandardCharsets.UTF_8);
    }
}
