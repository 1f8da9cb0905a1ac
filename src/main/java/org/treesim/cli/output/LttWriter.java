package org.treesim.cli.output;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.TreeSet;

import org.treesim.runtime.ltt.LttTrajectory;

/**
 * Writes the simulated and the observed lineages-through-time as one CSV table, evaluated on the
 * union of both trajectories' time points.
 */
public final class LttWriter {

    static final String HEADER = "time,number of lineages,observed number of lineages";

    private LttWriter() {
    }

    /**
     * @param simulated all simulated lineages over time.
     * @param observed  lineages of the reconstructed trees over time.
     * @param file      target file, overwritten.
     * @throws IOException if the file cannot be written.
     */
    public static void write(LttTrajectory simulated, LttTrajectory observed, Path file) throws IOException {
        TreeSet<Double> times = new TreeSet<>();
        for (int i = 0; i < simulated.size(); i++) {
            times.add(simulated.time(i));
        }
        for (int i = 0; i < observed.size(); i++) {
            times.add(observed.time(i));
        }
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            out.write(HEADER);
            out.newLine();
            for (double time : times) {
                out.write(time + "," + simulated.countAt(time) + "," + observed.countAt(time));
                out.newLine();
            }
        }
    }
}
