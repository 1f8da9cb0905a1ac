package org.treesim.cli.commands;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.treesim.cli.CommandLineInterface;
import org.treesim.cli.config.LoggingConfigurator;
import org.treesim.cli.output.LttWriter;
import org.treesim.cli.output.NewickWriter;
import org.treesim.cli.output.SimulationLogWriter;
import org.treesim.runtime.ForestGenerator;
import org.treesim.runtime.GenerationResult;
import org.treesim.runtime.TreeSimulationException;
import org.treesim.runtime.internal.services.SeededRandomProvider;
import org.treesim.runtime.ltt.LttCalculator;
import org.treesim.runtime.model.BirthDeathModel;
import org.treesim.runtime.model.NotificationModel;
import org.treesim.runtime.model.RateModel;
import org.treesim.runtime.model.RecipientDistribution;
import org.treesim.runtime.observability.Slf4jGenerationListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Simulates a tree (or a forest of trees) under a skyline birth-death model and writes the
 * Newick trees, the parameter log and optionally the LTT table.
 * <p>
 * Rate lists not given on the command line fall back to {@code simulation.defaults} in the
 * configuration. The number of intervals is the length of the shortest of the four lists.
 * <p>
 * Exit codes: 0 on success, 1 for invalid parameters or an unreachable target, 2 for output errors.
 */
@Command(
    name = "simulate",
    mixinStandardHelpOptions = true,
    description = "Simulates a tree (or a forest of trees) for given skyline BD model parameters. "
        + "If a simulation leads to less than --min_tips tips, it is repeated."
)
public class SimulateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SimulateCommand.class);

    @Option(names = "--min_tips", required = true,
        description = "Desired minimal bound on the total number of simulated leaves. For a tree simulation, "
            + "if --min_tips and --max_tips are equal, exactly that number of tips will be simulated; "
            + "otherwise a value randomly drawn between them.")
    private int minTips;

    @Option(names = "--max_tips", required = true,
        description = "Desired maximal bound on the total number of simulated leaves.")
    private int maxTips;

    @Option(names = "--T", description = "Total simulation time. If specified, a forest will be simulated "
        + "instead of one tree, until --min_tips is reached; if it then exceeds --max_tips, it is restarted.")
    private Double totalTime;

    @Option(names = "--la", arity = "1..*", split = ",", description = "Transmission rate of each interval.")
    private List<Double> la;

    @Option(names = "--psi", arity = "1..*", split = ",", description = "Removal rate of each interval.")
    private List<Double> psi;

    @Option(names = "--p", arity = "1..*", split = ",", description = "Sampling probability of each interval.")
    private List<Double> p;

    @Option(names = "--times", arity = "1..*", split = ",", description = "Time of each interval transition.")
    private List<Double> times;

    @Option(names = "--upsilon", description = "Notification probability (0 disables notification).")
    private Double upsilon;

    @Option(names = "--phi", description = "Removal rate of notified contacts.")
    private Double phi;

    @Option(names = "--max_notified_contacts", description = "Maximum number of notified contacts per person.")
    private Integer maxNotifiedContacts;

    @Option(names = "--avg_recipients", description = "Average number of recipients per transmission "
        + "(1 means one-to-one transmission).")
    private Double avgRecipients;

    @Option(names = "--log", required = true, description = "Output log file.")
    private File logFile;

    @Option(names = "--nwk", required = true, description = "Output tree or forest file.")
    private File nwkFile;

    @Option(names = "--ltt", description = "Output LTT file.")
    private File lttFile;

    @Option(names = "--seed", description = "Random seed (default: simulation.seed, else time based).")
    private Long seed;

    @Option(names = {"-v", "--verbose"}, description = "Describe the generation process.")
    private boolean verbose;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var err = spec.commandLine().getErr();

        final Config config;
        try {
            config = parent.getConfig();
        } catch (IllegalArgumentException | ConfigException e) {
            log.error("Failed to load configuration: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
        if (verbose) {
            LoggingConfigurator.setRootLevel("DEBUG");
        }
        final Config defaults = config.getConfig("simulation.defaults");

        final List<RateModel> models;
        final List<Double> skylineTimes = new ArrayList<>();
        final int notified = maxNotifiedContacts != null ? maxNotifiedContacts : defaults.getInt("max-notified-contacts");
        final double horizon = totalTime != null ? totalTime : Double.POSITIVE_INFINITY;
        try {
            models = buildModels(defaults, skylineTimes);
        } catch (TreeSimulationException e) {
            log.error("Invalid model parameters: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
        if (Double.isFinite(horizon)) {
            log.info("Total time T={}", horizon);
        }

        final long effectiveSeed = resolveSeed(config);
        log.info("Random seed: {}", effectiveSeed);

        final GenerationResult result;
        try {
            ForestGenerator generator = new ForestGenerator(new SeededRandomProvider(effectiveSeed),
                    new Slf4jGenerationListener(), config.getConfig("simulation"));
            result = generator.generate(models, minTips, maxTips, horizon, skylineTimes, notified);
        } catch (TreeSimulationException e) {
            log.error("Simulation failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }

        try {
            NewickWriter.write(result.forest(), nwkFile.toPath());
            // The log describes the last interval's model.
            SimulationLogWriter.write(models.get(models.size() - 1), result.summary(), logFile.toPath());
            if (lttFile != null) {
                LttWriter.write(result.ltt(), LttCalculator.observed(result.forest(), horizon), lttFile.toPath());
            }
        } catch (IOException e) {
            log.error("Failed to write output: {}", e.getMessage(), e);
            err.println("Error: failed to write output: " + e.getMessage());
            return 2;
        }
        log.info("Wrote {} tree(s) with {} sampled tips to {}", result.forest().size(),
                result.summary().totalTips(), nwkFile);
        return 0;
    }

    private List<RateModel> buildModels(Config defaults, List<Double> skylineTimes) {
        final List<Double> laValues = la != null ? la : defaults.getDoubleList("la");
        final List<Double> psiValues = psi != null ? psi : defaults.getDoubleList("psi");
        final List<Double> pValues = p != null ? p : defaults.getDoubleList("p");
        final List<Double> timeValues = times != null ? times : defaults.getDoubleList("times");
        final double notificationProbability = upsilon != null ? upsilon : defaults.getDouble("upsilon");
        final double notifiedRemovalRate = phi != null ? phi : defaults.getDouble("phi");
        final double recipients = avgRecipients != null ? avgRecipients : defaults.getDouble("avg-recipients");

        final RecipientDistribution recipientDistribution = RecipientDistribution.withMean(recipients);
        final boolean multiple = recipientDistribution.isMultiple();
        log.info("BD{} skyline model parameters are:\n\tlambda={}\n\tpsi={}\n\tp={}\n\ttimes={}{}",
                multiple ? "-MULT" : "", laValues, psiValues, pValues, timeValues,
                multiple ? "\n\tr=" + recipients : "");
        if (notificationProbability != 0) {
            log.info("PN parameters are:\n\tphi={}\n\tupsilon={}", notifiedRemovalRate, notificationProbability);
        }

        final int intervals = Math.min(Math.min(laValues.size(), psiValues.size()),
                Math.min(pValues.size(), timeValues.size()));
        final List<RateModel> models = new ArrayList<>(intervals);
        for (int i = 0; i < intervals; i++) {
            BirthDeathModel base = new BirthDeathModel(laValues.get(i), psiValues.get(i), pValues.get(i),
                    recipientDistribution);
            RateModel model = notificationProbability != 0
                    ? new NotificationModel(base, notificationProbability, notifiedRemovalRate)
                    : base;
            models.add(model);
            skylineTimes.add(timeValues.get(i));
            log.info("Model {} with transition time {}: lambda={}, psi={}, p={}",
                    i + 1, timeValues.get(i), base.birthRate(), base.removalRate(), base.samplingProbability());
        }
        return models;
    }

    private long resolveSeed(Config config) {
        if (seed != null) {
            return seed;
        }
        if (config.hasPath("simulation.seed")) {
            return config.getLong("simulation.seed");
        }
        return System.nanoTime();
    }
}
