package org.outbreak.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.outbreak.cli.CommandLineInterface;
import org.outbreak.cli.config.ConfigLoader;
import org.outbreak.io.TimeseriesExporter;
import org.outbreak.io.TimeseriesFormatException;
import org.outbreak.runtime.SimulationEngine;
import org.outbreak.runtime.SimulationRunner;
import org.outbreak.runtime.api.ConfigurationException;
import org.outbreak.runtime.api.PopulationCounts;
import org.outbreak.runtime.internal.services.SeededRandomProvider;
import org.outbreak.runtime.model.ScenarioPreset;
import org.outbreak.runtime.model.SimulationParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Runs a headless simulation and optionally exports its timeseries."
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunCommand.class);

    static final int EXIT_INVALID_CONFIGURATION = 2;
    static final int EXIT_EXPORT_FAILED = 3;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-p", "--preset"}, description = "Scenario preset: fast-spread, high-vaccination, low-transmission.")
    private String preset;

    @Option(names = {"-s", "--seed"}, description = "Random seed (default: simulation.seed).")
    private Long seed;

    @Option(names = {"-d", "--duration"}, description = "Simulated seconds to run (default: run.duration).")
    private Double duration;

    @Option(names = "--dt", description = "Simulated seconds per step, clamped to 0.1 (default: run.dt).")
    private Double dt;

    @Option(names = {"-o", "--output"}, description = "Export the timeseries to this .csv or .json file.")
    private Path output;

    @Option(names = "--stop-when-extinct", description = "Stop as soon as no agent is infectious.")
    private Boolean stopWhenExtinct;

    @Override
    public Integer call() {
        final Config config = parent.getConfig();
        final PrintWriter out = spec.commandLine().getOut();

        final SimulationParameters params;
        final long effectiveSeed;
        final SimulationEngine engine;
        final PopulationCounts finalCounts;
        try {
            params = resolveParameters(config);
            effectiveSeed = seed != null ? seed : config.getLong("simulation.seed");
            final double effectiveDuration = duration != null ? duration : config.getDouble("run.duration");
            final double effectiveDt = dt != null ? dt : config.getDouble("run.dt");
            final boolean effectiveStop = stopWhenExtinct != null
                    ? stopWhenExtinct
                    : config.getBoolean("run.stop-when-extinct");

            engine = new SimulationEngine(new SeededRandomProvider(effectiveSeed));
            engine.init(params);
            finalCounts = new SimulationRunner(engine, effectiveDt, effectiveStop).runFor(effectiveDuration);
        } catch (ConfigurationException | ConfigException | IllegalArgumentException e) {
            LOGGER.error("Invalid configuration: {}", e.getMessage());
            return EXIT_INVALID_CONFIGURATION;
        }

        out.printf("t=%.1fs seed=%d healthy=%d infected=%d asymptomatic=%d recovered=%d vaccinated=%d%n",
                engine.getSimulatedTime(), effectiveSeed, finalCounts.healthy(), finalCounts.infected(),
                finalCounts.asymptomatic(), finalCounts.recovered(), finalCounts.vaccinated());
        if (engine.getSeededInfections() < params.getInitialInfected()) {
            out.printf("note: only %d of %d initial infections could be seeded%n",
                    engine.getSeededInfections(), params.getInitialInfected());
        }

        if (output != null) {
            try {
                new TimeseriesExporter().write(engine.getTimeseries(), output);
                out.printf("timeseries: %d samples written to %s%n", engine.getTimeseries().size(), output);
            } catch (TimeseriesFormatException | IOException e) {
                LOGGER.error("Failed to export timeseries to {}: {}", output, e.getMessage());
                return EXIT_EXPORT_FAILED;
            }
        }
        out.flush();
        return 0;
    }

    private SimulationParameters resolveParameters(final Config config) throws ConfigurationException {
        SimulationParameters params = ConfigLoader.simulationParameters(config);
        if (preset != null) {
            params = ScenarioPreset.fromName(preset).apply(params);
            LOGGER.info("Applied preset {}", preset);
        }
        return params;
    }
}
