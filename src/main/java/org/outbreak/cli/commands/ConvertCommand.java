package org.outbreak.cli.commands;

import org.outbreak.io.TimeseriesExporter;
import org.outbreak.io.TimeseriesFormatException;
import org.outbreak.io.TimeseriesImporter;
import org.outbreak.runtime.timeseries.TimeseriesSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "convert",
    description = "Reads a timeseries from CSV or JSON and writes it in the format of the target file."
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConvertCommand.class);

    static final int EXIT_INVALID_INPUT = 3;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Input file (.csv or .json).")
    private Path input;

    @Parameters(index = "1", description = "Output file (.csv or .json).")
    private Path output;

    @Override
    public Integer call() {
        try {
            final List<TimeseriesSample> samples = new TimeseriesImporter().read(input);
            new TimeseriesExporter().write(samples, output);
            spec.commandLine().getOut().printf("Converted %d records from %s to %s%n", samples.size(), input, output);
            spec.commandLine().getOut().flush();
            return 0;
        } catch (TimeseriesFormatException | IOException e) {
            LOGGER.error("Conversion failed: {}", e.getMessage());
            return EXIT_INVALID_INPUT;
        }
    }
}
