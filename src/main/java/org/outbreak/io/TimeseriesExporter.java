package org.outbreak.io;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.outbreak.runtime.timeseries.TimeseriesSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a population timeseries as a pretty-printed JSON array or as CSV with the header
 * {@code t,healthy,infected,asymptomatic,recovered,vaccinated}.
 */
public class TimeseriesExporter {

    private static final Logger LOG = LoggerFactory.getLogger(TimeseriesExporter.class);

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final CsvMapper csvMapper = new CsvMapper();

    /**
     * Writes the samples to a file, choosing the format by its extension. Parent directories are created.
     * @param samples The samples to write.
     * @param file A .csv or .json file.
     * @throws TimeseriesFormatException if the file has another extension.
     * @throws IOException if writing fails.
     */
    public void write(List<TimeseriesSample> samples, Path file) throws TimeseriesFormatException, IOException {
        TimeseriesFileFormat format = TimeseriesFileFormat.forFile(file);
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            if (format == TimeseriesFileFormat.JSON) {
                writeJson(samples, writer);
            } else {
                writeCsv(samples, writer);
            }
        }
        LOG.info("Wrote {} samples to {}", samples.size(), file);
    }

    /**
     * @param samples The samples to write.
     * @param writer The target; left open.
     * @throws IOException if writing fails.
     */
    public void writeJson(List<TimeseriesSample> samples, Writer writer) throws IOException {
        objectMapper.writerFor(objectMapper.getTypeFactory().constructCollectionType(List.class, TimeseriesSample.class))
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValue(writer, samples);
    }

    /**
     * @param samples The samples to write.
     * @param writer The target; left open.
     * @throws IOException if writing fails.
     */
    public void writeCsv(List<TimeseriesSample> samples, Writer writer) throws IOException {
        CsvSchema schema = csvMapper.schemaFor(TimeseriesSample.class).withHeader();
        if (samples.isEmpty()) {
            // the generator only emits the header together with the first row
            List<String> names = new ArrayList<>();
            schema.forEach(column -> names.add(column.getName()));
            writer.write(String.join(",", names));
            writer.write("\n");
            return;
        }
        try (SequenceWriter rows = csvMapper.writer(schema)
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValues(writer)) {
            rows.writeAll(samples);
        }
    }
}
