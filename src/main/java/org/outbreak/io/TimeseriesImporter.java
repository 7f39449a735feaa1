package org.outbreak.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.outbreak.runtime.SimulationEngine;
import org.outbreak.runtime.timeseries.TimeseriesSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads externally produced population timeseries from CSV or JSON.
 * <p>
 * Both formats carry the fields {@code t, healthy, infected, recovered, vaccinated} and optionally
 * {@code asymptomatic}. Numeric fields are coerced tolerantly: missing, empty, non-numeric or
 * non-finite values become 0 and fractional counts are rounded. Structural problems, negative counts
 * and counts beyond the int range are rejected with a {@link TimeseriesFormatException}, so the
 * engine never sees unparsed input.
 */
public class TimeseriesImporter {

    private static final Logger LOG = LoggerFactory.getLogger(TimeseriesImporter.class);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CsvMapper csvMapper = new CsvMapper();

    /**
     * Reads a timeseries file, choosing the format by its extension.
     * @param file A .csv or .json file.
     * @return The samples in file order.
     * @throws TimeseriesFormatException if the file is structurally invalid or has another extension.
     * @throws IOException if the file cannot be read.
     */
    public List<TimeseriesSample> read(Path file) throws TimeseriesFormatException, IOException {
        TimeseriesFileFormat format = TimeseriesFileFormat.forFile(file);
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<TimeseriesSample> samples = format == TimeseriesFileFormat.JSON ? readJson(reader) : readCsv(reader);
            LOG.info("Read {} samples from {}", samples.size(), file);
            return samples;
        }
    }

    /**
     * Reads a JSON array of sample objects.
     * @param reader The JSON source.
     * @return The samples in document order.
     * @throws TimeseriesFormatException if the document is not valid JSON or not an array.
     * @throws IOException if reading fails.
     */
    public List<TimeseriesSample> readJson(Reader reader) throws TimeseriesFormatException, IOException {
        JsonNode root;
        try {
            root = objectMapper.readTree(reader);
        } catch (JsonProcessingException e) {
            throw new TimeseriesFormatException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new TimeseriesFormatException("JSON must be an array");
        }
        List<TimeseriesSample> samples = new ArrayList<>(root.size());
        for (JsonNode element : root) {
            samples.add(toSample(samples.size(), field -> coerce(element.get(field))));
        }
        return checkOrder(samples);
    }

    /**
     * Reads CSV with a header row followed by at least one data row.
     * @param reader The CSV source.
     * @return The samples in row order.
     * @throws TimeseriesFormatException if the header or all data rows are missing.
     * @throws IOException if reading fails.
     */
    public List<TimeseriesSample> readCsv(Reader reader) throws TimeseriesFormatException, IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<TimeseriesSample> samples = new ArrayList<>();
        try (MappingIterator<Map<String, String>> rows = csvMapper
                .readerFor(Map.class)
                .with(schema)
                .with(CsvParser.Feature.TRIM_SPACES)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .readValues(reader)) {
            while (rows.hasNextValue()) {
                Map<String, String> row = trimKeys(rows.nextValue());
                samples.add(toSample(samples.size(), field -> coerce(row.get(field))));
            }
        } catch (JsonProcessingException e) {
            throw new TimeseriesFormatException("Malformed CSV: " + e.getOriginalMessage(), e);
        }
        if (samples.isEmpty()) {
            throw new TimeseriesFormatException("CSV must have header and data");
        }
        return checkOrder(samples);
    }

    /**
     * Replaces the timeseries of an engine with imported samples. The engine's agents and clock are
     * not touched.
     *
     * @param engine The engine whose timeseries is replaced.
     * @param samples The imported samples, ordered by non-decreasing {@code t}.
     */
    public void importInto(SimulationEngine engine, List<TimeseriesSample> samples) {
        engine.replaceTimeseries(samples);
    }

    private static Map<String, String> trimKeys(Map<String, String> row) {
        Map<String, String> trimmed = new HashMap<>();
        for (Map.Entry<String, String> entry : row.entrySet()) {
            trimmed.put(entry.getKey().trim(), entry.getValue());
        }
        return trimmed;
    }

    private static TimeseriesSample toSample(int index, Function<String, Double> field)
            throws TimeseriesFormatException {
        return new TimeseriesSample(
                field.apply("t"),
                count(index, "healthy", field.apply("healthy")),
                count(index, "infected", field.apply("infected")),
                count(index, "asymptomatic", field.apply("asymptomatic")),
                count(index, "recovered", field.apply("recovered")),
                count(index, "vaccinated", field.apply("vaccinated")));
    }

    /**
     * Rounds a coerced value to an agent count. Negative counts and counts beyond the int range
     * cannot describe a population and are rejected.
     */
    private static int count(int index, String name, double value) throws TimeseriesFormatException {
        long rounded = Math.round(value);
        if (rounded < 0 || rounded > Integer.MAX_VALUE) {
            throw new TimeseriesFormatException(String.format(
                    "Record %d: %s must be a count in [0, %d] but was %s", index, name, Integer.MAX_VALUE, value));
        }
        return (int) rounded;
    }

    private static double coerce(JsonNode node) {
        if (node == null || node.isNull()) {
            return 0.0;
        }
        if (node.isNumber()) {
            return finiteOrZero(node.asDouble());
        }
        if (node.isBoolean()) {
            return node.asBoolean() ? 1.0 : 0.0;
        }
        if (node.isTextual()) {
            return coerce(node.asText());
        }
        return 0.0;
    }

    private static double coerce(String text) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        try {
            return finiteOrZero(Double.parseDouble(text.trim()));
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    private static double finiteOrZero(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }

    private static List<TimeseriesSample> checkOrder(List<TimeseriesSample> samples) throws TimeseriesFormatException {
        for (int i = 1; i < samples.size(); i++) {
            if (samples.get(i).t() < samples.get(i - 1).t()) {
                throw new TimeseriesFormatException(String.format(
                        "Timestamps must not decrease: record %d has t=%s after t=%s",
                        i, samples.get(i).t(), samples.get(i - 1).t()));
            }
        }
        return samples;
    }
}
