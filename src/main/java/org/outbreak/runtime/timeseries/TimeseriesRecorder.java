package org.outbreak.runtime.timeseries;

import org.outbreak.runtime.Config;
import org.outbreak.runtime.api.PopulationCounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Append-only population timeseries sampled at a fixed simulated-time cadence.
 * <p>
 * The engine reports every step through {@link #onStep}; once the accumulated step time reaches the
 * sampling interval the timer restarts at zero and one sample is appended. Timestamps never decrease.
 * The only other writer is the import path, which replaces the whole sequence via {@link #replaceWith}.
 */
public class TimeseriesRecorder {

    private static final Logger LOG = LoggerFactory.getLogger(TimeseriesRecorder.class);

    // absorbs rounding drift of accumulated step times such as 0.1 + 0.1 + ...
    private static final double TIMER_TOLERANCE = 1e-9;

    private final double sampleInterval;
    private final List<TimeseriesSample> samples = new ArrayList<>();
    private double sampleTimer = 0.0;

    /**
     * Creates a recorder with the default sampling interval.
     */
    public TimeseriesRecorder() {
        this(Config.SAMPLE_INTERVAL);
    }

    /**
     * Creates a recorder with a custom sampling interval.
     * @param sampleInterval Simulated seconds between samples, must be > 0.
     */
    public TimeseriesRecorder(double sampleInterval) {
        if (!(sampleInterval > 0)) {
            throw new IllegalArgumentException("sampleInterval must be > 0 but was " + sampleInterval);
        }
        this.sampleInterval = sampleInterval;
    }

    /**
     * Accumulates {@code dt} into the sampling timer and appends a sample when the interval is reached.
     * The counts are only computed when a sample is actually taken.
     *
     * @param dt Simulated seconds of the step that just completed.
     * @param simulatedTime Simulated time at the end of the step.
     * @param counts Supplies the population counts at the end of the step.
     * @return true if a sample was appended.
     */
    public boolean onStep(double dt, double simulatedTime, Supplier<PopulationCounts> counts) {
        sampleTimer += dt;
        if (sampleTimer + TIMER_TOLERANCE < sampleInterval) {
            return false;
        }
        sampleTimer = 0.0;
        record(simulatedTime, counts.get());
        return true;
    }

    /**
     * Appends a sample unconditionally. The timestamp is rounded to millisecond precision and raised to
     * the previous sample's timestamp if it would otherwise go backwards, which only happens when
     * stepping continues after an import.
     *
     * @param simulatedTime Simulated time of the sample.
     * @param counts The population counts.
     * @return The appended sample.
     */
    public TimeseriesSample record(double simulatedTime, PopulationCounts counts) {
        double t = Math.round(simulatedTime * 1000.0) / 1000.0;
        if (!samples.isEmpty()) {
            t = Math.max(t, samples.get(samples.size() - 1).t());
        }
        TimeseriesSample sample = TimeseriesSample.of(t, counts);
        samples.add(sample);
        LOG.debug("Sample t={} {}", t, counts);
        return sample;
    }

    /**
     * Replaces the whole sequence, e.g. with externally imported data, and restarts the sampling timer.
     *
     * @param replacement The new samples, ordered by non-decreasing {@code t}.
     * @throws IllegalArgumentException if the timestamps decrease anywhere.
     */
    public void replaceWith(List<TimeseriesSample> replacement) {
        for (int i = 1; i < replacement.size(); i++) {
            if (replacement.get(i).t() < replacement.get(i - 1).t()) {
                throw new IllegalArgumentException(String.format(
                        "Timeseries timestamps must not decrease: t[%d]=%s < t[%d]=%s",
                        i, replacement.get(i).t(), i - 1, replacement.get(i - 1).t()));
            }
        }
        samples.clear();
        samples.addAll(replacement);
        sampleTimer = 0.0;
        LOG.info("Timeseries replaced with {} samples", samples.size());
    }

    /**
     * Removes all samples and restarts the sampling timer.
     */
    public void clear() {
        samples.clear();
        sampleTimer = 0.0;
    }

    /**
     * @return A read-only view of the samples in recording order.
     */
    public List<TimeseriesSample> getSamples() {
        return Collections.unmodifiableList(samples);
    }

    /**
     * @return The most recent sample, if any.
     */
    public Optional<TimeseriesSample> latest() {
        return samples.isEmpty() ? Optional.empty() : Optional.of(samples.get(samples.size() - 1));
    }

    public int size() { return samples.size(); }
}
