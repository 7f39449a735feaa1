package org.outbreak.runtime;

import org.outbreak.runtime.api.PopulationCounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Headless driver that advances an initialized engine for a simulated duration.
 * <p>
 * Each iteration passes the frame time, clamped to {@link Config#MAX_RECOMMENDED_DT}, to
 * {@link SimulationEngine#step}; the last step is shortened so the run ends exactly at the
 * requested duration. The runner optionally stops early once no agent is infectious anymore.
 */
public class SimulationRunner {
    private static final Logger LOG = LoggerFactory.getLogger(SimulationRunner.class);

    private final SimulationEngine engine;
    private final double frameTime;
    private final boolean stopWhenExtinct;

    /**
     * @param engine An initialized engine.
     * @param frameTime Simulated seconds per step before clamping, must be > 0.
     * @param stopWhenExtinct Whether to stop as soon as the infectious count drops to zero.
     */
    public SimulationRunner(SimulationEngine engine, double frameTime, boolean stopWhenExtinct) {
        if (!engine.isInitialized()) {
            throw new IllegalStateException("Simulation has not been initialized");
        }
        if (!Double.isFinite(frameTime) || frameTime <= 0) {
            throw new IllegalArgumentException("frameTime must be a finite value > 0 but was " + frameTime);
        }
        if (frameTime > Config.MAX_RECOMMENDED_DT) {
            LOG.warn("Frame time {}s exceeds {}s and will be clamped", frameTime, Config.MAX_RECOMMENDED_DT);
        }
        this.engine = engine;
        this.frameTime = Math.min(frameTime, Config.MAX_RECOMMENDED_DT);
        this.stopWhenExtinct = stopWhenExtinct;
    }

    /**
     * Steps the engine until {@code duration} more simulated seconds have passed, or until the
     * epidemic is extinct if early stopping is enabled.
     *
     * @param duration Simulated seconds to run, must be >= 0.
     * @return The population counts after the last step.
     */
    public PopulationCounts runFor(double duration) {
        if (!Double.isFinite(duration) || duration < 0) {
            throw new IllegalArgumentException("duration must be a finite value >= 0 but was " + duration);
        }
        double end = engine.getSimulatedTime() + duration;
        long logEvery = Math.max(1L, Math.round(10.0 / frameTime));
        long steps = 0;

        while (end - engine.getSimulatedTime() > 1e-9) {
            double before = engine.getSimulatedTime();
            double dt = Math.min(frameTime, end - before);
            engine.step(dt);
            steps++;
            if (engine.getSimulatedTime() <= before) {
                LOG.warn("Simulated time stopped advancing at t={}s, remaining {}s cannot be resolved",
                        before, end - before);
                break;
            }

            if (steps % logEvery == 0) {
                LOG.info("t={}s {}", String.format("%.1f", engine.getSimulatedTime()), engine.getSnapshot());
            }
            if (stopWhenExtinct && engine.getSnapshot().infectious() == 0) {
                LOG.info("No infectious agents left at t={}s, stopping", String.format("%.1f", engine.getSimulatedTime()));
                break;
            }
        }
        PopulationCounts finalCounts = engine.getSnapshot();
        LOG.info("Run finished after {} steps at t={}s: {}", steps,
                String.format("%.1f", engine.getSimulatedTime()), finalCounts);
        return finalCounts;
    }
}
