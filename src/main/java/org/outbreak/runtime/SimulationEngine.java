package org.outbreak.runtime;

import org.outbreak.runtime.api.ConfigurationException;
import org.outbreak.runtime.api.PopulationCounts;
import org.outbreak.runtime.model.Agent;
import org.outbreak.runtime.model.FieldBounds;
import org.outbreak.runtime.model.HealthState;
import org.outbreak.runtime.model.SimulationParameters;
import org.outbreak.runtime.model.SpatialGrid;
import org.outbreak.runtime.spi.IRandomProvider;
import org.outbreak.runtime.timeseries.TimeseriesRecorder;
import org.outbreak.runtime.timeseries.TimeseriesSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Owns the agent population and advances the epidemic step by step.
 * <p>
 * A driver calls {@link #init} once and then {@link #step} repeatedly with the simulated time elapsed
 * since the previous call. Each step runs four phases in a fixed order:
 * <ol>
 *   <li>movement of every agent, followed by a rebuild of the spatial grid,</li>
 *   <li>infection spread, evaluated on the post-movement positions,</li>
 *   <li>progression of infection timers and recovery,</li>
 *   <li>sampling of the population counts into the timeseries.</li>
 * </ol>
 * Transmission in a step always sees the positions produced by that step's movement phase.
 * <p>
 * The engine is single-threaded. Callers must serialize access to one instance; independent
 * instances share no state. All randomness comes from the injected {@link IRandomProvider}.
 */
public class SimulationEngine {
    private static final Logger LOG = LoggerFactory.getLogger(SimulationEngine.class);

    private final IRandomProvider randomProvider;
    private final SpatialGrid grid = new SpatialGrid();
    private final TimeseriesRecorder recorder = new TimeseriesRecorder();

    private SimulationParameters params;
    private List<Agent> agents = List.of();
    private double simulatedTime = 0.0;
    private long stepCount = 0L;
    private int seededInfections = 0;

    /**
     * Constructs an engine that is not yet initialized.
     * @param randomProvider The source of all randomness of this engine.
     */
    public SimulationEngine(IRandomProvider randomProvider) {
        this.randomProvider = randomProvider;
    }

    /**
     * Validates the parameters and builds a fresh population: random positions and directions inside
     * the field, vaccination by an independent draw per agent, then seeding of the initial infections
     * by drawing random agents until the requested count is reached or the attempt budget of
     * {@link Config#SEEDING_ATTEMPT_FACTOR} per agent is exhausted. Seeding fewer infections than
     * requested is not an error; see {@link #getSeededInfections()}.
     * <p>
     * On failure the engine keeps its previous state.
     *
     * @param params The parameters of the run.
     * @throws ConfigurationException if the parameters violate a constraint.
     */
    public void init(SimulationParameters params) throws ConfigurationException {
        params.validate();

        FieldBounds bounds = params.getBounds();
        double marginX = Math.min(Config.SPAWN_MARGIN, bounds.width() / 2);
        double marginY = Math.min(Config.SPAWN_MARGIN, bounds.height() / 2);

        List<Agent> created = new ArrayList<>(params.getPopulation());
        for (int i = 0; i < params.getPopulation(); i++) {
            double x = randomProvider.nextDouble(marginX, bounds.width() - marginX);
            double y = randomProvider.nextDouble(marginY, bounds.height() - marginY);
            double vx = randomProvider.nextDouble(-1, 1);
            double vy = randomProvider.nextDouble(-1, 1);
            Agent agent = new Agent(i, x, y, vx, vy, params.getRecoveryTime());

            if (randomProvider.chance(params.getVaccinatedFraction())) {
                agent.vaccinate();
            }
            agent.setSuperSpreader(params.getSuperSpreaders().contains(i));
            created.add(agent);
        }

        int seeded = 0;
        int attempts = 0;
        int maxAttempts = created.size() * Config.SEEDING_ATTEMPT_FACTOR;
        while (seeded < params.getInitialInfected() && attempts < maxAttempts) {
            Agent candidate = created.get(randomProvider.nextInt(created.size()));
            if (candidate.infect(params, drawAsymptomatic(params))) {
                seeded++;
            }
            attempts++;
        }
        if (seeded < params.getInitialInfected()) {
            LOG.warn("Seeded only {} of {} initial infections after {} attempts",
                    seeded, params.getInitialInfected(), attempts);
        }

        this.params = params;
        this.agents = Collections.unmodifiableList(created);
        this.seededInfections = seeded;
        this.simulatedTime = 0.0;
        this.stepCount = 0L;
        this.recorder.clear();
        this.grid.rebuild(this.agents, params.getCellSize(), bounds);

        LOG.info("Initialized simulation: {} agents, {} infected, {} vaccinated, cell size {}",
                created.size(), seeded, getSnapshot().vaccinated(), params.getCellSize());
    }

    /**
     * Advances the simulation by {@code dt} simulated seconds. Drivers should keep {@code dt} at or below
     * {@link Config#MAX_RECOMMENDED_DT}.
     *
     * @param dt Simulated seconds elapsed since the previous step, finite and > 0.
     * @throws IllegalStateException if the engine was never initialized.
     * @throws IllegalArgumentException if {@code dt} is not a finite positive number.
     */
    public void step(double dt) {
        if (params == null) {
            throw new IllegalStateException("Simulation has not been initialized");
        }
        if (!Double.isFinite(dt) || dt <= 0) {
            throw new IllegalArgumentException("dt must be a finite value > 0 but was " + dt);
        }
        simulatedTime += dt;
        stepCount++;

        FieldBounds bounds = params.getBounds();
        for (Agent agent : agents) {
            agent.move(dt, params.getSpeed(), bounds, randomProvider);
        }
        grid.rebuild(agents, params.getCellSize(), bounds);

        int newInfections = spreadInfection();

        int recoveries = 0;
        for (Agent agent : agents) {
            if (agent.progress(dt)) {
                recoveries++;
            }
        }

        recorder.onStep(dt, simulatedTime, this::getSnapshot);

        if (LOG.isDebugEnabled() && (newInfections > 0 || recoveries > 0)) {
            LOG.debug("Step={} t={} newInfections={} recoveries={}",
                    stepCount, simulatedTime, newInfections, recoveries);
        }
    }

    private int spreadInfection() {
        double radius = params.getInfectionRadius();
        int newInfections = 0;
        for (Agent source : agents) {
            if (!source.getState().isInfectious()) continue;

            for (Agent target : grid.queryNeighbors(source)) {
                if (target.getState() != HealthState.HEALTHY) continue;

                double distance = source.distanceTo(target);
                if (distance > radius) continue;

                double probability = transmissionProbability(distance, radius,
                        params.getBaseProbability(), source.isSuperSpreader());
                if (randomProvider.chance(probability)
                        && target.infect(params, drawAsymptomatic(params))) {
                    newInfections++;
                }
            }
        }
        return newInfections;
    }

    private boolean drawAsymptomatic(SimulationParameters p) {
        return p.getAsymptomaticFraction() > 0 && randomProvider.chance(p.getAsymptomaticFraction());
    }

    /**
     * Per-contact transmission probability with linear falloff: maximal at distance zero, zero at and
     * beyond the infection radius, doubled for super-spreaders.
     *
     * @param distance Euclidean distance between source and target.
     * @param radius The infection radius.
     * @param baseProbability The probability at distance zero.
     * @param superSpreader Whether the source is a super-spreader.
     * @return The transmission probability.
     */
    public static double transmissionProbability(double distance, double radius, double baseProbability,
                                                 boolean superSpreader) {
        if (distance >= radius) {
            return 0.0;
        }
        double probability = baseProbability * (1 - distance / radius);
        return superSpreader ? probability * Config.SUPER_SPREADER_MULTIPLIER : probability;
    }

    /**
     * Replaces the active parameters of a running simulation. Speed, radius, probabilities, recovery and
     * incubation times and field size apply from the next step; agents that are already infected keep
     * their captured thresholds. Population, initial infections, vaccination and super-spreader
     * settings only take effect at the next {@link #init}.
     *
     * @param updated The new parameters.
     * @throws ConfigurationException if the parameters violate a constraint.
     */
    public void updateParameters(SimulationParameters updated) throws ConfigurationException {
        if (params == null) {
            throw new IllegalStateException("Simulation has not been initialized");
        }
        updated.validate();
        this.params = updated;
        LOG.info("Parameters updated at t={}: {}", simulatedTime, updated);
    }

    /**
     * Sets or clears the super-spreader flag of one agent.
     * @param agentId The agent's id.
     * @param superSpreader The new flag value.
     * @throws IllegalArgumentException if no agent has this id.
     */
    public void setSuperSpreader(int agentId, boolean superSpreader) {
        if (agentId < 0 || agentId >= agents.size()) {
            throw new IllegalArgumentException("No agent with id " + agentId);
        }
        agents.get(agentId).setSuperSpreader(superSpreader);
    }

    /**
     * @return The current population counts. Pure read.
     */
    public PopulationCounts getSnapshot() {
        return PopulationCounts.of(agents);
    }

    /**
     * @return A read-only view of the recorded samples in order.
     */
    public List<TimeseriesSample> getTimeseries() {
        return recorder.getSamples();
    }

    /**
     * Replaces the recorded timeseries wholesale, e.g. with imported data. Agents, clock and step
     * count are not touched.
     *
     * @param samples The new samples, ordered by non-decreasing {@code t}.
     * @throws IllegalArgumentException if the timestamps decrease anywhere.
     */
    public void replaceTimeseries(List<TimeseriesSample> samples) {
        recorder.replaceWith(samples);
    }

    /**
     * @return A read-only view of all agents, ordered by id.
     */
    public List<Agent> getAgents() { return agents; }

    /**
     * @return The spatial index as of the last movement phase.
     */
    public SpatialGrid getGrid() { return grid; }

    public SimulationParameters getParameters() { return params; }
    public boolean isInitialized() { return params != null; }
    public double getSimulatedTime() { return simulatedTime; }
    public long getStepCount() { return stepCount; }
    public int getSeededInfections() { return seededInfections; }
}
