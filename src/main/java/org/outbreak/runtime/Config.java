package org.outbreak.runtime;

/**
 * Provides the fixed constants of the transmission model.
 * This final class contains static constants for the movement integration, the spatial index,
 * seeding and sampling. Run-specific parameters live in
 * {@link org.outbreak.runtime.model.SimulationParameters}.
 * It is not meant to be instantiated.
 */
public final class Config {

    /**
     * Private constructor to prevent instantiation of this utility class.
     */
    private Config() {}

    /**
     * Simulated seconds between two timeseries samples.
     */
    public static final double SAMPLE_INTERVAL = 0.5;

    /**
     * Field units travelled per simulated second at speed multiplier 1.
     */
    public static final double SPEED_CONSTANT = 50.0;

    /**
     * Lower bound for the spatial grid cell size, in field units.
     */
    public static final double MIN_CELL_SIZE = 24.0;

    /**
     * Half-width of the uniform perturbation added to each velocity component per movement update.
     */
    public static final double VELOCITY_JITTER = 0.02;

    /**
     * Number of recent positions kept per agent for trail rendering.
     */
    public static final int TRAIL_LENGTH = 8;

    /**
     * Distance from the field border inside which no agent is placed at initialization.
     */
    public static final double SPAWN_MARGIN = 10.0;

    /**
     * Initial infection seeding gives up after this many attempts per agent.
     */
    public static final int SEEDING_ATTEMPT_FACTOR = 5;

    /**
     * Largest step a driver should pass to {@code step(dt)} to keep the discretization stable.
     */
    public static final double MAX_RECOMMENDED_DT = 0.1;

    /**
     * Multiplier applied to the transmission probability of a super-spreader.
     */
    public static final double SUPER_SPREADER_MULTIPLIER = 2.0;
}
