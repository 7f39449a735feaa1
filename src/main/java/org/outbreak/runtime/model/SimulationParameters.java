package org.outbreak.runtime.model;

import com.typesafe.config.ConfigException;
import org.outbreak.runtime.Config;
import org.outbreak.runtime.api.ConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable parameter set of one simulation run.
 * <p>
 * Instances may hold invalid values; {@link #validate()} is called by the engine before the
 * parameters are applied. Agents copy the recovery and incubation times when they get infected,
 * so replacing the parameters of a running engine never alters agents that are already infected.
 */
public final class SimulationParameters {

    private final int population;
    private final int initialInfected;
    private final double speed;
    private final double infectionRadius;
    private final double baseProbability;
    private final double recoveryTime;
    private final double incubationTime;
    private final double vaccinatedFraction;
    private final double asymptomaticFraction;
    private final double fieldWidth;
    private final double fieldHeight;
    private final Set<Integer> superSpreaders;

    private SimulationParameters(Builder builder) {
        this.population = builder.population;
        this.initialInfected = builder.initialInfected;
        this.speed = builder.speed;
        this.infectionRadius = builder.infectionRadius;
        this.baseProbability = builder.baseProbability;
        this.recoveryTime = builder.recoveryTime;
        this.incubationTime = builder.incubationTime;
        this.vaccinatedFraction = builder.vaccinatedFraction;
        this.asymptomaticFraction = builder.asymptomaticFraction;
        this.fieldWidth = builder.fieldWidth;
        this.fieldHeight = builder.fieldHeight;
        this.superSpreaders = Collections.unmodifiableSet(new TreeSet<>(builder.superSpreaders));
    }

    /**
     * @return A builder preset with the default parameters.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return The default parameters.
     */
    public static SimulationParameters defaults() {
        return builder().build();
    }

    /**
     * Reads parameters from a HOCON block. Missing keys keep their defaults.
     * <pre>
     * simulation {
     *   population = 120
     *   initial-infected = 3
     *   speed = 1.0
     *   infection-radius = 14
     *   base-probability = 0.45
     *   recovery-time = 12
     *   incubation-time = 0
     *   vaccinated-fraction = 0.0
     *   asymptomatic-fraction = 0.0
     *   field-width = 800
     *   field-height = 600
     *   super-spreaders = []
     * }
     * </pre>
     *
     * @param config The block containing the parameter keys.
     * @return The parameters, not yet validated.
     * @throws ConfigurationException if a key holds a value of the wrong type.
     */
    public static SimulationParameters fromConfig(com.typesafe.config.Config config) throws ConfigurationException {
        Builder b = builder();
        try {
            if (config.hasPath("population")) b.population(config.getInt("population"));
            if (config.hasPath("initial-infected")) b.initialInfected(config.getInt("initial-infected"));
            if (config.hasPath("speed")) b.speed(config.getDouble("speed"));
            if (config.hasPath("infection-radius")) b.infectionRadius(config.getDouble("infection-radius"));
            if (config.hasPath("base-probability")) b.baseProbability(config.getDouble("base-probability"));
            if (config.hasPath("recovery-time")) b.recoveryTime(config.getDouble("recovery-time"));
            if (config.hasPath("incubation-time")) b.incubationTime(config.getDouble("incubation-time"));
            if (config.hasPath("vaccinated-fraction")) b.vaccinatedFraction(config.getDouble("vaccinated-fraction"));
            if (config.hasPath("asymptomatic-fraction")) b.asymptomaticFraction(config.getDouble("asymptomatic-fraction"));
            if (config.hasPath("field-width")) b.fieldWidth(config.getDouble("field-width"));
            if (config.hasPath("field-height")) b.fieldHeight(config.getDouble("field-height"));
            if (config.hasPath("super-spreaders")) b.superSpreaders(config.getIntList("super-spreaders"));
        } catch (ConfigException e) {
            throw new ConfigurationException("Malformed simulation configuration: " + e.getMessage(), e);
        }
        return b.build();
    }

    /**
     * Checks every constraint and reports all violations at once.
     * @throws ConfigurationException if at least one constraint is violated.
     */
    public void validate() throws ConfigurationException {
        List<String> violations = new ArrayList<>();
        if (population <= 0) {
            violations.add("population must be > 0 but was " + population);
        }
        if (initialInfected < 0) {
            violations.add("initialInfected must be >= 0 but was " + initialInfected);
        }
        if (!Double.isFinite(speed) || speed < 0) {
            violations.add("speed must be a finite value >= 0 but was " + speed);
        }
        if (!Double.isFinite(infectionRadius) || infectionRadius <= 0) {
            violations.add("infectionRadius must be a finite value > 0 but was " + infectionRadius);
        }
        checkProbability("baseProbability", baseProbability, violations);
        if (!Double.isFinite(recoveryTime) || recoveryTime <= 0) {
            violations.add("recoveryTime must be a finite value > 0 but was " + recoveryTime);
        }
        if (!Double.isFinite(incubationTime) || incubationTime < 0) {
            violations.add("incubationTime must be a finite value >= 0 but was " + incubationTime);
        }
        checkProbability("vaccinatedFraction", vaccinatedFraction, violations);
        checkProbability("asymptomaticFraction", asymptomaticFraction, violations);
        if (!Double.isFinite(fieldWidth) || fieldWidth <= 0) {
            violations.add("fieldWidth must be a finite value > 0 but was " + fieldWidth);
        }
        if (!Double.isFinite(fieldHeight) || fieldHeight <= 0) {
            violations.add("fieldHeight must be a finite value > 0 but was " + fieldHeight);
        }
        for (int id : superSpreaders) {
            if (id < 0 || id >= population) {
                violations.add("super-spreader id " + id + " is outside [0, " + population + ")");
            }
        }
        if (!violations.isEmpty()) {
            throw new ConfigurationException(violations);
        }
    }

    private static void checkProbability(String name, double value, List<String> violations) {
        if (!(value >= 0.0 && value <= 1.0)) {
            violations.add(name + " must be in [0, 1] but was " + value);
        }
    }

    /**
     * @return A builder initialized with the values of this instance.
     */
    public Builder toBuilder() {
        return new Builder()
                .population(population)
                .initialInfected(initialInfected)
                .speed(speed)
                .infectionRadius(infectionRadius)
                .baseProbability(baseProbability)
                .recoveryTime(recoveryTime)
                .incubationTime(incubationTime)
                .vaccinatedFraction(vaccinatedFraction)
                .asymptomaticFraction(asymptomaticFraction)
                .fieldWidth(fieldWidth)
                .fieldHeight(fieldHeight)
                .superSpreaders(superSpreaders);
    }

    public int getPopulation() { return population; }
    public int getInitialInfected() { return initialInfected; }
    public double getSpeed() { return speed; }
    public double getInfectionRadius() { return infectionRadius; }
    public double getBaseProbability() { return baseProbability; }
    public double getRecoveryTime() { return recoveryTime; }
    public double getIncubationTime() { return incubationTime; }
    public double getVaccinatedFraction() { return vaccinatedFraction; }
    public double getAsymptomaticFraction() { return asymptomaticFraction; }
    public double getFieldWidth() { return fieldWidth; }
    public double getFieldHeight() { return fieldHeight; }
    public Set<Integer> getSuperSpreaders() { return superSpreaders; }

    /**
     * @return The field described by the width and height parameters.
     */
    public FieldBounds getBounds() {
        return new FieldBounds(fieldWidth, fieldHeight);
    }

    /**
     * Cell size of the spatial grid for these parameters.
     * Twice the infection radius keeps every pair within the radius in the same or adjacent cells.
     * @return The cell size in field units.
     */
    public double getCellSize() {
        return Math.max(Config.MIN_CELL_SIZE, 2 * infectionRadius);
    }

    @Override
    public String toString() {
        return "SimulationParameters{population=" + population
                + ", initialInfected=" + initialInfected
                + ", speed=" + speed
                + ", infectionRadius=" + infectionRadius
                + ", baseProbability=" + baseProbability
                + ", recoveryTime=" + recoveryTime
                + ", incubationTime=" + incubationTime
                + ", vaccinatedFraction=" + vaccinatedFraction
                + ", asymptomaticFraction=" + asymptomaticFraction
                + ", field=" + fieldWidth + "x" + fieldHeight
                + ", superSpreaders=" + superSpreaders + "}";
    }

    /**
     * Builder for {@link SimulationParameters}. Defaults match the interactive application.
     */
    public static final class Builder {
        private int population = 120;
        private int initialInfected = 3;
        private double speed = 1.0;
        private double infectionRadius = 14.0;
        private double baseProbability = 0.45;
        private double recoveryTime = 12.0;
        private double incubationTime = 0.0;
        private double vaccinatedFraction = 0.0;
        private double asymptomaticFraction = 0.0;
        private double fieldWidth = 800.0;
        private double fieldHeight = 600.0;
        private Set<Integer> superSpreaders = new TreeSet<>();

        private Builder() {}

        public Builder population(int population) { this.population = population; return this; }
        public Builder initialInfected(int initialInfected) { this.initialInfected = initialInfected; return this; }
        public Builder speed(double speed) { this.speed = speed; return this; }
        public Builder infectionRadius(double infectionRadius) { this.infectionRadius = infectionRadius; return this; }
        public Builder baseProbability(double baseProbability) { this.baseProbability = baseProbability; return this; }
        public Builder recoveryTime(double recoveryTime) { this.recoveryTime = recoveryTime; return this; }
        public Builder incubationTime(double incubationTime) { this.incubationTime = incubationTime; return this; }
        public Builder vaccinatedFraction(double vaccinatedFraction) { this.vaccinatedFraction = vaccinatedFraction; return this; }
        public Builder asymptomaticFraction(double asymptomaticFraction) { this.asymptomaticFraction = asymptomaticFraction; return this; }
        public Builder fieldWidth(double fieldWidth) { this.fieldWidth = fieldWidth; return this; }
        public Builder fieldHeight(double fieldHeight) { this.fieldHeight = fieldHeight; return this; }

        public Builder superSpreaders(Collection<Integer> ids) {
            this.superSpreaders = new TreeSet<>(ids);
            return this;
        }

        public SimulationParameters build() {
            return new SimulationParameters(this);
        }
    }
}
