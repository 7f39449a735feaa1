package org.outbreak.runtime.model;

import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * Named parameter adjustments applied on top of an existing parameter set.
 */
public enum ScenarioPreset {

    /** Dense, fast-moving population with high transmissibility. */
    FAST_SPREAD(b -> b.population(200).baseProbability(0.70).speed(1.4).infectionRadius(18)),

    /** Large vaccinated share with moderate transmissibility. */
    HIGH_VACCINATION(b -> b.vaccinatedFraction(0.60).baseProbability(0.20)),

    /** Short contact radius and low transmissibility. */
    LOW_TRANSMISSION(b -> b.baseProbability(0.10).infectionRadius(8));

    private final UnaryOperator<SimulationParameters.Builder> adjustment;

    ScenarioPreset(UnaryOperator<SimulationParameters.Builder> adjustment) {
        this.adjustment = adjustment;
    }

    /**
     * Applies this preset to the given parameters; values the preset does not touch are kept.
     * @param base The parameters to start from.
     * @return The adjusted parameters.
     */
    public SimulationParameters apply(SimulationParameters base) {
        return adjustment.apply(base.toBuilder()).build();
    }

    /**
     * Resolves a preset by name, case-insensitively, accepting dashes for underscores
     * (e.g. {@code fast-spread}).
     * @param name The preset name.
     * @return The preset.
     * @throws IllegalArgumentException if no preset has this name.
     */
    public static ScenarioPreset fromName(String name) {
        String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (ScenarioPreset preset : values()) {
            if (preset.name().equals(normalized)) {
                return preset;
            }
        }
        throw new IllegalArgumentException("Unknown scenario preset: " + name);
    }
}
