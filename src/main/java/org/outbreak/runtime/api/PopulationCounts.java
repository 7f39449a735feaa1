package org.outbreak.runtime.api;

import org.outbreak.runtime.model.Agent;
import org.outbreak.runtime.model.HealthState;

import java.util.Collection;

/**
 * Number of agents per disease state at one instant.
 *
 * @param healthy Agents that can still be infected.
 * @param infected Symptomatic infectious agents.
 * @param asymptomatic Asymptomatic infectious agents.
 * @param recovered Agents that went through an infection.
 * @param vaccinated Agents vaccinated at initialization.
 */
public record PopulationCounts(int healthy, int infected, int asymptomatic, int recovered, int vaccinated) {

    /**
     * Counts the given agents by state.
     * @param agents The agents to count.
     * @return The counts.
     */
    public static PopulationCounts of(Collection<Agent> agents) {
        int[] counts = new int[HealthState.values().length];
        for (Agent agent : agents) {
            counts[agent.getState().ordinal()]++;
        }
        return new PopulationCounts(
                counts[HealthState.HEALTHY.ordinal()],
                counts[HealthState.INFECTED.ordinal()],
                counts[HealthState.ASYMPTOMATIC.ordinal()],
                counts[HealthState.RECOVERED.ordinal()],
                counts[HealthState.VACCINATED.ordinal()]);
    }

    /**
     * @param state The state to look up.
     * @return The number of agents in that state.
     */
    public int get(HealthState state) {
        return switch (state) {
            case HEALTHY -> healthy;
            case INFECTED -> infected;
            case ASYMPTOMATIC -> asymptomatic;
            case RECOVERED -> recovered;
            case VACCINATED -> vaccinated;
        };
    }

    /**
     * @return Infected plus asymptomatic agents.
     */
    public int infectious() {
        return infected + asymptomatic;
    }

    /**
     * @return The sum over all states.
     */
    public int total() {
        return healthy + infected + asymptomatic + recovered + vaccinated;
    }
}
