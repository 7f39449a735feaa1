package org.outbreak.runtime.model;

/**
 * Disease state of a single agent.
 * <p>
 * Transitions: {@code HEALTHY -> INFECTED | ASYMPTOMATIC} on exposure,
 * {@code HEALTHY -> VACCINATED} at initialization only, and
 * {@code INFECTED | ASYMPTOMATIC -> RECOVERED} once the recovery threshold is reached.
 */
public enum HealthState {
    HEALTHY,
    INFECTED,
    ASYMPTOMATIC,
    RECOVERED,
    VACCINATED;

    /**
     * @return true if an agent in this state can transmit the disease.
     */
    public boolean isInfectious() {
        return this == INFECTED || this == ASYMPTOMATIC;
    }

    /**
     * @return true if no further transition leaves this state.
     */
    public boolean isTerminal() {
        return this == RECOVERED || this == VACCINATED;
    }
}
