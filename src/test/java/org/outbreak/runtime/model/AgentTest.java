package org.outbreak.runtime.model;

import org.outbreak.runtime.Config;
import org.outbreak.runtime.internal.services.SeededRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for the agent state machine and its movement integration.
 */
@Tag("unit")
class AgentTest {

    private static final FieldBounds FIELD = new FieldBounds(100, 100);

    private final SimulationParameters params = SimulationParameters.builder()
            .recoveryTime(2.0)
            .incubationTime(0.5)
            .build();

    @Test
    void infectCapturesThresholdsAndResetsClock() {
        Agent agent = new Agent(0, 50, 50, 1, 0, 99.0);

        assertThat(agent.infect(params, false)).isTrue();

        assertThat(agent.getState()).isEqualTo(HealthState.INFECTED);
        assertThat(agent.getInfectedElapsed()).isZero();
        assertThat(agent.getRecoveryThreshold()).isEqualTo(2.0);
        assertThat(agent.getIncubationThreshold()).isEqualTo(0.5);
    }

    @Test
    void infectIsNoOpUnlessHealthy() {
        Agent infected = new Agent(0, 50, 50, 1, 0, 12.0);
        infected.infect(params, false);
        infected.progress(1.0);
        assertThat(infected.infect(params, true)).isFalse();
        assertThat(infected.getState()).isEqualTo(HealthState.INFECTED);
        assertThat(infected.getInfectedElapsed()).isEqualTo(1.0);

        Agent vaccinated = new Agent(1, 50, 50, 1, 0, 12.0);
        vaccinated.vaccinate();
        assertThat(vaccinated.infect(params, false)).isFalse();
        assertThat(vaccinated.getState()).isEqualTo(HealthState.VACCINATED);
    }

    @Test
    void asymptomaticInfectionRecoversLikeSymptomatic() {
        Agent agent = new Agent(0, 50, 50, 1, 0, 12.0);
        agent.infect(params, true);
        assertThat(agent.getState()).isEqualTo(HealthState.ASYMPTOMATIC);

        assertThat(agent.progress(1.5)).isFalse();
        assertThat(agent.progress(0.5)).isTrue();
        assertThat(agent.getState()).isEqualTo(HealthState.RECOVERED);
    }

    @Test
    void recoveredAgentNeverChangesAgain() {
        Agent agent = new Agent(0, 50, 50, 1, 0, 12.0);
        agent.infect(params, false);
        agent.progress(5.0);
        assertThat(agent.getState()).isEqualTo(HealthState.RECOVERED);

        assertThat(agent.infect(params, false)).isFalse();
        assertThat(agent.vaccinate()).isFalse();
        assertThat(agent.progress(10.0)).isFalse();
        assertThat(agent.getState()).isEqualTo(HealthState.RECOVERED);
    }

    @Test
    void laterParameterChangesDoNotAffectInfectedAgent() {
        Agent agent = new Agent(0, 50, 50, 1, 0, 12.0);
        agent.infect(params, false);

        SimulationParameters changed = params.toBuilder().recoveryTime(100.0).build();
        Agent other = new Agent(1, 50, 50, 1, 0, 12.0);
        other.infect(changed, false);

        agent.progress(2.0);
        assertThat(agent.getState()).isEqualTo(HealthState.RECOVERED);
        assertThat(other.getRecoveryThreshold()).isEqualTo(100.0);
    }

    @Test
    void moveKeepsVelocityNormalizedAndPositionInsideField() {
        SeededRandomProvider random = new SeededRandomProvider(3L);
        Agent agent = new Agent(0, 50, 50, 0.3, -0.8, 12.0);

        for (int i = 0; i < 2_000; i++) {
            agent.move(0.1, 3.0, FIELD, random);
            assertThat(Math.hypot(agent.getVx(), agent.getVy())).isCloseTo(1.0, within(1e-9));
            assertThat(FIELD.contains(agent.getX(), agent.getY())).isTrue();
        }
    }

    @Test
    void moveReflectsAtBorder() {
        SeededRandomProvider random = new SeededRandomProvider(3L);
        Agent agent = new Agent(0, 99, 50, 1, 0, 12.0);

        agent.move(0.1, 1.0, FIELD, random);

        assertThat(agent.getX()).isEqualTo(100.0);
        assertThat(agent.getVx()).isNegative();
    }

    @Test
    void trailIsBoundedFifo() {
        SeededRandomProvider random = new SeededRandomProvider(3L);
        Agent agent = new Agent(0, 50, 50, 1, 0, 12.0);

        for (int i = 0; i < Config.TRAIL_LENGTH + 5; i++) {
            agent.move(0.01, 1.0, FIELD, random);
        }

        assertThat(agent.getTrail()).hasSize(Config.TRAIL_LENGTH);
        Point newest = agent.getTrail().get(Config.TRAIL_LENGTH - 1);
        assertThat(newest).isEqualTo(agent.getPosition());
    }
}
