package org.outbreak.runtime;

import org.outbreak.runtime.api.ConfigurationException;
import org.outbreak.runtime.api.PopulationCounts;
import org.outbreak.runtime.internal.services.SeededRandomProvider;
import org.outbreak.runtime.model.Agent;
import org.outbreak.runtime.model.HealthState;
import org.outbreak.runtime.model.SimulationParameters;
import org.outbreak.runtime.spi.IRandomProvider;
import org.outbreak.runtime.timeseries.TimeseriesRecorder;
import org.outbreak.runtime.timeseries.TimeseriesSample;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.CALLS_REAL_METHODS;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;

@Tag("unit")
class SimulationEngineTest {

    private static SimulationParameters.Builder smallRun() {
        return SimulationParameters.builder()
                .population(40)
                .initialInfected(4)
                .infectionRadius(30)
                .baseProbability(0.6)
                .recoveryTime(3);
    }

    @Test
    void zeroPopulationIsRejected() {
        SimulationEngine engine = new SimulationEngine(new SeededRandomProvider(1L));

        assertThatThrownBy(() -> engine.init(smallRun().population(0).build()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("population");
        assertThat(engine.isInitialized()).isFalse();
    }

    @Test
    void zeroRadiusIsRejected() {
        SimulationEngine engine = new SimulationEngine(new SeededRandomProvider(1L));

        assertThatThrownBy(() -> engine.init(smallRun().infectionRadius(0).build()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("infectionRadius");
    }

    @Test
    void failedInitKeepsPreviousPopulation() throws ConfigurationException {
        SimulationEngine engine = new SimulationEngine(new SeededRandomProvider(3L));
        engine.init(smallRun().build());
        engine.step(0.1);
        List<Agent> before = engine.getAgents();

        assertThatThrownBy(() -> engine.init(smallRun().population(0).build()))
                .isInstanceOf(ConfigurationException.class);

        assertThat(engine.getAgents()).isSameAs(before);
        assertThat(engine.getStepCount()).isEqualTo(1);
    }

    @Test
    void stepRequiresInitAndPositiveDt() throws ConfigurationException {
        SimulationEngine engine = new SimulationEngine(new SeededRandomProvider(5L));
        assertThatThrownBy(() -> engine.step(0.1)).isInstanceOf(IllegalStateException.class);

        engine.init(smallRun().build());
        assertThatThrownBy(() -> engine.step(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.step(-0.1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.step(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void initPlacesAgentsInsideFieldAndSeedsInfections() throws ConfigurationException {
        SimulationEngine engine = new SimulationEngine(new SeededRandomProvider(11L));
        engine.init(smallRun().build());

        assertThat(engine.getAgents()).hasSize(40);
        assertThat(engine.getSeededInfections()).isEqualTo(4);
        assertThat(engine.getSnapshot().infected()).isEqualTo(4);
        assertThat(engine.getTimeseries()).isEmpty();
        assertThat(engine.getGrid().size()).isEqualTo(40);
        for (Agent agent : engine.getAgents()) {
            assertThat(agent.getX()).isBetween(10.0, 790.0);
            assertThat(agent.getY()).isBetween(10.0, 590.0);
            assertThat(Math.hypot(agent.getVx(), agent.getVy())).isCloseTo(1.0, within(1e-9));
        }
    }

    @Test
    void fullyVaccinatedPopulationSeedsNothingWithoutFailing() throws ConfigurationException {
        SimulationEngine engine = new SimulationEngine(new SeededRandomProvider(13L));

        engine.init(smallRun().vaccinatedFraction(1.0).build());

        assertThat(engine.getSeededInfections()).isZero();
        assertThat(engine.getSnapshot()).isEqualTo(new PopulationCounts(0, 0, 0, 0, 40));
        engine.step(0.1);
        assertThat(engine.getSnapshot().vaccinated()).isEqualTo(40);
    }

    @Test
    void seedingNeverExceedsPopulation() throws ConfigurationException {
        SimulationEngine engine = new SimulationEngine(new SeededRandomProvider(17L));

        engine.init(smallRun().population(5).initialInfected(50).build());

        assertThat(engine.getSeededInfections()).isLessThanOrEqualTo(5);
        assertThat(engine.getSnapshot().infected()).isEqualTo(engine.getSeededInfections());
    }

    @ParameterizedTest
    @ValueSource(longs = {42L, 7L, 2024L})
    void fullyConnectedPopulationRecoversWithinTenSeconds(long seed) throws ConfigurationException {
        SimulationParameters params = SimulationParameters.builder()
                .population(10)
                .initialInfected(1)
                .vaccinatedFraction(0)
                .baseProbability(1.0)
                .infectionRadius(SimulationParameters.defaults().getBounds().diagonal())
                .recoveryTime(5)
                .build();
        SimulationEngine engine = new SimulationEngine(new SeededRandomProvider(seed));
        engine.init(params);

        for (int i = 0; i < 100; i++) {
            engine.step(0.1);
        }

        assertThat(engine.getSnapshot()).isEqualTo(new PopulationCounts(0, 0, 0, 10, 0));
    }

    @Test
    void populationIsConservedAndTerminalStatesAreFinal() throws ConfigurationException {
        SimulationEngine engine = new SimulationEngine(new SeededRandomProvider(99L));
        engine.init(smallRun().vaccinatedFraction(0.2).asymptomaticFraction(0.3).build());
        Map<Integer, HealthState> terminal = new HashMap<>();

        for (int i = 0; i < 200; i++) {
            engine.step(0.05);
            assertThat(engine.getSnapshot().total()).isEqualTo(40);
            for (Agent agent : engine.getAgents()) {
                HealthState previous = terminal.get(agent.getId());
                if (previous != null) {
                    assertThat(agent.getState()).isEqualTo(previous);
                } else if (agent.getState().isTerminal()) {
                    terminal.put(agent.getId(), agent.getState());
                }
            }
        }
        assertThat(terminal).isNotEmpty();
    }

    @Test
    void sameSeedProducesIdenticalRuns() throws ConfigurationException {
        SimulationEngine first = new SimulationEngine(new SeededRandomProvider(123L));
        SimulationEngine second = new SimulationEngine(new SeededRandomProvider(123L));
        first.init(smallRun().asymptomaticFraction(0.5).build());
        second.init(smallRun().asymptomaticFraction(0.5).build());

        for (int i = 0; i < 150; i++) {
            first.step(0.1);
            second.step(0.1);
        }

        assertThat(first.getTimeseries()).isEqualTo(second.getTimeseries());
        for (int i = 0; i < first.getAgents().size(); i++) {
            Agent a = first.getAgents().get(i);
            Agent b = second.getAgents().get(i);
            assertThat(a.getPosition()).isEqualTo(b.getPosition());
            assertThat(a.getState()).isEqualTo(b.getState());
        }
    }

    @Test
    void samplesAreTakenEveryHalfSecond() throws ConfigurationException {
        SimulationEngine engine = new SimulationEngine(new SeededRandomProvider(8L));
        engine.init(smallRun().build());

        for (int i = 0; i < 100; i++) {
            engine.step(0.1);
        }

        List<TimeseriesSample> samples = engine.getTimeseries();
        assertThat(samples).hasSize(20);
        for (int k = 0; k < samples.size(); k++) {
            assertThat(samples.get(k).t()).isCloseTo(0.5 * (k + 1), within(1e-9));
            assertThat(samples.get(k).counts().total()).isEqualTo(40);
        }
        assertThat(samples.get(19).counts()).isEqualTo(engine.getSnapshot());
    }

    @Test
    void transmissionProbabilityFallsOffLinearly() {
        assertThat(SimulationEngine.transmissionProbability(0, 10, 0.5, false)).isEqualTo(0.5);
        assertThat(SimulationEngine.transmissionProbability(5, 10, 0.5, false)).isEqualTo(0.25);
        assertThat(SimulationEngine.transmissionProbability(10, 10, 0.5, false)).isZero();
        assertThat(SimulationEngine.transmissionProbability(12, 10, 0.5, false)).isZero();
        assertThat(SimulationEngine.transmissionProbability(5, 10, 0.5, true)).isEqualTo(0.5);
    }

    /**
     * Every draw returns 0.5: all agents spawn at the field centre with zero velocity and stay there,
     * and agent 0 is the only seeded infection.
     */
    private static SimulationEngine stackedEngine(double baseProbability) throws ConfigurationException {
        IRandomProvider random = mock(IRandomProvider.class, CALLS_REAL_METHODS);
        doReturn(0.5).when(random).nextDouble();
        doReturn(0).when(random).nextInt(anyInt());
        SimulationEngine engine = new SimulationEngine(random);
        engine.init(SimulationParameters.builder()
                .population(3)
                .initialInfected(1)
                .baseProbability(baseProbability)
                .build());
        return engine;
    }

    @Test
    void drawBelowProbabilityInfects() throws ConfigurationException {
        SimulationEngine engine = stackedEngine(0.6);
        assertThat(engine.getAgents().get(1).getPosition()).isEqualTo(engine.getAgents().get(0).getPosition());

        engine.step(0.1);

        assertThat(engine.getSnapshot().infected()).isEqualTo(3);
    }

    @Test
    void drawAboveProbabilityDoesNotInfect() throws ConfigurationException {
        SimulationEngine engine = stackedEngine(0.4);

        engine.step(0.1);

        assertThat(engine.getSnapshot().infected()).isEqualTo(1);
        assertThat(engine.getSnapshot().healthy()).isEqualTo(2);
    }

    @Test
    void superSpreaderDoublesTransmissionProbability() throws ConfigurationException {
        SimulationEngine engine = stackedEngine(0.4);
        engine.setSuperSpreader(0, true);

        engine.step(0.1);

        assertThat(engine.getAgents().get(1).getState()).isEqualTo(HealthState.INFECTED);
        assertThatThrownBy(() -> engine.setSuperSpreader(3, true)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void updatedParametersApplyFromNextStep() throws ConfigurationException {
        SimulationEngine engine = stackedEngine(0.4);
        engine.step(0.1);
        assertThat(engine.getSnapshot().healthy()).isEqualTo(2);

        engine.updateParameters(engine.getParameters().toBuilder().baseProbability(0.9).build());
        engine.step(0.1);

        assertThat(engine.getSnapshot().healthy()).isZero();
        assertThatThrownBy(() -> engine.updateParameters(engine.getParameters().toBuilder().speed(-1).build()))
                .isInstanceOf(ConfigurationException.class);
        assertThat(engine.getParameters().getBaseProbability()).isEqualTo(0.9);
    }

    @Test
    void timeseriesCannotBeAppendedToFromOutside() throws ConfigurationException {
        SimulationEngine engine = new SimulationEngine(new SeededRandomProvider(20L));
        engine.init(smallRun().build());
        for (int i = 0; i < 10; i++) {
            engine.step(0.1);
        }
        List<TimeseriesSample> samples = engine.getTimeseries();

        assertThatThrownBy(() -> samples.add(TimeseriesSample.of(1.0, new PopulationCounts(999, 0, 0, 0, 0))))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(samples).hasSize(2);
        assertThat(Arrays.stream(SimulationEngine.class.getMethods()).map(Method::getReturnType))
                .doesNotContain(TimeseriesRecorder.class);
    }

    @Test
    void replaceTimeseriesKeepsAgentsAndClock() throws ConfigurationException {
        SimulationEngine engine = new SimulationEngine(new SeededRandomProvider(21L));
        engine.init(smallRun().build());
        engine.step(0.1);
        PopulationCounts before = engine.getSnapshot();
        List<TimeseriesSample> imported = List.of(TimeseriesSample.of(0.0, before), TimeseriesSample.of(1.0, before));

        engine.replaceTimeseries(imported);

        assertThat(engine.getTimeseries()).containsExactlyElementsOf(imported);
        assertThat(engine.getSnapshot()).isEqualTo(before);
        assertThat(engine.getSimulatedTime()).isCloseTo(0.1, within(1e-12));
        assertThatThrownBy(() -> engine.replaceTimeseries(List.of(imported.get(1), imported.get(0))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * Two agents on the horizontal centre line, agent 0 seeded as infected. Draws are scripted in the
     * order the engine consumes them: per agent x, y, vx, vy and the vaccination draw, then one jitter
     * pair per agent during the step, then the transmission draw.
     */
    private static SimulationEngine movingPair(double x0, double vx0, double x1, double vx1)
            throws ConfigurationException {
        IRandomProvider random = mock(IRandomProvider.class, CALLS_REAL_METHODS);
        doReturn((x0 - 10) / 780, 0.5, (vx0 + 1) / 2, 0.5, 0.5,
                (x1 - 10) / 780, 0.5, (vx1 + 1) / 2, 0.5, 0.5,
                0.5, 0.5, 0.5, 0.5,
                0.0).when(random).nextDouble();
        doReturn(0).when(random).nextInt(anyInt());
        SimulationEngine engine = new SimulationEngine(random);
        engine.init(SimulationParameters.builder()
                .population(2)
                .initialInfected(1)
                .speed(1.0)
                .infectionRadius(14)
                .baseProbability(1.0)
                .build());
        return engine;
    }

    @Test
    void transmissionSeesPositionsAfterMovement() throws ConfigurationException {
        // 20 apart, each moves 5 towards the other
        SimulationEngine engine = movingPair(380, 1, 400, -1);
        Agent source = engine.getAgents().get(0);
        Agent target = engine.getAgents().get(1);
        assertThat(source.distanceTo(target)).isCloseTo(20.0, within(1e-9));

        engine.step(0.1);

        assertThat(source.distanceTo(target)).isCloseTo(10.0, within(1e-9));
        assertThat(target.getState()).isEqualTo(HealthState.INFECTED);
    }

    @Test
    void agentsMovingApartDoNotTransmit() throws ConfigurationException {
        // 10 apart, each moves 5 away from the other
        SimulationEngine engine = movingPair(395, -1, 405, 1);
        Agent source = engine.getAgents().get(0);
        Agent target = engine.getAgents().get(1);
        assertThat(source.distanceTo(target)).isCloseTo(10.0, within(1e-9));

        engine.step(0.1);

        assertThat(source.distanceTo(target)).isCloseTo(20.0, within(1e-9));
        assertThat(target.getState()).isEqualTo(HealthState.HEALTHY);
    }
}
