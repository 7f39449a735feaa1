package org.outbreak.runtime.timeseries;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.outbreak.runtime.api.PopulationCounts;

/**
 * One row of the population timeseries.
 *
 * @param t Simulated time of the sample in seconds.
 * @param healthy Healthy agents.
 * @param infected Symptomatic infectious agents.
 * @param asymptomatic Asymptomatic infectious agents.
 * @param recovered Recovered agents.
 * @param vaccinated Vaccinated agents.
 */
@JsonPropertyOrder({"t", "healthy", "infected", "asymptomatic", "recovered", "vaccinated"})
public record TimeseriesSample(double t, int healthy, int infected, int asymptomatic, int recovered, int vaccinated) {

    /**
     * Creates a sample from a population snapshot.
     * @param t Simulated time of the sample.
     * @param counts The population counts.
     * @return The sample.
     */
    public static TimeseriesSample of(double t, PopulationCounts counts) {
        return new TimeseriesSample(t, counts.healthy(), counts.infected(), counts.asymptomatic(),
                counts.recovered(), counts.vaccinated());
    }

    /**
     * @return The population counts of this sample.
     */
    public PopulationCounts counts() {
        return new PopulationCounts(healthy, infected, asymptomatic, recovered, vaccinated);
    }
}
