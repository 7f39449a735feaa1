package org.outbreak.runtime.spi;

/**
 * The single source of randomness of a simulation engine.
 * <p>
 * Placement, vaccination, seeding, movement jitter and transmission all draw from one provider in a
 * fixed order, so two engines given providers with the same seed evolve identically. Tests replace it
 * with scripted draws.
 */
public interface IRandomProvider {

    /**
     * @param bound Exclusive upper bound, must be > 0.
     * @return A uniformly distributed int in [0, bound).
     */
    int nextInt(int bound);

    /**
     * @return A uniformly distributed double in [0.0, 1.0).
     */
    double nextDouble();

    /**
     * Scales one {@link #nextDouble()} draw to [origin, bound).
     *
     * @param origin Inclusive lower bound.
     * @param bound Exclusive upper bound.
     * @return The scaled draw.
     */
    default double nextDouble(double origin, double bound) {
        return nextDouble() * (bound - origin) + origin;
    }

    /**
     * Bernoulli trial consuming exactly one {@link #nextDouble()} draw.
     *
     * @param probability The success probability; values <= 0 never and values >= 1 always succeed.
     * @return true if the draw falls below {@code probability}.
     */
    default boolean chance(double probability) {
        return nextDouble() < probability;
    }
}
