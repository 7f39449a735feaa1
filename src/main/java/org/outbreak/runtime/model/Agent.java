package org.outbreak.runtime.model;

import org.outbreak.runtime.Config;
import org.outbreak.runtime.spi.IRandomProvider;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Represents a single simulated individual.
 * <p>
 * An Agent carries a position, a unit direction vector and a disease state. Its state machine only
 * moves forward: a healthy agent may become infected, asymptomatic or (at initialization) vaccinated,
 * an infectious agent recovers once its elapsed infection time reaches the captured threshold, and
 * {@link HealthState#RECOVERED} and {@link HealthState#VACCINATED} are never left again.
 */
public class Agent {

    private final int id;
    private double x;
    private double y;
    private double vx;
    private double vy;
    private HealthState state = HealthState.HEALTHY;
    private double infectedElapsed = 0.0;
    private double recoveryThreshold;
    private double incubationThreshold = 0.0;
    private boolean superSpreader = false;
    private final Deque<Point> trail = new ArrayDeque<>(Config.TRAIL_LENGTH);

    /**
     * Creates a healthy agent.
     * @param id The stable identity of the agent.
     * @param x The initial horizontal position.
     * @param y The initial vertical position.
     * @param vx The initial horizontal direction component.
     * @param vy The initial vertical direction component.
     * @param recoveryThreshold The recovery time in effect when the agent was created.
     */
    public Agent(int id, double x, double y, double vx, double vy, double recoveryThreshold) {
        this.id = id;
        this.x = x;
        this.y = y;
        this.vx = vx;
        this.vy = vy;
        this.recoveryThreshold = recoveryThreshold;
        normalizeVelocity();
    }

    /**
     * Integrates the position over {@code dt}, reflects the agent at the field borders and perturbs
     * its direction with a small random walk before re-normalizing it to unit length.
     *
     * @param dt Simulated seconds elapsed in this step.
     * @param speed The speed multiplier in effect.
     * @param bounds The field the agent is confined to.
     * @param random The source of the direction perturbation.
     */
    public void move(double dt, double speed, FieldBounds bounds, IRandomProvider random) {
        double distance = dt * Config.SPEED_CONSTANT * speed;
        x += vx * distance;
        y += vy * distance;

        if (x < 0) { x = 0; vx = -vx; }
        if (y < 0) { y = 0; vy = -vy; }
        if (x > bounds.width()) { x = bounds.width(); vx = -vx; }
        if (y > bounds.height()) { y = bounds.height(); vy = -vy; }

        vx += random.nextDouble(-Config.VELOCITY_JITTER, Config.VELOCITY_JITTER);
        vy += random.nextDouble(-Config.VELOCITY_JITTER, Config.VELOCITY_JITTER);
        normalizeVelocity();

        if (trail.size() == Config.TRAIL_LENGTH) {
            trail.removeFirst();
        }
        trail.addLast(new Point(x, y));
    }

    private void normalizeVelocity() {
        double magnitude = Math.hypot(vx, vy);
        if (magnitude == 0) {
            return;
        }
        vx /= magnitude;
        vy /= magnitude;
    }

    /**
     * Infects this agent if, and only if, it is currently healthy. Captures the recovery and incubation
     * times of the given parameters and resets the elapsed infection time.
     *
     * @param params The parameters in effect at the time of infection.
     * @param asymptomatic Whether the infection is asymptomatic.
     * @return true if the agent changed state.
     */
    public boolean infect(SimulationParameters params, boolean asymptomatic) {
        if (state != HealthState.HEALTHY) {
            return false;
        }
        state = asymptomatic ? HealthState.ASYMPTOMATIC : HealthState.INFECTED;
        infectedElapsed = 0.0;
        recoveryThreshold = params.getRecoveryTime();
        incubationThreshold = params.getIncubationTime();
        return true;
    }

    /**
     * Marks a healthy agent as vaccinated. Only the engine's initialization calls this.
     * @return true if the agent changed state.
     */
    public boolean vaccinate() {
        if (state != HealthState.HEALTHY) {
            return false;
        }
        state = HealthState.VACCINATED;
        return true;
    }

    /**
     * Advances the infection clock of an infectious agent and recovers it once the captured
     * threshold is reached. Has no effect in any other state.
     *
     * @param dt Simulated seconds elapsed in this step.
     * @return true if the agent recovered during this call.
     */
    public boolean progress(double dt) {
        if (!state.isInfectious()) {
            return false;
        }
        infectedElapsed += dt;
        if (infectedElapsed >= recoveryThreshold) {
            state = HealthState.RECOVERED;
            return true;
        }
        return false;
    }

    /**
     * Euclidean distance between the current positions of two agents.
     * @param other The other agent.
     * @return The distance.
     */
    public double distanceTo(Agent other) {
        return Math.hypot(x - other.x, y - other.y);
    }

    public int getId() { return id; }
    public double getX() { return x; }
    public double getY() { return y; }
    public Point getPosition() { return new Point(x, y); }
    public double getVx() { return vx; }
    public double getVy() { return vy; }
    public HealthState getState() { return state; }
    public double getInfectedElapsed() { return infectedElapsed; }
    public double getRecoveryThreshold() { return recoveryThreshold; }
    public double getIncubationThreshold() { return incubationThreshold; }
    public boolean isSuperSpreader() { return superSpreader; }

    public void setSuperSpreader(boolean superSpreader) {
        this.superSpreader = superSpreader;
    }

    /**
     * @return The most recent positions, oldest first, at most {@link Config#TRAIL_LENGTH} entries.
     */
    public List<Point> getTrail() {
        return List.copyOf(trail);
    }

    @Override
    public String toString() {
        return String.format("Agent{id=%d, pos=(%.1f, %.1f), state=%s, infectedElapsed=%.2f}",
                id, x, y, state, infectedElapsed);
    }
}
