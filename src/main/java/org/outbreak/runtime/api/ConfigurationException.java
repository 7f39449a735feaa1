package org.outbreak.runtime.api;

import java.util.List;

/**
 * Thrown when simulation parameters violate a constraint.
 * <p>
 * Raised by {@code SimulationEngine.init} and {@code SimulationEngine.updateParameters}
 * before any engine state is touched, so a failed call leaves the engine as it was.
 */
public class ConfigurationException extends Exception {

    private final List<String> violations;

    /**
     * Constructs a new configuration exception listing every violated constraint.
     * @param violations Human-readable descriptions of the violated constraints.
     */
    public ConfigurationException(List<String> violations) {
        super("Invalid simulation parameters: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    /**
     * Constructs a new configuration exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of(message);
    }

    /**
     * @return The violated constraints, in the order they were checked.
     */
    public List<String> getViolations() {
        return violations;
    }
}
