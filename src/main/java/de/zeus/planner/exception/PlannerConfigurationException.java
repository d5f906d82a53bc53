package de.zeus.planner.exception;

/**
 * Invalid or incomplete planner configuration. Never recovered with defaults.
 */
public class PlannerConfigurationException extends RuntimeException {

    public PlannerConfigurationException(String message) {
        super(message);
    }

    public PlannerConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
