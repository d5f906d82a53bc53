package de.zeus.planner.exception;

/**
 * A planning run failed. The previously published schedule stays in place.
 */
public class PlanningException extends RuntimeException {

    public PlanningException(String message) {
        super(message);
    }

    public PlanningException(String message, Throwable cause) {
        super(message, cause);
    }
}
