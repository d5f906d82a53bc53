package de.zeus.planner.exception;

/**
 * The dispatch optimizer failed, timed out or returned an unusable result.
 */
public class SolverException extends PlanningException {

    public SolverException(String message) {
        super(message);
    }

    public SolverException(String message, Throwable cause) {
        super(message, cause);
    }
}
