package de.zeus.planner.event;

/**
 * Published when a run fails. Sinks have not been called for the failed run.
 */
public class PlanningFailedEvent {
    private final Object source;
    private final Throwable cause;

    public PlanningFailedEvent(Object source, Throwable cause) {
        this.source = source;
        this.cause = cause;
    }

    public Object getSource() {
        return source;
    }

    public Throwable getCause() {
        return cause;
    }
}
