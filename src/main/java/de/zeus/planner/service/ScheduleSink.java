package de.zeus.planner.service;

import de.zeus.planner.model.PlanResult;

/**
 * Receives the final plan of a successful run. Never called for a failed run.
 */
public interface ScheduleSink {

    void publish(PlanResult plan);
}
