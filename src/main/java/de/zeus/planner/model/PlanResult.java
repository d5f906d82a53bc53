package de.zeus.planner.model;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * Complete output of a successful run: the final slot series and its debug payload.
 */
public record PlanResult(ZonedDateTime now, List<Slot> slots, PlannerDebug debug) {
}
