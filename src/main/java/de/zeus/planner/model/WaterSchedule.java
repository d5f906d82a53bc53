package de.zeus.planner.model;

import java.util.List;

/**
 * Summary of the water heating stage. The slots themselves carry {@code waterHeatingKw}.
 */
public record WaterSchedule(boolean enabled,
                            boolean vacationMode,
                            boolean antiLegionellaScheduled,
                            double scheduledKwh,
                            List<WaterDayPlan> days) {

    public static WaterSchedule disabled() {
        return new WaterSchedule(false, false, false, 0.0, List.of());
    }
}
