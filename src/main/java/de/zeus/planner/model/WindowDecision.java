package de.zeus.planner.model;

/**
 * Cheap-window threshold of a run, including whether it had to be widened.
 */
public record WindowDecision(double quantilePrice,
                             double baselineThreshold,
                             double finalThreshold,
                             boolean expanded,
                             double deficitKwh,
                             double baselineCapacityKwh,
                             int cheapSlotCount,
                             int nonCheapSlotCount) {

    public static WindowDecision empty() {
        return new WindowDecision(0.0, 0.0, 0.0, false, 0.0, 0.0, 0, 0);
    }
}
