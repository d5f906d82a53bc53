package de.zeus.planner.model;

public enum PlanningMode {
    /** Risk engine, safety margins and target SoC. */
    FULL,
    /** Raw forecasts and a neutral risk factor, for A/B comparison. */
    BASELINE
}
