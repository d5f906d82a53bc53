package de.zeus.planner.model;

import java.time.LocalDate;

/**
 * Water heating decision for one local day.
 */
public record WaterDayPlan(LocalDate date,
                           double requiredKwh,
                           double consumedKwh,
                           int requiredSlots,
                           int scheduledSlots,
                           int deferredSlots,
                           int blocks,
                           boolean shortfall) {
}
