package de.zeus.planner.model;

import java.util.List;

/**
 * Run of cheap slots, possibly bridging small gaps, whose price span stays within tolerance.
 */
public record WaterSegment(List<Slot> slots, double averagePrice) {

    public Slot first() {
        return slots.get(0);
    }
}
