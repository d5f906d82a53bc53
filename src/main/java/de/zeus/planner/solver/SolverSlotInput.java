package de.zeus.planner.solver;

import java.time.Duration;
import java.time.ZonedDateTime;

/**
 * One slot as seen by the optimizer. {@code loadKwh} already contains planned water heating.
 */
public record SolverSlotInput(ZonedDateTime start,
                              ZonedDateTime end,
                              double importPrice,
                              double exportPrice,
                              double pvKwh,
                              double loadKwh) {

    public double durationHours() {
        double hours = Duration.between(start, end).toSeconds() / 3600.0;
        return hours > 0 ? hours : 0.25;
    }
}
