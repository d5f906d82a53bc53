package de.zeus.planner.solver;

import java.util.List;

public record SolverResult(List<SolverSlotResult> slots, String status) {
}
