package de.zeus.planner.solver;

import java.util.List;

public record SolverInput(List<SolverSlotInput> slots, double initialSocKwh, SolverSettings settings) {
}
