package de.zeus.planner.solver;

import de.zeus.planner.model.SlotAction;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HeuristicDispatchSolverTest {

    private static final ZonedDateTime START = ZonedDateTime.of(2025, 1, 15, 0, 0, 0, 0, ZoneId.of("Europe/Stockholm"));

    private final HeuristicDispatchSolver solver = new HeuristicDispatchSolver();

    @Test
    void solve_chargesInCheapSlotAndCoversLoadLater() {
        SolverInput input = new SolverInput(slots(new double[]{0.1, 2.0, 2.0, 2.0}, 0.0), 5.0, settings(false));

        SolverResult result = solver.solve(input);

        assertEquals(4, result.slots().size());
        SolverSlotResult cheap = result.slots().get(0);
        assertEquals(SlotAction.CHARGE, cheap.action());
        assertEquals(1.0, cheap.chargeKwh(), 1e-9);
        assertEquals(1.5, cheap.importKwh(), 1e-9);
        SolverSlotResult expensive = result.slots().get(1);
        assertEquals(SlotAction.DISCHARGE, expensive.action());
        assertEquals(0.0, expensive.importKwh(), 1e-9);
        assertEquals(5.5, expensive.socKwh(), 1e-9);
    }

    @Test
    void solve_neverDrainsBelowMinimum() {
        SolverInput input = new SolverInput(slots(new double[]{0.1, 3.0, 3.0, 3.0, 3.0, 3.0, 3.0, 3.0}, 0.0), 1.5,
                settings(false));

        for (SolverSlotResult slot : solver.solve(input).slots()) {
            assertTrue(slot.socKwh() >= 1.0 - 1e-9, "SoC below minimum: " + slot.socKwh());
        }
    }

    @Test
    void solve_pvSurplusChargesThenExports() {
        SolverInput input = new SolverInput(slots(new double[]{1.0, 1.0}, 2.0), 5.0, settings(true));

        SolverSlotResult first = solver.solve(input).slots().get(0);

        assertEquals(1.0, first.chargeKwh(), 1e-9);
        assertEquals(0.5, first.exportKwh(), 1e-9);
    }

    @Test
    void solve_isDeterministic() {
        SolverInput input = new SolverInput(slots(new double[]{0.4, 1.2, 0.3, 2.2, 1.0}, 0.1), 3.0, settings(true));

        assertEquals(solver.solve(input), solver.solve(input));
    }

    @Test
    void solve_emptyInput() {
        assertEquals("empty", solver.solve(new SolverInput(List.of(), 0.0, settings(false))).status());
    }

    private static List<SolverSlotInput> slots(double[] prices, double pvKwh) {
        List<SolverSlotInput> slots = new ArrayList<>();
        for (int i = 0; i < prices.length; i++) {
            ZonedDateTime start = START.plusMinutes(15L * i);
            slots.add(new SolverSlotInput(start, start.plusMinutes(15), prices[i], prices[i], pvKwh, 0.5));
        }
        return slots;
    }

    private static SolverSettings settings(boolean export) {
        return new SolverSettings(10.0, 10.0, 100.0, 4.0, 4.0, 1.0, 1.0,
                0.0, 0.0, 0.0, export, null, 0.0, 0.0, 0.0);
    }
}
