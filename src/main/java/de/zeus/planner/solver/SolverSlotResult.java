package de.zeus.planner.solver;

import de.zeus.planner.model.SlotAction;

/**
 * Optimizer decision for one slot. Energies are kWh within the slot, {@code socKwh} is the
 * state of charge at its end. {@code action} may be null, it is then derived from the energies.
 */
public record SolverSlotResult(double chargeKwh,
                               double dischargeKwh,
                               double importKwh,
                               double exportKwh,
                               double socKwh,
                               SlotAction action) {
}
