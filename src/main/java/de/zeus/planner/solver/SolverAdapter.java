package de.zeus.planner.solver;

import de.zeus.planner.config.BatteryProperties;
import de.zeus.planner.config.PlannerProperties;
import de.zeus.planner.exception.SolverException;
import de.zeus.planner.model.Slot;
import de.zeus.planner.model.SlotAction;
import de.zeus.planner.model.TargetSoc;
import de.zeus.planner.model.TerminalValue;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Copyright 2024 Guido Zeuner - https://tiny-tool.de
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

/**
 * Translates between the slot series and the optimizer contract.
 */
@Component
public class SolverAdapter {

    public SolverSettings buildSettings(PlannerProperties properties, TerminalValue terminalValue, TargetSoc targetSoc) {
        BatteryProperties battery = properties.getBattery();
        boolean hasBattery = properties.getSystem().isHasBattery();
        PlannerProperties.Solver solver = properties.getSolver();
        return new SolverSettings(
                battery.getCapacityKwh(),
                battery.getMinSocPercent(),
                battery.getMaxSocPercent(),
                hasBattery ? battery.getMaxChargePowerKw() : 0.0,
                hasBattery ? battery.getMaxDischargePowerKw() : 0.0,
                battery.getChargeEfficiency(),
                battery.getDischargeEfficiency(),
                properties.getBatteryEconomics().getCycleCostPerKwh(),
                solver.getRampingCostPerKw(),
                solver.getExportThresholdPerKwh(),
                solver.isEnableExport(),
                battery.getGridImportLimitKw(),
                terminalValue != null ? terminalValue.valuePerKwh() : 0.0,
                targetSoc != null ? targetSoc.targetKwh() : 0.0,
                targetSoc != null ? targetSoc.penaltyPerKwh() : 0.0);
    }

    public SolverInput toSolverInput(List<Slot> slots, double initialSocKwh, SolverSettings settings) {
        List<SolverSlotInput> inputs = new ArrayList<>(slots.size());
        for (Slot slot : slots) {
            double load = slot.getAdjustedLoadKwh() + slot.getWaterHeatingKw() * slot.durationHours();
            inputs.add(new SolverSlotInput(slot.getStart(), slot.getEnd(),
                    slot.getImportPrice(), slot.getExportPrice(),
                    slot.getAdjustedPvKwh(), load));
        }
        return new SolverInput(inputs, initialSocKwh, settings);
    }

    /**
     * Writes the optimizer output onto the slots it was computed for. Entry SoC of each slot
     * is the projected SoC of the previous one, starting from the real initial SoC.
     *
     * @throws SolverException when the result does not line up with the input
     */
    public void applyResult(List<Slot> slots, SolverResult result, double capacityKwh, double initialSocKwh) {
        if (result == null || result.slots() == null) {
            throw new SolverException("Solver returned no result");
        }
        if (result.slots().size() != slots.size()) {
            throw new SolverException(String.format("Solver returned %d slots for %d inputs",
                    result.slots().size(), slots.size()));
        }

        double previousSocKwh = initialSocKwh;
        for (int i = 0; i < slots.size(); i++) {
            Slot slot = slots.get(i);
            SolverSlotResult out = result.slots().get(i);
            double hours = slot.durationHours();

            double chargeKw = out.chargeKwh() / hours;
            double dischargeKw = out.dischargeKwh() / hours;
            slot.setBatteryChargeKw(chargeKw);
            slot.setBatteryDischargeKw(dischargeKw);
            slot.setChargeKw(Math.min(out.chargeKwh(), out.importKwh()) / hours);
            slot.setImportKwh(out.importKwh());
            slot.setExportKwh(out.exportKwh());
            slot.setPlannedCost(out.importKwh() * slot.getImportPrice() - out.exportKwh() * slot.getExportPrice());

            slot.setEntrySocPercent(toPercent(previousSocKwh, capacityKwh));
            slot.setProjectedSocKwh(out.socKwh());
            slot.setProjectedSocPercent(toPercent(out.socKwh(), capacityKwh));
            previousSocKwh = out.socKwh();

            slot.setAction(out.action() != null
                    ? out.action()
                    : SlotAction.classify(chargeKw, dischargeKw, out.exportKwh()));

            splitWaterSources(slot, out.dischargeKwh());
        }
    }

    /**
     * Water heating draws PV surplus first, then whatever battery discharge is left after the
     * house load, the rest comes from the grid.
     */
    private void splitWaterSources(Slot slot, double dischargeKwh) {
        double waterKwh = slot.getWaterHeatingKw() * slot.durationHours();
        if (waterKwh <= 0) {
            slot.setWaterFromPvKwh(0.0);
            slot.setWaterFromBatteryKwh(0.0);
            slot.setWaterFromGridKwh(0.0);
            return;
        }
        double net = slot.getAdjustedLoadKwh() - slot.getAdjustedPvKwh();
        double fromPv = Math.min(waterKwh, Math.max(0.0, -net));
        double remaining = waterKwh - fromPv;
        double batteryLeft = Math.max(0.0, dischargeKwh - Math.max(0.0, net));
        double fromBattery = Math.min(remaining, batteryLeft);
        slot.setWaterFromPvKwh(fromPv);
        slot.setWaterFromBatteryKwh(fromBattery);
        slot.setWaterFromGridKwh(remaining - fromBattery);
    }

    private static double toPercent(double kwh, double capacityKwh) {
        return capacityKwh > 0 ? kwh / capacityKwh * 100.0 : 0.0;
    }
}
