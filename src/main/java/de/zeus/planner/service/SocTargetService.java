package de.zeus.planner.service;

import de.zeus.planner.config.BatteryProperties;
import de.zeus.planner.config.PlannerProperties;
import de.zeus.planner.config.RiskProperties;
import de.zeus.planner.model.ManualAction;
import de.zeus.planner.model.Slot;
import de.zeus.planner.model.SlotAction;
import de.zeus.planner.model.TargetSoc;
import de.zeus.planner.util.SlotUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

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
 * End-of-horizon target SoC and the per-slot SoC targets the executing controller follows.
 */
@Service
public class SocTargetService {

    private static final Logger logger = LoggerFactory.getLogger(SocTargetService.class);

    /**
     * Target = min SoC + appetite buffer + capped weather adjustment, floored and clamped to max SoC.
     */
    public TargetSoc calculateTarget(double rawFactor, PlannerProperties properties) {
        BatteryProperties battery = properties.getBattery();
        RiskProperties risk = properties.getRisk();
        int appetite = risk.getRiskAppetite();

        double baseBuffer = risk.getBaseBufferPercent().getOrDefault(appetite, 0.0);
        double cap = risk.getWeatherCapPercent();
        double weatherAdjustment = SlotUtils.clamp((rawFactor - 1.0) * risk.getWeatherScale(), -cap, cap);

        double target = battery.getMinSocPercent() + baseBuffer + weatherAdjustment;
        target = Math.max(risk.getAbsoluteFloorPercent(), target);
        target = Math.min(battery.getMaxSocPercent(), target);

        double targetKwh = target / 100.0 * battery.getCapacityKwh();
        double penalty = risk.getTargetPenaltyByAppetite().getOrDefault(appetite, 0.0);
        logger.info("Target SoC {}% ({} kWh), appetite {}, weather adjustment {}%",
                SlotUtils.round2(target), SlotUtils.round2(targetKwh), appetite, SlotUtils.round2(weatherAdjustment));
        return new TargetSoc(appetite, rawFactor, baseBuffer, weatherAdjustment, target, targetKwh, penalty);
    }

    /**
     * Assigns {@code socTargetPercent} to every slot. Slots before {@code futureStart} keep their
     * recorded entry SoC; future slots are derived from the planned action.
     */
    public void applySocTargets(List<Slot> slots, PlannerProperties properties, int futureStart) {
        if (slots.isEmpty()) {
            return;
        }
        BatteryProperties battery = properties.getBattery();
        double minSoc = battery.getMinSocPercent();
        double maxSoc = battery.getMaxSocPercent();
        PlannerProperties.ManualPlanning manual = properties.getManualPlanning();
        double manualChargeTarget = SlotUtils.clamp(
                manual.getChargeTargetPercent() != null ? manual.getChargeTargetPercent() : maxSoc, minSoc, maxSoc);
        double manualExportTarget = SlotUtils.clamp(
                manual.getExportTargetPercent() != null ? manual.getExportTargetPercent() : minSoc, minSoc, maxSoc);

        int start = Math.max(0, Math.min(futureStart, slots.size()));
        double[] targets = new double[slots.size()];
        for (int i = 0; i < slots.size(); i++) {
            targets[i] = minSoc;
        }
        for (int i = 0; i < start; i++) {
            Double entry = slots.get(i).getEntrySocPercent();
            if (entry != null) {
                targets[i] = entry;
            }
        }

        List<Integer> chargeIndices = new ArrayList<>();
        for (int i = start; i < slots.size(); i++) {
            Slot slot = slots.get(i);
            Double entry = slot.getEntrySocPercent();
            if (i == start && entry != null) {
                targets[i] = entry;
            }
            SlotAction action = slot.getAction();
            if (action == SlotAction.HOLD && entry != null) {
                targets[i] = entry;
            } else if (action == SlotAction.EXPORT) {
                targets[i] = slot.getManualAction() == ManualAction.EXPORT ? manualExportTarget : minSoc;
            } else if (action == SlotAction.DISCHARGE) {
                targets[i] = minSoc;
            } else if (action == SlotAction.CHARGE) {
                chargeIndices.add(i);
            }
        }

        for (List<Integer> block : SlotUtils.groupIntoBlocks(chargeIndices, 1)) {
            int first = block.get(0);
            int last = block.get(block.size() - 1);
            Double value = firstNonNull(slots.get(last).getProjectedSocPercent(),
                    slots.get(first).getProjectedSocPercent(), slots.get(first).getEntrySocPercent());
            double target = SlotUtils.clamp(value != null ? value : targets[first], minSoc, maxSoc);
            boolean manualCharge = false;
            for (int i = first; i <= last; i++) {
                manualCharge |= slots.get(i).getManualAction() == ManualAction.CHARGE;
            }
            if (manualCharge) {
                target = Math.min(target, manualChargeTarget);
            }
            for (int i = first; i <= last; i++) {
                targets[i] = target;
            }
        }

        applyExportBlocks(slots, targets, start, minSoc, manualExportTarget);
        applyWaterBlocks(slots, targets, start, minSoc);

        for (int i = start; i < slots.size(); i++) {
            Slot slot = slots.get(i);
            if (slot.getAction() == SlotAction.HOLD && slot.getEntrySocPercent() != null) {
                targets[i] = slot.getEntrySocPercent();
            }
        }
        for (int i = 0; i < slots.size(); i++) {
            slots.get(i).setSocTargetPercent(SlotUtils.round2(targets[i]));
        }
    }

    private void applyExportBlocks(List<Slot> slots, double[] targets, int start, double guard, double manualTarget) {
        int i = start;
        while (i < slots.size()) {
            if (slots.get(i).getAction() != SlotAction.EXPORT) {
                i++;
                continue;
            }
            int first = i;
            while (i + 1 < slots.size() && slots.get(i + 1).getAction() == SlotAction.EXPORT) {
                i++;
            }
            int last = i;
            boolean manual = false;
            for (int j = first; j <= last; j++) {
                manual |= slots.get(j).getManualAction() == ManualAction.EXPORT;
            }
            double target;
            if (manual) {
                target = manualTarget;
            } else {
                Double projected = slots.get(last).getProjectedSocPercent();
                target = projected != null ? Math.max(guard, projected) : guard;
            }
            for (int j = first; j <= last; j++) {
                targets[j] = target;
            }
            i++;
        }
    }

    /**
     * Water heated from the battery pins the block to min SoC so the controller may discharge;
     * grid-supplied heating holds at least the entry SoC so the battery is not drained for it.
     */
    private void applyWaterBlocks(List<Slot> slots, double[] targets, int start, double minSoc) {
        int i = start;
        while (i < slots.size()) {
            if (slots.get(i).getWaterHeatingKw() <= 0) {
                i++;
                continue;
            }
            int first = i;
            while (i + 1 < slots.size() && slots.get(i + 1).getWaterHeatingKw() > 0) {
                i++;
            }
            int last = i;
            boolean fromBattery = false;
            boolean fromGrid = false;
            for (int j = first; j <= last; j++) {
                fromBattery |= slots.get(j).getWaterFromBatteryKwh() > SlotAction.ACTIVITY_EPSILON;
                fromGrid |= slots.get(j).getWaterFromGridKwh() > SlotAction.ACTIVITY_EPSILON;
            }
            Double entry = slots.get(first).getEntrySocPercent();
            for (int j = first; j <= last; j++) {
                SlotAction action = slots.get(j).getAction();
                if (action == SlotAction.CHARGE || action == SlotAction.EXPORT) {
                    continue;
                }
                if (fromBattery) {
                    targets[j] = minSoc;
                } else if (fromGrid && entry != null) {
                    targets[j] = Math.max(targets[j], entry);
                }
            }
            i++;
        }
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
