package de.zeus.planner.solver;

import de.zeus.planner.model.SlotAction;
import de.zeus.planner.util.SlotUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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
 * Greedy single-pass dispatch used when no optimizer bean is provided by the host.
 * <p>
 * Rules per slot, in this order: PV surplus charges the battery and the rest is exported;
 * in the cheapest quarter of the horizon the battery is charged from the grid; otherwise
 * the battery covers the net load down to min SoC and exports energy above the target SoC
 * when the export price beats the terminal value plus wear cost.
 * The result is a pure function of the input.
 */
@Component
public class HeuristicDispatchSolver implements ScheduleSolver {

    private static final Logger logger = LoggerFactory.getLogger(HeuristicDispatchSolver.class);

    private static final double CHEAP_PERCENTILE = 25.0;

    @Override
    public SolverResult solve(SolverInput input) {
        SolverSettings settings = input.settings();
        List<SolverSlotInput> slots = input.slots();
        List<SolverSlotResult> results = new ArrayList<>(slots.size());
        if (slots.isEmpty()) {
            return new SolverResult(results, "empty");
        }

        List<Double> prices = new ArrayList<>();
        slots.forEach(s -> prices.add(s.importPrice()));
        double cheapThreshold = SlotUtils.percentile(prices, CHEAP_PERCENTILE);

        double minKwh = settings.minSocKwh();
        double maxKwh = settings.maxSocKwh();
        double exportFloorKwh = Math.max(minKwh, Math.min(maxKwh, settings.targetSocKwh()));
        double soc = SlotUtils.clamp(input.initialSocKwh(), 0.0, settings.capacityKwh());

        for (SolverSlotInput slot : slots) {
            double hours = slot.durationHours();
            double chargeCap = settings.maxChargePowerKw() * hours;
            double dischargeCap = settings.maxDischargePowerKw() * hours;
            double net = slot.loadKwh() - slot.pvKwh();

            double charge = 0.0;
            double discharge = 0.0;
            double imported = 0.0;
            double exported = 0.0;

            if (net < 0) {
                double surplus = -net;
                charge = Math.min(surplus, Math.min(chargeCap, headroom(soc, maxKwh, settings)));
                soc += charge * settings.chargeEfficiency();
                if (settings.enableExport() && slot.exportPrice() >= settings.exportThresholdPerKwh()) {
                    exported = surplus - charge;
                }
            } else if (slot.importPrice() <= cheapThreshold && soc < maxKwh) {
                double gridRoom = settings.gridImportLimitKw() == null
                        ? Double.MAX_VALUE
                        : Math.max(0.0, settings.gridImportLimitKw() * hours - net);
                charge = Math.min(chargeCap, Math.min(headroom(soc, maxKwh, settings), gridRoom));
                soc += charge * settings.chargeEfficiency();
                imported = net + charge;
            } else {
                discharge = Math.min(net, Math.min(dischargeCap, deliverable(soc, minKwh, settings)));
                soc -= discharge / settings.dischargeEfficiency();
                imported = net - discharge;

                double exportValue = slot.exportPrice() - settings.cycleCostPerKwh();
                if (settings.enableExport()
                        && exportValue >= settings.exportThresholdPerKwh()
                        && exportValue > settings.terminalValuePerKwh()) {
                    double extra = Math.min(dischargeCap - discharge, deliverable(soc, exportFloorKwh, settings));
                    if (extra > 0) {
                        discharge += extra;
                        exported += extra;
                        soc -= extra / settings.dischargeEfficiency();
                    }
                }
            }

            SlotAction action = SlotAction.classify(charge / hours, discharge / hours, exported);
            results.add(new SolverSlotResult(charge, discharge, imported, exported, soc, action));
        }

        logger.debug("Heuristic dispatch planned {} slots, cheap threshold {}", slots.size(), SlotUtils.round4(cheapThreshold));
        return new SolverResult(results, "heuristic");
    }

    private static double headroom(double soc, double maxKwh, SolverSettings settings) {
        return Math.max(0.0, (maxKwh - soc) / settings.chargeEfficiency());
    }

    private static double deliverable(double soc, double floorKwh, SolverSettings settings) {
        return Math.max(0.0, (soc - floorKwh) * settings.dischargeEfficiency());
    }
}
