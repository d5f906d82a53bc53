package de.zeus.planner.service;

import de.zeus.planner.config.PlannerProperties;
import de.zeus.planner.model.PlannerDebug;
import de.zeus.planner.model.PlanningMode;
import de.zeus.planner.model.RiskFactors;
import de.zeus.planner.model.Slot;
import de.zeus.planner.model.SlotAction;
import de.zeus.planner.model.TargetSoc;
import de.zeus.planner.model.TerminalValue;
import de.zeus.planner.model.WaterSchedule;
import de.zeus.planner.model.WindowDecision;
import de.zeus.planner.util.SlotUtils;
import org.springframework.stereotype.Component;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Summarises a finished run for the debug payload.
 */
@Component
public class DebugPayloadBuilder {

    public PlannerDebug build(PlanningMode mode, ZonedDateTime now, List<Slot> slots, PlannerProperties properties,
                              RiskFactors risk, TargetSoc targetSoc, TerminalValue terminalValue,
                              WindowDecision windows, WaterSchedule water) {
        List<Slot> future = new ArrayList<>();
        for (Slot slot : slots) {
            if (!slot.getStart().isBefore(now)) {
                future.add(slot);
            }
        }
        return new PlannerDebug(mode, now, risk, targetSoc, terminalValue, windows, water,
                chargingSummary(future), metrics(slots, future),
                sample(future, properties.getDebug().getSampleSize()));
    }

    private PlannerDebug.ChargingSummary chargingSummary(List<Slot> future) {
        int charge = 0;
        int discharge = 0;
        int export = 0;
        int hold = 0;
        int manual = 0;
        double gridCharge = 0.0;
        double batteryCharge = 0.0;
        double batteryDischarge = 0.0;
        for (Slot slot : future) {
            SlotAction action = slot.getAction() != null ? slot.getAction() : SlotAction.HOLD;
            switch (action) {
                case CHARGE:
                    charge++;
                    break;
                case DISCHARGE:
                    discharge++;
                    break;
                case EXPORT:
                    export++;
                    break;
                default:
                    hold++;
                    break;
            }
            if (slot.getManualAction() != null) {
                manual++;
            }
            double hours = slot.durationHours();
            gridCharge += slot.getChargeKw() * hours;
            batteryCharge += slot.getBatteryChargeKw() * hours;
            batteryDischarge += slot.getBatteryDischargeKw() * hours;
        }
        return new PlannerDebug.ChargingSummary(charge, discharge, export, hold, manual,
                SlotUtils.round2(gridCharge), SlotUtils.round2(batteryCharge), SlotUtils.round2(batteryDischarge));
    }

    private PlannerDebug.PlanMetrics metrics(List<Slot> slots, List<Slot> future) {
        double imported = 0.0;
        double exported = 0.0;
        double cost = 0.0;
        double water = 0.0;
        for (Slot slot : future) {
            imported += slot.getImportKwh();
            exported += slot.getExportKwh();
            cost += slot.getPlannedCost();
            water += slot.getWaterHeatingKw() * slot.durationHours();
        }
        Double finalSoc = slots.isEmpty() ? null : slots.get(slots.size() - 1).getProjectedSocPercent();
        return new PlannerDebug.PlanMetrics(slots.size(), future.size(), SlotUtils.round2(imported),
                SlotUtils.round2(exported), SlotUtils.round2(cost), SlotUtils.round2(water), finalSoc);
    }

    private List<PlannerDebug.SlotSample> sample(List<Slot> future, int size) {
        List<PlannerDebug.SlotSample> samples = new ArrayList<>();
        for (Slot slot : future.subList(0, Math.min(Math.max(0, size), future.size()))) {
            samples.add(new PlannerDebug.SlotSample(slot.getStart(),
                    slot.getAction() != null ? slot.getAction().getLabel() : null,
                    slot.getImportPrice(), slot.isCheap(), slot.getWaterHeatingKw(),
                    slot.getProjectedSocPercent(), slot.getSocTargetPercent(),
                    slot.getManualAction() != null ? slot.getManualAction().getLabel() : null));
        }
        return samples;
    }
}
