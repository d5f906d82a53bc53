package de.zeus.planner.model;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * Structured debug payload of one run. Serialisable with Jackson.
 * Risk, target and terminal value are {@code null} in baseline mode.
 */
public record PlannerDebug(PlanningMode mode,
                           ZonedDateTime now,
                           RiskFactors risk,
                           TargetSoc targetSoc,
                           TerminalValue terminalValue,
                           WindowDecision windows,
                           WaterSchedule water,
                           ChargingSummary charging,
                           PlanMetrics metrics,
                           List<SlotSample> sampleSchedule) {

    public record ChargingSummary(int chargeSlots,
                                  int dischargeSlots,
                                  int exportSlots,
                                  int holdSlots,
                                  int manualSlots,
                                  double gridChargeKwh,
                                  double batteryChargeKwh,
                                  double batteryDischargeKwh) {
    }

    public record PlanMetrics(int slotCount,
                              int futureSlotCount,
                              double totalImportKwh,
                              double totalExportKwh,
                              double totalPlannedCost,
                              double waterHeatingKwh,
                              Double finalSocPercent) {
    }

    public record SlotSample(ZonedDateTime start,
                             String action,
                             double importPrice,
                             boolean cheap,
                             double waterHeatingKw,
                             Double projectedSocPercent,
                             Double socTargetPercent,
                             String manualAction) {
    }
}
