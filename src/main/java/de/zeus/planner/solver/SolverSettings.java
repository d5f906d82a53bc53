package de.zeus.planner.solver;

/**
 * Battery limits and weighted objective terms of one optimizer call.
 *
 * @param gridImportLimitKw   null for an unlimited grid connection
 * @param terminalValuePerKwh credit for every kWh stored at the end of the horizon
 * @param targetSocKwh        soft end-of-horizon target, 0 when none
 * @param targetPenaltyPerKwh penalty per kWh below {@code targetSocKwh}
 */
public record SolverSettings(double capacityKwh,
                             double minSocPercent,
                             double maxSocPercent,
                             double maxChargePowerKw,
                             double maxDischargePowerKw,
                             double chargeEfficiency,
                             double dischargeEfficiency,
                             double cycleCostPerKwh,
                             double rampingCostPerKw,
                             double exportThresholdPerKwh,
                             boolean enableExport,
                             Double gridImportLimitKw,
                             double terminalValuePerKwh,
                             double targetSocKwh,
                             double targetPenaltyPerKwh) {

    public double minSocKwh() {
        return capacityKwh * minSocPercent / 100.0;
    }

    public double maxSocKwh() {
        return capacityKwh * maxSocPercent / 100.0;
    }
}
