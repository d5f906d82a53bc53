package de.zeus.planner.model;

/**
 * End-of-horizon SoC target handed to the optimizer as a soft constraint.
 */
public record TargetSoc(int riskAppetite,
                        double rawFactor,
                        double baseBufferPercent,
                        double weatherAdjustmentPercent,
                        double targetPercent,
                        double targetKwh,
                        double penaltyPerKwh) {
}
