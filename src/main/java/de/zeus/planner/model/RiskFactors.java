package de.zeus.planner.model;

/**
 * Output of the risk engine for one run.
 */
public record RiskFactors(double baseFactor,
                          double effectiveLoadMargin,
                          LoadMarginResult loadMargin,
                          FutureRiskResult futureRisk) {
}
