package de.zeus.planner.model;

/**
 * End-of-horizon risk factor. {@code rawFactor} and {@code rawFactorWithWeather} do not depend
 * on the risk appetite, {@code riskFactor} does.
 */
public record FutureRiskResult(double baseFactor,
                               int riskAppetite,
                               Double d1DeficitRatio,
                               Double d2DeficitRatio,
                               double weightedDeficit,
                               double pvContribution,
                               Double d2TemperatureC,
                               double temperatureAdjustment,
                               double temperatureContribution,
                               double rawFactor,
                               double weatherAmplification,
                               double rawFactorWithWeather,
                               double bufferMultiplier,
                               double riskFactor) {
}
