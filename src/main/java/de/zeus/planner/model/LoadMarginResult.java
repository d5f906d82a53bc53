package de.zeus.planner.model;

import java.util.List;

/**
 * Near-horizon load inflation multiplier and how it was derived.
 * A {@code null} factor means "no factor": the caller falls back to the base factor.
 */
public record LoadMarginResult(String mode,
                               Double factor,
                               double baseFactor,
                               List<Integer> requestedDays,
                               List<Integer> consideredDays,
                               double averageDeficit,
                               double temperatureAdjustment,
                               Double meanTemperatureC,
                               double totalUncertaintyKwh,
                               double totalLoadKwh,
                               Double factorUnclamped,
                               String reason) {

    public static LoadMarginResult noFactor(String mode, double baseFactor, List<Integer> requestedDays,
                                            List<Integer> consideredDays, String reason) {
        return new LoadMarginResult(mode, null, baseFactor, requestedDays, consideredDays,
                0.0, 0.0, null, 0.0, 0.0, null, reason);
    }

    public boolean hasFactor() {
        return factor != null;
    }
}
