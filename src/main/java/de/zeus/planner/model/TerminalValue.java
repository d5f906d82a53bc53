package de.zeus.planner.model;

/**
 * Credit per kWh left in the battery at the end of the horizon.
 */
public record TerminalValue(double averageImportPrice, double riskFactor, double valuePerKwh) {

    public static TerminalValue none() {
        return new TerminalValue(0.0, 0.0, 0.0);
    }
}
