package de.zeus.planner.config;

/**
 * Water heater scheduling tunables ({@code planner.water-heating.*}).
 */
public class WaterHeatingProperties {

    /**
     * Heater element power (kW).
     */
    private double powerKw = 3.0;

    private double minHoursPerDay = 2.0;

    /**
     * Daily energy requirement (kWh). Null falls back to power * minHoursPerDay.
     */
    private Double minKwhPerDay;

    private int maxBlocksPerDay = 2;

    /**
     * How far into tomorrow an unmet requirement of today may be carried (hours). 0 disables deferral.
     */
    private double deferUpToHours = 0.0;

    /**
     * 0 = today only, 1 = today and tomorrow.
     */
    private int planDaysAhead = 1;

    /**
     * Max price span (per kWh) inside one consolidated segment.
     */
    private double blockConsolidationTolerance = 0.0;

    /**
     * Gap slots a segment may bridge.
     */
    private int consolidationMaxGapSlots = 0;

    private VacationMode vacationMode = new VacationMode();

    public double getPowerKw() {
        return powerKw;
    }

    public void setPowerKw(double powerKw) {
        this.powerKw = powerKw;
    }

    public double getMinHoursPerDay() {
        return minHoursPerDay;
    }

    public void setMinHoursPerDay(double minHoursPerDay) {
        this.minHoursPerDay = minHoursPerDay;
    }

    public Double getMinKwhPerDay() {
        return minKwhPerDay;
    }

    public void setMinKwhPerDay(Double minKwhPerDay) {
        this.minKwhPerDay = minKwhPerDay;
    }

    public int getMaxBlocksPerDay() {
        return maxBlocksPerDay;
    }

    public void setMaxBlocksPerDay(int maxBlocksPerDay) {
        this.maxBlocksPerDay = maxBlocksPerDay;
    }

    public double getDeferUpToHours() {
        return deferUpToHours;
    }

    public void setDeferUpToHours(double deferUpToHours) {
        this.deferUpToHours = deferUpToHours;
    }

    public int getPlanDaysAhead() {
        return planDaysAhead;
    }

    public void setPlanDaysAhead(int planDaysAhead) {
        this.planDaysAhead = planDaysAhead;
    }

    public double getBlockConsolidationTolerance() {
        return blockConsolidationTolerance;
    }

    public void setBlockConsolidationTolerance(double blockConsolidationTolerance) {
        this.blockConsolidationTolerance = blockConsolidationTolerance;
    }

    public int getConsolidationMaxGapSlots() {
        return consolidationMaxGapSlots;
    }

    public void setConsolidationMaxGapSlots(int consolidationMaxGapSlots) {
        this.consolidationMaxGapSlots = consolidationMaxGapSlots;
    }

    public VacationMode getVacationMode() {
        return vacationMode;
    }

    public void setVacationMode(VacationMode vacationMode) {
        this.vacationMode = vacationMode;
    }

    /**
     * While away, comfort heating is off and only periodic anti-legionella cycles run.
     */
    public static class VacationMode {

        private boolean enabled = false;

        private int antiLegionellaIntervalDays = 7;

        private double antiLegionellaDurationHours = 3.0;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getAntiLegionellaIntervalDays() {
            return antiLegionellaIntervalDays;
        }

        public void setAntiLegionellaIntervalDays(int antiLegionellaIntervalDays) {
            this.antiLegionellaIntervalDays = antiLegionellaIntervalDays;
        }

        public double getAntiLegionellaDurationHours() {
            return antiLegionellaDurationHours;
        }

        public void setAntiLegionellaDurationHours(double antiLegionellaDurationHours) {
            this.antiLegionellaDurationHours = antiLegionellaDurationHours;
        }
    }
}
