package de.zeus.planner.model;

import java.time.ZonedDateTime;

/**
 * Live state reported by the hosting system at the start of a run.
 */
public class InitialState {

    /** Preferred over {@link #batterySocPercent} when both are present. */
    private Double batteryKwh;

    private Double batterySocPercent;

    /** Energy the water heater already used today (kWh). */
    private double waterHeatedTodayKwh;

    private boolean vacationMode;

    private ZonedDateTime lastAntiLegionellaAt;

    public InitialState() {
    }

    public InitialState(Double batteryKwh, Double batterySocPercent) {
        this.batteryKwh = batteryKwh;
        this.batterySocPercent = batterySocPercent;
    }

    public Double getBatteryKwh() {
        return batteryKwh;
    }

    public void setBatteryKwh(Double batteryKwh) {
        this.batteryKwh = batteryKwh;
    }

    public Double getBatterySocPercent() {
        return batterySocPercent;
    }

    public void setBatterySocPercent(Double batterySocPercent) {
        this.batterySocPercent = batterySocPercent;
    }

    public double getWaterHeatedTodayKwh() {
        return waterHeatedTodayKwh;
    }

    public void setWaterHeatedTodayKwh(double waterHeatedTodayKwh) {
        this.waterHeatedTodayKwh = waterHeatedTodayKwh;
    }

    public boolean isVacationMode() {
        return vacationMode;
    }

    public void setVacationMode(boolean vacationMode) {
        this.vacationMode = vacationMode;
    }

    public ZonedDateTime getLastAntiLegionellaAt() {
        return lastAntiLegionellaAt;
    }

    public void setLastAntiLegionellaAt(ZonedDateTime lastAntiLegionellaAt) {
        this.lastAntiLegionellaAt = lastAntiLegionellaAt;
    }
}
