package de.zeus.planner.model;

import java.time.Duration;
import java.time.ZonedDateTime;

/**
 * One 15-minute planning unit. Every stage of a run writes into the same instances;
 * the list they live in is never reordered or shortened.
 */
public class Slot {
    private ZonedDateTime start;
    private ZonedDateTime end;

    private double importPrice;
    private double exportPrice;

    /** Raw forecasts as delivered. */
    private double pvForecastKwh;

    private double loadForecastKwh;

    /** Forecasts after safety margins and learning overlay. */
    private double adjustedPvKwh;

    private double adjustedLoadKwh;

    /** Optional forecast bands, null when not supplied. */
    private Double pvP10;

    private Double pvP90;
    private Double loadP10;
    private Double loadP90;

    /** Slot starts before the frozen "now" of the run. */
    private boolean historical;

    private boolean cheap;

    private double waterHeatingKw;

    private ManualAction manualAction;

    /** Grid-sourced charge power. */
    private double chargeKw;

    private double batteryChargeKw;
    private double batteryDischargeKw;

    private double importKwh;
    private double exportKwh;

    /** SoC at the end of the slot. */
    private Double projectedSocKwh;

    private Double projectedSocPercent;

    /** SoC at the start of the slot. */
    private Double entrySocPercent;

    private SlotAction action;

    private double plannedCost;

    private double waterFromPvKwh;
    private double waterFromBatteryKwh;
    private double waterFromGridKwh;

    /** Hardware setpoint derived after optimization. */
    private Double socTargetPercent;

    public Slot() {
    }

    public Slot(ZonedDateTime start, ZonedDateTime end, double importPrice, double exportPrice) {
        this.start = start;
        this.end = end;
        this.importPrice = importPrice;
        this.exportPrice = exportPrice;
    }

    /**
     * Slot length in hours, 0.25 when the end is missing or not after the start.
     */
    public double durationHours() {
        if (start == null || end == null || !end.isAfter(start)) {
            return 0.25;
        }
        return Duration.between(start, end).toSeconds() / 3600.0;
    }

    public ZonedDateTime getStart() {
        return start;
    }

    public void setStart(ZonedDateTime start) {
        this.start = start;
    }

    public ZonedDateTime getEnd() {
        return end;
    }

    public void setEnd(ZonedDateTime end) {
        this.end = end;
    }

    public double getImportPrice() {
        return importPrice;
    }

    public void setImportPrice(double importPrice) {
        this.importPrice = importPrice;
    }

    public double getExportPrice() {
        return exportPrice;
    }

    public void setExportPrice(double exportPrice) {
        this.exportPrice = exportPrice;
    }

    public double getPvForecastKwh() {
        return pvForecastKwh;
    }

    public void setPvForecastKwh(double pvForecastKwh) {
        this.pvForecastKwh = pvForecastKwh;
    }

    public double getLoadForecastKwh() {
        return loadForecastKwh;
    }

    public void setLoadForecastKwh(double loadForecastKwh) {
        this.loadForecastKwh = loadForecastKwh;
    }

    public double getAdjustedPvKwh() {
        return adjustedPvKwh;
    }

    public void setAdjustedPvKwh(double adjustedPvKwh) {
        this.adjustedPvKwh = adjustedPvKwh;
    }

    public double getAdjustedLoadKwh() {
        return adjustedLoadKwh;
    }

    public void setAdjustedLoadKwh(double adjustedLoadKwh) {
        this.adjustedLoadKwh = adjustedLoadKwh;
    }

    public Double getPvP10() {
        return pvP10;
    }

    public void setPvP10(Double pvP10) {
        this.pvP10 = pvP10;
    }

    public Double getPvP90() {
        return pvP90;
    }

    public void setPvP90(Double pvP90) {
        this.pvP90 = pvP90;
    }

    public Double getLoadP10() {
        return loadP10;
    }

    public void setLoadP10(Double loadP10) {
        this.loadP10 = loadP10;
    }

    public Double getLoadP90() {
        return loadP90;
    }

    public void setLoadP90(Double loadP90) {
        this.loadP90 = loadP90;
    }

    public boolean isHistorical() {
        return historical;
    }

    public void setHistorical(boolean historical) {
        this.historical = historical;
    }

    public boolean isCheap() {
        return cheap;
    }

    public void setCheap(boolean cheap) {
        this.cheap = cheap;
    }

    public double getWaterHeatingKw() {
        return waterHeatingKw;
    }

    public void setWaterHeatingKw(double waterHeatingKw) {
        this.waterHeatingKw = waterHeatingKw;
    }

    public ManualAction getManualAction() {
        return manualAction;
    }

    public void setManualAction(ManualAction manualAction) {
        this.manualAction = manualAction;
    }

    public double getChargeKw() {
        return chargeKw;
    }

    public void setChargeKw(double chargeKw) {
        this.chargeKw = chargeKw;
    }

    public double getBatteryChargeKw() {
        return batteryChargeKw;
    }

    public void setBatteryChargeKw(double batteryChargeKw) {
        this.batteryChargeKw = batteryChargeKw;
    }

    public double getBatteryDischargeKw() {
        return batteryDischargeKw;
    }

    public void setBatteryDischargeKw(double batteryDischargeKw) {
        this.batteryDischargeKw = batteryDischargeKw;
    }

    public double getImportKwh() {
        return importKwh;
    }

    public void setImportKwh(double importKwh) {
        this.importKwh = importKwh;
    }

    public double getExportKwh() {
        return exportKwh;
    }

    public void setExportKwh(double exportKwh) {
        this.exportKwh = exportKwh;
    }

    public Double getProjectedSocKwh() {
        return projectedSocKwh;
    }

    public void setProjectedSocKwh(Double projectedSocKwh) {
        this.projectedSocKwh = projectedSocKwh;
    }

    public Double getProjectedSocPercent() {
        return projectedSocPercent;
    }

    public void setProjectedSocPercent(Double projectedSocPercent) {
        this.projectedSocPercent = projectedSocPercent;
    }

    public Double getEntrySocPercent() {
        return entrySocPercent;
    }

    public void setEntrySocPercent(Double entrySocPercent) {
        this.entrySocPercent = entrySocPercent;
    }

    public SlotAction getAction() {
        return action;
    }

    public void setAction(SlotAction action) {
        this.action = action;
    }

    public double getPlannedCost() {
        return plannedCost;
    }

    public void setPlannedCost(double plannedCost) {
        this.plannedCost = plannedCost;
    }

    public double getWaterFromPvKwh() {
        return waterFromPvKwh;
    }

    public void setWaterFromPvKwh(double waterFromPvKwh) {
        this.waterFromPvKwh = waterFromPvKwh;
    }

    public double getWaterFromBatteryKwh() {
        return waterFromBatteryKwh;
    }

    public void setWaterFromBatteryKwh(double waterFromBatteryKwh) {
        this.waterFromBatteryKwh = waterFromBatteryKwh;
    }

    public double getWaterFromGridKwh() {
        return waterFromGridKwh;
    }

    public void setWaterFromGridKwh(double waterFromGridKwh) {
        this.waterFromGridKwh = waterFromGridKwh;
    }

    public Double getSocTargetPercent() {
        return socTargetPercent;
    }

    public void setSocTargetPercent(Double socTargetPercent) {
        this.socTargetPercent = socTargetPercent;
    }
}
