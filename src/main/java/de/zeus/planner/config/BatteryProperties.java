package de.zeus.planner.config;

/**
 * Battery limits used by every planning stage.
 * Bound from {@code planner.battery.*}; the section is mandatory.
 */
public class BatteryProperties {

    /**
     * Usable capacity (kWh). Must be greater than zero while the battery is enabled.
     */
    private double capacityKwh;

    /**
     * Hard floor the optimizer must respect (%).
     */
    private double minSocPercent = 12.0;

    /**
     * Upper bound for charging (%).
     */
    private double maxSocPercent = 100.0;

    /**
     * Max charge power (kW). Example: 5.0
     */
    private double maxChargePowerKw = 5.0;

    /**
     * Max discharge power (kW).
     */
    private double maxDischargePowerKw = 5.0;

    private double chargeEfficiency = 0.95;

    private double dischargeEfficiency = 0.95;

    /**
     * Optional grid import limit (kW). Null means unlimited.
     */
    private Double gridImportLimitKw;

    public double getCapacityKwh() {
        return capacityKwh;
    }

    public void setCapacityKwh(double capacityKwh) {
        this.capacityKwh = capacityKwh;
    }

    public double getMinSocPercent() {
        return minSocPercent;
    }

    public void setMinSocPercent(double minSocPercent) {
        this.minSocPercent = minSocPercent;
    }

    public double getMaxSocPercent() {
        return maxSocPercent;
    }

    public void setMaxSocPercent(double maxSocPercent) {
        this.maxSocPercent = maxSocPercent;
    }

    public double getMaxChargePowerKw() {
        return maxChargePowerKw;
    }

    public void setMaxChargePowerKw(double maxChargePowerKw) {
        this.maxChargePowerKw = maxChargePowerKw;
    }

    public double getMaxDischargePowerKw() {
        return maxDischargePowerKw;
    }

    public void setMaxDischargePowerKw(double maxDischargePowerKw) {
        this.maxDischargePowerKw = maxDischargePowerKw;
    }

    public double getChargeEfficiency() {
        return chargeEfficiency;
    }

    public void setChargeEfficiency(double chargeEfficiency) {
        this.chargeEfficiency = chargeEfficiency;
    }

    public double getDischargeEfficiency() {
        return dischargeEfficiency;
    }

    public void setDischargeEfficiency(double dischargeEfficiency) {
        this.dischargeEfficiency = dischargeEfficiency;
    }

    public Double getGridImportLimitKw() {
        return gridImportLimitKw;
    }

    public void setGridImportLimitKw(Double gridImportLimitKw) {
        this.gridImportLimitKw = gridImportLimitKw;
    }
}
