package de.zeus.planner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Root of the planner configuration ({@code planner.*}).
 * <p>
 * {@code battery} and {@code batteryEconomics} have no defaults on purpose; they gate the
 * safety math and are checked by {@link PlannerConfigValidator}. Everything else is optional.
 * The structure is also the target of per-run overrides, see {@link PlannerConfigMerger}.
 */
@Component
@ConfigurationProperties(prefix = "planner")
public class PlannerProperties {

    private String timezone = "Europe/Stockholm";

    private BatteryProperties battery;

    private BatteryEconomics batteryEconomics;

    private SystemProfile system = new SystemProfile();

    private RiskProperties risk = new RiskProperties();

    private ChargingStrategy chargingStrategy = new ChargingStrategy();

    private WaterHeatingProperties waterHeating = new WaterHeatingProperties();

    private ManualPlanning manualPlanning = new ManualPlanning();

    private Forecasting forecasting = new Forecasting();

    private Solver solver = new Solver();

    private Debug debug = new Debug();

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public BatteryProperties getBattery() {
        return battery;
    }

    public void setBattery(BatteryProperties battery) {
        this.battery = battery;
    }

    public BatteryEconomics getBatteryEconomics() {
        return batteryEconomics;
    }

    public void setBatteryEconomics(BatteryEconomics batteryEconomics) {
        this.batteryEconomics = batteryEconomics;
    }

    public SystemProfile getSystem() {
        return system;
    }

    public void setSystem(SystemProfile system) {
        this.system = system;
    }

    public RiskProperties getRisk() {
        return risk;
    }

    public void setRisk(RiskProperties risk) {
        this.risk = risk;
    }

    public ChargingStrategy getChargingStrategy() {
        return chargingStrategy;
    }

    public void setChargingStrategy(ChargingStrategy chargingStrategy) {
        this.chargingStrategy = chargingStrategy;
    }

    public WaterHeatingProperties getWaterHeating() {
        return waterHeating;
    }

    public void setWaterHeating(WaterHeatingProperties waterHeating) {
        this.waterHeating = waterHeating;
    }

    public ManualPlanning getManualPlanning() {
        return manualPlanning;
    }

    public void setManualPlanning(ManualPlanning manualPlanning) {
        this.manualPlanning = manualPlanning;
    }

    public Forecasting getForecasting() {
        return forecasting;
    }

    public void setForecasting(Forecasting forecasting) {
        this.forecasting = forecasting;
    }

    public Solver getSolver() {
        return solver;
    }

    public void setSolver(Solver solver) {
        this.solver = solver;
    }

    public Debug getDebug() {
        return debug;
    }

    public void setDebug(Debug debug) {
        this.debug = debug;
    }

    public static class BatteryEconomics {

        /**
         * Wear cost per kWh cycled through the battery.
         */
        private double cycleCostPerKwh = 0.0;

        public double getCycleCostPerKwh() {
            return cycleCostPerKwh;
        }

        public void setCycleCostPerKwh(double cycleCostPerKwh) {
            this.cycleCostPerKwh = cycleCostPerKwh;
        }
    }

    /**
     * Which hardware is actually installed.
     */
    public static class SystemProfile {

        private boolean hasSolar = true;

        private boolean hasBattery = true;

        private boolean hasWaterHeater = true;

        /** Installed PV peak power, only used for a sanity warning. */
        private double solarKwp = 0.0;

        public boolean isHasSolar() {
            return hasSolar;
        }

        public void setHasSolar(boolean hasSolar) {
            this.hasSolar = hasSolar;
        }

        public boolean isHasBattery() {
            return hasBattery;
        }

        public void setHasBattery(boolean hasBattery) {
            this.hasBattery = hasBattery;
        }

        public boolean isHasWaterHeater() {
            return hasWaterHeater;
        }

        public void setHasWaterHeater(boolean hasWaterHeater) {
            this.hasWaterHeater = hasWaterHeater;
        }

        public double getSolarKwp() {
            return solarKwp;
        }

        public void setSolarKwp(double solarKwp) {
            this.solarKwp = solarKwp;
        }
    }

    public static class ChargingStrategy {

        private double chargeThresholdPercentile = 15.0;

        private double cheapPriceTolerance = 0.10;

        private double priceSmoothing = 0.05;

        /**
         * Strategic charge target (%). Null means battery max SoC.
         */
        private Double targetSocPercent;

        public double getChargeThresholdPercentile() {
            return chargeThresholdPercentile;
        }

        public void setChargeThresholdPercentile(double chargeThresholdPercentile) {
            this.chargeThresholdPercentile = chargeThresholdPercentile;
        }

        public double getCheapPriceTolerance() {
            return cheapPriceTolerance;
        }

        public void setCheapPriceTolerance(double cheapPriceTolerance) {
            this.cheapPriceTolerance = cheapPriceTolerance;
        }

        public double getPriceSmoothing() {
            return priceSmoothing;
        }

        public void setPriceSmoothing(double priceSmoothing) {
            this.priceSmoothing = priceSmoothing;
        }

        public Double getTargetSocPercent() {
            return targetSocPercent;
        }

        public void setTargetSocPercent(Double targetSocPercent) {
            this.targetSocPercent = targetSocPercent;
        }
    }

    public static class ManualPlanning {

        private Double chargeTargetPercent;

        private Double exportTargetPercent;

        public Double getChargeTargetPercent() {
            return chargeTargetPercent;
        }

        public void setChargeTargetPercent(Double chargeTargetPercent) {
            this.chargeTargetPercent = chargeTargetPercent;
        }

        public Double getExportTargetPercent() {
            return exportTargetPercent;
        }

        public void setExportTargetPercent(Double exportTargetPercent) {
            this.exportTargetPercent = exportTargetPercent;
        }
    }

    public static class Forecasting {

        /**
         * Share of the PV forecast we trust (%).
         */
        private double pvConfidencePercent = 90.0;

        public double getPvConfidencePercent() {
            return pvConfidencePercent;
        }

        public void setPvConfidencePercent(double pvConfidencePercent) {
            this.pvConfidencePercent = pvConfidencePercent;
        }
    }

    public static class Solver {

        private long timeoutSeconds = 60;

        private double rampingCostPerKw = 0.0;

        private double exportThresholdPerKwh = 0.0;

        private boolean enableExport = true;

        public long getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public double getRampingCostPerKw() {
            return rampingCostPerKw;
        }

        public void setRampingCostPerKw(double rampingCostPerKw) {
            this.rampingCostPerKw = rampingCostPerKw;
        }

        public double getExportThresholdPerKwh() {
            return exportThresholdPerKwh;
        }

        public void setExportThresholdPerKwh(double exportThresholdPerKwh) {
            this.exportThresholdPerKwh = exportThresholdPerKwh;
        }

        public boolean isEnableExport() {
            return enableExport;
        }

        public void setEnableExport(boolean enableExport) {
            this.enableExport = enableExport;
        }
    }

    public static class Debug {

        /** Number of future slots copied into the debug sample. */
        private int sampleSize = 30;

        public int getSampleSize() {
            return sampleSize;
        }

        public void setSampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
        }
    }
}
