package de.zeus.planner.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tunables of the S-Index / risk-factor engine ({@code planner.risk.*}).
 * <p>
 * The per-appetite tables are policy: keys 1 (conservative) to 5 (aggressive),
 * values must not increase with the key.
 */
public class RiskProperties {

    private RiskMode mode = RiskMode.DYNAMIC;

    private double baseFactor = 1.05;

    private double maxFactor = 1.5;

    /**
     * Floor of the end-of-horizon risk factor. Aggressive profiles may go below 1.0.
     */
    private double minFactor = 0.8;

    private double pvDeficitWeight = 0.2;

    /**
     * Weight of the cold-weather adjustment. 0 disables temperature lookups entirely.
     */
    private double tempWeight = 0.0;

    private double tempBaselineC = 20.0;

    private double tempColdC = -15.0;

    /**
     * Look-ahead days (offsets 1..N) for the load margin.
     */
    private int horizonDays = 4;

    /**
     * 1 = safety ... 5 = gambler.
     */
    private int riskAppetite = 3;

    private Map<Integer, Double> bufferMultiplier = table(1.5, 1.2, 1.0, 0.5, -0.5);

    private Map<Integer, Double> sigmaByAppetite = table(1.28, 0.67, 0.0, -0.25, -0.67);

    /**
     * Percentage points above min SoC for the end-of-horizon target.
     */
    private Map<Integer, Double> baseBufferPercent = table(35.0, 20.0, 10.0, 3.0, -7.0);

    /**
     * Soft penalty per kWh below the target SoC handed to the optimizer.
     */
    private Map<Integer, Double> targetPenaltyByAppetite = table(20.0, 14.0, 8.0, 5.0, 2.0);

    private double weatherScale = 40.0;

    private double weatherCapPercent = 8.0;

    private double absoluteFloorPercent = 5.0;

    private WeatherVolatility weatherVolatility = new WeatherVolatility();

    private static Map<Integer, Double> table(double... values) {
        Map<Integer, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(i + 1, values[i]);
        }
        return map;
    }

    public RiskMode getMode() {
        return mode;
    }

    public void setMode(RiskMode mode) {
        this.mode = mode;
    }

    public double getBaseFactor() {
        return baseFactor;
    }

    public void setBaseFactor(double baseFactor) {
        this.baseFactor = baseFactor;
    }

    public double getMaxFactor() {
        return maxFactor;
    }

    public void setMaxFactor(double maxFactor) {
        this.maxFactor = maxFactor;
    }

    public double getMinFactor() {
        return minFactor;
    }

    public void setMinFactor(double minFactor) {
        this.minFactor = minFactor;
    }

    public double getPvDeficitWeight() {
        return pvDeficitWeight;
    }

    public void setPvDeficitWeight(double pvDeficitWeight) {
        this.pvDeficitWeight = pvDeficitWeight;
    }

    public double getTempWeight() {
        return tempWeight;
    }

    public void setTempWeight(double tempWeight) {
        this.tempWeight = tempWeight;
    }

    public double getTempBaselineC() {
        return tempBaselineC;
    }

    public void setTempBaselineC(double tempBaselineC) {
        this.tempBaselineC = tempBaselineC;
    }

    public double getTempColdC() {
        return tempColdC;
    }

    public void setTempColdC(double tempColdC) {
        this.tempColdC = tempColdC;
    }

    public int getHorizonDays() {
        return horizonDays;
    }

    public void setHorizonDays(int horizonDays) {
        this.horizonDays = horizonDays;
    }

    public int getRiskAppetite() {
        return riskAppetite;
    }

    public void setRiskAppetite(int riskAppetite) {
        this.riskAppetite = riskAppetite;
    }

    public Map<Integer, Double> getBufferMultiplier() {
        return bufferMultiplier;
    }

    public void setBufferMultiplier(Map<Integer, Double> bufferMultiplier) {
        this.bufferMultiplier = bufferMultiplier;
    }

    public Map<Integer, Double> getSigmaByAppetite() {
        return sigmaByAppetite;
    }

    public void setSigmaByAppetite(Map<Integer, Double> sigmaByAppetite) {
        this.sigmaByAppetite = sigmaByAppetite;
    }

    public Map<Integer, Double> getBaseBufferPercent() {
        return baseBufferPercent;
    }

    public void setBaseBufferPercent(Map<Integer, Double> baseBufferPercent) {
        this.baseBufferPercent = baseBufferPercent;
    }

    public Map<Integer, Double> getTargetPenaltyByAppetite() {
        return targetPenaltyByAppetite;
    }

    public void setTargetPenaltyByAppetite(Map<Integer, Double> targetPenaltyByAppetite) {
        this.targetPenaltyByAppetite = targetPenaltyByAppetite;
    }

    public double getWeatherScale() {
        return weatherScale;
    }

    public void setWeatherScale(double weatherScale) {
        this.weatherScale = weatherScale;
    }

    public double getWeatherCapPercent() {
        return weatherCapPercent;
    }

    public void setWeatherCapPercent(double weatherCapPercent) {
        this.weatherCapPercent = weatherCapPercent;
    }

    public double getAbsoluteFloorPercent() {
        return absoluteFloorPercent;
    }

    public void setAbsoluteFloorPercent(double absoluteFloorPercent) {
        this.absoluteFloorPercent = absoluteFloorPercent;
    }

    public WeatherVolatility getWeatherVolatility() {
        return weatherVolatility;
    }

    public void setWeatherVolatility(WeatherVolatility weatherVolatility) {
        this.weatherVolatility = weatherVolatility;
    }

    /**
     * Forecast volatility (0..1) reported by an upstream analyst. The larger of the two
     * amplifies the end-of-horizon buffer by up to {@code amplification}.
     */
    public static class WeatherVolatility {

        private double cloud = 0.0;

        private double temp = 0.0;

        private double amplification = 0.4;

        public double getCloud() {
            return cloud;
        }

        public void setCloud(double cloud) {
            this.cloud = cloud;
        }

        public double getTemp() {
            return temp;
        }

        public void setTemp(double temp) {
            this.temp = temp;
        }

        public double getAmplification() {
            return amplification;
        }

        public void setAmplification(double amplification) {
            this.amplification = amplification;
        }
    }
}
