package de.zeus.planner.model;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

/**
 * Daily forecast aggregates with percentile bands for days the slot horizon does not reach yet.
 */
public class DailyProbabilisticForecast {

    private Map<LocalDate, Double> loadP50 = new HashMap<>();
    private Map<LocalDate, Double> loadP90 = new HashMap<>();
    private Map<LocalDate, Double> pvP50 = new HashMap<>();
    private Map<LocalDate, Double> pvP10 = new HashMap<>();

    public Map<LocalDate, Double> getLoadP50() {
        return loadP50;
    }

    public void setLoadP50(Map<LocalDate, Double> loadP50) {
        this.loadP50 = loadP50;
    }

    public Map<LocalDate, Double> getLoadP90() {
        return loadP90;
    }

    public void setLoadP90(Map<LocalDate, Double> loadP90) {
        this.loadP90 = loadP90;
    }

    public Map<LocalDate, Double> getPvP50() {
        return pvP50;
    }

    public void setPvP50(Map<LocalDate, Double> pvP50) {
        this.pvP50 = pvP50;
    }

    public Map<LocalDate, Double> getPvP10() {
        return pvP10;
    }

    public void setPvP10(Map<LocalDate, Double> pvP10) {
        this.pvP10 = pvP10;
    }
}
