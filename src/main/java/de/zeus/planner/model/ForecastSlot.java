package de.zeus.planner.model;

/**
 * PV and load forecast for one slot (kWh per slot). The percentile bands are optional.
 */
public class ForecastSlot {

    private String start;
    private Double pvKwh;
    private Double loadKwh;
    private Double pvP10;
    private Double pvP90;
    private Double loadP10;
    private Double loadP90;

    public ForecastSlot() {
    }

    public ForecastSlot(String start, Double pvKwh, Double loadKwh) {
        this.start = start;
        this.pvKwh = pvKwh;
        this.loadKwh = loadKwh;
    }

    public String getStart() {
        return start;
    }

    public void setStart(String start) {
        this.start = start;
    }

    public Double getPvKwh() {
        return pvKwh;
    }

    public void setPvKwh(Double pvKwh) {
        this.pvKwh = pvKwh;
    }

    public Double getLoadKwh() {
        return loadKwh;
    }

    public void setLoadKwh(Double loadKwh) {
        this.loadKwh = loadKwh;
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
}
