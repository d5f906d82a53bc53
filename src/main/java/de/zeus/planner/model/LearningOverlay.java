package de.zeus.planner.model;

import java.util.List;

/**
 * Precomputed correction map from the learning engine. All parts are optional.
 */
public class LearningOverlay {

    public static final int HOURS_PER_DAY = 24;

    /** Additive PV bias per local hour (kWh per slot), 24 entries. */
    private List<Double> pvAdjustment;

    /** Additive load bias per local hour (kWh per slot), 24 entries. */
    private List<Double> loadAdjustment;

    /** Learned replacement for the configured load-margin base factor. */
    private Double baseFactor;

    public LearningOverlay() {
    }

    public LearningOverlay(List<Double> pvAdjustment, List<Double> loadAdjustment, Double baseFactor) {
        this.pvAdjustment = pvAdjustment;
        this.loadAdjustment = loadAdjustment;
        this.baseFactor = baseFactor;
    }

    public List<Double> getPvAdjustment() {
        return pvAdjustment;
    }

    public void setPvAdjustment(List<Double> pvAdjustment) {
        this.pvAdjustment = pvAdjustment;
    }

    public List<Double> getLoadAdjustment() {
        return loadAdjustment;
    }

    public void setLoadAdjustment(List<Double> loadAdjustment) {
        this.loadAdjustment = loadAdjustment;
    }

    public Double getBaseFactor() {
        return baseFactor;
    }

    public void setBaseFactor(Double baseFactor) {
        this.baseFactor = baseFactor;
    }
}
