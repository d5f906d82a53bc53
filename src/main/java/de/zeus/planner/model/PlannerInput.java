package de.zeus.planner.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a planning run consumes besides configuration. Owned by the caller and
 * only read by the pipeline.
 */
public class PlannerInput {

    private List<PriceSlot> priceData = new ArrayList<>();

    private List<ForecastSlot> forecastData = new ArrayList<>();

    private InitialState initialState = new InitialState();

    /** Daily PV totals (kWh) for days beyond the slot horizon. */
    private Map<LocalDate, Double> dailyPvForecast = new HashMap<>();

    /** Daily load totals (kWh) for days beyond the slot horizon. */
    private Map<LocalDate, Double> dailyLoadForecast = new HashMap<>();

    private DailyProbabilisticForecast dailyProbabilistic;

    private List<ManualPlanEntry> manualPlan = new ArrayList<>();

    private LearningOverlay learningOverlay;

    private List<RecordedSlot> recordedHistory = new ArrayList<>();

    public List<PriceSlot> getPriceData() {
        return priceData;
    }

    public void setPriceData(List<PriceSlot> priceData) {
        this.priceData = priceData;
    }

    public List<ForecastSlot> getForecastData() {
        return forecastData;
    }

    public void setForecastData(List<ForecastSlot> forecastData) {
        this.forecastData = forecastData;
    }

    public InitialState getInitialState() {
        return initialState;
    }

    public void setInitialState(InitialState initialState) {
        this.initialState = initialState;
    }

    public Map<LocalDate, Double> getDailyPvForecast() {
        return dailyPvForecast;
    }

    public void setDailyPvForecast(Map<LocalDate, Double> dailyPvForecast) {
        this.dailyPvForecast = dailyPvForecast;
    }

    public Map<LocalDate, Double> getDailyLoadForecast() {
        return dailyLoadForecast;
    }

    public void setDailyLoadForecast(Map<LocalDate, Double> dailyLoadForecast) {
        this.dailyLoadForecast = dailyLoadForecast;
    }

    public DailyProbabilisticForecast getDailyProbabilistic() {
        return dailyProbabilistic;
    }

    public void setDailyProbabilistic(DailyProbabilisticForecast dailyProbabilistic) {
        this.dailyProbabilistic = dailyProbabilistic;
    }

    public List<ManualPlanEntry> getManualPlan() {
        return manualPlan;
    }

    public void setManualPlan(List<ManualPlanEntry> manualPlan) {
        this.manualPlan = manualPlan;
    }

    public LearningOverlay getLearningOverlay() {
        return learningOverlay;
    }

    public void setLearningOverlay(LearningOverlay learningOverlay) {
        this.learningOverlay = learningOverlay;
    }

    public List<RecordedSlot> getRecordedHistory() {
        return recordedHistory;
    }

    public void setRecordedHistory(List<RecordedSlot> recordedHistory) {
        this.recordedHistory = recordedHistory;
    }
}
