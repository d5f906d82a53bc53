package de.zeus.planner.service;

import de.zeus.planner.PlannerTestData;
import de.zeus.planner.config.PlannerProperties;
import de.zeus.planner.config.RiskMode;
import de.zeus.planner.config.RiskProperties;
import de.zeus.planner.model.DailyProbabilisticForecast;
import de.zeus.planner.model.FutureRiskResult;
import de.zeus.planner.model.LearningOverlay;
import de.zeus.planner.model.LoadMarginResult;
import de.zeus.planner.model.PlannerInput;
import de.zeus.planner.model.RiskFactors;
import de.zeus.planner.model.Slot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class RiskFactorServiceTest {

    private RiskFactorService service;
    private TemperatureForecastProvider temperatures;
    private RiskProperties risk;
    private ZonedDateTime now;
    private LocalDate today;

    @BeforeEach
    void setUp() {
        temperatures = mock(TemperatureForecastProvider.class);
        service = new RiskFactorService(temperatures);
        risk = new RiskProperties();
        risk.setBaseFactor(1.1);
        risk.setMaxFactor(1.5);
        risk.setMinFactor(0.8);
        risk.setPvDeficitWeight(0.2);
        risk.setTempWeight(0.0);
        risk.setRiskAppetite(3);
        now = PlannerTestData.at(2025, 1, 15, 10, 0);
        today = now.toLocalDate();
    }

    @Test
    void futureRisk_pvDeficitRaisesRisk() {
        FutureRiskResult dark = service.futureRisk(dayOne(30.0, 5.0), risk, 1.1, today, PlannerTestData.ZONE);
        FutureRiskResult sunny = service.futureRisk(dayOne(30.0, 25.0), risk, 1.1, today, PlannerTestData.ZONE);

        assertEquals(1.2167, dark.riskFactor(), 1e-4);
        assertEquals(1.1233, sunny.riskFactor(), 1e-4);
        assertTrue(dark.riskFactor() > sunny.riskFactor());
        assertNull(dark.d2DeficitRatio(), "Missing day two contributes nothing");
        verifyNoInteractions(temperatures);
    }

    @Test
    void futureRisk_staysWithinBoundsAndFallsWithAppetite() {
        risk.setPvDeficitWeight(3.0);
        double previous = Double.MAX_VALUE;
        for (int appetite = 1; appetite <= 5; appetite++) {
            risk.setRiskAppetite(appetite);
            double factor = service.futureRisk(dayOne(30.0, 0.0), risk, 1.1, today, PlannerTestData.ZONE).riskFactor();
            assertTrue(factor >= 0.8 && factor <= 1.5, "Appetite " + appetite + " out of bounds: " + factor);
            assertTrue(factor <= previous, "Appetite " + appetite + " should not raise the risk factor");
            previous = factor;
        }
    }

    @Test
    void futureRisk_coldDayTwoAddsTemperatureContribution() {
        risk.setTempWeight(0.5);
        when(temperatures.fetchMeanTemperatures(anyList(), any(), any())).thenReturn(Map.of(2, -15.0));

        FutureRiskResult result = service.futureRisk(List.of(), risk, 1.0, today, PlannerTestData.ZONE);

        assertEquals(1.0, result.temperatureAdjustment(), 1e-9);
        assertEquals(1.5, result.rawFactor(), 1e-9);
    }

    @Test
    void futureRisk_temperatureFailureDegradesGracefully() {
        risk.setTempWeight(0.5);
        when(temperatures.fetchMeanTemperatures(anyList(), any(), any())).thenThrow(new IllegalStateException("offline"));

        FutureRiskResult result = service.futureRisk(List.of(), risk, 1.0, today, PlannerTestData.ZONE);

        assertEquals(0.0, result.temperatureContribution(), 1e-9);
        assertEquals(1.0, result.riskFactor(), 1e-9);
    }

    @Test
    void futureRisk_weatherVolatilityAmplifiesBuffer() {
        risk.getWeatherVolatility().setCloud(1.0);

        FutureRiskResult result = service.futureRisk(dayOne(30.0, 5.0), risk, 1.1, today, PlannerTestData.ZONE);

        assertEquals(1.4, result.weatherAmplification(), 1e-9);
        assertEquals(1.0 + (result.rawFactor() - 1.0) * 1.4, result.rawFactorWithWeather(), 1e-9);
    }

    @Test
    void dynamicLoadMargin_usesSlotsAndDailyTotals() {
        Map<LocalDate, Double> dailyLoad = new HashMap<>();
        Map<LocalDate, Double> dailyPv = new HashMap<>();
        dailyLoad.put(today.plusDays(3), 20.0);
        dailyPv.put(today.plusDays(3), 20.0);

        LoadMarginResult result = service.dynamicLoadMargin(dayOne(30.0, 5.0), risk, 1.1, today,
                PlannerTestData.ZONE, dailyPv, dailyLoad);

        assertTrue(result.hasFactor());
        assertEquals(List.of(1, 3), result.consideredDays());
        assertEquals((25.0 / 30.0) / 2.0, result.averageDeficit(), 1e-9);
        assertEquals(1.1 + 0.2 * result.averageDeficit(), result.factor(), 1e-9);
    }

    @Test
    void dynamicLoadMargin_isCappedAtMaxFactor() {
        risk.setPvDeficitWeight(2.0);

        LoadMarginResult result = service.dynamicLoadMargin(dayOne(30.0, 0.0), risk, 1.1, today,
                PlannerTestData.ZONE, Map.of(), Map.of());

        assertEquals(1.5, result.factor(), 1e-9);
    }

    @Test
    void compute_withoutForecastFallsBackToBaseFactor() {
        PlannerProperties properties = PlannerTestData.properties();
        properties.setRisk(risk);

        RiskFactors factors = service.compute(List.of(), properties, new PlannerInput(), now);

        assertFalse(factors.loadMargin().hasFactor());
        assertEquals(1.1, factors.effectiveLoadMargin(), 1e-9);
    }

    @Test
    void compute_learnedBaseFactorReplacesConfiguredOne() {
        PlannerProperties properties = PlannerTestData.properties();
        properties.setRisk(risk);
        PlannerInput input = new PlannerInput();
        LearningOverlay overlay = new LearningOverlay();
        overlay.setBaseFactor(1.3);
        input.setLearningOverlay(overlay);

        RiskFactors factors = service.compute(List.of(), properties, input, now);

        assertEquals(1.3, factors.baseFactor(), 1e-9);
        assertEquals(1.3, factors.effectiveLoadMargin(), 1e-9);
        assertEquals(1.3, factors.futureRisk().rawFactor(), 1e-9);
    }

    @Test
    void compute_probabilisticMarginReportsLearnedBaseFactor() {
        risk.setMode(RiskMode.PROBABILISTIC);
        PlannerProperties properties = PlannerTestData.properties();
        properties.setRisk(risk);
        PlannerInput input = new PlannerInput();
        LearningOverlay overlay = new LearningOverlay();
        overlay.setBaseFactor(1.25);
        input.setLearningOverlay(overlay);

        RiskFactors factors = service.compute(List.of(), properties, input, now);

        assertFalse(factors.loadMargin().hasFactor());
        assertEquals(1.25, factors.loadMargin().baseFactor(), 1e-9, "Reported base factor must match the fallback");
        assertEquals(1.25, factors.effectiveLoadMargin(), 1e-9);
    }

    @Test
    void probabilisticLoadMargin_scalesUncertaintyBySigma() {
        risk.setMode(RiskMode.PROBABILISTIC);
        List<Slot> slots = dayOne(8.0, 4.0);
        for (Slot slot : slots) {
            slot.setLoadP90(slot.getLoadForecastKwh() * 1.5);
            slot.setPvP10(slot.getPvForecastKwh() * 0.5);
        }

        risk.setRiskAppetite(1);
        assertEquals(1.5, service.probabilisticLoadMargin(slots, risk, risk.getBaseFactor(), today, null).factor(), 1e-9);
        risk.setRiskAppetite(3);
        assertEquals(1.0, service.probabilisticLoadMargin(slots, risk, risk.getBaseFactor(), today, null).factor(), 1e-9);
        risk.setRiskAppetite(5);
        LoadMarginResult aggressive = service.probabilisticLoadMargin(slots, risk, risk.getBaseFactor(), today, null);
        assertEquals(0.5, aggressive.factor(), 1e-9, "Target load is floored at half the median");
        assertEquals(6.0, aggressive.totalUncertaintyKwh(), 1e-9);
    }

    @Test
    void probabilisticLoadMargin_fallsBackToDailyAggregates() {
        risk.setRiskAppetite(2);
        LocalDate day = today.plusDays(2);
        DailyProbabilisticForecast daily = new DailyProbabilisticForecast();
        daily.setLoadP50(Map.of(day, 10.0));
        daily.setLoadP90(Map.of(day, 12.0));
        daily.setPvP50(Map.of(day, 4.0));
        daily.setPvP10(Map.of(day, 2.0));

        LoadMarginResult result = service.probabilisticLoadMargin(List.of(), risk, risk.getBaseFactor(), today, daily);

        assertEquals(List.of(2), result.consideredDays());
        assertEquals((10.0 + 4.0 * 0.67) / 10.0, result.factor(), 1e-9);
    }

    @Test
    void probabilisticLoadMargin_withoutDataHasNoFactor() {
        assertFalse(service.probabilisticLoadMargin(List.of(), risk, risk.getBaseFactor(), today, null).hasFactor());
    }

    /**
     * Four slots on tomorrow summing to the given daily load and PV.
     */
    private List<Slot> dayOne(double loadKwh, double pvKwh) {
        List<Slot> slots = new ArrayList<>();
        ZonedDateTime start = now.toLocalDate().plusDays(1).atStartOfDay(PlannerTestData.ZONE).plusHours(12);
        for (Slot slot : PlannerTestData.flatSlots(start, 4, 1.0)) {
            slot.setLoadForecastKwh(loadKwh / 4.0);
            slot.setPvForecastKwh(pvKwh / 4.0);
            slots.add(slot);
        }
        return slots;
    }
}
