package de.zeus.planner.service;

import de.zeus.planner.config.PlannerProperties;
import de.zeus.planner.config.RiskMode;
import de.zeus.planner.config.RiskProperties;
import de.zeus.planner.model.DailyProbabilisticForecast;
import de.zeus.planner.model.FutureRiskResult;
import de.zeus.planner.model.LoadMarginResult;
import de.zeus.planner.model.PlannerInput;
import de.zeus.planner.model.RiskFactors;
import de.zeus.planner.model.Slot;
import de.zeus.planner.util.SlotUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Copyright 2024 Guido Zeuner - https://tiny-tool.de
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

/**
 * S-Index engine. Produces two decoupled numbers per run:
 * <ol>
 *     <li>the near-horizon load margin that inflates the load forecast, and</li>
 *     <li>the end-of-horizon risk factor that drives terminal value and target SoC.</li>
 * </ol>
 * Day offsets are relative to the local date of the run's frozen "now".
 */
@Service
public class RiskFactorService {

    private static final Logger logger = LoggerFactory.getLogger(RiskFactorService.class);

    static final double D1_WEIGHT = 0.7;
    static final double D2_WEIGHT = 0.3;

    /** Probabilistic target load never drops below half the median forecast. */
    private static final double MIN_TARGET_LOAD_SHARE = 0.5;

    private final TemperatureForecastProvider temperatureProvider;

    public RiskFactorService(TemperatureForecastProvider temperatureProvider) {
        this.temperatureProvider = temperatureProvider;
    }

    public RiskFactors compute(List<Slot> slots, PlannerProperties properties, PlannerInput input, ZonedDateTime now) {
        RiskProperties risk = properties.getRisk();
        ZoneId zone = now.getZone();
        LocalDate today = now.toLocalDate();

        double baseFactor = risk.getBaseFactor();
        if (input.getLearningOverlay() != null && input.getLearningOverlay().getBaseFactor() != null) {
            baseFactor = input.getLearningOverlay().getBaseFactor();
            logger.info("Using learned S-Index base factor {}", baseFactor);
        }

        LoadMarginResult loadMargin = risk.getMode() == RiskMode.PROBABILISTIC
                ? probabilisticLoadMargin(slots, risk, baseFactor, today, input.getDailyProbabilistic())
                : dynamicLoadMargin(slots, risk, baseFactor, today, zone,
                input.getDailyPvForecast(), input.getDailyLoadForecast());

        double effectiveMargin;
        if (loadMargin.hasFactor()) {
            effectiveMargin = loadMargin.factor();
        } else {
            effectiveMargin = SlotUtils.clamp(baseFactor, 0.0, risk.getMaxFactor());
            logger.warn("S-Index unavailable ({}), falling back to base factor {}", loadMargin.reason(), effectiveMargin);
        }

        FutureRiskResult futureRisk = futureRisk(slots, risk, baseFactor, today, zone);
        logger.info("Risk engine: load margin {}, raw factor {}, risk factor {} (appetite {})",
                SlotUtils.round4(effectiveMargin), SlotUtils.round4(futureRisk.rawFactor()),
                SlotUtils.round4(futureRisk.riskFactor()), risk.getRiskAppetite());
        return new RiskFactors(baseFactor, effectiveMargin, loadMargin, futureRisk);
    }

    /**
     * Load margin from the average forward PV deficit and the cold-weather outlook.
     * Days beyond the slot horizon use the daily aggregates; days without any data are skipped.
     */
    public LoadMarginResult dynamicLoadMargin(List<Slot> slots, RiskProperties risk, double baseFactor,
                                              LocalDate today, ZoneId zone,
                                              Map<LocalDate, Double> dailyPv, Map<LocalDate, Double> dailyLoad) {
        List<Integer> requested = requestedDays(risk);
        if (requested.isEmpty()) {
            return LoadMarginResult.noFactor("dynamic", baseFactor, requested, List.of(), "no_valid_days");
        }
        Map<LocalDate, Double> pvMap = dailyPv != null ? dailyPv : Collections.emptyMap();
        Map<LocalDate, Double> loadMap = dailyLoad != null ? dailyLoad : Collections.emptyMap();

        List<Integer> considered = new ArrayList<>();
        List<Double> deficits = new ArrayList<>();
        for (int offset : requested) {
            LocalDate date = today.plusDays(offset);
            List<Slot> daySlots = slotsOn(slots, date);
            double load;
            double pv;
            if (!daySlots.isEmpty()) {
                load = sum(daySlots, Slot::getLoadForecastKwh);
                pv = sum(daySlots, Slot::getPvForecastKwh);
            } else {
                load = loadMap.getOrDefault(date, 0.0);
                pv = pvMap.getOrDefault(date, 0.0);
                if (load <= 0 && pv <= 0) {
                    continue;
                }
            }
            considered.add(offset);
            deficits.add(load <= 0 ? 0.0 : Math.max(0.0, (load - pv) / load));
        }

        if (considered.isEmpty()) {
            return LoadMarginResult.noFactor("dynamic", baseFactor, requested, considered, "insufficient_forecast_data");
        }

        double averageDeficit = deficits.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double temperatureAdjustment = 0.0;
        Double meanTemperature = null;
        if (risk.getTempWeight() > 0) {
            Map<Integer, Double> temperatures = fetchTemperatures(considered, zone, today);
            List<Double> values = new ArrayList<>();
            for (int offset : considered) {
                Double value = temperatures.get(offset);
                if (value != null) {
                    values.add(value);
                }
            }
            if (!values.isEmpty()) {
                meanTemperature = values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
                temperatureAdjustment = temperatureAdjustment(meanTemperature, risk);
            }
        }

        double raw = baseFactor + risk.getPvDeficitWeight() * averageDeficit + risk.getTempWeight() * temperatureAdjustment;
        double factor = Math.min(risk.getMaxFactor(), Math.max(0.0, raw));
        return new LoadMarginResult("dynamic", factor, baseFactor, requested, considered, averageDeficit,
                temperatureAdjustment, meanTemperature, 0.0, 0.0, raw, null);
    }

    /**
     * Sigma scaling: the load forecast is inflated (or deflated) by the forecast uncertainty
     * times the sigma of the configured risk appetite.
     */
    public LoadMarginResult probabilisticLoadMargin(List<Slot> slots, RiskProperties risk, double baseFactor,
                                                    LocalDate today, DailyProbabilisticForecast daily) {
        List<Integer> requested = requestedDays(risk);
        double sigma = risk.getSigmaByAppetite().getOrDefault(risk.getRiskAppetite(), 0.0);
        if (requested.isEmpty()) {
            return LoadMarginResult.noFactor("probabilistic", baseFactor, requested, List.of(), "no_valid_days");
        }

        List<Integer> considered = new ArrayList<>();
        double totalUncertainty = 0.0;
        double totalLoad = 0.0;
        for (int offset : requested) {
            LocalDate date = today.plusDays(offset);
            List<Slot> daySlots = slotsOn(slots, date);
            double loadP50;
            double loadP90;
            double pvP50;
            double pvP10;
            if (!daySlots.isEmpty() && allHaveBands(daySlots)) {
                loadP50 = sum(daySlots, Slot::getLoadForecastKwh);
                loadP90 = sum(daySlots, Slot::getLoadP90);
                pvP50 = sum(daySlots, Slot::getPvForecastKwh);
                pvP10 = sum(daySlots, Slot::getPvP10);
            } else if (daily != null && daily.getLoadP90() != null && daily.getLoadP90().containsKey(date)) {
                loadP50 = lookup(daily.getLoadP50(), date);
                loadP90 = lookup(daily.getLoadP90(), date);
                pvP50 = lookup(daily.getPvP50(), date);
                pvP10 = lookup(daily.getPvP10(), date);
            } else {
                continue;
            }
            considered.add(offset);
            totalUncertainty += Math.max(0.0, loadP90 - loadP50) + Math.max(0.0, pvP50 - pvP10);
            totalLoad += loadP50;
        }

        if (considered.isEmpty() || totalLoad <= 0) {
            return LoadMarginResult.noFactor("probabilistic", baseFactor, requested, considered,
                    "insufficient_data_or_zero_load");
        }

        double targetLoad = Math.max(totalLoad * MIN_TARGET_LOAD_SHARE, totalLoad + totalUncertainty * sigma);
        double raw = targetLoad / totalLoad;
        double factor = Math.min(risk.getMaxFactor(), raw);
        return new LoadMarginResult("probabilistic", factor, baseFactor, requested, considered, 0.0,
                0.0, null, totalUncertainty, totalLoad, raw, null);
    }

    /**
     * End-of-horizon risk factor. The deficit ratio is signed, so a PV surplus lowers the
     * raw factor; temperature only looks at day+2.
     */
    public FutureRiskResult futureRisk(List<Slot> slots, RiskProperties risk, double baseFactor,
                                       LocalDate today, ZoneId zone) {
        Double d1 = signedDeficit(slotsOn(slots, today.plusDays(1)));
        Double d2 = signedDeficit(slotsOn(slots, today.plusDays(2)));
        double weighted = (d1 != null ? D1_WEIGHT * d1 : 0.0) + (d2 != null ? D2_WEIGHT * d2 : 0.0);

        Double d2Temperature = null;
        double temperatureAdjustment = 0.0;
        if (risk.getTempWeight() > 0) {
            d2Temperature = fetchTemperatures(List.of(2), zone, today).get(2);
            if (d2Temperature != null) {
                temperatureAdjustment = temperatureAdjustment(d2Temperature, risk);
            }
        }

        double pvContribution = risk.getPvDeficitWeight() * weighted;
        double temperatureContribution = risk.getTempWeight() * temperatureAdjustment;
        double raw = baseFactor + pvContribution + temperatureContribution;

        RiskProperties.WeatherVolatility volatility = risk.getWeatherVolatility();
        double amplification = 1.0 + Math.max(volatility.getCloud(), volatility.getTemp()) * volatility.getAmplification();
        double rawWithWeather = 1.0 + (raw - 1.0) * amplification;

        double multiplier = risk.getBufferMultiplier().getOrDefault(risk.getRiskAppetite(), 1.0);
        double adjusted = 1.0 + (rawWithWeather - 1.0) * multiplier;
        double riskFactor = SlotUtils.clamp(adjusted, risk.getMinFactor(), risk.getMaxFactor());

        return new FutureRiskResult(baseFactor, risk.getRiskAppetite(), d1, d2, weighted, pvContribution,
                d2Temperature, temperatureAdjustment, temperatureContribution, raw, amplification,
                rawWithWeather, multiplier, riskFactor);
    }

    /**
     * 0 at or above the baseline temperature, 1 at or below the cold temperature, linear between.
     */
    static double temperatureAdjustment(double meanTemperature, RiskProperties risk) {
        double span = risk.getTempBaselineC() - risk.getTempColdC();
        if (span <= 0) {
            span = 1.0;
        }
        return SlotUtils.clamp((risk.getTempBaselineC() - meanTemperature) / span, 0.0, 1.0);
    }

    private Map<Integer, Double> fetchTemperatures(List<Integer> offsets, ZoneId zone, LocalDate today) {
        try {
            Map<Integer, Double> temperatures = temperatureProvider.fetchMeanTemperatures(offsets, zone, today);
            return temperatures != null ? temperatures : Collections.emptyMap();
        } catch (RuntimeException ex) {
            logger.warn("Temperature forecast failed, continuing without temperature contribution: {}", ex.getMessage());
            return Collections.emptyMap();
        }
    }

    private static Double signedDeficit(List<Slot> daySlots) {
        if (daySlots.isEmpty()) {
            return null;
        }
        double load = sum(daySlots, Slot::getLoadForecastKwh);
        if (load <= 0) {
            return null;
        }
        return (load - sum(daySlots, Slot::getPvForecastKwh)) / load;
    }

    private static List<Integer> requestedDays(RiskProperties risk) {
        List<Integer> days = new ArrayList<>();
        for (int offset = 1; offset <= risk.getHorizonDays(); offset++) {
            days.add(offset);
        }
        return days;
    }

    private static List<Slot> slotsOn(List<Slot> slots, LocalDate date) {
        Predicate<Slot> sameDay = slot -> slot.getStart().toLocalDate().equals(date);
        return slots.stream().filter(sameDay).collect(Collectors.toList());
    }

    private static boolean allHaveBands(List<Slot> slots) {
        return slots.stream().allMatch(s -> s.getLoadP90() != null && s.getPvP10() != null);
    }

    private static double sum(List<Slot> slots, ToDoubleFunction<Slot> value) {
        return slots.stream().mapToDouble(value).sum();
    }

    private static double lookup(Map<LocalDate, Double> map, LocalDate date) {
        if (map == null) {
            return 0.0;
        }
        return Objects.requireNonNullElse(map.get(date), 0.0);
    }
}
