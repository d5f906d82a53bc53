package de.zeus.planner.service;

import de.zeus.planner.config.BatteryProperties;
import de.zeus.planner.config.PlannerProperties;
import de.zeus.planner.model.Slot;
import de.zeus.planner.model.WindowDecision;
import de.zeus.planner.util.SlotUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

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
 * Marks cheap slots. The threshold starts at a price percentile plus tolerance and is widened
 * when the baseline window cannot deliver the energy needed to reach the charge target.
 */
@Service
public class WindowIdentificationService {

    private static final Logger logger = LoggerFactory.getLogger(WindowIdentificationService.class);

    /** Lifts the expanded threshold just above the N-th cheapest price so that slot is included. */
    private static final double THRESHOLD_EPSILON = 0.0001;

    public WindowDecision identify(List<Slot> slots, PlannerProperties properties, double currentKwh, ZonedDateTime now) {
        if (slots.isEmpty()) {
            return WindowDecision.empty();
        }
        PlannerProperties.ChargingStrategy strategy = properties.getChargingStrategy();
        BatteryProperties battery = properties.getBattery();

        List<Double> prices = new ArrayList<>(slots.size());
        slots.forEach(slot -> prices.add(slot.getImportPrice()));
        double quantile = SlotUtils.percentile(prices, strategy.getChargeThresholdPercentile());
        double highestBelowQuantile = prices.stream().filter(p -> p <= quantile)
                .mapToDouble(Double::doubleValue).max().orElse(quantile);
        double baseline = highestBelowQuantile + strategy.getCheapPriceTolerance() + strategy.getPriceSmoothing();

        double targetPercent = resolveTargetPercent(properties);
        double deficit = Math.max(0.0, targetPercent / 100.0 * battery.getCapacityKwh() - currentKwh);
        double slotKwh = battery.getMaxChargePowerKw() * SlotUtils.SLOT_HOURS;

        List<Double> futurePrices = new ArrayList<>();
        for (Slot slot : slots) {
            if (!slot.getStart().isBefore(now)) {
                futurePrices.add(slot.getImportPrice());
            }
        }
        futurePrices.sort(Double::compare);
        long baselineCount = futurePrices.stream().filter(p -> p <= baseline).count();
        double baselineCapacity = baselineCount * slotKwh;

        double threshold = baseline;
        boolean expanded = false;
        if (!properties.getSystem().isHasBattery()) {
            logger.debug("No battery configured, cheap window stays at baseline threshold");
        } else if (deficit > baselineCapacity && slotKwh > 0 && !futurePrices.isEmpty()) {
            int needed = (int) Math.ceil(deficit / slotKwh);
            double nthPrice = futurePrices.get(Math.min(futurePrices.size() - 1, needed - 1));
            threshold = Math.max(baseline, nthPrice + THRESHOLD_EPSILON);
            expanded = threshold > baseline;
            logger.info("Cheap window expanded to {} for {} slots (deficit {} kWh, baseline covers {} kWh)",
                    SlotUtils.round4(threshold), needed, SlotUtils.round2(deficit), SlotUtils.round2(baselineCapacity));
        }

        int cheap = 0;
        for (Slot slot : slots) {
            slot.setCheap(slot.getImportPrice() <= threshold);
            if (slot.isCheap()) {
                cheap++;
            }
        }
        logger.info("Cheap threshold {} (percentile {}), {} of {} slots cheap",
                SlotUtils.round4(threshold), SlotUtils.round4(quantile), cheap, slots.size());
        return new WindowDecision(quantile, baseline, threshold, expanded, deficit, baselineCapacity,
                cheap, slots.size() - cheap);
    }

    private static double resolveTargetPercent(PlannerProperties properties) {
        Double manual = properties.getManualPlanning().getChargeTargetPercent();
        if (manual != null) {
            return manual;
        }
        Double strategy = properties.getChargingStrategy().getTargetSocPercent();
        if (strategy != null) {
            return strategy;
        }
        return properties.getBattery().getMaxSocPercent();
    }
}
