package de.zeus.planner.service;

import de.zeus.planner.config.PlannerProperties;
import de.zeus.planner.model.ForecastSlot;
import de.zeus.planner.model.LearningOverlay;
import de.zeus.planner.model.PlannerInput;
import de.zeus.planner.model.PriceSlot;
import de.zeus.planner.model.Slot;
import de.zeus.planner.util.SlotUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

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
 * Builds the slot series of a run from the price and forecast feeds.
 * <p>
 * This is the only place where absent values are resolved:
 * <ul>
 *     <li>export price missing: import price (intended, tariffs without export price)</li>
 *     <li>import price missing: nearest earlier price, else nearest later one (degraded)</li>
 *     <li>PV missing: 0</li>
 *     <li>load missing: previous load, else 0</li>
 *     <li>forecast bands missing: stay {@code null}</li>
 * </ul>
 */
@Service
public class DataPreparationService {

    private static final Logger logger = LoggerFactory.getLogger(DataPreparationService.class);

    private static final Duration SLOT_DURATION = Duration.ofMinutes(SlotUtils.SLOT_MINUTES);

    /**
     * Left-joins forecasts onto prices. Returns an empty list for empty input.
     */
    public List<Slot> prepare(PlannerInput input, ZoneId zone) {
        Map<Instant, PriceEntry> prices = indexPrices(input.getPriceData(), zone);
        Map<Instant, ForecastSlot> forecasts = indexForecasts(input.getForecastData(), zone);

        List<Slot> slots = new ArrayList<>(prices.size());
        int filledImport = 0;
        int missingForecast = 0;
        Double lastImport = null;
        Double lastLoad = null;

        for (Map.Entry<Instant, PriceEntry> entry : prices.entrySet()) {
            PriceEntry price = entry.getValue();
            Slot slot = new Slot();
            slot.setStart(price.start);
            slot.setEnd(price.end);

            Double importPrice = price.source.getImportPrice();
            if (importPrice == null) {
                filledImport++;
                importPrice = lastImport;
            } else {
                lastImport = importPrice;
            }
            slot.setImportPrice(importPrice != null ? importPrice : Double.NaN);

            ForecastSlot forecast = forecasts.get(entry.getKey());
            if (forecast == null) {
                missingForecast++;
            }
            Double pv = forecast != null ? forecast.getPvKwh() : null;
            Double load = forecast != null ? forecast.getLoadKwh() : null;
            if (load != null) {
                lastLoad = Math.max(0.0, load);
            }
            slot.setPvForecastKwh(pv != null ? Math.max(0.0, pv) : 0.0);
            slot.setLoadForecastKwh(load != null ? Math.max(0.0, load) : (lastLoad != null ? lastLoad : 0.0));
            slot.setAdjustedPvKwh(slot.getPvForecastKwh());
            slot.setAdjustedLoadKwh(slot.getLoadForecastKwh());
            if (forecast != null) {
                slot.setPvP10(forecast.getPvP10());
                slot.setPvP90(forecast.getPvP90());
                slot.setLoadP10(forecast.getLoadP10());
                slot.setLoadP90(forecast.getLoadP90());
            }
            slots.add(slot);
        }

        backfillImportPrices(slots);
        for (Slot slot : slots) {
            Double exportPrice = prices.get(slot.getStart().toInstant()).source.getExportPrice();
            slot.setExportPrice(exportPrice != null ? exportPrice : slot.getImportPrice());
        }

        if (filledImport > 0) {
            logger.warn("{} slot(s) without import price, filled from neighbouring slots", filledImport);
        }
        if (missingForecast > 0) {
            logger.warn("{} slot(s) without forecast, using PV=0 and the previous load", missingForecast);
        }
        logGaps(slots);
        logger.debug("Prepared {} slots in zone {}", slots.size(), zone);
        return slots;
    }

    /**
     * PV confidence, load margin and per-hour learning bias. Adjusted values never go negative.
     */
    public void applySafetyMargins(List<Slot> slots, PlannerProperties properties, LearningOverlay overlay,
                                   double loadMargin) {
        double pvConfidence = properties.getForecasting().getPvConfidencePercent() / 100.0;
        List<Double> pvBias = usableOverlay(overlay != null ? overlay.getPvAdjustment() : null, "PV");
        List<Double> loadBias = usableOverlay(overlay != null ? overlay.getLoadAdjustment() : null, "load");

        for (Slot slot : slots) {
            int hour = slot.getStart().getHour();
            double pv = slot.getPvForecastKwh() * pvConfidence;
            double load = slot.getLoadForecastKwh() * loadMargin;
            if (pvBias != null) {
                pv += valueOrZero(pvBias.get(hour));
            }
            if (loadBias != null) {
                load += valueOrZero(loadBias.get(hour));
            }
            slot.setAdjustedPvKwh(Math.max(0.0, pv));
            slot.setAdjustedLoadKwh(Math.max(0.0, load));
        }
    }

    /**
     * Baseline mode: optimizer sees the raw forecasts.
     */
    public void useRawForecasts(List<Slot> slots) {
        for (Slot slot : slots) {
            slot.setAdjustedPvKwh(slot.getPvForecastKwh());
            slot.setAdjustedLoadKwh(slot.getLoadForecastKwh());
        }
    }

    public void zeroPv(List<Slot> slots) {
        for (Slot slot : slots) {
            slot.setPvForecastKwh(0.0);
            slot.setAdjustedPvKwh(0.0);
            slot.setPvP10(null);
            slot.setPvP90(null);
        }
    }

    private Map<Instant, PriceEntry> indexPrices(List<PriceSlot> priceData, ZoneId zone) {
        Map<Instant, PriceEntry> index = new TreeMap<>();
        if (priceData == null) {
            return index;
        }
        for (PriceSlot price : priceData) {
            if (price == null) {
                continue;
            }
            ZonedDateTime start;
            try {
                start = SlotUtils.parseTimestamp(price.getStart(), zone);
            } catch (DateTimeParseException ex) {
                logger.warn("Skipping price entry with invalid start '{}': {}", price.getStart(), ex.getMessage());
                continue;
            }
            ZonedDateTime end = start.plus(SLOT_DURATION);
            if (price.getEnd() != null) {
                try {
                    end = SlotUtils.parseTimestamp(price.getEnd(), zone);
                } catch (DateTimeParseException ex) {
                    logger.warn("Invalid end '{}' for slot {}, assuming {} minutes", price.getEnd(), start, SlotUtils.SLOT_MINUTES);
                }
            }
            if (index.put(start.toInstant(), new PriceEntry(start, end, price)) != null) {
                logger.warn("Duplicate price slot {}, keeping the last one", start);
            }
        }
        return index;
    }

    private Map<Instant, ForecastSlot> indexForecasts(List<ForecastSlot> forecastData, ZoneId zone) {
        Map<Instant, ForecastSlot> index = new TreeMap<>();
        if (forecastData == null) {
            return index;
        }
        for (ForecastSlot forecast : forecastData) {
            if (forecast == null) {
                continue;
            }
            try {
                index.put(SlotUtils.parseTimestamp(forecast.getStart(), zone).toInstant(), forecast);
            } catch (DateTimeParseException ex) {
                logger.warn("Skipping forecast entry with invalid start '{}': {}", forecast.getStart(), ex.getMessage());
            }
        }
        return index;
    }

    /**
     * Leading slots without import price take the first known price. If the feed has no
     * price at all the slots are priced 0.
     */
    private void backfillImportPrices(List<Slot> slots) {
        Double next = null;
        for (int i = slots.size() - 1; i >= 0; i--) {
            Slot slot = slots.get(i);
            if (Double.isNaN(slot.getImportPrice())) {
                if (next == null) {
                    logger.warn("No import price known for {} and later, pricing at 0", slot.getStart());
                }
                slot.setImportPrice(next != null ? next : 0.0);
            } else {
                next = slot.getImportPrice();
            }
        }
    }

    private void logGaps(List<Slot> slots) {
        for (int i = 1; i < slots.size(); i++) {
            ZonedDateTime previous = slots.get(i - 1).getStart();
            ZonedDateTime current = slots.get(i).getStart();
            if (!Duration.between(previous, current).equals(SLOT_DURATION)) {
                logger.warn("Slot series is not contiguous between {} and {}", previous, current);
            }
        }
    }

    private List<Double> usableOverlay(List<Double> values, String name) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        if (values.size() != LearningOverlay.HOURS_PER_DAY) {
            logger.warn("Ignoring {} learning overlay with {} entries (expected {})", name, values.size(), LearningOverlay.HOURS_PER_DAY);
            return null;
        }
        return values;
    }

    private static double valueOrZero(Double value) {
        return value != null ? value : 0.0;
    }

    private static final class PriceEntry {
        private final ZonedDateTime start;
        private final ZonedDateTime end;
        private final PriceSlot source;

        private PriceEntry(ZonedDateTime start, ZonedDateTime end, PriceSlot source) {
            this.start = start;
            this.end = end;
            this.source = source;
        }
    }
}
