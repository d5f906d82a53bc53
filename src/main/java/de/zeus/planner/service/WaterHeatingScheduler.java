package de.zeus.planner.service;

import de.zeus.planner.config.PlannerProperties;
import de.zeus.planner.config.WaterHeatingProperties;
import de.zeus.planner.model.InitialState;
import de.zeus.planner.model.Slot;
import de.zeus.planner.model.WaterDayPlan;
import de.zeus.planner.model.WaterSchedule;
import de.zeus.planner.model.WaterSegment;
import de.zeus.planner.util.SlotUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
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
 * Places water heating into cheap slots before the optimizer runs.
 * <p>
 * Per local day the outstanding energy is turned into a slot count, filled from the cheapest
 * segments of cheap slots, then consolidated into at most {@code maxBlocksPerDay} blocks.
 * Slots at or before "now" are never scheduled. In vacation mode only the periodic
 * anti-legionella cycle is planned.
 */
@Service
public class WaterHeatingScheduler {

    private static final Logger logger = LoggerFactory.getLogger(WaterHeatingScheduler.class);

    /** Energy already heated today that counts as a finished anti-legionella cycle when no run is recorded. */
    static final double ANTI_LEGIONELLA_DONE_KWH = 2.0;

    /** Anti-legionella cycles are only started in the afternoon. */
    static final int ANTI_LEGIONELLA_EARLIEST_HOUR = 14;

    private static final long NO_PREVIOUS_CYCLE_DAYS = 999;
    private static final double SLOT_ROUNDING_EPSILON = 1e-9;
    private static final int MAX_PLAN_DAYS_AHEAD = 1;

    public WaterSchedule schedule(List<Slot> slots, PlannerProperties properties, ZonedDateTime now, InitialState state) {
        WaterHeatingProperties water = properties.getWaterHeating();
        if (!properties.getSystem().isHasWaterHeater() || water.getPowerKw() <= 0) {
            logger.debug("Water heating disabled (no heater or power 0)");
            return WaterSchedule.disabled();
        }
        InitialState initial = state != null ? state : new InitialState();
        double slotEnergy = water.getPowerKw() * SlotUtils.SLOT_HOURS;
        Set<Integer> taken = new HashSet<>();

        boolean vacation = water.getVacationMode().isEnabled() || initial.isVacationMode();
        if (vacation) {
            return scheduleAntiLegionella(slots, water, now, initial, slotEnergy, taken);
        }

        ZoneId zone = now.getZone();
        LocalDate today = now.toLocalDate();
        int daysAhead = (int) SlotUtils.clamp(water.getPlanDaysAhead(), 0, MAX_PLAN_DAYS_AHEAD);
        List<WaterDayPlan> days = new ArrayList<>();

        for (int offset = 0; offset <= daysAhead; offset++) {
            LocalDate date = today.plusDays(offset);
            List<Integer> dayIndices = indicesOn(slots, date);
            if (offset > 0 && !hasFullDay(dayIndices, date, zone)) {
                logger.info("Prices for {} incomplete ({} slots), water heating not planned for that day", date, dayIndices.size());
                continue;
            }

            double requirement = dailyRequirement(water);
            double consumed = offset == 0 ? initial.getWaterHeatedTodayKwh() : 0.0;
            double outstanding = Math.max(0.0, requirement - consumed);
            int requiredSlots = (int) Math.ceil(outstanding / slotEnergy - SLOT_ROUNDING_EPSILON);
            if (requiredSlots <= 0) {
                days.add(new WaterDayPlan(date, requirement, consumed, 0, 0, 0, 0, false));
                continue;
            }

            List<Integer> candidates = new ArrayList<>();
            for (int i : dayIndices) {
                Slot slot = slots.get(i);
                if (slot.isCheap() && slot.getStart().isAfter(now) && !taken.contains(i)) {
                    candidates.add(i);
                }
            }
            List<Integer> selected = selectFromSegments(slots, candidates, requiredSlots, water);
            List<List<Integer>> blocks = consolidate(slots, selected, requiredSlots, water);
            List<Integer> scheduled = new ArrayList<>();
            blocks.forEach(scheduled::addAll);

            int deferred = 0;
            if (offset == 0 && scheduled.size() < requiredSlots && water.getDeferUpToHours() > 0) {
                List<Integer> deferredSlots = deferToTomorrow(slots, date, zone, now, water, taken,
                        requiredSlots - scheduled.size());
                deferred = deferredSlots.size();
                markHeating(slots, deferredSlots, water.getPowerKw(), taken);
            }
            markHeating(slots, scheduled, water.getPowerKw(), taken);

            boolean shortfall = scheduled.size() + deferred < requiredSlots;
            if (shortfall) {
                logger.warn("Water heating for {} short by {} slot(s): not enough cheap future slots",
                        date, requiredSlots - scheduled.size() - deferred);
            }
            days.add(new WaterDayPlan(date, requirement, consumed, requiredSlots, scheduled.size(), deferred,
                    blocks.size(), shortfall));
        }

        double scheduledKwh = taken.size() * slotEnergy;
        logger.info("Water heating: {} slot(s), {} kWh over {} day(s)", taken.size(), SlotUtils.round2(scheduledKwh), days.size());
        return new WaterSchedule(true, false, false, scheduledKwh, days);
    }

    /**
     * Groups cheap slots (sorted by time) into segments. A slot joins the running segment when
     * it starts at most {@code maxGap} slots after the previous one and the segment's price
     * span stays within {@code tolerance}.
     */
    List<WaterSegment> buildSegments(List<Slot> cheapByTime, int maxGap, double tolerance) {
        List<WaterSegment> segments = new ArrayList<>();
        Duration maxStep = Duration.ofMinutes((long) (Math.max(0, maxGap) + 1) * SlotUtils.SLOT_MINUTES);
        List<Slot> current = new ArrayList<>();
        double low = 0.0;
        double high = 0.0;
        for (Slot slot : cheapByTime) {
            double price = slot.getImportPrice();
            if (!current.isEmpty()) {
                Slot previous = current.get(current.size() - 1);
                boolean close = Duration.between(previous.getStart(), slot.getStart()).compareTo(maxStep) <= 0;
                boolean flat = Math.max(high, price) - Math.min(low, price) <= tolerance + SLOT_ROUNDING_EPSILON;
                if (!close || !flat) {
                    segments.add(toSegment(current));
                    current = new ArrayList<>();
                }
            }
            if (current.isEmpty()) {
                low = price;
                high = price;
            } else {
                low = Math.min(low, price);
                high = Math.max(high, price);
            }
            current.add(slot);
        }
        if (!current.isEmpty()) {
            segments.add(toSegment(current));
        }
        return segments;
    }

    private List<Integer> selectFromSegments(List<Slot> slots, List<Integer> candidates, int required,
                                             WaterHeatingProperties water) {
        if (candidates.size() <= required) {
            return new ArrayList<>(candidates);
        }
        List<Slot> cheapByTime = new ArrayList<>();
        candidates.forEach(i -> cheapByTime.add(slots.get(i)));
        List<WaterSegment> segments = buildSegments(cheapByTime, water.getConsolidationMaxGapSlots(),
                water.getBlockConsolidationTolerance());
        segments.sort(Comparator.comparingDouble(WaterSegment::averagePrice)
                .thenComparing(segment -> segment.first().getStart()));

        TreeSet<Integer> selected = new TreeSet<>();
        for (WaterSegment segment : segments) {
            for (Slot slot : segment.slots()) {
                if (selected.size() >= required) {
                    break;
                }
                selected.add(candidates.get(cheapByTime.indexOf(slot)));
            }
            if (selected.size() >= required) {
                break;
            }
        }
        return new ArrayList<>(selected);
    }

    /**
     * Merges the block pair that is cheapest to bridge until the block limit holds, then keeps
     * the cheapest contiguous run inside each merged block so the total matches the required
     * slot count.
     */
    private List<List<Integer>> consolidate(List<Slot> slots, List<Integer> selected, int required,
                                            WaterHeatingProperties water) {
        List<List<Integer>> blocks = SlotUtils.groupIntoBlocks(selected, water.getConsolidationMaxGapSlots());
        int maxBlocks = water.getMaxBlocksPerDay();
        if (maxBlocks <= 0) {
            return blocks;
        }
        while (blocks.size() > maxBlocks) {
            int best = 0;
            double bestCost = Double.MAX_VALUE;
            for (int b = 0; b + 1 < blocks.size(); b++) {
                double cost = bridgeCost(slots, blocks.get(b), blocks.get(b + 1));
                if (cost < bestCost) {
                    bestCost = cost;
                    best = b;
                }
            }
            List<Integer> left = blocks.get(best);
            List<Integer> right = blocks.remove(best + 1);
            for (int i = left.get(left.size() - 1) + 1; i < right.get(0); i++) {
                left.add(i);
            }
            left.addAll(right);
        }

        int count = blocks.stream().mapToInt(List::size).sum();
        if (count <= required) {
            return blocks;
        }
        return cheapestRuns(slots, blocks, required);
    }

    /**
     * Splits {@code required} slots over the blocks so that the sum of the cheapest run of each
     * block's share is minimal. Equal costs keep the earlier run.
     */
    static List<List<Integer>> cheapestRuns(List<Slot> slots, List<List<Integer>> blocks, int required) {
        int blockCount = blocks.size();
        double[][] runCost = new double[blockCount][];
        int[][] runStart = new int[blockCount][];
        for (int b = 0; b < blockCount; b++) {
            List<Integer> block = blocks.get(b);
            int maxLength = Math.min(block.size(), required);
            runCost[b] = new double[maxLength + 1];
            runStart[b] = new int[maxLength + 1];
            for (int length = 1; length <= maxLength; length++) {
                double window = 0.0;
                for (int i = 0; i < length; i++) {
                    window += slots.get(block.get(i)).getImportPrice();
                }
                double cheapest = window;
                int cheapestStart = 0;
                for (int start = 1; start + length <= block.size(); start++) {
                    window += slots.get(block.get(start + length - 1)).getImportPrice()
                            - slots.get(block.get(start - 1)).getImportPrice();
                    if (window < cheapest - SLOT_ROUNDING_EPSILON) {
                        cheapest = window;
                        cheapestStart = start;
                    }
                }
                runCost[b][length] = cheapest;
                runStart[b][length] = cheapestStart;
            }
        }

        // cost[b][k]: cheapest way to keep k slots in the first b blocks
        double[][] cost = new double[blockCount + 1][required + 1];
        int[][] share = new int[blockCount + 1][required + 1];
        for (double[] row : cost) {
            Arrays.fill(row, Double.MAX_VALUE);
        }
        cost[0][0] = 0.0;
        for (int b = 0; b < blockCount; b++) {
            for (int kept = 0; kept <= required; kept++) {
                if (cost[b][kept] == Double.MAX_VALUE) {
                    continue;
                }
                for (int length = 0; length < runCost[b].length && kept + length <= required; length++) {
                    double total = cost[b][kept] + runCost[b][length];
                    if (total < cost[b + 1][kept + length] - SLOT_ROUNDING_EPSILON) {
                        cost[b + 1][kept + length] = total;
                        share[b + 1][kept + length] = length;
                    }
                }
            }
        }

        List<List<Integer>> runs = new ArrayList<>();
        int remaining = required;
        for (int b = blockCount; b > 0; b--) {
            int length = share[b][remaining];
            if (length > 0) {
                int start = runStart[b - 1][length];
                runs.add(0, new ArrayList<>(blocks.get(b - 1).subList(start, start + length)));
            }
            remaining -= length;
        }
        return runs;
    }

    private static double bridgeCost(List<Slot> slots, List<Integer> left, List<Integer> right) {
        double cost = 0.0;
        for (int i = left.get(left.size() - 1) + 1; i < right.get(0); i++) {
            cost += slots.get(i).getImportPrice();
        }
        return cost;
    }

    private List<Integer> deferToTomorrow(List<Slot> slots, LocalDate today, ZoneId zone, ZonedDateTime now,
                                          WaterHeatingProperties water, Set<Integer> taken, int missing) {
        LocalDate tomorrow = today.plusDays(1);
        List<Integer> tomorrowIndices = indicesOn(slots, tomorrow);
        if (!hasFullDay(tomorrowIndices, tomorrow, zone)) {
            logger.debug("Tomorrow's prices incomplete, water heating shortfall cannot be deferred");
            return List.of();
        }
        ZonedDateTime windowStart = tomorrow.atStartOfDay(zone);
        ZonedDateTime windowEnd = windowStart.plusMinutes(Math.round(water.getDeferUpToHours() * 60));
        List<Integer> deferred = new ArrayList<>();
        for (int i : tomorrowIndices) {
            if (deferred.size() >= missing) {
                break;
            }
            Slot slot = slots.get(i);
            if (slot.isCheap() && slot.getStart().isAfter(now) && !taken.contains(i)
                    && !slot.getStart().isBefore(windowStart) && slot.getStart().isBefore(windowEnd)) {
                deferred.add(i);
            }
        }
        if (!deferred.isEmpty()) {
            logger.info("Deferred {} water heating slot(s) into the first {} h of {}", deferred.size(),
                    water.getDeferUpToHours(), tomorrow);
        }
        return deferred;
    }

    private WaterSchedule scheduleAntiLegionella(List<Slot> slots, WaterHeatingProperties water, ZonedDateTime now,
                                                 InitialState state, double slotEnergy, Set<Integer> taken) {
        WaterHeatingProperties.VacationMode vacation = water.getVacationMode();
        ZonedDateTime last = state.getLastAntiLegionellaAt();
        if (last == null && state.getWaterHeatedTodayKwh() >= ANTI_LEGIONELLA_DONE_KWH) {
            last = now;
        }
        long daysSince = last == null ? NO_PREVIOUS_CYCLE_DAYS : Duration.between(last, now).toDays();
        boolean due = daysSince >= vacation.getAntiLegionellaIntervalDays() - 1L
                && now.getHour() >= ANTI_LEGIONELLA_EARLIEST_HOUR;
        if (!due) {
            logger.info("Vacation mode: comfort heating off, anti-legionella not due ({} day(s) since last cycle)", daysSince);
            return new WaterSchedule(true, true, false, 0.0, List.of());
        }

        double requiredKwh = vacation.getAntiLegionellaDurationHours() * water.getPowerKw();
        int requiredSlots = (int) Math.ceil(requiredKwh / slotEnergy - SLOT_ROUNDING_EPSILON);
        ZonedDateTime windowEnd = now.plusHours(24);

        List<Integer> window = new ArrayList<>();
        List<Integer> cheap = new ArrayList<>();
        for (int i = 0; i < slots.size(); i++) {
            Slot slot = slots.get(i);
            if (slot.getStart().isAfter(now) && slot.getStart().isBefore(windowEnd)) {
                window.add(i);
                if (slot.isCheap()) {
                    cheap.add(i);
                }
            }
        }
        List<Integer> pool = cheap.size() >= requiredSlots ? cheap : window;
        Comparator<Integer> byPrice = Comparator.comparingDouble((Integer i) -> slots.get(i).getImportPrice())
                .thenComparing(i -> slots.get(i).getStart());
        List<Integer> chosen = pool.stream().sorted(byPrice).limit(requiredSlots).sorted()
                .collect(Collectors.toList());
        markHeating(slots, chosen, water.getPowerKw(), taken);

        boolean scheduled = !chosen.isEmpty();
        if (chosen.size() < requiredSlots) {
            logger.warn("Anti-legionella cycle needs {} slot(s) but only {} are available in the next 24 h",
                    requiredSlots, chosen.size());
        } else {
            logger.info("Vacation mode: anti-legionella cycle scheduled in {} slot(s)", chosen.size());
        }
        WaterDayPlan day = new WaterDayPlan(now.toLocalDate(), requiredKwh, state.getWaterHeatedTodayKwh(),
                requiredSlots, chosen.size(), 0, SlotUtils.groupIntoBlocks(chosen, 0).size(),
                chosen.size() < requiredSlots);
        return new WaterSchedule(true, true, scheduled, chosen.size() * slotEnergy, List.of(day));
    }

    private static double dailyRequirement(WaterHeatingProperties water) {
        double byEnergy = water.getMinKwhPerDay() != null
                ? water.getMinKwhPerDay()
                : water.getPowerKw() * water.getMinHoursPerDay();
        return Math.max(byEnergy, water.getPowerKw() * water.getMinHoursPerDay());
    }

    private static void markHeating(List<Slot> slots, List<Integer> indices, double powerKw, Set<Integer> taken) {
        for (int i : indices) {
            slots.get(i).setWaterHeatingKw(powerKw);
            taken.add(i);
        }
    }

    private static List<Integer> indicesOn(List<Slot> slots, LocalDate date) {
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < slots.size(); i++) {
            if (slots.get(i).getStart().toLocalDate().equals(date)) {
                indices.add(i);
            }
        }
        return indices;
    }

    /**
     * A day counts as priced when it has a slot for every quarter hour of its local length,
     * so 23 and 25 hour days are handled.
     */
    private static boolean hasFullDay(List<Integer> dayIndices, LocalDate date, ZoneId zone) {
        long minutes = Duration.between(date.atStartOfDay(zone), date.plusDays(1).atStartOfDay(zone)).toMinutes();
        return dayIndices.size() >= minutes / SlotUtils.SLOT_MINUTES;
    }

    private static WaterSegment toSegment(List<Slot> slots) {
        double average = slots.stream().mapToDouble(Slot::getImportPrice).average().orElse(0.0);
        return new WaterSegment(List.copyOf(slots), average);
    }
}
