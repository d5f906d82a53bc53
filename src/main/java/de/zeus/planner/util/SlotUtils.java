package de.zeus.planner.util;

import de.zeus.planner.model.Slot;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
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
 * Stateless helpers shared by the planning stages: time handling, price statistics
 * and index grouping.
 */
public final class SlotUtils {

    public static final int SLOT_MINUTES = 15;
    public static final double SLOT_HOURS = SLOT_MINUTES / 60.0;

    private SlotUtils() {
    }

    /**
     * Parses an ISO-8601 timestamp and moves it into {@code zone}.
     * <p>
     * Values with offset or zone keep their instant. Local values are placed in {@code zone}:
     * an ambiguous time during the autumn overlap resolves to the earlier (daylight saving)
     * offset, a time inside the spring gap is shifted forward by the gap length.
     *
     * @throws DateTimeParseException if the text is not an ISO date-time
     */
    public static ZonedDateTime parseTimestamp(String text, ZoneId zone) {
        if (text == null || text.isBlank()) {
            throw new DateTimeParseException("Empty timestamp", String.valueOf(text), 0);
        }
        String normalized = text.trim().replace(' ', 'T');
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(normalized,
                ZonedDateTime::from, LocalDateTime::from);
        if (parsed instanceof ZonedDateTime) {
            return ((ZonedDateTime) parsed).withZoneSameInstant(zone);
        }
        return ZonedDateTime.ofLocal((LocalDateTime) parsed, zone, null);
    }

    /**
     * Floors a time to the start of its 15-minute slot.
     */
    public static ZonedDateTime floorToSlot(ZonedDateTime time) {
        ZonedDateTime truncated = time.truncatedTo(ChronoUnit.MINUTES);
        return truncated.minusMinutes(truncated.getMinute() % SLOT_MINUTES);
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     *
     * @param percentile 0..100
     */
    public static double percentile(Collection<Double> values, double percentile) {
        if (values.isEmpty()) {
            return Double.NaN;
        }
        List<Double> sorted = new ArrayList<>(values);
        sorted.sort(Double::compare);
        double clamped = Math.max(0.0, Math.min(100.0, percentile));
        double position = clamped / 100.0 * (sorted.size() - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double fraction = position - lower;
        return sorted.get(lower) + (sorted.get(upper) - sorted.get(lower)) * fraction;
    }

    public static double averageImportPrice(List<Slot> slots) {
        return slots.stream().mapToDouble(Slot::getImportPrice).average().orElse(0.0);
    }

    /**
     * Groups ascending indices into blocks; indices at most {@code maxGap} positions apart
     * still belong to the same block.
     */
    public static List<List<Integer>> groupIntoBlocks(List<Integer> indices, int maxGap) {
        List<List<Integer>> blocks = new ArrayList<>();
        List<Integer> current = new ArrayList<>();
        for (Integer index : indices) {
            if (!current.isEmpty() && index > current.get(current.size() - 1) + maxGap + 1) {
                blocks.add(current);
                current = new ArrayList<>();
            }
            current.add(index);
        }
        if (!current.isEmpty()) {
            blocks.add(current);
        }
        return blocks;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    public static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
