package de.zeus.planner.util;

import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SlotUtilsTest {

    private static final ZoneId ZONE = ZoneId.of("Europe/Stockholm");

    @Test
    void parseTimestamp_convertsOffsetValuesIntoZone() {
        ZonedDateTime parsed = SlotUtils.parseTimestamp("2025-01-15T10:00:00Z", ZONE);
        assertEquals(11, parsed.getHour());
        assertEquals(ZONE, parsed.getZone());
    }

    @Test
    void parseTimestamp_ambiguousLocalTimeTakesSummerOffset() {
        ZonedDateTime parsed = SlotUtils.parseTimestamp("2025-10-26 02:30:00", ZONE);
        assertEquals(ZoneOffset.ofHours(2), parsed.getOffset(), "Overlap should resolve to the earlier offset");
    }

    @Test
    void parseTimestamp_shiftsTimeInsideSpringGap() {
        ZonedDateTime parsed = SlotUtils.parseTimestamp("2025-03-30T02:30:00", ZONE);
        assertEquals(3, parsed.getHour());
        assertEquals(30, parsed.getMinute());
    }

    @Test
    void parseTimestamp_rejectsBlankAndGarbage() {
        assertThrows(DateTimeParseException.class, () -> SlotUtils.parseTimestamp(" ", ZONE));
        assertThrows(DateTimeParseException.class, () -> SlotUtils.parseTimestamp("tomorrow", ZONE));
    }

    @Test
    void floorToSlot_dropsToQuarterHour() {
        ZonedDateTime time = ZonedDateTime.of(2025, 1, 15, 10, 44, 59, 0, ZONE);
        assertEquals(ZonedDateTime.of(2025, 1, 15, 10, 30, 0, 0, ZONE), SlotUtils.floorToSlot(time));
    }

    @Test
    void percentile_interpolatesLinearly() {
        assertEquals(0.605, SlotUtils.percentile(List.of(2.0, 0.5, 0.6, 0.7, 0.8, 1.0, 1.2, 1.5), 15), 1e-9);
        assertEquals(3.0, SlotUtils.percentile(List.of(1.0, 5.0), 50), 1e-9);
        assertTrue(Double.isNaN(SlotUtils.percentile(List.of(), 50)));
    }

    @Test
    void groupIntoBlocks_respectsAllowedGap() {
        List<Integer> indices = List.of(1, 2, 4, 8, 9);
        assertEquals(List.of(List.of(1, 2), List.of(4), List.of(8, 9)), SlotUtils.groupIntoBlocks(indices, 0));
        assertEquals(List.of(List.of(1, 2, 4), List.of(8, 9)), SlotUtils.groupIntoBlocks(indices, 1));
    }
}
