package de.zeus.planner.service;

import de.zeus.planner.PlannerTestData;
import de.zeus.planner.config.PlannerProperties;
import de.zeus.planner.model.ManualAction;
import de.zeus.planner.model.ManualPlanEntry;
import de.zeus.planner.model.Slot;
import de.zeus.planner.model.SlotAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.ZonedDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ManualPlanServiceTest {

    private ManualPlanService service;
    private PlannerProperties properties;
    private ZonedDateTime now;
    private List<Slot> slots;

    @BeforeEach
    void setUp() {
        service = new ManualPlanService();
        properties = PlannerTestData.properties();
        now = PlannerTestData.at(2025, 1, 15, 10, 0);
        slots = PlannerTestData.flatSlots(now.minusMinutes(30), 10, 1.0);
        slots.forEach(s -> s.setAction(SlotAction.HOLD));
    }

    @Test
    void apply_chargeOverrideSetsPowerAndKeepsPlannedAction() {
        ManualPlanEntry entry = new ManualPlanEntry("item-1", "Charge", "2025-01-15T10:00:00", "2025-01-15T10:30:00");

        int applied = service.apply(slots, List.of(entry), properties, PlannerTestData.ZONE, now);

        assertEquals(1, applied);
        assertEquals(ManualAction.CHARGE, slots.get(2).getManualAction());
        assertEquals(5.0, slots.get(3).getChargeKw(), 1e-9);
        assertNull(slots.get(4).getManualAction(), "End is exclusive");
        assertEquals(SlotAction.HOLD, slots.get(2).getAction());
    }

    @Test
    void apply_neverTouchesHistoricalSlots() {
        ManualPlanEntry entry = new ManualPlanEntry("item-1", "Export", "2025-01-15T09:00:00", "2025-01-15T10:15:00");

        service.apply(slots, List.of(entry), properties, PlannerTestData.ZONE, now);

        assertNull(slots.get(0).getManualAction());
        assertNull(slots.get(1).getManualAction());
        assertEquals(ManualAction.EXPORT, slots.get(2).getManualAction());
    }

    @Test
    void apply_infersActionFromIdAndGroup() {
        ManualPlanEntry water = new ManualPlanEntry("water-block-7", null, "2025-01-15T10:00:00", "2025-01-15T10:15:00");
        ManualPlanEntry battery = new ManualPlanEntry("item-9", null, "2025-01-15T10:15:00", "2025-01-15T10:30:00");
        battery.setGroup("battery");

        service.apply(slots, List.of(water, battery), properties, PlannerTestData.ZONE, now);

        assertEquals(ManualAction.WATER_HEATING, slots.get(2).getManualAction());
        assertEquals(3.0, slots.get(2).getWaterHeatingKw(), 1e-9);
        assertEquals(ManualAction.CHARGE, slots.get(3).getManualAction());
    }

    @Test
    void apply_skipsDecorationsAndBrokenEntries() {
        ManualPlanEntry background = new ManualPlanEntry("bg", "Charge", "2025-01-15T10:00:00", "2025-01-15T12:00:00");
        background.setType("background");
        ManualPlanEntry spacer = new ManualPlanEntry("lane-spacer-1", "Hold", "2025-01-15T10:00:00", "2025-01-15T12:00:00");
        ManualPlanEntry noEnd = new ManualPlanEntry("item-2", "Hold", "2025-01-15T10:00:00", null);
        ManualPlanEntry unknown = new ManualPlanEntry("item-3", "dance", "2025-01-15T10:00:00", "2025-01-15T12:00:00");

        int applied = service.apply(slots, List.of(background, spacer, noEnd, unknown), properties, PlannerTestData.ZONE, now);

        assertEquals(0, applied);
        assertTrue(slots.stream().allMatch(s -> s.getManualAction() == null));
    }

    @Test
    void apply_laterEntryWinsOnOverlap() {
        ManualPlanEntry hold = new ManualPlanEntry("a", "Hold", "2025-01-15T10:00:00", "2025-01-15T11:00:00");
        ManualPlanEntry export = new ManualPlanEntry("b", "Export", "2025-01-15T10:15:00", "2025-01-15T10:30:00");

        service.apply(slots, List.of(hold, export), properties, PlannerTestData.ZONE, now);

        assertEquals(ManualAction.HOLD, slots.get(2).getManualAction());
        assertEquals(ManualAction.EXPORT, slots.get(3).getManualAction());
        assertEquals(ManualAction.HOLD, slots.get(4).getManualAction());
    }
}
